package org.stianloader.picodep.view;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.CachedDataSource;
import org.stianloader.picodep.DataSourceMatcher;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.ResourceNotFoundException;
import org.stianloader.picodep.cache.SourcesCache;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * {@link ViewLoader} exposing every cached data source as a view named after the URL of the source.
 *
 * <p>The views of the sources have no dependencies. Any other view name, including {@link #ALL_VIEW_KEY},
 * depends on all source views in sources list order, which is how precedence between the sources
 * is expressed. This loader does not map resources to views; it is meant to be composed with another
 * loader whose views depend on the views of this loader.
 */
public class SourcesListLoader implements ViewLoader {

    /**
     * The name of the view combining all sources.
     */
    @NotNull
    public static final String ALL_VIEW_KEY = "sources.list";

    @NotNull
    private final List<CachedDataSource> sources;

    public SourcesListLoader(@NotNull List<CachedDataSource> sources) {
        this.sources = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(sources, "sources may not be null")));
    }

    /**
     * Creates a loader for the cached sources that match the given matcher.
     *
     * @param matcher The matcher describing the current platform
     * @param cache The cache to load the sources from
     * @return The loader
     * @throws IOException If the cache cannot be read
     * @throws InvalidDataException If the cache index is malformed
     */
    @NotNull
    public static SourcesListLoader createDefault(@NotNull DataSourceMatcher matcher, @NotNull SourcesCache cache) throws IOException, InvalidDataException {
        LoggingAdapter.getDefaultLogger().debug(SourcesListLoader.class, "Using matcher with tags [{}]", String.join(", ", matcher.getTags()));
        List<CachedDataSource> cached = cache.loadCachedSources();
        List<CachedDataSource> matching = new ArrayList<>();
        for (CachedDataSource source : cached) {
            if (matcher.matches(source)) {
                matching.add(source);
            }
        }
        LoggingAdapter.getDefaultLogger().debug(SourcesListLoader.class, "Loaded {} sources, {} of which match the current tags", cached.size(), matching.size());
        return new SourcesListLoader(matching);
    }

    @NotNull
    @Contract(pure = true)
    public List<CachedDataSource> getSources() {
        return this.sources;
    }

    @Override
    public void loadView(@NotNull String viewName, @NotNull ViewDatabase database) throws ResourceNotFoundException {
        if (database.isLoaded(viewName)) {
            return;
        }
        CachedDataSource source = this.getSource(viewName);
        LoggingAdapter.getDefaultLogger().debug(SourcesListLoader.class, "Loading view [{}] with the sources list loader", viewName);
        database.setViewData(viewName, source.getMappingData(), this.getViewDependencies(viewName), viewName);
    }

    @Override
    @NotNull
    public List<String> getLoadableViews() {
        List<String> views = new ArrayList<>();
        for (CachedDataSource source : this.sources) {
            views.add(source.getUrl());
        }
        return views;
    }

    @Override
    @NotNull
    public List<String> getLoadableResources() {
        return Collections.emptyList();
    }

    @Override
    @NotNull
    public List<String> getViewDependencies(@NotNull String viewName) {
        if (!viewName.equals(SourcesListLoader.ALL_VIEW_KEY)) {
            for (CachedDataSource source : this.sources) {
                if (source.getUrl().equals(viewName)) {
                    // None of the sources has dependencies
                    return Collections.emptyList();
                }
            }
        }
        // Not one of our views, so it depends on everything we provide
        return this.getLoadableViews();
    }

    /**
     * Obtains the source backing a view.
     *
     * @param viewName The name of the view, which is the URL of the source
     * @return The first source with the given URL
     * @throws ResourceNotFoundException If no source has the given URL
     */
    @NotNull
    public CachedDataSource getSource(@NotNull String viewName) throws ResourceNotFoundException {
        for (CachedDataSource source : this.sources) {
            if (source.getUrl().equals(viewName)) {
                return source;
            }
        }
        throw new ResourceNotFoundException(viewName);
    }

    @Override
    @NotNull
    public LookupResult<List<String>> getRosdeps(@NotNull String resourceName) {
        return LookupResult.notFound(resourceName);
    }

    @Override
    @NotNull
    public LookupResult<String> getViewKey(@NotNull String resourceName) {
        return LookupResult.notFound(resourceName);
    }
}
