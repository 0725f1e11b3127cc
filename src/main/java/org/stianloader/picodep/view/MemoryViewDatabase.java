package org.stianloader.picodep.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.ResourceNotFoundException;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * A {@link ViewDatabase} keeping all views in memory. Besides storage it resolves dependency keys
 * through a view and its dependencies: the data of the view itself wins over the data of its
 * dependencies, and earlier dependencies win over later ones.
 */
public class MemoryViewDatabase implements ViewDatabase {

    @NotNull
    private final Map<String, ViewData> views = new LinkedHashMap<>();

    @Override
    public synchronized boolean isLoaded(@NotNull String viewName) {
        return this.views.containsKey(viewName);
    }

    @Override
    public synchronized void setViewData(@NotNull String viewName, @Nullable Map<String, Object> mappingData, @NotNull List<String> dependencies, @Nullable String origin) {
        Map<String, Object> data = mappingData == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(mappingData));
        this.views.put(viewName, new ViewData(viewName, data, Collections.unmodifiableList(new ArrayList<>(dependencies)), origin));
    }

    @Override
    @Nullable
    public synchronized ViewData getViewData(@NotNull String viewName) {
        return this.views.get(viewName);
    }

    /**
     * Loads a view and all of its dependencies through a loader. Views that the loader cannot load
     * themselves (such as {@link SourcesListLoader#ALL_VIEW_KEY}) are registered without data of their own.
     *
     * @param loader The loader to load the views with
     * @param viewName The name of the view
     * @throws InvalidDataException If the data of a view is malformed
     */
    public void loadViewTree(@NotNull ViewLoader loader, @NotNull String viewName) throws InvalidDataException {
        this.loadViewTree(loader, viewName, new HashSet<>());
    }

    private void loadViewTree(@NotNull ViewLoader loader, @NotNull String viewName, @NotNull Set<String> visited) throws InvalidDataException {
        if (!visited.add(viewName)) {
            return;
        }
        List<String> dependencies = loader.getViewDependencies(viewName);
        for (String dependency : dependencies) {
            this.loadViewTree(loader, dependency, visited);
        }
        if (this.isLoaded(viewName)) {
            return;
        }
        try {
            loader.loadView(viewName, this);
        } catch (ResourceNotFoundException e) {
            LoggingAdapter.getDefaultLogger().debug(MemoryViewDatabase.class, "View [{}] has no data of its own", viewName);
            this.setViewData(viewName, null, dependencies, null);
        }
    }

    /**
     * Resolves a dependency key within a view.
     *
     * @param viewName The view to resolve the key in
     * @param key The dependency key
     * @return The definition of the key with the highest precedence, or not found
     */
    @NotNull
    public LookupResult<Object> lookup(@NotNull String viewName, @NotNull String key) {
        Object value = this.lookup(viewName, key, new HashSet<>());
        if (value == null) {
            return LookupResult.notFound(key);
        }
        return LookupResult.found(key, value);
    }

    @Nullable
    private Object lookup(@NotNull String viewName, @NotNull String key, @NotNull Set<String> visited) {
        if (!visited.add(viewName)) {
            return null;
        }
        ViewData view = this.getViewData(viewName);
        if (view == null) {
            return null;
        }
        Object value = view.mappingData().get(key);
        if (value != null) {
            return value;
        }
        for (String dependency : view.dependencies()) {
            value = this.lookup(dependency, key, visited);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
