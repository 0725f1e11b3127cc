package org.stianloader.picodep.update;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.DataSourceType;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.PicodepConfiguration;
import org.stianloader.picodep.SourcesList;
import org.stianloader.picodep.cache.SourcesCache;
import org.stianloader.picodep.internal.ConcurrencyUtil;
import org.stianloader.picodep.internal.StronglyMultiCompletableFuture;
import org.stianloader.picodep.logging.LoggingAdapter;
import org.stianloader.picodep.repo.ResourceFetcher;
import org.stianloader.picodep.repo.URLResourceFetcher;

/**
 * Re-downloads the data of every configured source into the {@link SourcesCache} and rebuilds the cache index.
 *
 * <p>A source that cannot be fetched does not prevent the other sources from being updated.
 * The index always lists every configured source, including the ones that failed, as a cache
 * entry from a previous successful update is still usable.
 */
public class SourcesListUpdater {

    @NotNull
    private final Path sourcesListDirectory;
    @NotNull
    private final SourcesCache cache;
    @NotNull
    private final Map<DataSourceType, DataSourceFetcher> fetchers = new EnumMap<>(DataSourceType.class);

    public SourcesListUpdater(@NotNull PicodepConfiguration configuration) {
        this(configuration.sourcesListDirectory(), new SourcesCache(configuration.sourcesCacheDirectory()), new URLResourceFetcher(configuration.downloadTimeout()));
    }

    public SourcesListUpdater(@NotNull Path sourcesListDirectory, @NotNull SourcesCache cache, @NotNull ResourceFetcher fetcher) {
        this.sourcesListDirectory = Objects.requireNonNull(sourcesListDirectory, "sourcesListDirectory may not be null");
        this.cache = Objects.requireNonNull(cache, "cache may not be null");
        this.fetchers.put(DataSourceType.YAML, new YamlDataSourceFetcher(fetcher));
    }

    /**
     * Sets the fetcher used for sources of the given type. Sources of a type without a fetcher fail to update.
     * No fetcher is registered for {@link DataSourceType#GBPDISTRO} by default.
     *
     * @param type The type of sources to fetch
     * @param fetcher The fetcher to use
     * @return The current {@link SourcesListUpdater} instance, for chaining
     */
    @NotNull
    @Contract(mutates = "this", pure = false, value = "_, _ -> this")
    public SourcesListUpdater setFetcher(@NotNull DataSourceType type, @NotNull DataSourceFetcher fetcher) {
        this.fetchers.put(Objects.requireNonNull(type, "type may not be null"), Objects.requireNonNull(fetcher, "fetcher may not be null"));
        return this;
    }

    @NotNull
    @Contract(pure = true)
    public SourcesCache getCache() {
        return this.cache;
    }

    @NotNull
    public List<UpdateResult> update(@NotNull Executor executor) throws InvalidDataException, IOException {
        return this.update(executor, null);
    }

    /**
     * Updates all sources of the sources list.
     *
     * <p>Sources are fetched through the given executor, so passing {@code Runnable::run} fetches them
     * one after another on the calling thread while a thread pool fetches them in parallel.
     * Either way, this method returns only once all fetches finished and the index was written.
     *
     * @param executor The executor to fetch the sources with
     * @param listener Listener notified once a source was updated or failed to update, may be null
     * @return The outcome for every source, in sources list order
     * @throws InvalidDataException If the sources list is malformed
     * @throws IOException If the sources list cannot be read or the cache cannot be written
     */
    @NotNull
    public List<UpdateResult> update(@NotNull Executor executor, @Nullable UpdateListener listener) throws InvalidDataException, IOException {
        List<DataSource> sources = SourcesList.parseSourcesList(this.sourcesListDirectory);
        Object listenerLock = new Object();

        List<CompletableFuture<UpdateResult>> futures = new ArrayList<>();
        for (DataSource source : sources) {
            CompletableFuture<UpdateResult> future = ConcurrencyUtil.schedule(() -> this.updateSource(source), executor);
            futures.add(future.thenApply((result) -> {
                synchronized (listenerLock) {
                    this.report(result, listener);
                }
                return result;
            }));
        }

        // Wait for every fetch before touching the index
        StronglyMultiCompletableFuture<UpdateResult> barrier = new StronglyMultiCompletableFuture<>(futures);
        barrier.handle((results, ex) -> null).join();

        for (CompletableFuture<UpdateResult> future : futures) {
            Throwable failure = future.handle((result, ex) -> ex).join();
            if (failure == null) {
                continue;
            }
            Throwable cause = ConcurrencyUtil.unwrap(failure);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IOException("Unable to update the sources cache", cause);
        }

        // The index lists all sources regardless of failures: a cache entry from a previous
        // attempt may still exist and readers need to see a consistent index.
        this.cache.writeIndex(sources);
        return barrier.join();
    }

    @NotNull
    private UpdateResult updateSource(@NotNull DataSource source) throws IOException {
        DataSourceFetcher fetcher = this.fetchers.get(source.getType());
        Map<String, Object> data;
        try {
            if (fetcher == null) {
                throw new DownloadFailureException(source.getUrl(), "No fetcher is registered for data sources of type " + source.getType().getName());
            }
            data = fetcher.fetch(source);
        } catch (DownloadFailureException e) {
            return UpdateResult.failure(source, e);
        }
        return UpdateResult.success(source, this.cache.writeEntry(source.getUrl(), data));
    }

    private void report(@NotNull UpdateResult result, @Nullable UpdateListener listener) {
        DownloadFailureException failure = result.failure();
        if (failure == null) {
            LoggingAdapter.getDefaultLogger().info(SourcesListUpdater.class, "Updated {}", result.source().getUrl());
            if (listener != null) {
                listener.onSuccess(result.source());
            }
        } else {
            LoggingAdapter.getDefaultLogger().warn(SourcesListUpdater.class, "Failed to update {}: {}", result.source().getUrl(), failure.getMessage());
            if (listener != null) {
                listener.onError(result.source(), failure);
            }
        }
    }
}
