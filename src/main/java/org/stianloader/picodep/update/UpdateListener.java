package org.stianloader.picodep.update;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.DownloadFailureException;

/**
 * Receives progress reports of {@link SourcesListUpdater#update(java.util.concurrent.Executor, UpdateListener)}.
 * Calls are never made concurrently, even if sources are fetched in parallel.
 */
public interface UpdateListener {

    void onSuccess(@NotNull DataSource source);

    void onError(@NotNull DataSource source, @NotNull DownloadFailureException failure);
}
