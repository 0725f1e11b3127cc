package org.stianloader.picodep.update;

import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.DownloadFailureException;

/**
 * Obtains the mapping data of a data source. There is one fetcher per {@link org.stianloader.picodep.DataSourceType}.
 */
@FunctionalInterface
public interface DataSourceFetcher {

    /**
     * Fetches the mapping data of a source. Implementations are called concurrently for
     * different sources.
     *
     * @param source The source to fetch
     * @return The mapping document of the source
     * @throws DownloadFailureException If the data could not be downloaded or is not a mapping document
     */
    @NotNull
    Map<String, Object> fetch(@NotNull DataSource source) throws DownloadFailureException;
}
