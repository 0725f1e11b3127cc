package org.stianloader.picodep.repo;

import java.net.URI;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DownloadFailureException;

/**
 * The network fetch primitive of picodep.
 *
 * <p><ul>
 * <li>Implementations MUST either return the complete contents of the resource or throw.</li>
 * <li>Timeouts, connection failures and unsuccessful responses MUST be reported as a
 * {@link DownloadFailureException} that names the requested location.</li>
 * <li>Implementations SHOULD apply a bounded timeout to every request.</li>
 * <li>Implementations MUST be safe to use from several threads at once.</li>
 * </ul>
 */
@FunctionalInterface
public interface ResourceFetcher {

    /**
     * Downloads a resource.
     *
     * @param location The location of the resource
     * @return The raw bytes of the resource
     * @throws DownloadFailureException If the resource could not be downloaded
     */
    byte @NotNull[] fetch(@NotNull URI location) throws DownloadFailureException;
}
