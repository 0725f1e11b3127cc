package org.stianloader.picodep;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.repo.URLResourceFetcher;

/**
 * The locations and limits picodep operates with. Components receive these values through
 * their constructors; only {@link #fromEnvironment()} consults system properties and environment variables.
 *
 * @param sourcesListDirectory The directory containing the {@code *.list} files
 * @param sourcesCacheDirectory The directory fetched mapping data is cached in
 * @param downloadTimeout The connect and read timeout of network requests
 */
public record PicodepConfiguration(@NotNull Path sourcesListDirectory, @NotNull Path sourcesCacheDirectory, @NotNull Duration downloadTimeout) {

    @NotNull
    public static final String SOURCES_LIST_DIR_PROPERTY = "picodep.sources.list.dir";
    @NotNull
    public static final String SOURCES_CACHE_DIR_PROPERTY = "picodep.sources.cache.dir";
    @NotNull
    public static final String DOWNLOAD_TIMEOUT_PROPERTY = "picodep.download.timeout";

    public PicodepConfiguration {
        Objects.requireNonNull(sourcesListDirectory, "sourcesListDirectory may not be null");
        Objects.requireNonNull(sourcesCacheDirectory, "sourcesCacheDirectory may not be null");
        Objects.requireNonNull(downloadTimeout, "downloadTimeout may not be null");
    }

    public PicodepConfiguration(@NotNull Path sourcesListDirectory, @NotNull Path sourcesCacheDirectory) {
        this(sourcesListDirectory, sourcesCacheDirectory, URLResourceFetcher.DEFAULT_TIMEOUT);
    }

    /**
     * Resolves the configuration of the current process.
     *
     * <p><ul>
     * <li>The sources list directory is read from the {@value #SOURCES_LIST_DIR_PROPERTY} system property,
     * defaulting to {@code /etc/ros/rosdep/sources.list.d}.</li>
     * <li>The cache directory is read from the {@value #SOURCES_CACHE_DIR_PROPERTY} system property,
     * defaulting to {@code rosdep/sources.cache} within {@code $ROS_HOME} or {@code ~/.ros}.</li>
     * <li>The download timeout is read in seconds from the {@value #DOWNLOAD_TIMEOUT_PROPERTY} system property,
     * defaulting to 15 seconds.</li>
     * </ul>
     *
     * @return The configuration
     */
    @NotNull
    public static PicodepConfiguration fromEnvironment() {
        String listDir = System.getProperty(SOURCES_LIST_DIR_PROPERTY);
        Path sourcesListDirectory = listDir != null ? Paths.get(listDir) : Paths.get("/etc", "ros", "rosdep", "sources.list.d");

        String cacheDir = System.getProperty(SOURCES_CACHE_DIR_PROPERTY);
        Path sourcesCacheDirectory;
        if (cacheDir != null) {
            sourcesCacheDirectory = Paths.get(cacheDir);
        } else {
            sourcesCacheDirectory = PicodepConfiguration.getRosHome(System.getenv("ROS_HOME")).resolve("rosdep").resolve("sources.cache");
        }

        Duration timeout = URLResourceFetcher.DEFAULT_TIMEOUT;
        String timeoutSeconds = System.getProperty(DOWNLOAD_TIMEOUT_PROPERTY);
        if (timeoutSeconds != null) {
            try {
                timeout = Duration.ofSeconds(Long.parseLong(timeoutSeconds.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalStateException("The system property " + DOWNLOAD_TIMEOUT_PROPERTY + " must be a number of seconds, but was \"" + timeoutSeconds + "\"", e);
            }
        }
        return new PicodepConfiguration(sourcesListDirectory, sourcesCacheDirectory, timeout);
    }

    @NotNull
    private static Path getRosHome(@Nullable String rosHome) {
        if (rosHome != null && !rosHome.isEmpty()) {
            return Paths.get(rosHome);
        }
        return Paths.get(System.getProperty("user.home"), ".ros");
    }
}
