package org.stianloader.picodep.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLConnection;
import java.time.Duration;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * {@link ResourceFetcher} backed by {@link URLConnection}, supporting every protocol the JVM supports
 * (most notably http, https and file).
 */
public class URLResourceFetcher implements ResourceFetcher {

    /**
     * The timeout applied by {@link #URLResourceFetcher()}.
     */
    @NotNull
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    @NotNull
    private final Duration timeout;

    public URLResourceFetcher() {
        this(URLResourceFetcher.DEFAULT_TIMEOUT);
    }

    public URLResourceFetcher(@NotNull Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout may not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("The timeout must be positive, but was " + timeout);
        }
    }

    @NotNull
    @Contract(pure = true)
    public Duration getTimeout() {
        return this.timeout;
    }

    @Override
    public byte @NotNull[] fetch(@NotNull URI location) throws DownloadFailureException {
        LoggingAdapter.getDefaultLogger().debug(URLResourceFetcher.class, "Downloading {}", location);
        URLConnection connection;
        try {
            connection = location.toURL().openConnection();
        } catch (IOException | IllegalArgumentException e) {
            throw new DownloadFailureException(location.toString(), "Unable to open a connection to " + location + ": " + e.getMessage(), e);
        }

        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, this.timeout.toMillis());
        connection.setConnectTimeout(timeoutMillis);
        connection.setReadTimeout(timeoutMillis);

        try {
            if (connection instanceof HttpURLConnection) {
                HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
                if ((httpUrlConn.getResponseCode() / 100) != 2) {
                    throw new DownloadFailureException(location.toString(), "Query for " + location + " returned with a response code of " + httpUrlConn.getResponseCode() + " (" + httpUrlConn.getResponseMessage() + ")");
                }
            }

            try (InputStream is = connection.getInputStream()) {
                return is.readAllBytes();
            }
        } catch (SocketTimeoutException e) {
            throw new DownloadFailureException(location.toString(), "Timed out after " + this.timeout.toMillis() + "ms while downloading " + location, e);
        } catch (IOException e) {
            throw new DownloadFailureException(location.toString(), "Unable to download " + location + ": " + e, e);
        } finally {
            if (connection instanceof HttpURLConnection) {
                ((HttpURLConnection) connection).disconnect();
            }
        }
    }
}
