package org.stianloader.picodep;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if a remote document could not be obtained: the connection failed or timed out,
 * the server answered with an error, the document was malformed or its checksum did not
 * match the expected value.
 */
public class DownloadFailureException extends PicodepException {

    private static final long serialVersionUID = 4426207139581183307L;

    @Nullable
    private final String url;

    public DownloadFailureException(@Nullable String url, @NotNull String message) {
        this(url, message, null);
    }

    public DownloadFailureException(@Nullable String url, @NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    @Nullable
    @Contract(pure = true)
    public String getUrl() {
        return this.url;
    }
}
