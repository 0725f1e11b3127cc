package org.stianloader.picodep;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if data read by picodep does not follow the expected format, for example a malformed
 * line within a sources list file, a dependency recipe without a "uri" or a manifest which
 * could not be obtained at all.
 */
public class InvalidDataException extends PicodepException {

    private static final long serialVersionUID = -6092761289173004145L;

    @Nullable
    private final String origin;

    public InvalidDataException(@NotNull String message) {
        this(message, null, null);
    }

    public InvalidDataException(@NotNull String message, @Nullable String origin) {
        this(message, origin, null);
    }

    public InvalidDataException(@NotNull String message, @Nullable String origin, @Nullable Throwable cause) {
        super(origin == null ? message : "[" + origin + "]: " + message, cause);
        this.origin = origin;
    }

    /**
     * Obtains the file or URL the invalid data was read from, if known.
     *
     * @return The origin of the data, or null
     */
    @Nullable
    @Contract(pure = true)
    public String getOrigin() {
        return this.origin;
    }
}
