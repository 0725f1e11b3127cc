package org.stianloader.picodep;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of all checked exceptions thrown by picodep. Subclasses describe which
 * part of the resolution or installation process failed; callers that do not care
 * about the distinction can simply catch this type.
 */
public class PicodepException extends Exception {

    private static final long serialVersionUID = 2310847512304762381L;

    public PicodepException(@NotNull String message) {
        super(message);
    }

    public PicodepException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
