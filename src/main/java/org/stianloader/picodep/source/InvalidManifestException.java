package org.stianloader.picodep.source;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.PicodepException;

/**
 * Thrown if an rdmanifest was downloaded, but is not a valid YAML mapping document.
 */
public class InvalidManifestException extends PicodepException {

    private static final long serialVersionUID = 5517030318841764036L;

    public InvalidManifestException(@NotNull String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
