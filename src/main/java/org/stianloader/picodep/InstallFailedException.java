package org.stianloader.picodep;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown if the installation of a single dependency failed. The installer key names the
 * installer that raised the failure so that callers installing through several installers
 * can tell them apart.
 */
public class InstallFailedException extends PicodepException {

    private static final long serialVersionUID = -1508224376603145582L;

    @NotNull
    private final String installerKey;
    @NotNull
    private final String failure;

    public InstallFailedException(@NotNull String installerKey, @NotNull String failure) {
        this(installerKey, failure, null);
    }

    public InstallFailedException(@NotNull String installerKey, @NotNull String failure, @Nullable Throwable cause) {
        super(installerKey + ": " + failure, cause);
        this.installerKey = installerKey;
        this.failure = failure;
    }

    @NotNull
    @Contract(pure = true)
    public String getInstallerKey() {
        return this.installerKey;
    }

    @NotNull
    @Contract(pure = true)
    public String getFailure() {
        return this.failure;
    }
}
