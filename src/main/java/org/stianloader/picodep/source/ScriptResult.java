package org.stianloader.picodep.source;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The outcome of running a script.
 *
 * @param exitCode The exit code of the script
 * @param output The combined standard output and standard error of the script
 */
public record ScriptResult(int exitCode, @NotNull String output) {

    @Contract(pure = true)
    public boolean isSuccess() {
        return this.exitCode == 0;
    }
}
