package org.stianloader.picodep.source;

import java.io.IOException;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Runs the check-presence and install scripts of rdmanifests.
 */
@FunctionalInterface
public interface ScriptRunner {

    /**
     * Runs a script and waits for it to finish.
     *
     * @param script The contents of the script
     * @param workingDirectory The directory to run the script in, or null for the working directory of the current process
     * @return The exit code and output of the script
     * @throws IOException If the script could not be started
     */
    @NotNull
    ScriptResult run(@NotNull String script, @Nullable Path workingDirectory) throws IOException;
}
