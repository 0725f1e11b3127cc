package org.stianloader.picodep.source;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * {@link ScriptRunner} that writes the script into a temporary file and runs it with bash.
 * The temporary file is removed once the script finished.
 */
public class ShellScriptRunner implements ScriptRunner {

    @NotNull
    private final String shell;

    public ShellScriptRunner() {
        this("bash");
    }

    public ShellScriptRunner(@NotNull String shell) {
        this.shell = shell;
    }

    @Override
    @NotNull
    public ScriptResult run(@NotNull String script, @Nullable Path workingDirectory) throws IOException {
        Path scriptFile = Files.createTempFile("picodep-script", ".sh");
        try {
            Files.writeString(scriptFile, script, StandardCharsets.UTF_8);

            ProcessBuilder pb = new ProcessBuilder(this.shell, scriptFile.toString());
            pb.redirectErrorStream(true);
            if (workingDirectory != null) {
                pb.directory(workingDirectory.toFile());
            }

            Process process = pb.start();
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }

            int exitCode;
            try {
                exitCode = process.waitFor();
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for " + scriptFile + " to finish");
            }
            LoggingAdapter.getDefaultLogger().debug(ShellScriptRunner.class, "Script {} exited with code {}", scriptFile, exitCode);
            return new ScriptResult(exitCode, output);
        } finally {
            Files.deleteIfExists(scriptFile);
        }
    }
}
