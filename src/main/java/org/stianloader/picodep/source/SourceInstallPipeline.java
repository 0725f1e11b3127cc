package org.stianloader.picodep.source;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.InstallFailedException;
import org.stianloader.picodep.internal.Digests;
import org.stianloader.picodep.logging.LoggingAdapter;
import org.stianloader.picodep.repo.ResourceFetcher;

/**
 * Installs a {@link SourceInstall}: checks whether it is present already, downloads the tarball,
 * verifies its MD5 digest (falling back to the alternate tarball if it does not match), extracts it
 * and runs the install script within the extracted files.
 *
 * <p>All files are placed in a fresh working directory which is removed once the installation
 * finished, no matter whether it succeeded or failed.
 */
public class SourceInstallPipeline {

    @NotNull
    private final ResourceFetcher fetcher;
    @NotNull
    private final ScriptRunner scriptRunner;
    @NotNull
    private final ArchiveExtractor extractor;
    @Nullable
    private final Path workRoot;
    @Nullable
    private InstallListener listener;

    public SourceInstallPipeline(@NotNull ResourceFetcher fetcher, @NotNull ScriptRunner scriptRunner) {
        this(fetcher, scriptRunner, new ArchiveExtractor(), null);
    }

    /**
     * Constructor.
     *
     * @param fetcher The fetcher used to download tarballs
     * @param scriptRunner The runner of the check-presence and install scripts
     * @param extractor The extractor of the tarballs
     * @param workRoot The directory working directories are created in, or null for the default temporary directory
     */
    public SourceInstallPipeline(@NotNull ResourceFetcher fetcher, @NotNull ScriptRunner scriptRunner, @NotNull ArchiveExtractor extractor, @Nullable Path workRoot) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher may not be null");
        this.scriptRunner = Objects.requireNonNull(scriptRunner, "scriptRunner may not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor may not be null");
        this.workRoot = workRoot;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public SourceInstallPipeline setListener(@Nullable InstallListener listener) {
        this.listener = listener;
        return this;
    }

    /**
     * Checks whether an installation is present by running its check-presence script.
     * An installation without a check-presence script is never considered present.
     *
     * @param install The installation to check
     * @return True if the check-presence script exited with 0
     * @throws InstallFailedException If the check-presence script could not be run
     */
    public boolean isInstalled(@NotNull SourceInstall install) throws InstallFailedException {
        String script = install.getCheckPresenceScript();
        if (script.isBlank()) {
            return false;
        }
        try {
            return this.scriptRunner.run(script, null).isSuccess();
        } catch (IOException e) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to run the check-presence script of " + install.getManifestUrl() + ": " + e, e);
        }
    }

    /**
     * Installs a source installation.
     *
     * @param install The installation to perform
     * @return {@link InstallState#ALREADY_INSTALLED} if the check-presence script succeeded, {@link InstallState#DONE} otherwise
     * @throws InstallFailedException If the tarball could not be obtained or verified, extraction failed or the install script failed
     */
    @NotNull
    public InstallState install(@NotNull SourceInstall install) throws InstallFailedException {
        this.transition(install, InstallState.NOT_STARTED);
        boolean installed;
        try {
            installed = this.isInstalled(install);
        } catch (InstallFailedException e) {
            this.transition(install, InstallState.FAILED);
            throw e;
        }
        this.transition(install, InstallState.PRESENCE_CHECKED);
        if (installed) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "{} is already installed", install);
            this.transition(install, InstallState.ALREADY_INSTALLED);
            return InstallState.ALREADY_INSTALLED;
        }

        Path workDir;
        try {
            workDir = this.workRoot == null ? Files.createTempDirectory("picodep") : Files.createTempDirectory(Files.createDirectories(this.workRoot), "picodep");
        } catch (IOException e) {
            this.transition(install, InstallState.FAILED);
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to create a working directory: " + e, e);
        }

        boolean success = false;
        try {
            this.install0(install, workDir);
            success = true;
        } finally {
            this.transition(install, InstallState.CLEANUP);
            this.cleanup(workDir);
            this.transition(install, success ? InstallState.DONE : InstallState.FAILED);
        }
        return InstallState.DONE;
    }

    private void install0(@NotNull SourceInstall install, @NotNull Path workDir) throws InstallFailedException {
        this.transition(install, InstallState.FETCHING);
        LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Fetching tarball {}", install.getTarball());
        Path tarball = workDir.resolve(SourceInstallPipeline.getFileName(install.getTarball()));
        String fetchError = this.fetch(install.getTarball(), tarball);

        this.transition(install, InstallState.VERIFYING);
        tarball = this.verify(install, workDir, tarball, fetchError);

        this.transition(install, InstallState.EXTRACTING);
        if (Files.notExists(tarball)) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to fetch " + install.getTarball() + ": " + fetchError);
        }
        // Disk images cannot be unpacked as an archive
        if (!tarball.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".dmg")) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Extracting tarball {}", tarball);
            try {
                this.extractor.extract(tarball, workDir);
            } catch (IOException e) {
                throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to extract " + install.getTarball() + ": " + e.getMessage(), e);
            }
        } else {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Bypassing tarball extraction as {} is a dmg", tarball);
        }

        this.transition(install, InstallState.EXECUTING);
        LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Running installation script of {}", install);
        Path execDir = workDir.resolve(install.getExecPath()).normalize();
        ScriptResult result;
        try {
            result = this.scriptRunner.run(install.getInstallScript(), execDir);
        } catch (IOException e) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to run the installation script of " + install.getManifestUrl() + ": " + e, e);
        }
        if (!result.isSuccess()) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Installation script output:\n{}", result.output());
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "installation script returned with error code " + result.exitCode());
        }
        LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Successfully executed installation script of {}", install);
    }

    /**
     * Verifies the digest of the fetched tarball, fetching the alternate tarball if it does not match.
     *
     * @return The tarball to use
     */
    @NotNull
    private Path verify(@NotNull SourceInstall install, @NotNull Path workDir, @NotNull Path tarball, @Nullable String fetchError) throws InstallFailedException {
        String expected = install.getTarballMd5sum();
        if (expected == null || expected.isEmpty()) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "No md5sum defined for tarball {}, not checking", install.getTarball());
            return tarball;
        }

        String hash1 = this.digest(tarball, fetchError);
        if (expected.equalsIgnoreCase(hash1)) {
            return tarball;
        }

        String alternate = install.getAlternateTarball();
        if (alternate == null) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "md5sum check on " + install.getTarball() + " failed.  Expected " + expected + " got " + hash1);
        }

        LoggingAdapter.getDefaultLogger().warn(SourceInstallPipeline.class, "md5sum check on {} failed, trying alternate tarball {}", install.getTarball(), alternate);
        try {
            Files.deleteIfExists(tarball);
        } catch (IOException e) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to discard " + tarball + ": " + e, e);
        }
        Path alternateTarball = workDir.resolve(SourceInstallPipeline.getFileName(alternate));
        String alternateError = this.fetch(alternate, alternateTarball);
        String hash2 = this.digest(alternateTarball, alternateError);
        if (!expected.equalsIgnoreCase(hash2)) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "md5sum check on " + install.getTarball() + " and " + alternate
                    + " failed.  Expected " + expected + " got " + hash1 + " and " + hash2);
        }
        return alternateTarball;
    }

    /**
     * Downloads a file.
     *
     * @return null on success, a description of the failure otherwise
     */
    @Nullable
    private String fetch(@NotNull String url, @NotNull Path to) {
        try {
            Files.write(to, this.fetcher.fetch(new URI(url)));
            return null;
        } catch (DownloadFailureException | IOException | URISyntaxException e) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Download of {} failed: {}", url, e.getMessage());
            return e.getMessage();
        }
    }

    @NotNull
    private String digest(@NotNull Path file, @Nullable String fetchError) throws InstallFailedException {
        if (Files.notExists(file)) {
            return "nothing (" + fetchError + ")";
        }
        try {
            return Digests.md5Hex(file);
        } catch (IOException e) {
            throw new InstallFailedException(SourceInstaller.INSTALLER_KEY, "Unable to compute the md5sum of " + file + ": " + e, e);
        }
    }

    @NotNull
    static String getFileName(@NotNull String url) {
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            path = url;
        }
        if (path != null) {
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            int slash = path.lastIndexOf('/');
            String name = path.substring(slash + 1);
            if (!name.isEmpty() && !name.equals(".") && !name.equals("..")) {
                return name;
            }
        }
        return "download";
    }

    private void cleanup(@NotNull Path workDir) {
        LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Cleaning up working directory {}", workDir);
        try {
            Files.walkFileTree(workDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (NoSuchFileException e) {
            LoggingAdapter.getDefaultLogger().debug(SourceInstallPipeline.class, "Working directory {} vanished before cleanup", workDir);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().warn(SourceInstallPipeline.class, "Unable to remove working directory {}", workDir, e);
        }
    }

    private void transition(@NotNull SourceInstall install, @NotNull InstallState state) {
        InstallListener listener = this.listener;
        if (listener != null) {
            listener.onStateChange(install, state);
        }
    }
}
