package org.stianloader.picodep.source;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.InstallFailedException;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.PicodepConfiguration;
import org.stianloader.picodep.logging.LoggingAdapter;
import org.stianloader.picodep.repo.ResourceFetcher;
import org.stianloader.picodep.repo.URLResourceFetcher;

/**
 * Installer for dependencies which are built from source as described by an rdmanifest.
 *
 * <p>The installer arguments of a dependency are a mapping containing the location of the
 * rdmanifest ("uri"), optionally a mirror of it ("alternate-uri"), the MD5 digest of the manifest
 * ("md5sum") and further dependency keys ("depends").
 *
 * <p>Resolved manifests are kept for the lifetime of the installer, so that each manifest is downloaded
 * at most once regardless of how many dependency keys refer to it. Instances are thread-safe.
 */
public class SourceInstaller {

    @NotNull
    public static final String INSTALLER_KEY = "source";

    /**
     * The command that installs a single rdmanifest, as emitted by {@link #getInstallCommands(List, boolean)}.
     */
    @NotNull
    public static final String INSTALL_COMMAND = "picodep-source";

    @NotNull
    private final RdManifestLoader manifestLoader;
    @NotNull
    private final SourceInstallPipeline pipeline;
    @NotNull
    private final Map<String, SourceInstall> resolved = new HashMap<>();

    public SourceInstaller(@NotNull PicodepConfiguration config) {
        this(new URLResourceFetcher(config.downloadTimeout()), new ShellScriptRunner());
    }

    public SourceInstaller(@NotNull ResourceFetcher fetcher, @NotNull ScriptRunner scriptRunner) {
        this(new RdManifestLoader(fetcher), new SourceInstallPipeline(fetcher, scriptRunner));
    }

    public SourceInstaller(@NotNull RdManifestLoader manifestLoader, @NotNull SourceInstallPipeline pipeline) {
        this.manifestLoader = Objects.requireNonNull(manifestLoader, "manifestLoader may not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public SourceInstallPipeline getPipeline() {
        return this.pipeline;
    }

    /**
     * Resolves the rdmanifest referenced by the installer arguments of a dependency.
     *
     * <p>If a manifest was resolved earlier under either the primary location or the mirror, the
     * earlier result is returned without contacting either location.
     *
     * @param args The installer arguments
     * @return The installations described by the manifest
     * @throws InvalidDataException If the arguments have no "uri", the manifest could not be downloaded or is malformed
     */
    @NotNull
    public List<SourceInstall> resolve(@NotNull Map<String, ?> args) throws InvalidDataException {
        String url = SourceInstall.getString(args, "uri", null);
        if (url == null) {
            throw new InvalidDataException("'uri' key required for source rosdeps");
        }
        String alternateUrl = SourceInstall.getString(args, "alternate-uri", null);
        String md5sum = SourceInstall.getString(args, "md5sum", null);

        synchronized (this.resolved) {
            SourceInstall install = this.resolved.get(url);
            if (install == null && alternateUrl != null) {
                install = this.resolved.get(alternateUrl);
            }
            if (install != null) {
                LoggingAdapter.getDefaultLogger().debug(SourceInstaller.class, "Using cached rdmanifest for {}", url);
                return Collections.singletonList(install);
            }

            RdManifestLoader.DownloadedManifest downloaded;
            try {
                downloaded = this.manifestLoader.download(url, md5sum, alternateUrl);
            } catch (DownloadFailureException | InvalidManifestException e) {
                throw new InvalidDataException(e.getMessage(), url, e);
            }
            LoggingAdapter.getDefaultLogger().debug(SourceInstaller.class, "Downloaded rdmanifest from {}", downloaded.downloadUrl());
            install = SourceInstall.fromManifest(downloaded.manifest(), downloaded.downloadUrl());
            this.resolved.put(downloaded.downloadUrl(), install);
            return Collections.singletonList(install);
        }
    }

    /**
     * Obtains the dependency keys of a dependency: the keys listed in the installer arguments followed
     * by the keys listed in the rdmanifest itself.
     *
     * @param args The installer arguments
     * @return The dependency keys
     * @throws InvalidDataException If the manifest could not be resolved
     */
    @NotNull
    public List<String> getDependsOn(@NotNull Map<String, ?> args) throws InvalidDataException {
        List<String> depends = new ArrayList<>(SourceInstall.getStringList(args, "depends", null));
        for (SourceInstall install : this.resolve(args)) {
            depends.addAll(install.getDependencies());
        }
        return depends;
    }

    public boolean isInstalled(@NotNull SourceInstall install) throws InstallFailedException {
        return this.pipeline.isInstalled(install);
    }

    /**
     * Filters installations down to those whose check-presence script reports them as installed.
     *
     * @param installs The installations to check
     * @return The installed installations, in their original order
     * @throws InstallFailedException If a check-presence script could not be run
     */
    @NotNull
    public List<SourceInstall> detectInstalled(@NotNull List<SourceInstall> installs) throws InstallFailedException {
        List<SourceInstall> installed = new ArrayList<>();
        for (SourceInstall install : installs) {
            if (this.isInstalled(install)) {
                installed.add(install);
            }
        }
        return installed;
    }

    /**
     * Obtains the commands that would install the given installations.
     *
     * @param installs The installations
     * @param reinstall Whether to emit commands for installations that are present already
     * @return One {@code picodep-source install <manifest url>} command per installation to perform
     * @throws InstallFailedException If a check-presence script could not be run
     */
    @NotNull
    public List<List<String>> getInstallCommands(@NotNull List<SourceInstall> installs, boolean reinstall) throws InstallFailedException {
        List<List<String>> commands = new ArrayList<>();
        for (SourceInstall install : installs) {
            if (reinstall || !this.isInstalled(install)) {
                commands.add(List.of(SourceInstaller.INSTALL_COMMAND, "install", install.getManifestUrl()));
            }
        }
        return commands;
    }

    @NotNull
    public InstallState install(@NotNull SourceInstall install) throws InstallFailedException {
        return this.pipeline.install(install);
    }

    /**
     * Installs the rdmanifest stored in a local file.
     *
     * @param manifestFile The rdmanifest
     * @return The terminal state of the installation
     * @throws IOException If the file cannot be read
     * @throws InvalidDataException If the manifest is malformed
     * @throws InstallFailedException If the installation failed
     */
    @NotNull
    public InstallState installFromFile(@NotNull Path manifestFile) throws IOException, InvalidDataException, InstallFailedException {
        String origin = manifestFile.toString();
        Map<String, Object> manifest;
        try {
            manifest = RdManifestLoader.parse(Files.readAllBytes(manifestFile), origin);
        } catch (InvalidManifestException e) {
            throw new InvalidDataException(e.getMessage(), origin, e);
        }
        return this.install(SourceInstall.fromManifest(manifest, origin));
    }

    /**
     * Downloads and installs an rdmanifest. The manifest is not verified against a digest.
     *
     * @param manifestUrl The location of the rdmanifest
     * @return The terminal state of the installation
     * @throws InvalidDataException If the manifest could not be downloaded or is malformed
     * @throws InstallFailedException If the installation failed
     */
    @NotNull
    public InstallState installFromUrl(@NotNull URI manifestUrl) throws InvalidDataException, InstallFailedException {
        List<SourceInstall> installs = this.resolve(Collections.singletonMap("uri", manifestUrl.toString()));
        InstallState state = InstallState.DONE;
        for (SourceInstall install : installs) {
            state = this.install(install);
        }
        return state;
    }
}
