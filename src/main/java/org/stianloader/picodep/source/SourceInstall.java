package org.stianloader.picodep.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.InvalidDataException;

/**
 * A source based installation resolved from an rdmanifest: where to obtain the tarball, how to
 * verify it and which scripts check for and perform the installation.
 */
public final class SourceInstall {

    @NotNull
    private final Map<String, Object> manifest;
    @NotNull
    private final String manifestUrl;
    @NotNull
    private final String installScript;
    @NotNull
    private final String checkPresenceScript;
    @NotNull
    private final String execPath;
    @NotNull
    private final String tarball;
    @Nullable
    private final String alternateTarball;
    @Nullable
    private final String tarballMd5sum;
    @NotNull
    private final List<String> dependencies;

    private SourceInstall(@NotNull Map<String, Object> manifest, @NotNull String manifestUrl, @NotNull String installScript,
            @NotNull String checkPresenceScript, @NotNull String execPath, @NotNull String tarball,
            @Nullable String alternateTarball, @Nullable String tarballMd5sum, @NotNull List<String> dependencies) {
        this.manifest = manifest;
        this.manifestUrl = manifestUrl;
        this.installScript = installScript;
        this.checkPresenceScript = checkPresenceScript;
        this.execPath = execPath;
        this.tarball = tarball;
        this.alternateTarball = alternateTarball;
        this.tarballMd5sum = tarballMd5sum;
        this.dependencies = dependencies;
    }

    /**
     * Creates an installation from a parsed rdmanifest.
     *
     * @param manifest The rdmanifest
     * @param manifestUrl The location the rdmanifest was obtained from
     * @return The installation described by the manifest
     * @throws InvalidDataException If the manifest has no "uri" or a field has the wrong type
     */
    @NotNull
    public static SourceInstall fromManifest(@NotNull Map<String, Object> manifest, @NotNull String manifestUrl) throws InvalidDataException {
        String tarball = SourceInstall.getString(manifest, "uri", manifestUrl);
        if (tarball == null) {
            throw new InvalidDataException("uri required for source rosdeps", manifestUrl);
        }
        String installScript = SourceInstall.getString(manifest, "install-script", manifestUrl);
        String checkPresenceScript = SourceInstall.getString(manifest, "check-presence-script", manifestUrl);
        String execPath = SourceInstall.getString(manifest, "exec-path", manifestUrl);

        return new SourceInstall(Collections.unmodifiableMap(new LinkedHashMap<>(manifest)), manifestUrl,
                installScript == null ? "" : installScript,
                checkPresenceScript == null ? "" : checkPresenceScript,
                execPath == null ? "." : execPath,
                tarball,
                SourceInstall.getString(manifest, "alternate-uri", manifestUrl),
                SourceInstall.getString(manifest, "md5sum", manifestUrl),
                SourceInstall.getStringList(manifest, "depends", manifestUrl));
    }

    @Nullable
    static String getString(@NotNull Map<String, ?> map, @NotNull String key, @Nullable String origin) throws InvalidDataException {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new InvalidDataException("\"" + key + "\" must be a scalar value, but was " + value, origin);
        }
        return value.toString();
    }

    @NotNull
    static List<String> getStringList(@NotNull Map<String, ?> map, @NotNull String key, @Nullable String origin) throws InvalidDataException {
        Object value = map.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new InvalidDataException("\"" + key + "\" must be a list, but was " + value, origin);
        }
        List<String> strings = new ArrayList<>();
        for (Object element : (List<?>) value) {
            strings.add(Objects.toString(element));
        }
        return Collections.unmodifiableList(strings);
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, Object> getManifest() {
        return this.manifest;
    }

    @NotNull
    @Contract(pure = true)
    public String getManifestUrl() {
        return this.manifestUrl;
    }

    @NotNull
    @Contract(pure = true)
    public String getInstallScript() {
        return this.installScript;
    }

    @NotNull
    @Contract(pure = true)
    public String getCheckPresenceScript() {
        return this.checkPresenceScript;
    }

    /**
     * Obtains the directory, relative to the extracted tarball, the install script runs in.
     *
     * @return The execution path, "." by default
     */
    @NotNull
    @Contract(pure = true)
    public String getExecPath() {
        return this.execPath;
    }

    @NotNull
    @Contract(pure = true)
    public String getTarball() {
        return this.tarball;
    }

    @Nullable
    @Contract(pure = true)
    public String getAlternateTarball() {
        return this.alternateTarball;
    }

    @Nullable
    @Contract(pure = true)
    public String getTarballMd5sum() {
        return this.tarballMd5sum;
    }

    /**
     * Obtains the dependency keys the installation requires beforehand.
     *
     * @return The dependency keys
     */
    @NotNull
    @Contract(pure = true)
    public List<String> getDependencies() {
        return this.dependencies;
    }

    @Override
    public String toString() {
        return "source: " + this.manifestUrl;
    }
}
