package org.stianloader.picodep.source;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.internal.Digests;
import org.stianloader.picodep.internal.MappingDocuments;
import org.stianloader.picodep.logging.LoggingAdapter;
import org.stianloader.picodep.repo.ResourceFetcher;

/**
 * Downloads and parses rdmanifests, falling back to a mirror if the primary location fails.
 */
public class RdManifestLoader {

    /**
     * A downloaded rdmanifest.
     *
     * @param manifest The parsed manifest
     * @param downloadUrl The location the manifest was obtained from, either the primary location or the mirror
     */
    public record DownloadedManifest(@NotNull Map<String, Object> manifest, @NotNull String downloadUrl) {
    }

    @NotNull
    private final ResourceFetcher fetcher;

    public RdManifestLoader(@NotNull ResourceFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher may not be null");
    }

    /**
     * Parses an rdmanifest.
     *
     * @param contents The raw manifest
     * @param origin Where the manifest was read from
     * @return The manifest
     * @throws InvalidManifestException If the manifest is not a YAML mapping
     */
    @NotNull
    public static Map<String, Object> parse(byte @NotNull[] contents, @NotNull String origin) throws InvalidManifestException {
        Object document;
        try {
            document = MappingDocuments.parse(contents);
        } catch (IOException e) {
            throw new InvalidManifestException("Failed to parse yaml in " + origin + ": " + e.getMessage(), e);
        }
        Map<String, Object> manifest = MappingDocuments.asMapping(document);
        if (manifest == null) {
            throw new InvalidManifestException("The rdmanifest at " + origin + " is not a YAML dictionary", null);
        }
        return manifest;
    }

    /**
     * Downloads an rdmanifest.
     *
     * @param url The primary location of the manifest
     * @param md5sum The expected MD5 digest of the manifest, or null to skip verification
     * @param alternateUrl The mirror to use if the primary location fails, may be null
     * @return The manifest and the location it was obtained from
     * @throws DownloadFailureException If neither location yielded the manifest. The message names every attempted location
     * @throws InvalidManifestException If the downloaded manifest could not be parsed
     */
    @NotNull
    public DownloadedManifest download(@NotNull String url, @Nullable String md5sum, @Nullable String alternateUrl) throws DownloadFailureException, InvalidManifestException {
        String downloadUrl = url;
        String errorPrefix = "Failed to load a rdmanifest from " + url + ": ";
        DownloadFailureException failure = null;
        byte[] contents = null;
        try {
            contents = this.fetch(url, md5sum);
        } catch (DownloadFailureException e) {
            LoggingAdapter.getDefaultLogger().debug(RdManifestLoader.class, "Download of rdmanifest {} failed: {}", url, e.getMessage());
            failure = e;
        }

        if (contents == null && alternateUrl != null) {
            LoggingAdapter.getDefaultLogger().warn(RdManifestLoader.class, "Download of rdmanifest {} failed, trying mirror {}", url, alternateUrl);
            errorPrefix = "Failed to load a rdmanifest from either " + url + " or " + alternateUrl + ": ";
            downloadUrl = alternateUrl;
            try {
                contents = this.fetch(alternateUrl, md5sum);
            } catch (DownloadFailureException e) {
                if (failure != null) {
                    e.addSuppressed(failure);
                }
                failure = e;
            }
        }

        if (contents == null) {
            String detail = failure == null ? "empty contents" : failure.getMessage();
            throw new DownloadFailureException(downloadUrl, errorPrefix + detail, failure);
        }

        return new DownloadedManifest(RdManifestLoader.parse(contents, downloadUrl), downloadUrl);
    }

    private byte @Nullable[] fetch(@NotNull String url, @Nullable String md5sum) throws DownloadFailureException {
        URI location;
        try {
            location = new URI(url);
        } catch (URISyntaxException e) {
            throw new DownloadFailureException(url, "Invalid location " + url + ": " + e.getMessage(), e);
        }
        byte[] contents = this.fetcher.fetch(location);
        if (contents.length == 0) {
            return null;
        }
        if (md5sum != null && !md5sum.isEmpty()) {
            String actual = Digests.md5Hex(contents);
            if (!actual.equalsIgnoreCase(md5sum)) {
                throw new DownloadFailureException(url, "md5sum didn't match for " + url + ".  Expected " + md5sum + " got " + actual);
            }
        }
        return contents;
    }
}
