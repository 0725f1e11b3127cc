package org.stianloader.picodep.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picodep.InstallFailedException;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.internal.Digests;
import org.stianloader.picodep.source.ArchiveExtractor;
import org.stianloader.picodep.source.InstallState;
import org.stianloader.picodep.source.SourceInstall;
import org.stianloader.picodep.source.SourceInstallPipeline;
import org.stianloader.picodep.source.SourceInstaller;

public class SourceInstallPipelineTest {

    private static final String TARBALL_URL = "http://example.org/foo-1.0.tar.gz";
    private static final String MIRROR_URL = "http://mirror.example.org/foo-1.0.tar.gz";

    @TempDir
    Path tempDir;

    static byte @NotNull[] createTarball(@NotNull Map<String, String> files) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            for (Map.Entry<String, String> file : files.entrySet()) {
                byte[] contents = file.getValue().getBytes(StandardCharsets.UTF_8);
                TarArchiveEntry entry = new TarArchiveEntry(file.getKey());
                entry.setSize(contents.length);
                entry.setMode(0100755);
                tar.putArchiveEntry(entry);
                tar.write(contents);
                tar.closeArchiveEntry();
            }
        }
        return bytes.toByteArray();
    }

    @NotNull
    private static SourceInstall install(@Nullable String md5sum, @Nullable String alternate) throws InvalidDataException {
        Map<String, Object> manifest = new HashMap<>();
        manifest.put("uri", TARBALL_URL);
        manifest.put("install-script", "install");
        manifest.put("check-presence-script", "check");
        manifest.put("exec-path", "foo-1.0");
        if (md5sum != null) {
            manifest.put("md5sum", md5sum);
        }
        if (alternate != null) {
            manifest.put("alternate-uri", alternate);
        }
        return SourceInstall.fromManifest(manifest, "http://example.org/foo.rdmanifest");
    }

    @NotNull
    private Path workRoot() {
        return this.tempDir.resolve("work");
    }

    private void assertWorkRootEmpty() throws IOException {
        if (Files.notExists(this.workRoot())) {
            return;
        }
        try (Stream<Path> stream = Files.list(this.workRoot())) {
            assertEquals(0, stream.count(), "Working directory was not removed");
        }
    }

    @NotNull
    private SourceInstallPipeline pipeline(@NotNull MapResourceFetcher fetcher, @NotNull RecordingScriptRunner runner) {
        return new SourceInstallPipeline(fetcher, runner, new ArchiveExtractor(), this.workRoot());
    }

    @Test
    public void testInstall() throws Exception {
        byte[] tarball = createTarball(Map.of("foo-1.0/configure", "#!/bin/sh\n"));
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, tarball);
        List<Path> execDirs = new ArrayList<>();
        RecordingScriptRunner runner = new RecordingScriptRunner()
                .exitWith("check", 1)
                .onRun("install", (dir) -> {
                    execDirs.add(dir);
                    return Files.isExecutable(dir.resolve("configure")) ? 0 : 1;
                });
        List<InstallState> states = Collections.synchronizedList(new ArrayList<>());
        SourceInstallPipeline pipeline = this.pipeline(fetcher, runner).setListener((unit, state) -> states.add(state));

        assertEquals(InstallState.DONE, pipeline.install(install(Digests.md5Hex(tarball), null)));
        assertEquals(List.of(InstallState.NOT_STARTED, InstallState.PRESENCE_CHECKED, InstallState.FETCHING, InstallState.VERIFYING,
                InstallState.EXTRACTING, InstallState.EXECUTING, InstallState.CLEANUP, InstallState.DONE), states);
        assertEquals(1, execDirs.size());
        assertEquals("foo-1.0", execDirs.get(0).getFileName().toString());
        assertEquals(this.workRoot().toAbsolutePath().normalize(), execDirs.get(0).getParent().getParent().toAbsolutePath().normalize());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testAlreadyInstalled() throws Exception {
        MapResourceFetcher fetcher = new MapResourceFetcher();
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 0);
        List<InstallState> states = new ArrayList<>();
        SourceInstallPipeline pipeline = this.pipeline(fetcher, runner).setListener((unit, state) -> states.add(state));

        assertEquals(InstallState.ALREADY_INSTALLED, pipeline.install(install(null, null)));
        assertEquals(List.of(InstallState.NOT_STARTED, InstallState.PRESENCE_CHECKED, InstallState.ALREADY_INSTALLED), states);
        assertEquals(0, fetcher.getRequestCount(TARBALL_URL));
        assertEquals(1, runner.getInvocations().size());
        assertTrue(InstallState.ALREADY_INSTALLED.isTerminal());
    }

    @Test
    public void testMissingPresenceCheck() throws Exception {
        SourceInstall install = SourceInstall.fromManifest(Map.of("uri", TARBALL_URL), "http://example.org/foo.rdmanifest");
        RecordingScriptRunner runner = new RecordingScriptRunner();
        SourceInstallPipeline pipeline = this.pipeline(new MapResourceFetcher(), runner);
        assertFalse(pipeline.isInstalled(install));
        assertTrue(runner.getInvocations().isEmpty());
    }

    @Test
    public void testMirrorOnChecksumMismatch() throws Exception {
        byte[] good = createTarball(Map.of("foo-1.0/README", "good"));
        byte[] bad = createTarball(Map.of("foo-1.0/README", "tampered"));
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, bad).put(MIRROR_URL, good);
        List<Path> execDirs = new ArrayList<>();
        RecordingScriptRunner runner = new RecordingScriptRunner()
                .exitWith("check", 1)
                .onRun("install", (dir) -> {
                    execDirs.add(dir);
                    try {
                        return Files.readString(dir.resolve("README"), StandardCharsets.UTF_8).equals("good") ? 0 : 1;
                    } catch (IOException e) {
                        return 2;
                    }
                });

        assertEquals(InstallState.DONE, this.pipeline(fetcher, runner).install(install(Digests.md5Hex(good), MIRROR_URL)));
        assertEquals(1, fetcher.getRequestCount(MIRROR_URL));
        assertEquals(1, execDirs.size());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testChecksumMismatchOnBoth() throws Exception {
        byte[] first = createTarball(Map.of("a", "first"));
        byte[] second = createTarball(Map.of("a", "second"));
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, first).put(MIRROR_URL, second);
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 1);
        String expected = "00112233445566778899aabbccddeeff";

        InstallFailedException e = assertThrows(InstallFailedException.class, () -> this.pipeline(fetcher, runner).install(install(expected, MIRROR_URL)));
        assertEquals(SourceInstaller.INSTALLER_KEY, e.getInstallerKey());
        assertEquals("md5sum check on " + TARBALL_URL + " and " + MIRROR_URL + " failed.  Expected " + expected
                + " got " + Digests.md5Hex(first) + " and " + Digests.md5Hex(second), e.getFailure());
        // The install script never ran
        assertEquals(1, runner.getInvocations().size());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testChecksumMismatchWithoutMirror() throws Exception {
        byte[] tarball = createTarball(Map.of("a", "b"));
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, tarball);
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 1);
        String expected = "00112233445566778899aabbccddeeff";

        InstallFailedException e = assertThrows(InstallFailedException.class, () -> this.pipeline(fetcher, runner).install(install(expected, null)));
        assertEquals("md5sum check on " + TARBALL_URL + " failed.  Expected " + expected + " got " + Digests.md5Hex(tarball), e.getFailure());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testFetchFailureWithoutChecksum() throws Exception {
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 1);
        List<InstallState> states = new ArrayList<>();
        SourceInstallPipeline pipeline = this.pipeline(new MapResourceFetcher(), runner).setListener((unit, state) -> states.add(state));

        InstallFailedException e = assertThrows(InstallFailedException.class, () -> pipeline.install(install(null, null)));
        assertTrue(e.getFailure().startsWith("Unable to fetch " + TARBALL_URL), e.getFailure());
        assertEquals(InstallState.FAILED, states.get(states.size() - 1));
        assertEquals(InstallState.CLEANUP, states.get(states.size() - 2));
        this.assertWorkRootEmpty();
    }

    @Test
    public void testCleanupAfterScriptFailure() throws Exception {
        byte[] tarball = createTarball(Map.of("foo-1.0/Makefile", "all:\n"));
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, tarball);
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 1).exitWith("install", 2);

        InstallFailedException e = assertThrows(InstallFailedException.class, () -> this.pipeline(fetcher, runner).install(install(null, null)));
        assertEquals("installation script returned with error code 2", e.getFailure());
        assertEquals("source: installation script returned with error code 2", e.getMessage());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testCleanupAfterExtractionFailure() throws Exception {
        // A full tar record of garbage, so that the header cannot be parsed
        MapResourceFetcher fetcher = new MapResourceFetcher().put(TARBALL_URL, "x".repeat(1024).getBytes(StandardCharsets.UTF_8));
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("check", 1);

        InstallFailedException e = assertThrows(InstallFailedException.class, () -> this.pipeline(fetcher, runner).install(install(null, null)));
        assertTrue(e.getFailure().startsWith("Unable to extract " + TARBALL_URL), e.getFailure());
        this.assertWorkRootEmpty();
    }

    @Test
    public void testDiskImagesAreNotExtracted() throws Exception {
        String dmgUrl = "http://example.org/foo-1.0.dmg";
        MapResourceFetcher fetcher = new MapResourceFetcher().put(dmgUrl, "not an archive".getBytes(StandardCharsets.UTF_8));
        List<Path> execDirs = new ArrayList<>();
        RecordingScriptRunner runner = new RecordingScriptRunner()
                .exitWith("check", 1)
                .onRun("hdiutil attach foo-1.0.dmg", (dir) -> {
                    execDirs.add(dir);
                    return Files.exists(dir.resolve("foo-1.0.dmg")) ? 0 : 1;
                });
        SourceInstall install = SourceInstall.fromManifest(Map.of("uri", dmgUrl, "check-presence-script", "check",
                "install-script", "hdiutil attach foo-1.0.dmg"), "http://example.org/foo.rdmanifest");

        assertEquals(InstallState.DONE, this.pipeline(fetcher, runner).install(install));
        assertEquals(1, execDirs.size());
        this.assertWorkRootEmpty();
    }
}
