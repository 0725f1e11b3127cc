package org.stianloader.picodep.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.internal.Digests;
import org.stianloader.picodep.source.InstallState;
import org.stianloader.picodep.source.InvalidManifestException;
import org.stianloader.picodep.source.SourceInstall;
import org.stianloader.picodep.source.SourceInstaller;

public class SourceInstallerTest {

    private static final String MANIFEST_URL = "http://example.org/rdmanifests/foo.rdmanifest";
    private static final String MIRROR_URL = "http://mirror.example.org/rdmanifests/foo.rdmanifest";
    private static final String MANIFEST = "uri: http://example.org/foo-1.0.tar.gz\n"
            + "md5sum: 0123456789abcdef0123456789abcdef\n"
            + "install-script: |\n"
            + "  make install\n"
            + "check-presence-script: test -f /usr/local/lib/libfoo.so\n"
            + "exec-path: foo-1.0\n"
            + "depends: [bar, baz]\n";

    @TempDir
    Path tempDir;

    @Test
    public void testResolve() throws InvalidDataException {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());

        List<SourceInstall> installs = installer.resolve(Map.of("uri", MANIFEST_URL));
        assertEquals(1, installs.size());
        SourceInstall install = installs.get(0);
        assertEquals(MANIFEST_URL, install.getManifestUrl());
        assertEquals("http://example.org/foo-1.0.tar.gz", install.getTarball());
        assertEquals("0123456789abcdef0123456789abcdef", install.getTarballMd5sum());
        assertEquals("make install\n", install.getInstallScript());
        assertEquals("test -f /usr/local/lib/libfoo.so", install.getCheckPresenceScript());
        assertEquals("foo-1.0", install.getExecPath());
        assertEquals(List.of("bar", "baz"), install.getDependencies());
        assertEquals("source: " + MANIFEST_URL, install.toString());

        // Cached for the lifetime of the installer
        assertSame(install, installer.resolve(Map.of("uri", MANIFEST_URL)).get(0));
        assertEquals(1, fetcher.getRequestCount(MANIFEST_URL));
    }

    @Test
    public void testManifestDefaults() throws InvalidDataException {
        SourceInstall install = SourceInstall.fromManifest(Map.of("uri", "http://example.org/foo.tar.gz"), MANIFEST_URL);
        assertEquals("", install.getInstallScript());
        assertEquals("", install.getCheckPresenceScript());
        assertEquals(".", install.getExecPath());
        assertTrue(install.getDependencies().isEmpty());
        assertEquals(null, install.getAlternateTarball());
        assertEquals(null, install.getTarballMd5sum());

        InvalidDataException e = assertThrows(InvalidDataException.class, () -> SourceInstall.fromManifest(Map.of("md5sum", "abc"), MANIFEST_URL));
        assertTrue(e.getMessage().contains("uri required for source rosdeps"), e.getMessage());
        assertThrows(InvalidDataException.class, () -> SourceInstall.fromManifest(Map.of("uri", "http://example.org/foo.tar.gz", "depends", "bar"), MANIFEST_URL));
    }

    @Test
    public void testMissingUri() {
        SourceInstaller installer = new SourceInstaller(new MapResourceFetcher(), new RecordingScriptRunner());
        InvalidDataException e = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("md5sum", "abc")));
        assertEquals("'uri' key required for source rosdeps", e.getMessage());
    }

    @Test
    public void testMirror() throws InvalidDataException {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MIRROR_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        Map<String, Object> args = Map.of("uri", MANIFEST_URL, "alternate-uri", MIRROR_URL);

        SourceInstall install = installer.resolve(args).get(0);
        assertEquals(MIRROR_URL, install.getManifestUrl());
        assertEquals(1, fetcher.getRequestCount(MANIFEST_URL));
        assertEquals(1, fetcher.getRequestCount(MIRROR_URL));

        // The result is cached under the mirror
        assertSame(install, installer.resolve(args).get(0));
        assertSame(install, installer.resolve(Map.of("uri", "http://example.org/other.rdmanifest", "alternate-uri", MIRROR_URL)).get(0));
        assertEquals(1, fetcher.getRequestCount(MANIFEST_URL));
        assertEquals(1, fetcher.getRequestCount(MIRROR_URL));
        assertEquals(0, fetcher.getRequestCount("http://example.org/other.rdmanifest"));
    }

    @Test
    public void testEmptyPrimaryUsesMirror() throws InvalidDataException {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, "").put(MIRROR_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        assertEquals(MIRROR_URL, installer.resolve(Map.of("uri", MANIFEST_URL, "alternate-uri", MIRROR_URL)).get(0).getManifestUrl());
    }

    @Test
    public void testBothLocationsFail() {
        SourceInstaller installer = new SourceInstaller(new MapResourceFetcher(), new RecordingScriptRunner());
        InvalidDataException e = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("uri", MANIFEST_URL, "alternate-uri", MIRROR_URL)));
        assertTrue(e.getMessage().contains("Failed to load a rdmanifest from either " + MANIFEST_URL + " or " + MIRROR_URL), e.getMessage());
        assertInstanceOf(DownloadFailureException.class, e.getCause());

        InvalidDataException single = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("uri", MANIFEST_URL)));
        assertTrue(single.getMessage().contains("Failed to load a rdmanifest from " + MANIFEST_URL), single.getMessage());
    }

    @Test
    public void testManifestChecksum() throws InvalidDataException {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        InvalidDataException e = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("uri", MANIFEST_URL, "md5sum", "00000000000000000000000000000000")));
        assertTrue(e.getMessage().contains("md5sum didn't match"), e.getMessage());

        String md5 = Digests.md5Hex(MANIFEST.getBytes(StandardCharsets.UTF_8));
        assertEquals(MANIFEST_URL, installer.resolve(Map.of("uri", MANIFEST_URL, "md5sum", md5.toUpperCase())).get(0).getManifestUrl());
    }

    @Test
    public void testInvalidManifest() {
        MapResourceFetcher fetcher = new MapResourceFetcher()
                .put(MANIFEST_URL, "- not\n- a dictionary\n")
                .put(MIRROR_URL, "uri: [unterminated\n");
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        InvalidDataException e = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("uri", MANIFEST_URL)));
        assertInstanceOf(InvalidManifestException.class, e.getCause());
        InvalidDataException yaml = assertThrows(InvalidDataException.class, () -> installer.resolve(Map.of("uri", MIRROR_URL)));
        assertInstanceOf(InvalidManifestException.class, yaml.getCause());
    }

    @Test
    public void testGetDependsOn() throws InvalidDataException {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        Map<String, Object> args = new HashMap<>();
        args.put("uri", MANIFEST_URL);
        List<String> explicit = new ArrayList<>(List.of("qux"));
        args.put("depends", explicit);

        assertEquals(List.of("qux", "bar", "baz"), installer.getDependsOn(args));
        assertEquals(List.of("qux"), explicit);
        assertEquals(List.of("bar", "baz"), installer.getDependsOn(Map.of("uri", MANIFEST_URL)));
    }

    @Test
    public void testConcurrentResolveDownloadsOnce() throws Exception {
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, MANIFEST);
        SourceInstaller installer = new SourceInstaller(fetcher, new RecordingScriptRunner());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<SourceInstall>>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> installer.resolve(Map.of("uri", MANIFEST_URL))));
            }
            SourceInstall first = futures.get(0).get().get(0);
            for (Future<List<SourceInstall>> future : futures) {
                assertSame(first, future.get().get(0));
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
        assertEquals(1, fetcher.getRequestCount(MANIFEST_URL));
    }

    @Test
    public void testInstallCommands() throws Exception {
        MapResourceFetcher fetcher = new MapResourceFetcher()
                .put(MANIFEST_URL, MANIFEST)
                .put(MIRROR_URL, "uri: http://example.org/other.tar.gz\ncheck-presence-script: missing\n");
        RecordingScriptRunner runner = new RecordingScriptRunner().exitWith("missing", 1);
        SourceInstaller installer = new SourceInstaller(fetcher, runner);

        SourceInstall present = installer.resolve(Map.of("uri", MANIFEST_URL)).get(0);
        SourceInstall absent = installer.resolve(Map.of("uri", MIRROR_URL)).get(0);
        List<SourceInstall> installs = List.of(present, absent);

        assertEquals(List.of(present), installer.detectInstalled(installs));
        assertEquals(List.of(List.of(SourceInstaller.INSTALL_COMMAND, "install", MIRROR_URL)), installer.getInstallCommands(installs, false));
        assertEquals(2, installer.getInstallCommands(installs, true).size());
    }

    @Test
    public void testInstallFromFileAndUrl() throws Exception {
        String manifest = "uri: http://example.org/foo.tar.gz\ncheck-presence-script: present\n";
        Path manifestFile = this.tempDir.resolve("foo.rdmanifest");
        Files.writeString(manifestFile, manifest, StandardCharsets.UTF_8);
        MapResourceFetcher fetcher = new MapResourceFetcher().put(MANIFEST_URL, manifest);
        RecordingScriptRunner runner = new RecordingScriptRunner();
        SourceInstaller installer = new SourceInstaller(fetcher, runner);

        assertEquals(InstallState.ALREADY_INSTALLED, installer.installFromFile(manifestFile));
        assertEquals(InstallState.ALREADY_INSTALLED, installer.installFromUrl(URI.create(MANIFEST_URL)));
        assertEquals(0, fetcher.getRequestCount("http://example.org/foo.tar.gz"));

        Path broken = this.tempDir.resolve("broken.rdmanifest");
        Files.writeString(broken, "install-script: make\n", StandardCharsets.UTF_8);
        assertThrows(InvalidDataException.class, () -> installer.installFromFile(broken));
    }
}
