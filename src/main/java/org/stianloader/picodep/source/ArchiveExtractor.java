package org.stianloader.picodep.source;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * Extracts tarballs. Plain tar archives as well as gzip, bzip2 or xz compressed ones are supported;
 * the compression is detected from the contents of the file rather than from its name.
 */
public class ArchiveExtractor {

    /**
     * Extracts a tarball into a directory.
     *
     * @param archive The tarball
     * @param target The directory to extract into
     * @throws IOException If the tarball cannot be read, is not a tar archive or contains entries outside the target directory
     */
    public void extract(@NotNull Path archive, @NotNull Path target) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        Files.createDirectories(root);
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(archive));
                InputStream in = ArchiveExtractor.decompress(archive, raw);
                TarArchiveInputStream tar = new TarArchiveInputStream(in)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                Path destination = root.resolve(entry.getName()).normalize();
                if (!destination.startsWith(root)) {
                    throw new IOException("The entry " + entry.getName() + " of " + archive + " would be extracted outside of " + root);
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else if (entry.isSymbolicLink()) {
                    Files.createDirectories(destination.getParent());
                    Files.createSymbolicLink(destination, Paths.get(entry.getLinkName()));
                } else if (entry.isFile()) {
                    Files.createDirectories(destination.getParent());
                    Files.copy(tar, destination, StandardCopyOption.REPLACE_EXISTING);
                    if ((entry.getMode() & 0100) != 0) {
                        destination.toFile().setExecutable(true);
                    }
                } else {
                    LoggingAdapter.getDefaultLogger().debug(ArchiveExtractor.class, "Skipping unsupported entry {} of {}", entry.getName(), archive);
                }
            }
        }
    }

    @NotNull
    private static InputStream decompress(@NotNull Path archive, @NotNull InputStream raw) throws IOException {
        String format;
        try {
            format = CompressorStreamFactory.detect(raw);
        } catch (CompressorException notCompressed) {
            return raw;
        }
        try {
            return new CompressorStreamFactory().createCompressorInputStream(format, raw);
        } catch (CompressorException e) {
            throw new IOException("Unable to decompress " + archive + " (" + format + ")", e);
        }
    }
}
