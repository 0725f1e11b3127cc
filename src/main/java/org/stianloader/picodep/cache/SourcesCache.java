package org.stianloader.picodep.cache;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.CachedDataSource;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.InvalidDataException;
import org.stianloader.picodep.SourceDescriptor;
import org.stianloader.picodep.SourcesList;
import org.stianloader.picodep.internal.Digests;
import org.stianloader.picodep.internal.MappingDocuments;
import org.stianloader.picodep.logging.LoggingAdapter;

/**
 * Content addressed cache of fetched mapping data. Every source is stored in a file named
 * after the SHA-1 digest of its URL. An index file lists all configured sources so that the
 * cache can be loaded without consulting the sources list again.
 *
 * <p>Entries are written to a temporary file first and then moved in place, so readers never
 * observe a partially written entry. The presence of an entry does not imply that it is up to date.
 * There is no locking across processes beyond that: concurrent updates from several processes
 * only guarantee that each individual file is complete.
 */
public class SourcesCache {

    /**
     * The name of the index file within the cache directory.
     */
    @NotNull
    public static final String INDEX_FILE = "index";

    @NotNull
    public static final String INDEX_HEADER = "#autogenerated by picodep, do not edit. use 'picodep update' instead";

    private static final long LOCK_TIMEOUT = 10_000L;

    @NotNull
    private final Path cacheDirectory;

    public SourcesCache(@NotNull Path cacheDirectory) {
        this.cacheDirectory = Objects.requireNonNull(cacheDirectory, "cacheDirectory may not be null");
    }

    /**
     * Computes the name of the cache entry of a URL.
     *
     * @param url The URL of the source
     * @return The lowercase hex SHA-1 digest of the URL
     */
    @NotNull
    @Contract(pure = true)
    public static String computeKey(@NotNull String url) {
        return Digests.sha1Hex(url);
    }

    @NotNull
    @Contract(pure = true)
    public Path getCacheDirectory() {
        return this.cacheDirectory;
    }

    @NotNull
    @Contract(pure = true)
    public Path getIndexFile() {
        return this.cacheDirectory.resolve(SourcesCache.INDEX_FILE);
    }

    @NotNull
    @Contract(pure = true)
    public Path getEntryFile(@NotNull String url) {
        return this.cacheDirectory.resolve(SourcesCache.computeKey(url));
    }

    /**
     * Stores the mapping data of a source, replacing any previous entry.
     *
     * @param url The URL of the source
     * @param mappingData The data to store
     * @return The entry file
     * @throws IOException If the cache directory or the entry cannot be written
     */
    @NotNull
    public Path writeEntry(@NotNull String url, @NotNull Map<String, Object> mappingData) throws IOException {
        Files.createDirectories(this.cacheDirectory);
        Path entry = this.getEntryFile(url);
        this.write(MappingDocuments.write(mappingData), entry);
        return entry;
    }

    /**
     * Loads the mapping data cached for a source.
     *
     * @param url The URL of the source
     * @return The cached data, or null if the source was never cached
     * @throws IOException If the entry exists but cannot be read or is not a mapping
     */
    @Nullable
    public Map<String, Object> loadEntry(@NotNull String url) throws IOException {
        Path entry = this.getEntryFile(url);
        if (Files.notExists(entry)) {
            return null;
        }
        LoggingAdapter.getDefaultLogger().debug(SourcesCache.class, "Loading cached data source {} from {}", url, entry);
        Object document = MappingDocuments.parse(Files.readAllBytes(entry));
        Map<String, Object> mapping = MappingDocuments.asMapping(document);
        if (mapping == null) {
            throw new IOException("The cache entry " + entry + " for " + url + " is not a mapping");
        }
        return mapping;
    }

    /**
     * Reads the index of the cache.
     *
     * @return The indexed sources, empty if the cache was never initialized
     * @throws IOException If the index cannot be read
     * @throws InvalidDataException If the index is malformed
     */
    @NotNull
    public List<DataSource> readIndex() throws IOException, InvalidDataException {
        Path index = this.getIndexFile();
        if (Files.notExists(index)) {
            return Collections.emptyList();
        }
        return SourcesList.parseSourcesData(Files.readString(index, StandardCharsets.UTF_8), index.toString());
    }

    /**
     * Rewrites the index so that it lists the given sources. All sources are written with the
     * "yaml" type regardless of their actual type, as the cached data is always a YAML mapping.
     *
     * @param sources The sources to index
     * @return The index file
     * @throws IOException If the index cannot be written
     */
    @NotNull
    public Path writeIndex(@NotNull List<? extends SourceDescriptor> sources) throws IOException {
        StringBuilder builder = new StringBuilder(SourcesCache.INDEX_HEADER).append('\n');
        for (SourceDescriptor source : sources) {
            builder.append("yaml ").append(source.getUrl());
            for (String tag : source.getTags()) {
                builder.append(' ').append(tag);
            }
            builder.append('\n');
        }
        Files.createDirectories(this.cacheDirectory);
        Path index = this.getIndexFile();
        this.write(builder.toString().getBytes(StandardCharsets.UTF_8), index);
        return index;
    }

    /**
     * Loads all indexed sources along with their cached data. The origin of every loaded source
     * is the path of its cache entry.
     *
     * @return The cached sources, in index order
     * @throws IOException If the index or an entry cannot be read
     * @throws InvalidDataException If the index is malformed
     */
    @NotNull
    public List<CachedDataSource> loadCachedSources() throws IOException, InvalidDataException {
        Path index = this.getIndexFile();
        if (Files.notExists(index)) {
            LoggingAdapter.getDefaultLogger().debug(SourcesCache.class, "No cache index present at {}, not loading cached sources", index);
            return Collections.emptyList();
        }
        String data = Files.readString(index, StandardCharsets.UTF_8);
        try {
            return SourcesList.parseSourcesData(data, index.toString(), (type, url, tags, origin) -> {
                DataSource source = new DataSource(type, url, tags, this.getEntryFile(url).toString());
                try {
                    return new CachedDataSource(source, this.loadEntry(url));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    protected void write(byte @NotNull[] data, @NotNull Path to) throws IOException {
        Path parts = to.resolveSibling(to.getFileName().toString() + ".part");
        Path lock = to.resolveSibling(to.getFileName().toString() + ".part.lock");

        try (FileChannel lockChannel = FileChannel.open(lock, StandardOpenOption.WRITE, StandardOpenOption.CREATE, StandardOpenOption.DELETE_ON_CLOSE)) {
            FileLock fileLock;
            long idleTime = 0L;
            while ((fileLock = SourcesCache.tryLock(lockChannel)) == null) {
                try {
                    Thread.sleep(10L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InterruptedIOException("Interrupted while waiting for the lock on " + parts.toAbsolutePath());
                }
                if ((idleTime += 10L) > SourcesCache.LOCK_TIMEOUT) {
                    throw new IOException("Waited more than 10 seconds to acquire lock on " + parts.toAbsolutePath());
                }
            }

            try {
                Files.write(parts, data, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                try {
                    Files.move(parts, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(parts, to, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                fileLock.release();
            }
        }
    }

    @Nullable
    private static FileLock tryLock(@NotNull FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // Held by another thread of this JVM, wait for it like for any other holder
            return null;
        }
    }
}
