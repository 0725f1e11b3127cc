package org.stianloader.picodep;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.repo.ResourceFetcher;

/**
 * Parser for the sources list format. Each non-empty line that does not start with '#' declares
 * a single data source:
 *
 * <pre>
 * # comments and empty lines allowed
 * &lt;type&gt; &lt;url&gt; [tags...]
 * </pre>
 *
 * <p>for example {@code yaml http://example.org/base.yaml jammy ubuntu}. If tags are specified,
 * <b>all</b> tags must match the current platform for the data to be used.
 */
public final class SourcesList {

    /**
     * The sources list downloaded by {@link #downloadDefaultSourcesList(ResourceFetcher)}.
     */
    @NotNull
    public static final String DEFAULT_SOURCES_LIST_URL = "https://raw.githubusercontent.com/ros/rosdistro/master/rosdep/sources.list.d/20-default.list";

    /**
     * The name under which the default sources list is stored by {@link #writeDefaultSourcesList(Path, String)}.
     */
    @NotNull
    public static final String DEFAULT_SOURCES_LIST_FILE = "20-default.list";

    @NotNull
    public static final String LIST_FILE_SUFFIX = ".list";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SourcesList() {
    }

    @NotNull
    public static List<DataSource> parseSourcesData(@NotNull String data, @Nullable String origin) throws InvalidDataException {
        return SourcesList.parseSourcesData(data, origin, DataSource::new);
    }

    /**
     * Parses data in the sources list format.
     *
     * @param <T> The type of the parsed sources
     * @param data The data in sources list format
     * @param origin Where the data was read from, used in error messages and passed to the factory
     * @param factory The factory creating the sources
     * @return The sources, in the order they were declared in
     * @throws InvalidDataException If a line is malformed
     */
    @NotNull
    public static <T> List<T> parseSourcesData(@NotNull String data, @Nullable String origin, @NotNull DataSourceFactory<T> factory) throws InvalidDataException {
        List<T> sources = new ArrayList<>();
        for (String rawLine : data.split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] splits = SourcesList.WHITESPACE.split(line);
            if (splits.length < 2) {
                throw new InvalidDataException("invalid line:\n" + line, origin);
            }
            try {
                DataSourceType type = DataSourceType.fromName(splits[0]);
                List<String> tags = Arrays.asList(splits).subList(2, splits.length);
                sources.add(factory.create(type, splits[1], tags, origin));
            } catch (IllegalArgumentException e) {
                throw new InvalidDataException("line:\n\t" + line + "\n" + e.getMessage(), origin, e);
            }
        }
        return sources;
    }

    /**
     * Parses a sources list file.
     *
     * @param file The file to parse
     * @return The sources declared in the file
     * @throws InvalidDataException If the file could not be read or is malformed
     */
    @NotNull
    public static List<DataSource> parseSourcesFile(@NotNull Path file) throws InvalidDataException {
        String data;
        try {
            data = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidDataException("I/O error reading sources file: " + e, file.toString(), e);
        }
        return SourcesList.parseSourcesData(data, file.toString());
    }

    /**
     * Parses every {@code *.list} file within a sources list directory. Files are read in the
     * order of their sorted names, so the result does not depend on the order in which the
     * filesystem lists them.
     *
     * @param directory The sources list directory
     * @return The sources of all files, concatenated. Empty if the directory does not exist
     * @throws InvalidDataException If any of the files is malformed
     * @throws IOException If the directory cannot be listed
     */
    @NotNull
    public static List<DataSource> parseSourcesList(@NotNull Path directory) throws InvalidDataException, IOException {
        if (Files.notExists(directory)) {
            // No sources on this system. This is a valid state.
            return Collections.emptyList();
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(file -> file.getFileName().toString().endsWith(SourcesList.LIST_FILE_SUFFIX))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        List<DataSource> sources = new ArrayList<>();
        for (Path file : files) {
            sources.addAll(SourcesList.parseSourcesFile(file));
        }
        return sources;
    }

    @NotNull
    public static String downloadDefaultSourcesList(@NotNull ResourceFetcher fetcher) throws DownloadFailureException, InvalidDataException {
        return SourcesList.downloadDefaultSourcesList(fetcher, URI.create(SourcesList.DEFAULT_SOURCES_LIST_URL));
    }

    /**
     * Downloads and validates a sources list.
     *
     * @param fetcher The fetcher to download with
     * @param location The location of the sources list
     * @return The raw sources list
     * @throws DownloadFailureException If the sources list could not be downloaded
     * @throws InvalidDataException If the sources list is empty or malformed
     */
    @NotNull
    public static String downloadDefaultSourcesList(@NotNull ResourceFetcher fetcher, @NotNull URI location) throws DownloadFailureException, InvalidDataException {
        String data = new String(fetcher.fetch(location), StandardCharsets.UTF_8);
        if (data.isBlank()) {
            throw new InvalidDataException("cannot download defaults file: empty contents", location.toString());
        }
        // Parse only for validation
        SourcesList.parseSourcesData(data, location.toString());
        return data;
    }

    /**
     * Stores a default sources list within a sources list directory, creating the directory if needed.
     *
     * @param directory The sources list directory
     * @param data The sources list, as obtained through {@link #downloadDefaultSourcesList(ResourceFetcher)}
     * @return The file the sources list was written to
     * @throws FileAlreadyExistsException If a default sources list already exists
     * @throws IOException If the file could not be written
     */
    @NotNull
    public static Path writeDefaultSourcesList(@NotNull Path directory, @NotNull String data) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(SourcesList.DEFAULT_SOURCES_LIST_FILE);
        if (Files.exists(file)) {
            throw new FileAlreadyExistsException(file.toString(), null, "The default sources list was already initialized");
        }
        Files.writeString(file, data, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return file;
    }
}
