package org.stianloader.picodep;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Creates the objects a sources list line is parsed into.
 *
 * @param <T> The type of the created sources
 */
@FunctionalInterface
public interface DataSourceFactory<T> {

    /**
     * Creates a source from a parsed line.
     *
     * @param type The type of the source
     * @param url The URL of the source
     * @param tags The tags of the source, in declaration order
     * @param origin Where the line was read from
     * @return The created source
     * @throws IllegalArgumentException If the values do not describe a valid source
     */
    @NotNull
    T create(@NotNull DataSourceType type, @NotNull String url, @NotNull List<String> tags, @Nullable String origin);
}
