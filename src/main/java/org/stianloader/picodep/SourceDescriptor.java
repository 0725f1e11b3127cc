package org.stianloader.picodep;

import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Read-only view on the fields describing a source of mapping data.
 * Implemented by {@link DataSource} and by {@link CachedDataSource}, which delegates
 * to the {@link DataSource} it wraps.
 */
public interface SourceDescriptor {

    @NotNull
    @Contract(pure = true)
    DataSourceType getType();

    /**
     * Obtains the URL of the mapping data as it was declared. The URL doubles as
     * the name of the view the data is exposed under.
     *
     * @return The URL of the data source
     */
    @NotNull
    @Contract(pure = true)
    String getUrl();

    @NotNull
    @Contract(pure = true)
    Set<String> getTags();

    /**
     * Obtains the file or other location this source was declared in, for debugging purposes.
     *
     * @return The origin of the source, may be null
     */
    @Nullable
    @Contract(pure = true)
    String getOrigin();
}
