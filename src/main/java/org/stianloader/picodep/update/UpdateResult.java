package org.stianloader.picodep.update;

import java.nio.file.Path;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.DownloadFailureException;

/**
 * The outcome of updating a single source. Exactly one of {@code cacheFile} and {@code failure} is non-null.
 *
 * @param source The updated source
 * @param cacheFile The cache entry the fetched data was written to, null if the update failed
 * @param failure The reason the update failed, null if it succeeded
 */
public record UpdateResult(@NotNull DataSource source, @Nullable Path cacheFile, @Nullable DownloadFailureException failure) {

    public UpdateResult {
        Objects.requireNonNull(source, "source may not be null");
        if ((cacheFile == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of cacheFile and failure must be set");
        }
    }

    @NotNull
    public static UpdateResult success(@NotNull DataSource source, @NotNull Path cacheFile) {
        return new UpdateResult(source, cacheFile, null);
    }

    @NotNull
    public static UpdateResult failure(@NotNull DataSource source, @NotNull DownloadFailureException failure) {
        return new UpdateResult(source, null, failure);
    }

    @Contract(pure = true)
    public boolean isSuccessful() {
        return this.cacheFile != null;
    }
}
