package org.stianloader.picodep;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link DataSource} together with the mapping data that was cached for it.
 * The mapping data is null if the source was never fetched successfully.
 */
public final class CachedDataSource implements SourceDescriptor {

    @NotNull
    private final DataSource source;
    @Nullable
    private final Map<String, Object> mappingData;

    public CachedDataSource(@NotNull DataSource source, @Nullable Map<String, Object> mappingData) {
        this.source = Objects.requireNonNull(source, "source may not be null");
        this.mappingData = mappingData;
    }

    @NotNull
    @Contract(pure = true)
    public DataSource getSource() {
        return this.source;
    }

    @Nullable
    @Contract(pure = true)
    public Map<String, Object> getMappingData() {
        return this.mappingData;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public DataSourceType getType() {
        return this.source.getType();
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getUrl() {
        return this.source.getUrl();
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public Set<String> getTags() {
        return this.source.getTags();
    }

    @Override
    @Nullable
    @Contract(pure = true)
    public String getOrigin() {
        return this.source.getOrigin();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof CachedDataSource) {
            CachedDataSource other = (CachedDataSource) obj;
            return other.source.equals(this.source) && Objects.equals(other.mappingData, this.mappingData);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.source, this.mappingData);
    }

    @Override
    public String toString() {
        return this.source + "\n" + this.mappingData;
    }
}
