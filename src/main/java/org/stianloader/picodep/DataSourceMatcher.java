package org.stianloader.picodep;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Decides whether a data source applies to the current platform. A source matches if
 * all of its tags are known to the matcher, so a source without tags matches everywhere.
 */
public class DataSourceMatcher {

    @NotNull
    private final Set<String> tags;

    public DataSourceMatcher(@NotNull Collection<String> tags) {
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
    }

    /**
     * Creates a matcher for a platform described by the given values, usually the distribution
     * codename, the OS name and the OS codename. Null or empty values are dropped.
     *
     * @param platformTags The descriptors of the current platform
     * @return A matcher for the platform
     */
    @NotNull
    public static DataSourceMatcher create(@Nullable String @NotNull... platformTags) {
        List<String> tags = new ArrayList<>();
        for (String tag : platformTags) {
            if (tag != null && !tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return new DataSourceMatcher(tags);
    }

    @Contract(pure = true)
    public boolean matches(@NotNull SourceDescriptor source) {
        return this.tags.containsAll(source.getTags());
    }

    @NotNull
    @Contract(pure = true)
    public Set<String> getTags() {
        return this.tags;
    }

    @Override
    public String toString() {
        return "DataSourceMatcher[" + String.join(", ", this.tags) + "]";
    }
}
