package org.stianloader.picodep;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable descriptor of a single source of dependency mapping data, as declared by
 * a line of a sources list file.
 */
public final class DataSource implements SourceDescriptor {

    @NotNull
    private final DataSourceType type;
    @NotNull
    private final String url;
    @NotNull
    private final URI uri;
    @NotNull
    private final Set<String> tags;
    @Nullable
    private final String origin;

    /**
     * Constructor.
     *
     * @param type The type of the data source
     * @param url The URL of the data. It must be a fully specified URL with a scheme, a host and a path
     * @param tags The tags used to match the data source against the current platform
     * @param origin The file or other location where this source was declared, for debugging
     * @throws IllegalArgumentException If the URL is not fully specified
     */
    public DataSource(@NotNull DataSourceType type, @NotNull String url, @NotNull Collection<String> tags, @Nullable String origin) {
        this.type = Objects.requireNonNull(type, "type may not be null");
        this.url = Objects.requireNonNull(url, "url may not be null");
        this.uri = DataSource.parseUrl(url);
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        this.origin = origin;
    }

    @NotNull
    private static URI parseUrl(@NotNull String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("url must be a fully-specified URL with scheme, hostname, and path: " + url, e);
        }
        String path = uri.getRawPath();
        if (uri.getScheme() == null || uri.getRawAuthority() == null || path == null || path.isEmpty() || path.equals("/")) {
            throw new IllegalArgumentException("url must be a fully-specified URL with scheme, hostname, and path: " + url);
        }
        return uri;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public DataSourceType getType() {
        return this.type;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getUrl() {
        return this.url;
    }

    @NotNull
    @Contract(pure = true)
    public URI getUri() {
        return this.uri;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public Set<String> getTags() {
        return this.tags;
    }

    @Override
    @Nullable
    @Contract(pure = true)
    public String getOrigin() {
        return this.origin;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof DataSource) {
            DataSource other = (DataSource) obj;
            return other.type == this.type
                    && other.url.equals(this.url)
                    && other.tags.equals(this.tags)
                    && Objects.equals(other.origin, this.origin);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.url, this.tags, this.origin);
    }

    @Override
    public String toString() {
        String line = this.type.getName() + " " + this.url + " " + String.join(" ", this.tags);
        if (this.origin != null) {
            return "[" + this.origin + "]:\n" + line;
        }
        return line;
    }
}
