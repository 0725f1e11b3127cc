package org.stianloader.picodep.test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.repo.ResourceFetcher;

/**
 * In-memory {@link ResourceFetcher} counting how often each location was requested.
 */
public class MapResourceFetcher implements ResourceFetcher {

    @NotNull
    private final Map<String, byte[]> resources = new ConcurrentHashMap<>();
    @NotNull
    private final Map<String, AtomicInteger> requests = new ConcurrentHashMap<>();

    @NotNull
    public MapResourceFetcher put(@NotNull String url, @NotNull String contents) {
        return this.put(url, contents.getBytes(StandardCharsets.UTF_8));
    }

    @NotNull
    public MapResourceFetcher put(@NotNull String url, byte @NotNull[] contents) {
        this.resources.put(url, contents);
        return this;
    }

    @NotNull
    public MapResourceFetcher remove(@NotNull String url) {
        this.resources.remove(url);
        return this;
    }

    public int getRequestCount(@NotNull String url) {
        AtomicInteger count = this.requests.get(url);
        return count == null ? 0 : count.get();
    }

    @Override
    public byte @NotNull[] fetch(@NotNull URI location) throws DownloadFailureException {
        String url = location.toString();
        this.requests.computeIfAbsent(url, (ignored) -> new AtomicInteger()).incrementAndGet();
        byte[] contents = this.resources.get(url);
        if (contents == null) {
            throw new DownloadFailureException(url, "Query for " + url + " returned with a response code of 404 (Not Found)");
        }
        return contents;
    }
}
