package org.stianloader.picodep.update;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picodep.DataSource;
import org.stianloader.picodep.DownloadFailureException;
import org.stianloader.picodep.internal.MappingDocuments;
import org.stianloader.picodep.repo.ResourceFetcher;

/**
 * Fetches sources of the {@link org.stianloader.picodep.DataSourceType#YAML yaml} type, which point directly to a
 * YAML mapping document.
 */
public class YamlDataSourceFetcher implements DataSourceFetcher {

    @NotNull
    private final ResourceFetcher fetcher;

    public YamlDataSourceFetcher(@NotNull ResourceFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher may not be null");
    }

    @Override
    @NotNull
    public Map<String, Object> fetch(@NotNull DataSource source) throws DownloadFailureException {
        byte[] data = this.fetcher.fetch(source.getUri());
        Object document;
        try {
            document = MappingDocuments.parse(data);
        } catch (IOException e) {
            throw new DownloadFailureException(source.getUrl(), "mapping data from [" + source.getUrl() + "] is not valid YAML: " + e.getMessage(), e);
        }
        Map<String, Object> mapping = MappingDocuments.asMapping(document);
        if (mapping == null) {
            throw new DownloadFailureException(source.getUrl(), "mapping data from [" + source.getUrl() + "] is not a YAML dictionary");
        }
        return mapping;
    }
}
