package com.ingestmanager.ingestmanager.source;

import com.ingestmanager.ingestmanager.ingestion.IngestionConstants;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up data sources by the name jobs use in {@code args.source}.
 */
@Component
public class DataFetcherRegistry {

    private final Map<String, DataFetcher> fetchers = new TreeMap<>();

    public DataFetcherRegistry(List<DataFetcher> dataFetchers) {
        for (DataFetcher fetcher : dataFetchers) {
            String name = normalize(fetcher.sourceName());
            DataFetcher previous = fetchers.putIfAbsent(name, fetcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate data source name: " + name);
            }
        }
    }

    public DataFetcher resolve(String sourceName) {
        DataFetcher fetcher = fetchers.get(normalize(sourceName));
        if (fetcher == null) {
            throw new FetchException(IngestionConstants.MSG_UNKNOWN_SOURCE.formatted(sourceName, fetchers.keySet()));
        }
        return fetcher;
    }

    private String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
