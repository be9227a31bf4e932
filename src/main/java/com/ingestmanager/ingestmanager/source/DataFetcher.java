package com.ingestmanager.ingestmanager.source;

import java.util.List;
import java.util.Map;

/**
 * Abstraction for obtaining the raw records of one ingestion run from any backing source.
 * Implementations are selected by the job's {@code source} argument.
 */
public interface DataFetcher {

    /**
     * Name a schedule uses in {@code args.source} to select this fetcher.
     */
    String sourceName();

    /**
     * Fetches the finite record set for one run.
     *
     * @throws FetchException when the source cannot produce records
     */
    List<Map<String, Object>> fetch(Map<String, Object> args);

    /**
     * Record fields forming the business key when the job does not declare {@code key_fields}.
     */
    default List<String> defaultKeyFields() {
        return List.of("id");
    }

    /**
     * Entity the records are versioned into when the job does not declare {@code entity}.
     */
    default String defaultEntityName() {
        return sourceName() + "_records";
    }
}
