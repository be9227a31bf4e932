package com.ingestmanager.ingestmanager.ingestion;

import java.time.Instant;

public final class IngestionModels {

    private IngestionModels() {
    }

    public record JobStatusResponse(
            String name,
            String triggerType,
            String trigger,
            Instant lastRunAt,
            Instant nextEligibleAt,
            boolean running
    ) {
    }
}
