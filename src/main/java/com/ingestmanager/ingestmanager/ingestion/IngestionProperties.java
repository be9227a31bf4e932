package com.ingestmanager.ingestmanager.ingestion;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized ingestion runner configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    private String scheduleFile;
    private String zoneId = IngestionConstants.DEFAULT_ZONE_ID;
    private int maxConcurrency = IngestionConstants.DEFAULT_MAX_CONCURRENCY;
    private boolean restoreRunState = true;
    private int scd2LockStripes = IngestionConstants.DEFAULT_SCD2_LOCK_STRIPES;
    private int httpTimeoutSeconds = IngestionConstants.DEFAULT_HTTP_TIMEOUT_SECONDS;

    public String getScheduleFile() {
        return scheduleFile;
    }

    public void setScheduleFile(String scheduleFile) {
        this.scheduleFile = scheduleFile;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public boolean isRestoreRunState() {
        return restoreRunState;
    }

    public void setRestoreRunState(boolean restoreRunState) {
        this.restoreRunState = restoreRunState;
    }

    public int getScd2LockStripes() {
        return scd2LockStripes;
    }

    public void setScd2LockStripes(int scd2LockStripes) {
        this.scd2LockStripes = scd2LockStripes;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public void setHttpTimeoutSeconds(int httpTimeoutSeconds) {
        this.httpTimeoutSeconds = httpTimeoutSeconds;
    }
}
