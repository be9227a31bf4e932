package com.ingestmanager.ingestmanager.scd2;

public enum UpsertOutcome {
    /** First sighting of the business key. */
    INSERTED,
    /** Payload equal to the current version; nothing written. */
    UNCHANGED,
    /** Current version closed and a new one opened. */
    VERSIONED;

    public boolean createdVersion() {
        return this != UNCHANGED;
    }
}
