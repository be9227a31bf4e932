package com.ingestmanager.ingestmanager.history;

public enum RunStatus {
    SUCCESS,
    FAILURE
}
