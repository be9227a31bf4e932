package com.ingestmanager.ingestmanager.schedule;

/**
 * Raised when a schedule entry names a trigger type other than interval, daily or weekly.
 */
public class UnknownTriggerKindException extends IllegalArgumentException {

    private final String triggerKind;

    public UnknownTriggerKindException(String triggerKind) {
        super("Unknown trigger type: " + triggerKind);
        this.triggerKind = triggerKind;
    }

    public String getTriggerKind() {
        return triggerKind;
    }
}
