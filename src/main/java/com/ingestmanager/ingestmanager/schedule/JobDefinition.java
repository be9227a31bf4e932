package com.ingestmanager.ingestmanager.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One scheduled ingestion job. The argument map is forwarded verbatim to the job's data source.
 */
public record JobDefinition(String name, TriggerSpec trigger, Map<String, Object> args) {

    public JobDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(trigger, "trigger");
        // LinkedHashMap keeps null values, which Map.copyOf rejects.
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    public Object arg(String key) {
        return args.get(key);
    }
}
