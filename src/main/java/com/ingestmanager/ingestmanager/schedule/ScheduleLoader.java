package com.ingestmanager.ingestmanager.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the JSON schedule file into job definitions. Entries are validated one by one so that a
 * malformed job is reported and skipped without failing the rest of the schedule.
 */
@Component
public class ScheduleLoader {

    private static final Logger log = LoggerFactory.getLogger(ScheduleLoader.class);
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ScheduleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads a schedule file. Unreadable or non-JSON content fails the whole load.
     */
    public LoadedSchedule load(Path scheduleFile) {
        String content;
        try {
            content = Files.readString(scheduleFile, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read schedule file: " + scheduleFile, ex);
        }
        LoadedSchedule schedule = parse(content);
        log.info("Loaded schedule {}: jobs={}, rejected={}",
                scheduleFile, schedule.jobs().size(), schedule.rejected().size());
        return schedule;
    }

    public LoadedSchedule parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Schedule is not valid JSON: " + ex.getOriginalMessage(), ex);
        }

        JsonNode entries = root != null && root.isObject() ? root.get("jobs") : root;
        if (entries == null || !entries.isArray()) {
            throw new IllegalStateException("Schedule must be a JSON array of jobs or an object with a 'jobs' array");
        }

        List<JobDefinition> jobs = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode entry : entries) {
            index++;
            try {
                JobDefinition job = parseJob(entry);
                if (!names.add(job.name())) {
                    throw new IllegalArgumentException("Duplicate job name: " + job.name());
                }
                jobs.add(job);
            } catch (IllegalArgumentException ex) {
                String message = "Job #" + index + " rejected: " + ex.getMessage();
                log.warn(message);
                rejected.add(message);
            }
        }
        return new LoadedSchedule(jobs, rejected);
    }

    private JobDefinition parseJob(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            throw new IllegalArgumentException("Job entry must be a JSON object");
        }
        String name = entry.path("name").asText("").trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Job name is required");
        }
        JsonNode triggerNode = entry.get("trigger");
        if (triggerNode == null || !triggerNode.isObject()) {
            throw new IllegalArgumentException("Job '" + name + "' has no trigger object");
        }
        JsonNode argsNode = entry.get("args");
        if (argsNode != null && !argsNode.isNull() && !argsNode.isObject()) {
            throw new IllegalArgumentException("Job '" + name + "' args must be a JSON object");
        }
        Map<String, Object> args = argsNode == null || argsNode.isNull()
                ? Map.of()
                : objectMapper.convertValue(argsNode, ARGS_TYPE);
        return new JobDefinition(name, parseTrigger(name, triggerNode), args);
    }

    private TriggerSpec parseTrigger(String jobName, JsonNode node) {
        TriggerSpec.Kind kind = TriggerSpec.Kind.fromName(node.path("type").asText(null));
        switch (kind) {
            case INTERVAL:
                JsonNode seconds = node.get("seconds");
                if (seconds == null || !seconds.isIntegralNumber() || !seconds.canConvertToLong() || seconds.asLong() <= 0) {
                    throw new IllegalArgumentException("Job '" + jobName + "' interval needs a positive whole number of 'seconds'");
                }
                return TriggerSpec.Interval.ofSeconds(seconds.asLong());
            case DAILY:
                return new TriggerSpec.Daily(parseTime(jobName, node));
            case WEEKLY:
                return new TriggerSpec.Weekly(parseWeekday(jobName, node.path("weekday").asText(null)), parseTime(jobName, node));
            default:
                throw new UnknownTriggerKindException(kind.name());
        }
    }

    private LocalTime parseTime(String jobName, JsonNode node) {
        String value = node.path("time").asText("");
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Job '" + jobName + "' has invalid time '" + value + "', expected HH:mm", ex);
        }
    }

    private DayOfWeek parseWeekday(String jobName, String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean abbreviated = normalized.length() == 3 && day.name().startsWith(normalized);
            if (day.name().equals(normalized) || abbreviated) {
                return day;
            }
        }
        throw new IllegalArgumentException("Job '" + jobName + "' has invalid weekday '" + value + "'");
    }
}
