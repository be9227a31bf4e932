package com.ingestmanager.ingestmanager.schedule;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Objects;

/**
 * Cadence on which a job becomes due. One of {@link Interval}, {@link Daily} or {@link Weekly}.
 */
public interface TriggerSpec {

    Kind kind();

    enum Kind {
        INTERVAL,
        DAILY,
        WEEKLY;

        public static Kind fromName(String name) {
            String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
            for (Kind kind : values()) {
                if (kind.name().equals(normalized)) {
                    return kind;
                }
            }
            throw new UnknownTriggerKindException(name);
        }
    }

    record Interval(Duration period) implements TriggerSpec {

        public Interval {
            Objects.requireNonNull(period, "period");
            if (period.isZero() || period.isNegative()) {
                throw new IllegalArgumentException("Interval must be positive, got: " + period);
            }
        }

        public static Interval ofSeconds(long seconds) {
            return new Interval(Duration.ofSeconds(seconds));
        }

        @Override
        public Kind kind() {
            return Kind.INTERVAL;
        }
    }

    record Daily(LocalTime time) implements TriggerSpec {

        public Daily {
            Objects.requireNonNull(time, "time");
        }

        @Override
        public Kind kind() {
            return Kind.DAILY;
        }
    }

    record Weekly(DayOfWeek weekday, LocalTime time) implements TriggerSpec {

        public Weekly {
            Objects.requireNonNull(weekday, "weekday");
            Objects.requireNonNull(time, "time");
        }

        @Override
        public Kind kind() {
            return Kind.WEEKLY;
        }
    }
}
