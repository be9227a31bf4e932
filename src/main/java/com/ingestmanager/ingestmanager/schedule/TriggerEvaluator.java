package com.ingestmanager.ingestmanager.schedule;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Decides whether a job is due and when it next becomes eligible.
 * Daily and weekly times are interpreted in a single configured zone; a time that falls into a
 * daylight-saving gap shifts forward by the length of the gap.
 */
public class TriggerEvaluator {

    private final ZoneId zone;

    public TriggerEvaluator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Returns true when the trigger fires at {@code now} given the job's last run.
     * Only answers for the present moment: several missed windows still yield a single due run.
     */
    public boolean isDue(TriggerSpec trigger, Instant lastRunAt, Instant now) {
        Objects.requireNonNull(now, "now");
        if (trigger instanceof TriggerSpec.Interval interval) {
            return lastRunAt == null || !now.isBefore(lastRunAt.plus(interval.period()));
        }
        if (trigger instanceof TriggerSpec.Daily daily) {
            return isDueAtTimeOfDay(daily.time(), lastRunAt, now);
        }
        if (trigger instanceof TriggerSpec.Weekly weekly) {
            if (now.atZone(zone).getDayOfWeek() != weekly.weekday()) {
                return false;
            }
            return isDueAtTimeOfDay(weekly.time(), lastRunAt, now);
        }
        throw new UnknownTriggerKindException(trigger == null ? null : trigger.getClass().getSimpleName());
    }

    /**
     * Returns the first instant after {@code lastRunAt} at which the trigger can fire again.
     * A job that never ran has no such bound and yields {@link Instant#EPOCH}.
     */
    public Instant nextEligible(TriggerSpec trigger, Instant lastRunAt) {
        if (lastRunAt == null) {
            return Instant.EPOCH;
        }
        if (trigger instanceof TriggerSpec.Interval interval) {
            return lastRunAt.plus(interval.period());
        }
        ZonedDateTime last = lastRunAt.atZone(zone);
        if (trigger instanceof TriggerSpec.Daily daily) {
            ZonedDateTime candidate = crossing(last.toLocalDate(), daily.time());
            if (!candidate.isAfter(last)) {
                candidate = crossing(last.toLocalDate().plusDays(1), daily.time());
            }
            return candidate.toInstant();
        }
        if (trigger instanceof TriggerSpec.Weekly weekly) {
            LocalDate date = last.toLocalDate().with(TemporalAdjusters.nextOrSame(weekly.weekday()));
            ZonedDateTime candidate = crossing(date, weekly.time());
            if (!candidate.isAfter(last)) {
                candidate = crossing(date.plusWeeks(1), weekly.time());
            }
            return candidate.toInstant();
        }
        throw new UnknownTriggerKindException(trigger == null ? null : trigger.getClass().getSimpleName());
    }

    /**
     * Due once today's crossing of {@code time} has passed and no run happened since that crossing.
     */
    private boolean isDueAtTimeOfDay(LocalTime time, Instant lastRunAt, Instant now) {
        ZonedDateTime current = now.atZone(zone);
        ZonedDateTime todayCrossing = crossing(current.toLocalDate(), time);
        if (current.isBefore(todayCrossing)) {
            return false;
        }
        return lastRunAt == null || lastRunAt.isBefore(todayCrossing.toInstant());
    }

    private ZonedDateTime crossing(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, zone);
    }
}
