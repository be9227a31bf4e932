package com.ingestmanager.ingestmanager.ingestion;

import java.time.Instant;

/**
 * Converts instants to and from the nanosecond {@code BIGINT} columns of the ingestion tables.
 * Representable range is 1677-09-21 to 2262-04-11.
 */
public final class EpochNanos {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private EpochNanos() {
    }

    public static long toNanos(Instant instant) {
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Instant out of storable range: " + instant, ex);
        }
    }

    public static Instant fromNanos(long epochNanos) {
        return Instant.ofEpochSecond(0L, epochNanos);
    }
}
