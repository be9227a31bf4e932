package com.ingestmanager.ingestmanager.source;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates mock transactions for offline runs. The same {@code seed} always yields the same records,
 * so re-running a job against unchanged mock data creates no new versions.
 */
@Component
public class MockTransactionFetcher implements DataFetcher {

    static final String SOURCE_NAME = "mock";
    private static final int DEFAULT_LIMIT = 5;
    private static final int MAX_LIMIT = 100_000;
    private static final String DEFAULT_CURRENCY = "KRW";
    private static final LocalDate BASE_BOOKING_DATE = LocalDate.of(2024, 1, 1);

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<Map<String, Object>> fetch(Map<String, Object> args) {
        long limit = SourceArgs.optionalLong(args, "limit", DEFAULT_LIMIT);
        if (limit < 0 || limit > MAX_LIMIT) {
            throw new FetchException("Argument 'limit' must be between 0 and " + MAX_LIMIT + ", got: " + limit);
        }
        long seed = SourceArgs.optionalLong(args, "seed", 0L);
        String currency = SourceArgs.optionalString(args, "currency", DEFAULT_CURRENCY);

        Random random = new Random(seed);
        List<Map<String, Object>> records = new ArrayList<>((int) limit);
        for (int i = 0; i < limit; i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("tx_id", "mock-" + i);
            record.put("amount", BigDecimal.valueOf(random.nextInt(100_000), 2));
            record.put("currency", currency);
            record.put("booked_on", BASE_BOOKING_DATE.plusDays(i).toString());
            records.add(record);
        }
        return records;
    }

    @Override
    public List<String> defaultKeyFields() {
        return List.of("tx_id");
    }

    @Override
    public String defaultEntityName() {
        return "transactions";
    }
}
