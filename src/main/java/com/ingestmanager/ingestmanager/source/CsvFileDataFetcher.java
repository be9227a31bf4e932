package com.ingestmanager.ingestmanager.source;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads records from a local CSV file with a header row. Headers become snake_case record fields.
 */
@Component
public class CsvFileDataFetcher implements DataFetcher {

    static final String SOURCE_NAME = "csv";
    private static final String DEFAULT_COLUMN_PREFIX = "col_";

    @Override
    public String sourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<Map<String, Object>> fetch(Map<String, Object> args) {
        Path path = Path.of(SourceArgs.requiredString(args, "path"));
        String delimiter = SourceArgs.optionalString(args, "delimiter", ",");
        if (delimiter.length() != 1) {
            throw new FetchException("Argument 'delimiter' must be a single character, got: " + delimiter);
        }

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter.charAt(0))
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .setIgnoreEmptyLines(true)
                .build();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvFormat.parse(reader)) {
            List<String> headerNames = parser.getHeaderNames();
            if (headerNames.isEmpty()) {
                throw new FetchException("CSV header row not found in " + path);
            }
            List<String> columns = sanitizeCsvHeaders(headerNames);

            List<Map<String, Object>> records = new ArrayList<>();
            for (CSVRecord csvRecord : parser) {
                Map<String, Object> record = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    String value = csvRecord.isSet(i) ? csvRecord.get(i) : null;
                    record.put(columns.get(i), value == null || value.isEmpty() ? null : value);
                }
                records.add(record);
            }
            return records;
        } catch (NoSuchFileException ex) {
            throw new FetchException("CSV file not found: " + path, ex);
        } catch (IOException | IllegalArgumentException | IllegalStateException ex) {
            throw new FetchException("Unable to parse CSV file " + path + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public String defaultEntityName() {
        return "csv_records";
    }

    /**
     * Normalizes CSV headers to unique snake_case field names.
     */
    static List<String> sanitizeCsvHeaders(List<String> headers) {
        List<String> sanitized = new ArrayList<>(headers.size());
        Map<String, Integer> seen = new LinkedHashMap<>();

        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i) == null ? "" : headers.get(i).trim();
            String value = header.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
            value = value.replaceAll("_+", "_");
            value = value.replaceAll("^_+|_+$", "");
            if (value.isEmpty()) {
                value = DEFAULT_COLUMN_PREFIX + (i + 1);
            }
            if (!Character.isLetter(value.charAt(0)) && value.charAt(0) != '_') {
                value = DEFAULT_COLUMN_PREFIX + value;
            }

            int count = seen.getOrDefault(value, 0);
            seen.put(value, count + 1);
            sanitized.add(count == 0 ? value : value + "_" + (count + 1));
        }
        return sanitized;
    }
}
