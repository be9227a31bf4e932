package com.ingestmanager.ingestmanager.source;

import java.util.Map;

/**
 * Typed reads of the loosely typed job argument map.
 */
final class SourceArgs {

    private SourceArgs() {
    }

    static String requiredString(Map<String, Object> args, String key) {
        String value = optionalString(args, key, null);
        if (value == null || value.isBlank()) {
            throw new FetchException("Missing required argument '" + key + "'");
        }
        return value.trim();
    }

    static String optionalString(Map<String, Object> args, String key, String defaultValue) {
        Object value = args.get(key);
        return value == null ? defaultValue : String.valueOf(value);
    }

    static long optionalLong(Map<String, Object> args, String key, long defaultValue) {
        Object value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException ex) {
            throw new FetchException("Argument '" + key + "' must be a number, got: " + value, ex);
        }
    }
}
