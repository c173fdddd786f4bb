package com.tenantgate.logs;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LogLevel {
    INFO, WARN, ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies a raw agent log line: mentions of "error" or "fail" are errors,
     * mentions of "warn" are warnings, everything else is info.
     */
    public static LogLevel classify(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.contains("error") || lower.contains("fail")) {
            return ERROR;
        }
        if (lower.contains("warn")) {
            return WARN;
        }
        return INFO;
    }
}
