package com.tenantgate.logs;

public record LogEntry(long ts, LogLevel level, String msg, String tenant) {}
