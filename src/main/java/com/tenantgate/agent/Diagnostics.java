package com.tenantgate.agent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence gathered from a sandbox when the agent cannot be brought up or reached.
 * Every field is filled, with a placeholder when collection itself failed.
 */
public record Diagnostics(
    String agentLog,
    String processes,
    String listeningPorts,
    List<String> notes
) {
    public Diagnostics {
        agentLog = orPlaceholder(agentLog);
        processes = orPlaceholder(processes);
        listeningPorts = orPlaceholder(listeningPorts);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("agentLog", agentLog);
        map.put("processes", processes);
        map.put("listeningPorts", listeningPorts);
        if (!notes.isEmpty()) {
            map.put("notes", notes);
        }
        return map;
    }

    private static String orPlaceholder(String value) {
        return value == null || value.isBlank() ? "(empty)" : value;
    }
}
