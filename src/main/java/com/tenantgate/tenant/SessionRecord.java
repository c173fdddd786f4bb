package com.tenantgate.tenant;

import com.fasterxml.jackson.databind.JsonNode;

public record SessionRecord(
    String id,
    String userId,
    String lastMessage,
    JsonNode lastResponse,
    long updatedAt
) {}
