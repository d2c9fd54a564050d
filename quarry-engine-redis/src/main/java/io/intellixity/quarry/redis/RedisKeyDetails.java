package io.intellixity.quarry.redis;

import com.fasterxml.jackson.databind.JsonNode;

public record RedisKeyDetails(String key, String type, long ttl, JsonNode value, Long size, Long length, String encoding) {}
