package io.intellixity.quarry.redis;

/** {@code ttl} is -1 without expiry; {@code size} is MEMORY USAGE in bytes when the server reports it. */
public record RedisKeyInfo(String key, String type, long ttl, Long size) {}
