package io.intellixity.quarry.core.model;

/** A table-like object. {@code type} is "table", "view", or backend-specific (e.g. "keyspace"). */
public record TableInfo(String schema, String name, String type) {}
