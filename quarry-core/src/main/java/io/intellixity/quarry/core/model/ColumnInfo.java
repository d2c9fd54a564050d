package io.intellixity.quarry.core.model;

public record ColumnInfo(String name, String dataType, boolean nullable, String defaultValue, boolean primaryKey) {}
