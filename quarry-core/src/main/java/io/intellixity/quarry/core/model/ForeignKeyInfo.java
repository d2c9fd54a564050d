package io.intellixity.quarry.core.model;

public record ForeignKeyInfo(String name, String column, String referencesTable, String referencesColumn) {}
