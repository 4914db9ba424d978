package com.expense.audit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One expense line: an ordered, immutable mapping from column name to raw string value.
 *
 * <p>An absent column and an empty value both mean "no value" to the parsers.
 * Updates produce a new instance via {@link #merge(Map)}.
 */
@Schema(description = "An expense record as column -> value pairs",
        example = "{\"expense_id\": \"E-1001\", \"merchant\": \"Acme\", \"invoice_no\": \"INV-1\", \"amount_usd\": \"100.00\"}")
public final class ExpenseRecord {

    private final Map<String, String> fields;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ExpenseRecord(Map<String, String> fields) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> copy.put(k, v == null ? "" : v));
        }
        this.fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a record from alternating column/value arguments.
     */
    public static ExpenseRecord of(String... columnsAndValues) {
        if (columnsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected column/value pairs, got " + columnsAndValues.length + " arguments");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            map.put(columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return new ExpenseRecord(map);
    }

    /**
     * Raw value of a column, or null if the column is absent.
     */
    public String get(String column) {
        return fields.get(column);
    }

    public String getOrEmpty(String column) {
        return fields.getOrDefault(column, "");
    }

    public boolean hasValue(String column) {
        String v = fields.get(column);
        return v != null && !v.isBlank();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return fields;
    }

    public ExpenseRecord merge(Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>(fields);
        merged.putAll(updates);
        return new ExpenseRecord(merged);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpenseRecord other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "ExpenseRecord" + fields;
    }
}
