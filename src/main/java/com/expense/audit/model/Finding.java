package com.expense.audit.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record flagged by a detector. The record is kept untouched; the detection metadata
 * lives beside it and is only merged into reserved {@code _}-prefixed keys by {@link #toRow()}.
 */
@Value
@Builder
@Schema(description = "An expense record annotated with the reason it was flagged")
public class Finding {

    public static final String REASON_KEY = "_reason";
    public static final String DUP_COUNT_KEY = "_dup_count";
    public static final String DETAILS_KEY = "_details";

    @NonNull
    ExpenseRecord record;

    @NonNull
    FindingReason reason;

    // Duplicate detector only
    Integer dupCount;

    // Keyword and discrepancy detectors only
    String details;

    public static Finding of(ExpenseRecord record, FindingReason reason) {
        return Finding.builder().record(record).reason(reason).build();
    }

    /**
     * Flat row view: every original column verbatim, then the reserved metadata keys.
     * A caller column named like a reserved key is shadowed in this view only.
     */
    @JsonValue
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>(record.asMap());
        row.put(REASON_KEY, reason.getCode());
        if (dupCount != null) {
            row.put(DUP_COUNT_KEY, dupCount);
        }
        if (details != null) {
            row.put(DETAILS_KEY, details);
        }
        return row;
    }
}
