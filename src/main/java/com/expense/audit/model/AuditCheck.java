package com.expense.audit.model;

/**
 * The record-level audit checks. Each one is served by exactly one detector.
 */
public enum AuditCheck {
    DUPLICATES,
    WEEKENDS,
    THRESHOLD,
    SUSPICIOUS_KEYWORDS,
    PAYMENT_DISCREPANCIES
}
