package com.expense.audit.engine;

import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;

import java.util.List;

/**
 * Interface for all record-level audit detectors.
 * Each implementation handles a specific AuditCheck.
 */
public interface FindingDetector {

    /**
     * The audit check this detector handles.
     */
    AuditCheck getSupportedCheck();

    /**
     * Scan a snapshot of records and return the flagged ones.
     * Implementations must not modify the records and must not throw on malformed values.
     *
     * @param records read-only snapshot of the expense table
     * @param context column names and policy parameters for this run
     * @return findings, in the detector's documented order
     */
    List<Finding> detect(List<ExpenseRecord> records, AuditContext context);
}
