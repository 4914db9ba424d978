package com.expense.audit.service;

import com.expense.audit.config.AuditProperties;
import com.expense.audit.engine.AuditContext;
import com.expense.audit.engine.AuditEngine;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.BenfordResult;
import com.expense.audit.model.DatasetSummary;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.normalize.AmountParser;
import com.expense.audit.repository.ExpenseCsvRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs audits over a snapshot of the expense table and keeps the most recent result
 * set around for CSV export.
 */
@Service
public class AuditService {

    private final AuditEngine auditEngine;
    private final ExpenseRecordStore store;
    private final ExpenseCsvRepository repository;
    private final AuditProperties properties;

    // Rows behind the next /download; null until something has been viewed
    private final AtomicReference<List<Map<String, ?>>> lastResults = new AtomicReference<>();

    public AuditService(AuditEngine auditEngine, ExpenseRecordStore store,
                        ExpenseCsvRepository repository, AuditProperties properties) {
        this.auditEngine = auditEngine;
        this.store = store;
        this.repository = repository;
        this.properties = properties;
    }

    public List<Finding> runCheck(AuditCheck check) {
        return runCheck(check, properties.toContext());
    }

    /**
     * Threshold check with per-request overrides. Null falls back to the configured value.
     */
    public List<Finding> flagThreshold(BigDecimal limit, BigDecimal buffer) {
        AuditContext context = properties.toContext();
        if (limit != null) context.setLimit(limit);
        if (buffer != null) context.setBuffer(buffer);
        return runCheck(AuditCheck.THRESHOLD, context);
    }

    public BenfordResult analyzeBenford() {
        return auditEngine.analyzeBenford(store.snapshot(), properties.toContext());
    }

    public DatasetSummary summarize() {
        AuditContext context = properties.toContext();
        List<ExpenseRecord> records = store.snapshot();

        BigDecimal total = BigDecimal.ZERO;
        LocalDate first = null;
        LocalDate last = null;
        for (ExpenseRecord record : records) {
            Optional<BigDecimal> amount = AmountParser.parse(record.get(context.getAmountColumn()));
            if (amount.isPresent()) {
                total = total.add(amount.get());
            }
            Optional<LocalDate> date = context.getDateParser().parse(record.get(context.getDateColumn()));
            if (date.isPresent()) {
                if (first == null || date.get().isBefore(first)) first = date.get();
                if (last == null || date.get().isAfter(last)) last = date.get();
            }
        }

        return DatasetSummary.builder()
                .totalRows(records.size())
                .totalAmount(String.format(Locale.US, "$%,.2f", total))
                .dateRange(first == null ? "N/A" : first + " to " + last)
                .build();
    }

    /**
     * Makes the full table the export set, as when the user is browsing all rows.
     */
    public void selectAllRecordsForExport() {
        List<Map<String, ?>> rows = new ArrayList<>();
        for (ExpenseRecord record : store.snapshot()) {
            rows.add(record.asMap());
        }
        lastResults.set(rows);
    }

    /**
     * CSV of the last viewed result set, or the first rows of the table if there is none.
     * Header is the sorted union of all keys present, reserved {@code _} keys included.
     */
    public byte[] exportLastResults() {
        List<Map<String, ?>> rows = lastResults.get();
        if (rows == null || rows.isEmpty()) {
            rows = new ArrayList<>();
            List<ExpenseRecord> snapshot = store.snapshot();
            for (ExpenseRecord record : snapshot.subList(0, Math.min(properties.getExportFallbackRows(), snapshot.size()))) {
                rows.add(record.asMap());
            }
        }

        TreeSet<String> header = new TreeSet<>();
        for (Map<String, ?> row : rows) {
            header.addAll(row.keySet());
        }
        return repository.export(header, rows);
    }

    private List<Finding> runCheck(AuditCheck check, AuditContext context) {
        List<Finding> findings = auditEngine.run(check, store.snapshot(), context);
        List<Map<String, ?>> rows = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            rows.add(finding.toRow());
        }
        lastResults.set(rows);
        return findings;
    }
}
