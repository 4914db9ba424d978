package com.expense.audit.service;

import com.expense.audit.config.AuditProperties;
import com.expense.audit.config.MetricsConfig;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.PagedResponse;
import com.expense.audit.normalize.AmountParser;
import com.expense.audit.normalize.DateParser;
import com.expense.audit.repository.ExpenseCsvRepository;
import com.expense.audit.repository.ExpenseStorageException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Service layer for expense records.
 * Validates changes, applies them to the in-memory store and writes the table back to CSV.
 * A change that cannot be persisted is undone in memory before the error propagates.
 */
@Service
public class ExpenseService {

    private static final Logger log = LoggerFactory.getLogger(ExpenseService.class);

    static final String CURRENCY_COLUMN = "currency";

    // Entry forms only accept year-month-day dates, even though the audits read more formats
    private static final DateParser ENTRY_DATE = new DateParser(List.of("uuuu-M-d"));

    private final ExpenseRecordStore store;
    private final ExpenseCsvRepository repository;
    private final AuditProperties properties;
    private final MetricsConfig metricsConfig;

    public ExpenseService(ExpenseRecordStore store, ExpenseCsvRepository repository,
                          AuditProperties properties, MetricsConfig metricsConfig) {
        this.store = store;
        this.repository = repository;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (!properties.isLoadOnStartup()) {
            return;
        }
        if (!repository.exists()) {
            log.warn("Expense data file {} not found, starting with an empty table", repository.getDataFile());
            return;
        }
        store.replaceAll(repository.load());
        metricsConfig.updateLoadedRecordCount(store.size());
    }

    public PagedResponse<ExpenseRecord> listRecords(int offset, int limit) {
        return store.page(offset, limit);
    }

    public ExpenseRecord getRecord(String expenseId) {
        return store.findById(expenseId).orElse(null);
    }

    public synchronized ExpenseRecord addRecord(ExpenseRecord record) {
        AuditProperties.Columns columns = properties.getColumns();
        List<String> missing = new ArrayList<>();
        for (String field : requiredFields()) {
            if (!record.hasValue(field)) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new ExpenseValidationException("Missing fields: " + String.join(", ", missing), missing.get(0));
        }
        validateDate(record.get(columns.getDate()));
        validateAmount(columns.getAmount(), record.get(columns.getAmount()));

        String id = record.get(columns.getId());
        if (!store.add(record)) {
            throw new ExpenseValidationException("Expense ID already exists: " + id, columns.getId());
        }

        try {
            persist();
        } catch (ExpenseStorageException e) {
            store.remove(id);
            metricsConfig.recordRecordChange("add", "failed");
            throw e;
        }
        metricsConfig.recordRecordChange("add", "success");
        metricsConfig.updateLoadedRecordCount(store.size());
        log.info("Added expense record {}", id);
        return record;
    }

    /**
     * Merges the given fields into an existing record.
     *
     * @return the updated record, or null if no record has this id
     */
    public synchronized ExpenseRecord updateRecord(String expenseId, Map<String, String> updates) {
        AuditProperties.Columns columns = properties.getColumns();
        Optional<ExpenseRecord> existing = store.findById(expenseId);
        if (existing.isEmpty()) {
            return null;
        }

        if (updates.containsKey(columns.getDate())) {
            validateDate(updates.get(columns.getDate()));
        }
        if (updates.containsKey(columns.getAmount())) {
            validateAmount(columns.getAmount(), updates.get(columns.getAmount()));
        }
        String paid = updates.get(columns.getPaidAmount());
        if (paid != null && !paid.isBlank()) {
            validateAmount(columns.getPaidAmount(), paid);
        }
        String newId = updates.get(columns.getId());
        if (newId != null && newId.isBlank()) {
            throw new ExpenseValidationException("Expense ID cannot be blank", columns.getId());
        }
        if (newId != null && !newId.equals(expenseId) && store.findById(newId).isPresent()) {
            throw new ExpenseValidationException("Expense ID already exists: " + newId, columns.getId());
        }

        ExpenseRecord updated = existing.get().merge(updates);
        store.replace(expenseId, updated);

        try {
            persist();
        } catch (ExpenseStorageException e) {
            store.replace(updated.getOrEmpty(columns.getId()), existing.get());
            metricsConfig.recordRecordChange("update", "failed");
            throw e;
        }
        metricsConfig.recordRecordChange("update", "success");
        log.info("Updated expense record {}", expenseId);
        return updated;
    }

    public synchronized boolean deleteRecord(String expenseId) {
        int index = store.indexOf(expenseId);
        Optional<ExpenseRecord> removed = store.remove(expenseId);
        if (removed.isEmpty()) {
            return false;
        }

        try {
            persist();
        } catch (ExpenseStorageException e) {
            store.insert(index, removed.get());
            metricsConfig.recordRecordChange("delete", "failed");
            throw e;
        }
        metricsConfig.recordRecordChange("delete", "success");
        metricsConfig.updateLoadedRecordCount(store.size());
        log.info("Deleted expense record {}", expenseId);
        return true;
    }

    List<String> requiredFields() {
        AuditProperties.Columns c = properties.getColumns();
        return List.of(c.getId(), c.getEmployee(), c.getDepartment(), c.getDate(), c.getAmount(),
                CURRENCY_COLUMN, c.getCategory(), c.getMerchant(), c.getInvoice());
    }

    private void persist() {
        if (!repository.save(store.snapshot())) {
            throw new ExpenseStorageException("Refusing to write an empty expense table to " + repository.getDataFile());
        }
    }

    private void validateDate(String value) {
        if (ENTRY_DATE.parse(value).isEmpty()) {
            throw new ExpenseValidationException("Invalid date format. Use YYYY-MM-DD",
                    properties.getColumns().getDate());
        }
    }

    private void validateAmount(String column, String value) {
        if (AmountParser.parse(value).isEmpty()) {
            throw new ExpenseValidationException("Invalid " + column, column);
        }
    }
}
