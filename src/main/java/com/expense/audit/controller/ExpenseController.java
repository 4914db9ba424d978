package com.expense.audit.controller;

import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.PagedResponse;
import com.expense.audit.repository.ExpenseStorageException;
import com.expense.audit.service.AuditService;
import com.expense.audit.service.ExpenseService;
import com.expense.audit.service.ExpenseValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/expenses")
@Tag(name = "Expenses", description = "Browse and maintain the expense records under audit")
public class ExpenseController {

    private static final Logger log = LoggerFactory.getLogger(ExpenseController.class);

    private final ExpenseService expenseService;
    private final AuditService auditService;

    public ExpenseController(ExpenseService expenseService, AuditService auditService) {
        this.expenseService = expenseService;
        this.auditService = auditService;
    }

    @Operation(summary = "List expense records",
            description = "Offset-based pagination in table order. Requesting the first page also makes " +
                    "the full table the set exported by `/api/v1/audit/download`.")
    @GetMapping
    public ResponseEntity<PagedResponse<ExpenseRecord>> listRecords(
            @Parameter(description = "Index of the first record to return", example = "0")
            @RequestParam(defaultValue = "0") int offset,
            @Parameter(description = "Max number of records to return", example = "100")
            @RequestParam(defaultValue = "100") int limit) {
        if (offset == 0) {
            auditService.selectAllRecordsForExport();
        }
        return ResponseEntity.ok(expenseService.listRecords(offset, limit));
    }

    @Operation(summary = "Get an expense record by ID")
    @GetMapping("/{expenseId}")
    public ResponseEntity<ExpenseRecord> getRecord(
            @Parameter(description = "Expense ID", example = "E-1001")
            @PathVariable String expenseId) {
        ExpenseRecord record = expenseService.getRecord(expenseId);
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }

    @Operation(summary = "Add an expense record",
            description = "Requires expense_id, employee, department, expense_date (YYYY-MM-DD), amount_usd, " +
                    "currency, category, merchant and invoice_no. The table is saved to CSV immediately.")
    @PostMapping
    public ResponseEntity<ExpenseRecord> addRecord(@RequestBody ExpenseRecord record) {
        return ResponseEntity.ok(expenseService.addRecord(record));
    }

    @Operation(summary = "Update an expense record",
            description = "Merges the given fields into the record and saves the table.")
    @PutMapping("/{expenseId}")
    public ResponseEntity<ExpenseRecord> updateRecord(
            @Parameter(description = "Expense ID", example = "E-1001")
            @PathVariable String expenseId,
            @RequestBody Map<String, String> updates) {
        ExpenseRecord updated = expenseService.updateRecord(expenseId, updates);
        if (updated == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(updated);
    }

    @Operation(summary = "Delete an expense record")
    @DeleteMapping("/{expenseId}")
    public ResponseEntity<Void> deleteRecord(
            @Parameter(description = "Expense ID", example = "E-1001")
            @PathVariable String expenseId) {
        if (!expenseService.deleteRecord(expenseId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    // ── Helpers ──

    @ExceptionHandler(ExpenseValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ExpenseValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    @ExceptionHandler(ExpenseStorageException.class)
    public ResponseEntity<Map<String, String>> handleStorage(ExpenseStorageException e) {
        log.error("Expense change rolled back: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Failed to save to CSV"));
    }
}
