package com.expense.audit.controller;

import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.BenfordReport;
import com.expense.audit.model.BenfordResult;
import com.expense.audit.model.DatasetSummary;
import com.expense.audit.model.Finding;
import com.expense.audit.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Run audit checks over the loaded expense table and export results")
public class AuditController {

    static final String EXPORT_FILE_NAME = "expenses_audit_results.csv";

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    @Operation(summary = "Get dataset summary",
            description = "Row count, total of all parseable amounts, and the span of parseable expense dates.")
    @GetMapping("/summary")
    public ResponseEntity<DatasetSummary> getSummary() {
        return ResponseEntity.ok(auditService.summarize());
    }

    @Operation(summary = "Find duplicate invoices",
            description = "Records sharing merchant, invoice number and amount after normalization. " +
                    "Each row carries `_dup_count`, the size of its duplicate group.")
    @GetMapping("/duplicates")
    public ResponseEntity<List<Finding>> findDuplicates() {
        return ResponseEntity.ok(auditService.runCheck(AuditCheck.DUPLICATES));
    }

    @Operation(summary = "Flag weekend expenses")
    @GetMapping("/weekends")
    public ResponseEntity<List<Finding>> flagWeekends() {
        return ResponseEntity.ok(auditService.runCheck(AuditCheck.WEEKENDS));
    }

    @Operation(summary = "Flag threshold violations",
            description = "`over_limit` when amount > limit, `near_limit` when limit - buffer < amount <= limit. " +
                    "Omitted parameters fall back to the configured values.")
    @GetMapping("/threshold")
    public ResponseEntity<List<Finding>> flagThreshold(
            @Parameter(description = "Policy limit in USD", example = "5000")
            @RequestParam(required = false) BigDecimal limit,
            @Parameter(description = "Width of the near-limit band below the limit", example = "200")
            @RequestParam(required = false) BigDecimal buffer) {
        return ResponseEntity.ok(auditService.flagThreshold(limit, buffer));
    }

    @Operation(summary = "Benford's Law analysis",
            description = "Leading-digit distribution of amounts vs. Benford's Law. " +
                    "Returns `{\"error\": ...}` when no amount has a leading digit.",
            responses = @ApiResponse(responseCode = "200",
                    content = @Content(schema = @Schema(implementation = BenfordReport.class))))
    @GetMapping("/benford")
    public ResponseEntity<?> analyzeBenford() {
        BenfordResult result = auditService.analyzeBenford();
        if (!result.isAvailable()) {
            return ResponseEntity.ok(Map.of("error", result.getError()));
        }
        return ResponseEntity.ok(result.getReport().get());
    }

    @Operation(summary = "Flag suspicious keywords",
            description = "Merchant, category or employee text containing terms such as cash, gift, casino or consulting. " +
                    "`_details` lists every hit.")
    @GetMapping("/suspicious")
    public ResponseEntity<List<Finding>> flagSuspiciousKeywords() {
        return ResponseEntity.ok(auditService.runCheck(AuditCheck.SUSPICIOUS_KEYWORDS));
    }

    @Operation(summary = "Flag payment discrepancies",
            description = "Records whose paid amount differs from the incurred amount by more than $0.01.")
    @GetMapping("/discrepancies")
    public ResponseEntity<List<Finding>> flagDiscrepancies() {
        return ResponseEntity.ok(auditService.runCheck(AuditCheck.PAYMENT_DISCREPANCIES));
    }

    @Operation(summary = "Download the last results as CSV",
            description = "Exports the rows of the most recent check (or the record listing). " +
                    "Falls back to the first rows of the table when nothing has been viewed yet.")
    @GetMapping("/download")
    public ResponseEntity<byte[]> download() {
        byte[] csv = auditService.exportLastResults();
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(EXPORT_FILE_NAME).build().toString())
                .body(csv);
    }
}
