package com.expense.audit.controller;

import com.expense.audit.config.AuditProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify audit policy settings")
public class ConfigController {

    private final AuditProperties auditProperties;

    public ConfigController(AuditProperties auditProperties) {
        this.auditProperties = auditProperties;
    }

    @Operation(summary = "Get audit policy settings")
    @GetMapping("/audit")
    public ResponseEntity<Map<String, Object>> getAuditConfig() {
        return ResponseEntity.ok(Map.of(
                "limit", auditProperties.getThreshold().getLimit(),
                "buffer", auditProperties.getThreshold().getBuffer(),
                "includeMerchant", auditProperties.getDuplicates().isIncludeMerchant(),
                "keywordColumns", auditProperties.getKeywordColumns(),
                "dateFormats", auditProperties.getDateFormats()
        ));
    }

    @Operation(summary = "Update audit policy settings",
            description = "Changes apply immediately but reset on restart. A buffer at or above the limit " +
                    "is accepted; the near-limit band then reaches below zero.")
    @PutMapping("/audit")
    public ResponseEntity<?> updateAuditConfig(@RequestBody Map<String, Object> body) {
        BigDecimal limit = toDecimal(body, "limit", auditProperties.getThreshold().getLimit());
        BigDecimal buffer = toDecimal(body, "buffer", auditProperties.getThreshold().getBuffer());
        boolean includeMerchant = toBoolean(body, "includeMerchant",
                auditProperties.getDuplicates().isIncludeMerchant());

        if (limit == null || limit.signum() < 0) return badRequest("limit must be a number >= 0", "limit");
        if (buffer == null || buffer.signum() < 0) return badRequest("buffer must be a number >= 0", "buffer");

        auditProperties.getThreshold().setLimit(limit);
        auditProperties.getThreshold().setBuffer(buffer);
        auditProperties.getDuplicates().setIncludeMerchant(includeMerchant);

        return getAuditConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    // Null signals an unparseable value
    private BigDecimal toDecimal(Map<String, Object> body, String key, BigDecimal defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        try { return new BigDecimal(v.toString()); } catch (NumberFormatException e) { return null; }
    }

    private boolean toBoolean(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }
}
