package com.expense.audit.engine.detectors;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.engine.FindingDetector;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.normalize.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags records whose text columns mention policy-sensitive vocabulary.
 *
 * Matching is plain substring containment on normalized text, so "cash" also hits
 * "cashier". Every (term, column) hit is listed in the finding details, in scan order.
 */
@Component
public class SuspiciousKeywordDetector implements FindingDetector {

    public static final List<String> SUSPICIOUS_TERMS = List.of(
            "cash", "gift", "party", "casino", "spa", "personal",
            "misc", "various", "round", "facilitation", "consulting");

    @Override
    public AuditCheck getSupportedCheck() {
        return AuditCheck.SUSPICIOUS_KEYWORDS;
    }

    @Override
    public List<Finding> detect(List<ExpenseRecord> records, AuditContext context) {
        return flagSuspiciousKeywords(records, context.getKeywordColumns());
    }

    public List<Finding> flagSuspiciousKeywords(List<ExpenseRecord> records, List<String> columns) {
        List<Finding> flagged = new ArrayList<>();
        for (ExpenseRecord record : records) {
            List<String> hits = new ArrayList<>();
            for (String column : columns) {
                String value = TextNormalizer.normalize(record.get(column));
                for (String term : SUSPICIOUS_TERMS) {
                    if (value.contains(term)) {
                        hits.add(term + " (in " + column + ")");
                    }
                }
            }
            if (!hits.isEmpty()) {
                flagged.add(Finding.builder()
                        .record(record)
                        .reason(FindingReason.SUSPICIOUS_KEYWORD)
                        .details(String.join(", ", hits))
                        .build());
            }
        }
        return flagged;
    }
}
