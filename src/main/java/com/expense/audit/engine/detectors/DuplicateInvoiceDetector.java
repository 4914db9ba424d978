package com.expense.audit.engine.detectors;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.engine.FindingDetector;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.normalize.AmountParser;
import com.expense.audit.normalize.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects invoices submitted more than once.
 *
 * Records are keyed on (merchant, invoice number, amount) after normalization, so
 * "ACME" / "inv-1" / "$100" and "Acme" / "INV‐1" / "100.00" collide. Merchant can be
 * left out of the key to catch the same invoice filed against differently spelled vendors.
 *
 * Every member of a group of two or more is emitted with the group size; singletons
 * are dropped. Output is sorted by key so repeated runs give identical ordering.
 */
@Component
public class DuplicateInvoiceDetector implements FindingDetector {

    private static final Comparator<GroupKey> BY_KEY = Comparator
            .comparing(GroupKey::merchant)
            .thenComparing(GroupKey::invoice)
            .thenComparing(GroupKey::amount);

    @Override
    public AuditCheck getSupportedCheck() {
        return AuditCheck.DUPLICATES;
    }

    @Override
    public List<Finding> detect(List<ExpenseRecord> records, AuditContext context) {
        return findDuplicates(records, context.getMerchantColumn(), context.getInvoiceColumn(),
                context.getAmountColumn(), context.isIncludeMerchant());
    }

    public List<Finding> findDuplicates(List<ExpenseRecord> records, String merchantColumn,
                                        String invoiceColumn, String amountColumn,
                                        boolean includeMerchant) {
        Map<GroupKey, List<ExpenseRecord>> buckets = new LinkedHashMap<>();
        for (ExpenseRecord record : records) {
            GroupKey key = new GroupKey(
                    includeMerchant ? TextNormalizer.normalize(record.get(merchantColumn)) : "",
                    TextNormalizer.normalize(record.get(invoiceColumn)),
                    AmountParser.normalize(record.get(amountColumn)));
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        // Sorting whole groups by key gives the same order as a stable per-record sort
        List<Map.Entry<GroupKey, List<ExpenseRecord>>> clusters = new ArrayList<>();
        for (Map.Entry<GroupKey, List<ExpenseRecord>> entry : buckets.entrySet()) {
            if (entry.getValue().size() >= 2) {
                clusters.add(entry);
            }
        }
        clusters.sort(Map.Entry.comparingByKey(BY_KEY));

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<GroupKey, List<ExpenseRecord>> cluster : clusters) {
            int size = cluster.getValue().size();
            for (ExpenseRecord record : cluster.getValue()) {
                findings.add(Finding.builder()
                        .record(record)
                        .reason(FindingReason.DUPLICATE)
                        .dupCount(size)
                        .build());
            }
        }
        return findings;
    }

    private record GroupKey(String merchant, String invoice, String amount) {}
}
