package com.expense.audit.engine.detectors;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.engine.FindingDetector;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.normalize.AmountParser;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags records where the paid amount differs from the incurred amount by more than one cent.
 * Records missing either amount are skipped.
 */
@Component
public class PaymentDiscrepancyDetector implements FindingDetector {

    static final BigDecimal EPSILON = new BigDecimal("0.01");

    @Override
    public AuditCheck getSupportedCheck() {
        return AuditCheck.PAYMENT_DISCREPANCIES;
    }

    @Override
    public List<Finding> detect(List<ExpenseRecord> records, AuditContext context) {
        return flagDiscrepancies(records, context.getAmountColumn(), context.getPaidAmountColumn());
    }

    public List<Finding> flagDiscrepancies(List<ExpenseRecord> records, String incurredColumn, String paidColumn) {
        List<Finding> flagged = new ArrayList<>();
        for (ExpenseRecord record : records) {
            Optional<BigDecimal> incurred = AmountParser.parse(record.get(incurredColumn));
            Optional<BigDecimal> paid = AmountParser.parse(record.get(paidColumn));
            if (incurred.isEmpty() || paid.isEmpty()) continue;

            BigDecimal diff = incurred.get().subtract(paid.get()).abs();
            if (diff.compareTo(EPSILON) > 0) {
                flagged.add(Finding.builder()
                        .record(record)
                        .reason(FindingReason.DISCREPANCY)
                        .details("Diff: $" + diff.setScale(2, RoundingMode.HALF_EVEN).toPlainString())
                        .build());
            }
        }
        return flagged;
    }
}
