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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags amounts over a policy limit, or just under it.
 *
 * Logic: amount > limit is OVER_LIMIT; otherwise limit - buffer < amount <= limit is
 * NEAR_LIMIT. The limit itself is in the near band, not over it.
 *
 * Example: limit=5000, buffer=200. 5000.00 is near, 5000.01 is over, 4800.00 is clean.
 * A buffer larger than the limit is not clamped, so the near band reaches below zero.
 */
@Component
public class ThresholdDetector implements FindingDetector {

    @Override
    public AuditCheck getSupportedCheck() {
        return AuditCheck.THRESHOLD;
    }

    @Override
    public List<Finding> detect(List<ExpenseRecord> records, AuditContext context) {
        return flagThreshold(records, context.getAmountColumn(), context.getLimit(), context.getBuffer());
    }

    public List<Finding> flagThreshold(List<ExpenseRecord> records, String amountColumn,
                                       BigDecimal limit, BigDecimal buffer) {
        BigDecimal nearFloor = limit.subtract(buffer);
        List<Finding> flagged = new ArrayList<>();
        for (ExpenseRecord record : records) {
            Optional<BigDecimal> parsed = AmountParser.parse(record.get(amountColumn));
            if (parsed.isEmpty()) continue;

            BigDecimal amount = parsed.get();
            FindingReason reason = null;
            if (amount.compareTo(limit) > 0) {
                reason = FindingReason.OVER_LIMIT;
            } else if (amount.compareTo(nearFloor) > 0) {
                reason = FindingReason.NEAR_LIMIT;
            }
            if (reason != null) {
                flagged.add(Finding.of(record, reason));
            }
        }
        return flagged;
    }
}
