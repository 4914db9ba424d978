package com.expense.audit.engine.benford;

import com.expense.audit.model.BenfordDigitStat;
import com.expense.audit.model.BenfordReport;
import com.expense.audit.model.BenfordResult;
import com.expense.audit.model.ExpenseRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Compares the leading-digit distribution of expense amounts with Benford's Law,
 * P(d) = log10(1 + 1/d).
 *
 * The leading digit is read from the raw amount text: the first digit character that
 * is not '0', so "$0.99" counts as 9. Amounts with no such digit are left out of the sample.
 *
 * The suspicion flag trips when any digit's share is more than 5 percentage points off
 * the expected share. It is a tripwire for manual review, not a significance test.
 */
@Component
public class BenfordAnalyzer {

    public static final double SUSPICION_THRESHOLD = 0.05;
    public static final String NO_DATA_ERROR = "No valid amounts found";

    private static final double[] EXPECTED = new double[10];

    static {
        for (int d = 1; d <= 9; d++) {
            EXPECTED[d] = Math.log10(1.0 + 1.0 / d);
        }
    }

    public BenfordResult analyze(List<ExpenseRecord> records, String amountColumn) {
        int[] counts = new int[10];
        int total = 0;
        for (ExpenseRecord record : records) {
            int digit = leadingDigit(record.getOrEmpty(amountColumn));
            if (digit > 0) {
                counts[digit]++;
                total++;
            }
        }

        if (total == 0) {
            return BenfordResult.insufficientData(NO_DATA_ERROR);
        }

        BenfordReport.BenfordReportBuilder report = BenfordReport.builder().totalAnalyzed(total);
        double maxDeviation = 0.0;
        for (int d = 1; d <= 9; d++) {
            double actual = (double) counts[d] / total;
            double diff = Math.abs(actual - EXPECTED[d]);
            maxDeviation = Math.max(maxDeviation, diff);

            report.stat(BenfordDigitStat.builder()
                    .digit(d)
                    .actualCount(counts[d])
                    .actualPct(toPct(actual))
                    .expectedPct(toPct(EXPECTED[d]))
                    .diffPct(toPct(diff))
                    .build());
        }

        return BenfordResult.of(report
                .suspicious(maxDeviation > SUSPICION_THRESHOLD)
                .maxDeviationPct(toPct(maxDeviation))
                .build());
    }

    /**
     * First non-zero digit in the text, or 0 if there is none.
     */
    static int leadingDigit(String amount) {
        for (int i = 0; i < amount.length(); i++) {
            char c = amount.charAt(i);
            if (Character.isDigit(c)) {
                int d = Character.digit(c, 10);
                if (d > 0) {
                    return d;
                }
            }
        }
        return 0;
    }

    static double expectedFrequency(int digit) {
        return EXPECTED[digit];
    }

    private static double toPct(double fraction) {
        return BigDecimal.valueOf(fraction * 100.0).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
