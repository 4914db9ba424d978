package com.expense.audit.engine.detectors;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.normalize.DateParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.expense.audit.testutil.TestDataFactory.createDated;
import static org.assertj.core.api.Assertions.assertThat;

class WeekendExpenseDetectorTest {

    private final WeekendExpenseDetector detector = new WeekendExpenseDetector();

    @Test
    void detect_saturdayFlagged_mondayNot() {
        List<Finding> findings = detector.detect(List.of(
                createDated("E-1", "2024-01-06"),
                createDated("E-2", "2024-01-08")), AuditContext.defaults());

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).getReason()).isEqualTo(FindingReason.WEEKEND);
        assertThat(findings.get(0).getRecord().get("expense_id")).isEqualTo("E-1");
    }

    @Test
    void detect_acceptsEveryDefaultFormat() {
        List<Finding> findings = detector.detect(List.of(
                createDated("E-1", "2024-01-07"),
                createDated("E-2", "01/07/2024"),
                createDated("E-3", "2024/01/07")), AuditContext.defaults());

        assertThat(findings).extracting(f -> f.getRecord().get("expense_id"))
                .containsExactly("E-1", "E-2", "E-3");
    }

    @Test
    void detect_unparseableOrMissingDates_skipped() {
        List<Finding> findings = detector.detect(List.of(
                createDated("E-1", ""),
                createDated("E-2", "Saturday"),
                createDated("E-3", "2024-13-06"),
                ExpenseRecord.of("expense_id", "E-4")), AuditContext.defaults());

        assertThat(findings).isEmpty();
    }

    @Test
    void detect_preservesInputOrder() {
        List<Finding> findings = detector.detect(List.of(
                createDated("E-3", "2024-03-10"),
                createDated("E-1", "2024-03-09"),
                createDated("E-9", "2024-03-11"),
                createDated("E-2", "2024-03-16")), AuditContext.defaults());

        assertThat(findings).extracting(f -> f.getRecord().get("expense_id"))
                .containsExactly("E-3", "E-1", "E-2");
    }

    @Test
    void flagWeekends_customColumnAndFormat() {
        ExpenseRecord record = ExpenseRecord.of("posted", "06.01.2024");

        List<Finding> findings = detector.flagWeekends(List.of(record), "posted",
                new DateParser(List.of("dd.MM.uuuu")));

        assertThat(findings).hasSize(1);
    }
}
