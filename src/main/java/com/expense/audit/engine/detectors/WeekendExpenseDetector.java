package com.expense.audit.engine.detectors;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.engine.FindingDetector;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import com.expense.audit.model.FindingReason;
import com.expense.audit.normalize.DateParser;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flags expenses dated on a Saturday or Sunday. Records without a parseable date
 * are skipped. Output keeps input order.
 */
@Component
public class WeekendExpenseDetector implements FindingDetector {

    @Override
    public AuditCheck getSupportedCheck() {
        return AuditCheck.WEEKENDS;
    }

    @Override
    public List<Finding> detect(List<ExpenseRecord> records, AuditContext context) {
        return flagWeekends(records, context.getDateColumn(), context.getDateParser());
    }

    public List<Finding> flagWeekends(List<ExpenseRecord> records, String dateColumn, DateParser dateParser) {
        List<Finding> flagged = new ArrayList<>();
        for (ExpenseRecord record : records) {
            Optional<LocalDate> date = dateParser.parse(record.get(dateColumn));
            if (date.isPresent() && isWeekend(date.get().getDayOfWeek())) {
                flagged.add(Finding.of(record, FindingReason.WEEKEND));
            }
        }
        return flagged;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
