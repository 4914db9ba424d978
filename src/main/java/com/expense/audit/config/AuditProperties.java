package com.expense.audit.config;

import com.expense.audit.engine.AuditContext;
import com.expense.audit.normalize.DateParser;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "audit")
public class AuditProperties {

    // CSV file backing the record store
    private String dataFile = "data/expenses.csv";

    private boolean loadOnStartup = true;

    // Rows exported by /download before any audit has been run
    private int exportFallbackRows = 2000;

    // Tried in order, first match wins. Order matters for 03/04/2024-style dates.
    private List<String> dateFormats = new ArrayList<>(DateParser.DEFAULT_PATTERNS);

    private List<String> keywordColumns = new ArrayList<>(List.of("merchant", "category", "employee"));

    private Columns columns = new Columns();

    private Duplicates duplicates = new Duplicates();

    private Threshold threshold = new Threshold();

    @Data
    public static class Columns {
        private String id = "expense_id";
        private String merchant = "merchant";
        private String invoice = "invoice_no";
        private String amount = "amount_usd";
        private String paidAmount = "paid_amount_usd";
        private String date = "expense_date";
        private String category = "category";
        private String employee = "employee";
        private String department = "department";
    }

    @Data
    public static class Duplicates {
        private boolean includeMerchant = true;
    }

    @Data
    public static class Threshold {
        private BigDecimal limit = new BigDecimal("5000.0");
        // Near-limit band is (limit - buffer, limit]. Not clamped at zero.
        private BigDecimal buffer = new BigDecimal("200.0");
    }

    /**
     * Snapshot of the current settings as detector parameters.
     */
    public AuditContext toContext() {
        return AuditContext.builder()
                .merchantColumn(columns.getMerchant())
                .invoiceColumn(columns.getInvoice())
                .amountColumn(columns.getAmount())
                .paidAmountColumn(columns.getPaidAmount())
                .dateColumn(columns.getDate())
                .includeMerchant(duplicates.isIncludeMerchant())
                .limit(threshold.getLimit())
                .buffer(threshold.getBuffer())
                .keywordColumns(List.copyOf(keywordColumns))
                .dateParser(new DateParser(dateFormats))
                .build();
    }
}
