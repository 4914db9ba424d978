package com.expense.audit.engine;

import com.expense.audit.normalize.DateParser;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-run parameters handed to every detector: which columns hold what, and the
 * caller-supplied policy values. Column names are plain configuration, absent
 * columns simply read as "no value".
 */
@Data
@Builder
public class AuditContext {

    @Builder.Default
    private String merchantColumn = "merchant";
    @Builder.Default
    private String invoiceColumn = "invoice_no";
    @Builder.Default
    private String amountColumn = "amount_usd";
    @Builder.Default
    private String paidAmountColumn = "paid_amount_usd";
    @Builder.Default
    private String dateColumn = "expense_date";

    // Duplicate key: (merchant?, invoice, amount)
    @Builder.Default
    private boolean includeMerchant = true;

    @Builder.Default
    private BigDecimal limit = new BigDecimal("5000");
    @Builder.Default
    private BigDecimal buffer = new BigDecimal("200");

    @Builder.Default
    private List<String> keywordColumns = List.of("merchant", "category", "employee");

    @Builder.Default
    private DateParser dateParser = DateParser.defaults();

    public static AuditContext defaults() {
        return AuditContext.builder().build();
    }
}
