package com.expense.audit.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI expenseAuditOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Expense Audit API")
                        .version("1.0.0")
                        .description(
                                "Audits a table of expense records loaded from CSV.\n\n" +
                                "**Record-level checks** (each returns the flagged rows with a `_reason`):\n" +
                                "- `duplicate`: same merchant, invoice number and amount after normalization (`_dup_count` = group size)\n" +
                                "- `weekend`: expense dated on a Saturday or Sunday\n" +
                                "- `over_limit` / `near_limit`: amount above the policy limit, or within the buffer below it\n" +
                                "- `suspicious_keyword`: merchant/category/employee mentions cash, gift, casino, ... (`_details`)\n" +
                                "- `discrepancy`: paid amount differs from incurred amount by more than $0.01 (`_details`)\n\n" +
                                "**Aggregate check:** Benford's Law leading-digit analysis of `amount_usd`.\n\n" +
                                "The last check's results can be exported as CSV via `GET /api/v1/audit/download`.")
                        .contact(new Contact().name("Expense Audit Team")));
    }
}
