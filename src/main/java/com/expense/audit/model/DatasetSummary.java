package com.expense.audit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Headline figures for the loaded expense table")
public class DatasetSummary {

    @Schema(description = "Number of records loaded", example = "1500")
    int totalRows;

    @Schema(description = "Sum of all parseable amounts", example = "$1,234,567.89")
    String totalAmount;

    @Schema(description = "Earliest to latest parseable expense date, or N/A", example = "2024-01-02 to 2024-12-30")
    String dateRange;
}
