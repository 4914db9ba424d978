package com.expense.audit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Observed vs expected frequency of one leading digit")
public class BenfordDigitStat {

    @Schema(description = "Leading digit (1-9)", example = "1")
    int digit;

    @Schema(description = "Number of amounts with this leading digit", example = "42")
    @JsonProperty("actual_count")
    int actualCount;

    @Schema(description = "Observed share of the sample, in percent", example = "30.5")
    @JsonProperty("actual_pct")
    double actualPct;

    @Schema(description = "Share predicted by Benford's Law, in percent", example = "30.1")
    @JsonProperty("expected_pct")
    double expectedPct;

    @Schema(description = "Absolute difference between observed and expected, in percentage points", example = "0.4")
    @JsonProperty("diff_pct")
    double diffPct;
}
