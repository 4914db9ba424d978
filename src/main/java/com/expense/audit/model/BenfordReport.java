package com.expense.audit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Leading-digit distribution of expense amounts compared against Benford's Law")
public class BenfordReport {

    @Schema(description = "Number of amounts that yielded a leading digit", example = "1200")
    @JsonProperty("total_analyzed")
    int totalAnalyzed;

    @Singular
    @Schema(description = "Per-digit breakdown, digits 1 through 9")
    List<BenfordDigitStat> stats;

    @Schema(description = "True when any digit deviates from the expected share by more than 5 points", example = "false")
    @JsonProperty("is_suspicious")
    boolean suspicious;

    @Schema(description = "Largest per-digit deviation, in percentage points", example = "3.21")
    @JsonProperty("max_deviation_pct")
    double maxDeviationPct;
}
