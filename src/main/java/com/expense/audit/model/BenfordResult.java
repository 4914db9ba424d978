package com.expense.audit.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a Benford analysis: either a report, or an insufficient-data error
 * when no amount yielded a leading digit. Callers must check {@link #isAvailable()}.
 */
public final class BenfordResult {

    private final BenfordReport report;
    private final String error;

    private BenfordResult(BenfordReport report, String error) {
        this.report = report;
        this.error = error;
    }

    public static BenfordResult of(BenfordReport report) {
        return new BenfordResult(Objects.requireNonNull(report, "report"), null);
    }

    public static BenfordResult insufficientData(String error) {
        return new BenfordResult(null, error);
    }

    public boolean isAvailable() {
        return report != null;
    }

    public Optional<BenfordReport> getReport() {
        return Optional.ofNullable(report);
    }

    public String getError() {
        return error;
    }
}
