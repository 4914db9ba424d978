package com.expense.audit.config;

import com.expense.audit.model.BenfordResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger loadedRecordCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.loadedRecordCount = registry.gauge("audit.records.loaded", new AtomicInteger(0));
    }

    public void recordAuditRun(String check, int findingCount) {
        Counter.builder("audit.run.count")
                .tag("check", check)
                .register(registry)
                .increment();

        DistributionSummary.builder("audit.findings.count")
                .tag("check", check)
                .register(registry)
                .record(findingCount);
    }

    public void recordBenfordRun(BenfordResult result) {
        String outcome = !result.isAvailable() ? "no_data"
                : result.getReport().get().isSuspicious() ? "suspicious" : "clean";
        Counter.builder("audit.benford.run.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRecordChange(String operation, String status) {
        Counter.builder("audit.record.change.count")
                .tag("operation", operation)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void updateLoadedRecordCount(int count) {
        loadedRecordCount.set(count);
    }
}
