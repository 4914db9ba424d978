package com.expense.audit.engine;

import com.expense.audit.config.MetricsConfig;
import com.expense.audit.engine.benford.BenfordAnalyzer;
import com.expense.audit.model.AuditCheck;
import com.expense.audit.model.BenfordResult;
import com.expense.audit.model.ExpenseRecord;
import com.expense.audit.model.Finding;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches audit checks to their detectors.
 * Uses the Strategy pattern: each AuditCheck is handled by a registered FindingDetector.
 */
@Component
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    private final Map<AuditCheck, FindingDetector> detectorMap;
    private final BenfordAnalyzer benfordAnalyzer;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public AuditEngine(List<FindingDetector> detectors, BenfordAnalyzer benfordAnalyzer,
                       Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new EnumMap<>(AuditCheck.class);
        this.benfordAnalyzer = benfordAnalyzer;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        for (FindingDetector detector : detectors) {
            detectorMap.put(detector.getSupportedCheck(), detector);
            log.info("Registered audit detector: {} -> {}",
                    detector.getSupportedCheck(), detector.getClass().getSimpleName());
        }
    }

    /**
     * Run one audit check over a snapshot of records.
     *
     * @throws IllegalStateException if no detector is registered for the check
     */
    public List<Finding> run(AuditCheck check, List<ExpenseRecord> records, AuditContext context) {
        FindingDetector detector = detectorMap.get(check);
        if (detector == null) {
            throw new IllegalStateException("No detector registered for audit check: " + check);
        }

        Span span = tracer.nextSpan()
                .name("audit.check." + check)
                .tag("audit.check", check.name())
                .tag("audit.records", String.valueOf(records.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Finding> findings = detector.detect(records, context);
            span.tag("audit.findings", String.valueOf(findings.size()));
            metricsConfig.recordAuditRun(check.name(), findings.size());
            log.debug("Audit check {} flagged {} of {} records", check, findings.size(), records.size());
            return findings;
        } finally {
            span.end();
        }
    }

    public BenfordResult analyzeBenford(List<ExpenseRecord> records, AuditContext context) {
        Span span = tracer.nextSpan()
                .name("audit.benford")
                .tag("audit.records", String.valueOf(records.size()))
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            BenfordResult result = benfordAnalyzer.analyze(records, context.getAmountColumn());
            metricsConfig.recordBenfordRun(result);
            if (result.isAvailable()) {
                log.debug("Benford analysis over {} amounts, suspicious={}",
                        result.getReport().get().getTotalAnalyzed(), result.getReport().get().isSuspicious());
            } else {
                log.debug("Benford analysis skipped: {}", result.getError());
            }
            return result;
        } finally {
            span.end();
        }
    }

    public boolean supports(AuditCheck check) {
        return detectorMap.containsKey(check);
    }
}
