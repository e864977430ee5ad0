package com.investigation.linkage.config;

import com.investigation.linkage.model.AnalysisSummary;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(AnalysisSummary summary) {
        Counter.builder("analysis.count")
                .register(registry)
                .increment();

        DistributionSummary.builder("analysis.entities")
                .register(registry)
                .record(summary.getTotalEntities());

        DistributionSummary.builder("analysis.high_risk_entities")
                .register(registry)
                .record(summary.getHighRiskCount());
    }

    public void recordSource(String sourceType, String status) {
        Counter.builder("source.files")
                .tag("type", sourceType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExportNode(String status) {
        Counter.builder("export.nodes")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordExportEdge(String status) {
        Counter.builder("export.edges")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
