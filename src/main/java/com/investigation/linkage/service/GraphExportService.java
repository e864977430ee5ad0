package com.investigation.linkage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investigation.linkage.client.EdgeCreateRequest;
import com.investigation.linkage.client.MoneyFlowClient;
import com.investigation.linkage.client.NodeCreateRequest;
import com.investigation.linkage.config.ExportConfig;
import com.investigation.linkage.config.MetricsConfig;
import com.investigation.linkage.model.AnalysisResult;
import com.investigation.linkage.model.EntityMetadata;
import com.investigation.linkage.model.ExportReport;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.RelationshipEdge;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Pushes an analysis graph into a case's money-flow board.
 *
 * Flow:
 * 1. Create one node per entity and record the id the backend assigns
 * 2. Once every node call has finished, create one edge per relationship using those ids
 *
 * Both phases run on a bounded pool. A failed create is logged, counted and skipped;
 * nothing is retried or rolled back.
 */
@Service
public class GraphExportService {

    private static final Logger log = LoggerFactory.getLogger(GraphExportService.class);

    private final MoneyFlowClient client;
    private final ExportConfig config;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;

    public GraphExportService(MoneyFlowClient client, ExportConfig config, MetricsConfig metricsConfig) {
        this.client = client;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.objectMapper = new ObjectMapper();
    }

    @Observed(name = "graph.export", contextualName = "export-graph")
    public ExportReport export(long caseId, AnalysisResult result) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, config.getConcurrency()));
        try {
            Map<String, Long> remoteIds = new ConcurrentHashMap<>();
            AtomicInteger nodesCreated = new AtomicInteger();
            AtomicInteger nodesFailed = new AtomicInteger();

            log.info("Exporting {} nodes to case {}", result.getEntities().size(), caseId);
            runAll(pool, result.getEntities(), entity -> {
                try {
                    long id = client.createNode(caseId, toNodeRequest(entity));
                    remoteIds.put(entity.getKey(), id);
                    nodesCreated.incrementAndGet();
                    metricsConfig.recordExportNode("success");
                } catch (Exception e) {
                    nodesFailed.incrementAndGet();
                    metricsConfig.recordExportNode("error");
                    log.warn("Failed to create node for {} in case {}: {}", entity.getKey(), caseId, e.getMessage());
                }
            });

            AtomicInteger edgesCreated = new AtomicInteger();
            AtomicInteger edgesFailed = new AtomicInteger();
            AtomicInteger edgesSkipped = new AtomicInteger();

            log.info("Exporting {} edges to case {}", result.getEdges().size(), caseId);
            runAll(pool, result.getEdges(), edge -> {
                Long fromId = remoteIds.get(edge.getSource());
                Long toId = remoteIds.get(edge.getTarget());
                if (fromId == null || toId == null) {
                    edgesSkipped.incrementAndGet();
                    metricsConfig.recordExportEdge("skipped");
                    return;
                }
                try {
                    client.createEdge(caseId, toEdgeRequest(edge, fromId, toId));
                    edgesCreated.incrementAndGet();
                    metricsConfig.recordExportEdge("success");
                } catch (Exception e) {
                    edgesFailed.incrementAndGet();
                    metricsConfig.recordExportEdge("error");
                    log.warn("Failed to create edge {} in case {}: {}", edge.getId(), caseId, e.getMessage());
                }
            });

            ExportReport report = ExportReport.builder()
                    .caseId(caseId)
                    .nodesCreated(nodesCreated.get())
                    .nodesFailed(nodesFailed.get())
                    .edgesCreated(edgesCreated.get())
                    .edgesFailed(edgesFailed.get())
                    .edgesSkipped(edgesSkipped.get())
                    .build();
            log.info("Export to case {} finished: nodes {}/{}, edges {}/{} ({} skipped)",
                    caseId, report.getNodesCreated(), result.getEntities().size(),
                    report.getEdgesCreated(), result.getEdges().size(), report.getEdgesSkipped());
            return report;
        } finally {
            pool.shutdown();
        }
    }

    NodeCreateRequest toNodeRequest(LinkedEntity entity) {
        EntityMetadata m = entity.getMetadata();
        double amount = m.getTotalReceived() > 0 ? m.getTotalReceived()
                : m.getTotalSent() > 0 ? m.getTotalSent() : 0.0;

        return NodeCreateRequest.builder()
                .label(entity.getLabel())
                .nodeType(entity.getType().getNodeType())
                .riskScore(entity.getRiskScore())
                .amount(amount)
                .metadata(metadataJson(entity))
                .build();
    }

    EdgeCreateRequest toEdgeRequest(RelationshipEdge edge, long fromId, long toId) {
        return EdgeCreateRequest.builder()
                .fromNodeId(fromId)
                .toNodeId(toId)
                .edgeType(edge.getEdgeType().getRemoteEdgeType())
                .label(edge.getLabel())
                .amount(edge.getAmount() != null ? edge.getAmount() : 0.0)
                .transactionDate(edge.getDate())
                .build();
    }

    @SuppressWarnings("unchecked")
    private String metadataJson(LinkedEntity entity) {
        Map<String, Object> blob = new LinkedHashMap<>();
        blob.put("riskFactors", entity.getRiskFactors());
        blob.put("sources", entity.getSources());
        blob.putAll(objectMapper.convertValue(entity.getMetadata(), Map.class));
        try {
            return objectMapper.writeValueAsString(blob);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize metadata for {}", entity.getKey(), e);
            return "{}";
        }
    }

    private static <T> void runAll(ExecutorService pool, List<T> items, Consumer<T> task) {
        CompletableFuture<?>[] futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> task.accept(item), pool))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
    }
}
