package com.investigation.linkage.service;

import com.investigation.linkage.config.LinkAnalysisConfig;
import com.investigation.linkage.engine.GraphWorkspace;
import com.investigation.linkage.model.AnalysisResult;
import com.investigation.linkage.model.AnalysisSummary;
import com.investigation.linkage.model.EdgeType;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.RelationshipEdge;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Projects a scored workspace into the final entity list, edge list and summary counters.
 * Does not mutate the workspace.
 */
@Service
public class GraphAssemblerService {

    private final LinkAnalysisConfig config;

    public GraphAssemblerService(LinkAnalysisConfig config) {
        this.config = config;
    }

    public AnalysisResult assemble(GraphWorkspace workspace, List<ParsedSource> sources) {
        List<LinkedEntity> entities = workspace.getStore().snapshot();
        List<RelationshipEdge> edges = new ArrayList<>(workspace.getEdges());

        int totalRecords = sources.stream()
                .filter(ParsedSource::isUsable)
                .mapToInt(s -> s.getRecords().size())
                .sum();

        double totalAmount = edges.stream()
                .filter(e -> e.getEdgeType() == EdgeType.MONEY_TRANSFER)
                .mapToDouble(e -> e.getAmount() != null ? e.getAmount() : 0.0)
                .sum();

        int highRisk = (int) entities.stream()
                .filter(e -> e.getRiskScore() >= config.getHighRiskThreshold())
                .count();

        int crossLinked = (int) entities.stream()
                .filter(e -> e.getSources().size() >= config.getCrossLinkedMinSources())
                .count();

        AnalysisSummary summary = AnalysisSummary.builder()
                .totalRecords(totalRecords)
                .totalEntities(entities.size())
                .totalEdges(edges.size())
                .totalAmount(totalAmount)
                .highRiskCount(highRisk)
                .crossLinkedCount(crossLinked)
                .build();

        return AnalysisResult.builder()
                .entities(entities)
                .edges(edges)
                .summary(summary)
                .sources(sources.stream().map(ParsedSource::toReport).toList())
                .build();
    }
}
