package com.investigation.linkage.service;

import com.investigation.linkage.config.MetricsConfig;
import com.investigation.linkage.engine.GraphWorkspace;
import com.investigation.linkage.engine.RelationshipEngine;
import com.investigation.linkage.model.AnalysisOverview;
import com.investigation.linkage.model.AnalysisResult;
import com.investigation.linkage.model.AnalysisSummary;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.SourceUpload;
import com.investigation.linkage.repository.AnalysisResultRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Main orchestrator for one analysis run.
 *
 * Flow:
 * 1. Parse, map and classify every uploaded file (unreadable files are kept as ERROR reports)
 * 2. Build the entity graph in a fresh workspace: people first, then bank, phone, crypto
 * 3. Score every entity
 * 4. Assemble entities, edges and summary
 * 5. Persist the snapshot and record metrics
 *
 * Nothing is shared between runs; the same files always produce the same graph and scores.
 */
@Service
public class LinkAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LinkAnalysisService.class);

    private final SourceParsingService parsingService;
    private final RelationshipEngine relationshipEngine;
    private final RiskScoringService riskScoringService;
    private final GraphAssemblerService assemblerService;
    private final AnalysisResultRepository resultRepository;
    private final MetricsConfig metricsConfig;

    public LinkAnalysisService(SourceParsingService parsingService,
                               RelationshipEngine relationshipEngine,
                               RiskScoringService riskScoringService,
                               GraphAssemblerService assemblerService,
                               AnalysisResultRepository resultRepository,
                               MetricsConfig metricsConfig) {
        this.parsingService = parsingService;
        this.relationshipEngine = relationshipEngine;
        this.riskScoringService = riskScoringService;
        this.assemblerService = assemblerService;
        this.resultRepository = resultRepository;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "analysis.run", contextualName = "analyze-sources")
    public AnalysisResult analyze(List<SourceUpload> uploads) {
        // 1. Parse
        List<ParsedSource> sources = new ArrayList<>(uploads.size());
        for (SourceUpload upload : uploads) {
            ParsedSource source = parsingService.parse(upload.getFileName(), upload.getContent());
            metricsConfig.recordSource(source.getSourceType().getCode(), source.getStatus().name());
            sources.add(source);
        }

        // 2. Build
        GraphWorkspace workspace = relationshipEngine.build(sources);

        // 3. Score, after every source is in
        riskScoringService.scoreAll(workspace.getStore());

        // 4. Assemble
        AnalysisResult result = assemblerService.assemble(workspace, sources);
        result.setAnalysisId(UUID.randomUUID().toString());
        result.setAnalyzedAt(System.currentTimeMillis());

        // 5. Persist; a storage outage must not lose the caller's result
        try {
            resultRepository.save(result);
        } catch (Exception e) {
            log.error("Failed to persist analysis {}: {}", result.getAnalysisId(), e.getMessage(), e);
        }

        AnalysisSummary summary = result.getSummary();
        metricsConfig.recordAnalysis(summary);
        log.info("Analysis {} complete: files={}, records={}, entities={}, edges={}, highRisk={}, crossLinked={}",
                result.getAnalysisId(), uploads.size(), summary.getTotalRecords(), summary.getTotalEntities(),
                summary.getTotalEdges(), summary.getHighRiskCount(), summary.getCrossLinkedCount());

        return result;
    }

    public AnalysisResult getAnalysis(String analysisId) {
        return resultRepository.findById(analysisId);
    }

    /** Most recent analyses first. A limit below 1 is raised to 1. */
    public List<AnalysisOverview> getRecentAnalyses(int limit) {
        return resultRepository.findRecent(Math.max(1, limit));
    }

    /**
     * Entities of a stored analysis scoring at least {@code minScore}, highest first.
     * Returns null when the analysis is unknown.
     */
    public List<LinkedEntity> getEntities(String analysisId, int minScore) {
        AnalysisResult result = resultRepository.findById(analysisId);
        if (result == null) return null;

        return result.getEntities().stream()
                .filter(e -> e.getRiskScore() >= minScore)
                .sorted(Comparator.comparingInt(LinkedEntity::getRiskScore).reversed())
                .collect(Collectors.toList());
    }
}
