package com.investigation.linkage.controller;

import com.investigation.linkage.model.AnalysisOverview;
import com.investigation.linkage.model.AnalysisResult;
import com.investigation.linkage.model.ExportReport;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.SourceUpload;
import com.investigation.linkage.service.GraphExportService;
import com.investigation.linkage.service.LinkAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analyses")
@Tag(name = "Link Analysis", description = "Upload investigative record files, resolve entities and score their risk")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final LinkAnalysisService analysisService;
    private final GraphExportService exportService;

    public AnalysisController(LinkAnalysisService analysisService, GraphExportService exportService) {
        this.analysisService = analysisService;
        this.exportService = exportService;
    }

    @Operation(summary = "Analyze uploaded record files",
            description = "Accepts one or more CSV files (person, bank, phone or crypto records). Each file is " +
                    "classified from its headers, entities are resolved across files and every entity is " +
                    "risk-scored. Unreadable files are reported with status ERROR and do not abort the run.")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(
            @Parameter(description = "Record files to analyze")
            @RequestParam("files") List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one file is required"));
        }

        List<SourceUpload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            byte[] content = null;
            try {
                content = file.getBytes();
            } catch (IOException e) {
                log.warn("Could not read upload {}: {}", file.getOriginalFilename(), e.getMessage());
            }
            uploads.add(new SourceUpload(file.getOriginalFilename(), content));
        }

        AnalysisResult result = analysisService.analyze(uploads);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get an analysis by ID",
            description = "Retrieves the stored entities, edges, summary and file reports of a previous analysis.")
    @GetMapping("/{analysisId}")
    public ResponseEntity<AnalysisResult> getAnalysis(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId) {
        AnalysisResult result = analysisService.getAnalysis(analysisId);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "List recent analyses",
            description = "Returns summaries of the most recent analyses, newest first.")
    @GetMapping
    public ResponseEntity<List<AnalysisOverview>> getRecentAnalyses(
            @Parameter(description = "Maximum number of analyses to return", example = "20")
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(analysisService.getRecentAnalyses(limit));
    }

    @Operation(summary = "List entities of an analysis",
            description = "Returns the entities of a stored analysis with a risk score of at least minScore, highest first.")
    @GetMapping("/{analysisId}/entities")
    public ResponseEntity<List<LinkedEntity>> getEntities(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Minimum risk score", example = "70")
            @RequestParam(defaultValue = "0") int minScore) {
        List<LinkedEntity> entities = analysisService.getEntities(analysisId, minScore);
        if (entities == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(entities);
    }

    @Operation(summary = "Export an analysis to a case money-flow board",
            description = "Creates one node per entity, then one edge per relationship, in the given case. " +
                    "Failed creates are counted in the report and are not retried.")
    @PostMapping("/{analysisId}/export")
    public ResponseEntity<ExportReport> export(
            @Parameter(description = "Analysis ID") @PathVariable String analysisId,
            @Parameter(description = "Target case ID", example = "42") @RequestParam long caseId) {
        AnalysisResult result = analysisService.getAnalysis(analysisId);
        if (result == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(exportService.export(caseId, result));
    }
}
