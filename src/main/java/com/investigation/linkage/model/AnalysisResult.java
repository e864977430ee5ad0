package com.investigation.linkage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Entity-relationship graph built from one set of uploaded files, with risk scores")
public class AnalysisResult {

    @Schema(description = "Analysis identifier", example = "7c9e6679-7425-40de-944b-e07fc1f90ae7")
    private String analysisId;

    @Schema(description = "Analysis timestamp in epoch milliseconds", example = "1739886764000")
    private long analyzedAt;

    @Builder.Default
    private List<LinkedEntity> entities = new ArrayList<>();

    @Builder.Default
    private List<RelationshipEdge> edges = new ArrayList<>();

    private AnalysisSummary summary;

    @Schema(description = "Per-file parsing outcome")
    @Builder.Default
    private List<SourceReport> sources = new ArrayList<>();
}
