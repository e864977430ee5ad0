package com.investigation.linkage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored analysis without its entity and edge lists")
public class AnalysisOverview {
    private String analysisId;
    private long analyzedAt;
    private AnalysisSummary summary;
}
