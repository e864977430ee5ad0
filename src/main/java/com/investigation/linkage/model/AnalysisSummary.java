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
@Schema(description = "Counters describing one analysis")
public class AnalysisSummary {

    @Schema(description = "Records read across all parsed files", example = "120")
    private int totalRecords;

    @Schema(description = "Distinct entities", example = "45")
    private int totalEntities;

    @Schema(description = "Relationship edges", example = "98")
    private int totalEdges;

    @Schema(description = "Sum of all bank transfer amounts (THB)", example = "1250000.0")
    private double totalAmount;

    @Schema(description = "Entities with risk score >= 70", example = "3")
    private int highRiskCount;

    @Schema(description = "Entities observed in two or more files", example = "8")
    private int crossLinkedCount;
}
