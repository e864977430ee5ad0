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
@Schema(description = "Result of pushing an analysis graph into a case's money-flow board. Partial success is normal.")
public class ExportReport {

    @Schema(description = "Target case id", example = "42")
    private long caseId;

    private int nodesCreated;
    private int nodesFailed;
    private int edgesCreated;
    private int edgesFailed;

    @Schema(description = "Edges not attempted because an endpoint node was not created")
    private int edgesSkipped;
}
