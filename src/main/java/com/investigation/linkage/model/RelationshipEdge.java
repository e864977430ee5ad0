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
@Schema(description = "Directed relationship between two entity keys")
public class RelationshipEdge {

    @Schema(description = "Sequential edge id, unique within one analysis", example = "edge-0")
    private String id;

    @Schema(description = "Key of the sending, calling or owning entity", example = "account:111")
    private String source;

    @Schema(description = "Key of the receiving, called or owned entity", example = "account:222")
    private String target;

    @Schema(description = "Relationship type", example = "money_transfer")
    private EdgeType edgeType;

    @Schema(description = "Display label", example = "฿50,000")
    private String label;

    @Schema(description = "Amount in THB, absent for calls and ownership", example = "50000.0")
    private Double amount;

    @Schema(description = "Date as supplied by the source", example = "2024-01-15")
    private String date;
}
