package com.investigation.linkage.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeCreateRequest {

    private String label;

    @JsonProperty("node_type")
    private String nodeType;

    @JsonProperty("risk_score")
    private int riskScore;

    private double amount;

    // JSON-encoded risk factors, sources and metadata
    private String metadata;
}
