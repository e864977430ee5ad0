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
public class EdgeCreateRequest {

    @JsonProperty("from_node_id")
    private long fromNodeId;

    @JsonProperty("to_node_id")
    private long toNodeId;

    @JsonProperty("edge_type")
    private String edgeType;

    private String label;

    private double amount;

    @JsonProperty("transaction_date")
    private String transactionDate;
}
