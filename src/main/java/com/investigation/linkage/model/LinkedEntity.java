package com.investigation.linkage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A distinct person, account, phone number or wallet resolved from the uploaded sources")
public class LinkedEntity {

    @Schema(description = "Stable key: type + ':' + normalized identifier", example = "account:1234567890")
    private String key;

    @Schema(description = "Entity type", example = "account")
    private EntityType type;

    @Schema(description = "Identifier as first seen", example = "1234567890")
    private String value;

    @Schema(description = "Display label", example = "Somchai Jaidee")
    private String label;

    @Schema(description = "File names the entity was observed in")
    @Builder.Default
    private Set<String> sources = new LinkedHashSet<>();

    @Schema(description = "Keys of entities connected by at least one edge")
    @Builder.Default
    private Set<String> linkedIds = new LinkedHashSet<>();

    @Builder.Default
    private EntityMetadata metadata = new EntityMetadata();

    @Schema(description = "Risk score (0-100)", example = "55")
    @Builder.Default
    private int riskScore = 0;

    @Schema(description = "Factors that make up the risk score, in evaluation order")
    @Builder.Default
    private List<RiskFactor> riskFactors = new ArrayList<>();

    public LinkedEntity copy() {
        return LinkedEntity.builder()
                .key(key)
                .type(type)
                .value(value)
                .label(label)
                .sources(new LinkedHashSet<>(sources))
                .linkedIds(new LinkedHashSet<>(linkedIds))
                .metadata(metadata.copy())
                .riskScore(riskScore)
                .riskFactors(new ArrayList<>(riskFactors))
                .build();
    }
}
