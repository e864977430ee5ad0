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
@Schema(description = "One contribution to an entity's risk score")
public class RiskFactor {

    @Schema(description = "Factor name", example = "received > ฿500K")
    private String factor;

    @Schema(description = "Points added to the score", example = "25")
    private int score;

    @Schema(description = "Explanation with the observed values", example = "received ฿520,000")
    private String description;
}
