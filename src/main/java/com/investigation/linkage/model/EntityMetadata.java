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
@Schema(description = "Financial and behavioral totals accumulated for an entity across all sources")
public class EntityMetadata {

    @Schema(description = "Total amount received (THB)", example = "520000.0")
    private double totalReceived;

    @Schema(description = "Total amount sent (THB, crypto converted to fiat)", example = "35000.0")
    private double totalSent;

    @Schema(description = "Bank transactions in which the entity took part", example = "4")
    private long transactionCount;

    @Schema(description = "Outgoing calls placed", example = "7")
    private long callCount;

    @Schema(description = "Total duration of outgoing calls in seconds", example = "1260")
    private long callDuration;

    @Schema(description = "Sent funds through a mixer, tumbler or exchange", example = "false")
    private boolean usedMixer;

    @Schema(description = "Sent funds to a foreign jurisdiction", example = "false")
    private boolean foreignTransfer;

    @Schema(description = "Role declared in the personal registry", example = "suspect")
    private String role;

    /**
     * Fold a patch into this accumulator. Sums and counts only grow, flags only go
     * from false to true, and an existing role is never replaced.
     */
    public void accumulate(MetadataPatch patch) {
        totalReceived += patch.getTotalReceived();
        totalSent += patch.getTotalSent();
        transactionCount += patch.getTransactionCount();
        callCount += patch.getCallCount();
        callDuration += patch.getCallDuration();
        usedMixer = usedMixer || patch.isUsedMixer();
        foreignTransfer = foreignTransfer || patch.isForeignTransfer();
        if ((role == null || role.isBlank()) && patch.getRole() != null && !patch.getRole().isBlank()) {
            role = patch.getRole();
        }
    }

    public EntityMetadata copy() {
        return new EntityMetadata(totalReceived, totalSent, transactionCount, callCount,
                callDuration, usedMixer, foreignTransfer, role);
    }
}
