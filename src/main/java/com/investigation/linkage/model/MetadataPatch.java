package com.investigation.linkage.model;

import lombok.Builder;
import lombok.Value;

/**
 * Increment applied to an entity's {@link EntityMetadata}. Numeric fields are added,
 * flags are OR-ed in, and role only fills an empty role.
 */
@Value
@Builder
public class MetadataPatch {

    double totalReceived;
    double totalSent;
    long transactionCount;
    long callCount;
    long callDuration;
    boolean usedMixer;
    boolean foreignTransfer;
    String role;

    public static MetadataPatch sent(double amount) {
        return MetadataPatch.builder().totalSent(amount).transactionCount(1).build();
    }

    public static MetadataPatch received(double amount) {
        return MetadataPatch.builder().totalReceived(amount).transactionCount(1).build();
    }

    public static MetadataPatch role(String role) {
        return MetadataPatch.builder().role(role).build();
    }
}
