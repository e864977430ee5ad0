package com.investigation.linkage.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EdgeType {
    MONEY_TRANSFER("money_transfer", "bank_transfer"),
    PHONE_CALL("phone_call", "other"),
    CRYPTO_TRANSFER("crypto_transfer", "crypto_transfer"),
    OWNERSHIP("ownership", "other");

    private final String code;
    private final String remoteEdgeType;

    EdgeType(String code, String remoteEdgeType) {
        this.code = code;
        this.remoteEdgeType = remoteEdgeType;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    // edge_type value sent to the money-flow case backend
    public String getRemoteEdgeType() {
        return remoteEdgeType;
    }
}
