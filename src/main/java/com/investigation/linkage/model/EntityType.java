package com.investigation.linkage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of real-world referent an entity stands for. Bank and crypto sources produce
 * {@link #ACCOUNT} and {@link #WALLET} entities; the source category never names an entity.
 */
public enum EntityType {
    PERSON("person", "person"),
    ACCOUNT("account", "bank_account"),
    PHONE("phone", "phone"),
    WALLET("wallet", "wallet");

    private final String code;
    private final String nodeType;

    EntityType(String code, String nodeType) {
        this.code = code;
        this.nodeType = nodeType;
    }

    /** Prefix of every entity key of this type. */
    @JsonValue
    public String getCode() {
        return code;
    }

    /** Node type understood by the money-flow case backend. */
    public String getNodeType() {
        return nodeType;
    }
}
