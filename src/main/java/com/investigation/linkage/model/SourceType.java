package com.investigation.linkage.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an uploaded table, decided from its column headers.
 */
public enum SourceType {
    BANK("bank", "Bank transactions"),
    PERSON("person", "Personal registry"),
    PHONE("phone", "Phone records"),
    CRYPTO("crypto", "Crypto transfers"),
    UNKNOWN("unknown", "Unknown");

    private final String code;
    private final String displayName;

    SourceType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }
}
