package com.investigation.linkage.model;

public enum SourceStatus {
    PARSED,
    ERROR
}
