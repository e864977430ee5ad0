package com.investigation.linkage.model;

public enum WarningSeverity {
    ERROR,
    WARNING,
    INFO
}
