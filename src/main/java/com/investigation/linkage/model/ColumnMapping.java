package com.investigation.linkage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnMapping {
    private String original;
    private String mapped;
    private int confidence;
    private boolean autoMapped;
}
