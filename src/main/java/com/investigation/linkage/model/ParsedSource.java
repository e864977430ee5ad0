package com.investigation.linkage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One uploaded file after tabular parsing, column mapping and classification.
 * Records are keyed by canonical column name.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParsedSource {

    private String id;
    private String fileName;

    @Builder.Default
    private SourceType sourceType = SourceType.UNKNOWN;

    @Builder.Default
    private SourceStatus status = SourceStatus.PARSED;

    private String errorMessage;

    @Builder.Default
    private List<String> columns = new ArrayList<>();

    @Builder.Default
    private List<ColumnMapping> columnMappings = new ArrayList<>();

    @Builder.Default
    private List<Map<String, String>> records = new ArrayList<>();

    @Builder.Default
    private List<FieldWarning> warnings = new ArrayList<>();

    private String sha256;
    private long fileSize;

    public boolean isUsable() {
        return status == SourceStatus.PARSED;
    }

    public SourceReport toReport() {
        return SourceReport.builder()
                .fileName(fileName)
                .sourceType(sourceType)
                .status(status)
                .errorMessage(errorMessage)
                .recordCount(records.size())
                .warnings(new ArrayList<>(warnings))
                .sha256(sha256)
                .fileSize(fileSize)
                .build();
    }
}
