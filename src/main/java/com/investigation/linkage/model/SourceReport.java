package com.investigation.linkage.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of reading one uploaded file")
public class SourceReport {

    @Schema(description = "Uploaded file name", example = "bank_statement.csv")
    private String fileName;

    @Schema(description = "Detected source type", example = "bank")
    private SourceType sourceType;

    @Schema(description = "PARSED or ERROR", example = "PARSED")
    private SourceStatus status;

    @Schema(description = "Why the file could not be read, when status is ERROR")
    private String errorMessage;

    @Schema(description = "Data rows read", example = "42")
    private int recordCount;

    @Builder.Default
    private List<FieldWarning> warnings = new ArrayList<>();

    @Schema(description = "SHA-256 of the raw file bytes (chain of custody)")
    private String sha256;

    @Schema(description = "File size in bytes", example = "2048")
    private long fileSize;
}
