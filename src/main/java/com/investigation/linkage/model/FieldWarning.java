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
@Schema(description = "Problem found in a file's columns")
public class FieldWarning {

    @Schema(description = "Field or column concerned", example = "bank_account")
    private String field;

    @Schema(description = "What is wrong", example = "Link field \"bank_account\" not found")
    private String message;

    private WarningSeverity severity;

    @Schema(description = "Effect on the analysis", example = "Cannot link people to bank transactions")
    private String impact;
}
