package com.investigation.linkage.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceUpload {
    private String fileName;
    private byte[] content;
}
