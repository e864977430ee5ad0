package com.investigation.linkage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "link-analysis.export")
public class ExportConfig {

    // Case backend API root, e.g. https://host/api/v1
    private String baseUrl = "http://localhost:8000/api/v1";
    private String apiToken;

    // Parallel create calls in flight
    private int concurrency = 4;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
}
