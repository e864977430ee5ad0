package com.investigation.linkage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinkAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkAnalysisApplication.class, args);
    }
}
