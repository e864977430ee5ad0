package com.investigation.linkage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "link-analysis")
public class LinkAnalysisConfig {

    // Role values from the personal registry, compared case-insensitively.
    private List<String> suspectRoles = List.of("suspect", "ผู้ต้องสงสัย");
    private List<String> victimRoles = List.of("victim", "ผู้เสียหาย");

    // THB per crypto unit when a transfer carries no amount_thb.
    private double cryptoFallbackRate = 35.0;
    private String defaultCryptoCurrency = "USDT";

    // Destination label fragments that flag the sending wallet.
    private List<String> mixerKeywords = List.of("mixer", "tumbler");
    private List<String> foreignKeywords = List.of("cambodia", "myanmar", "laos");

    // Bank destination names containing this are treated as mixer/exchange endpoints.
    private String exchangeKeyword = "exchange";

    // Summary counters
    private int highRiskThreshold = 70;
    private int crossLinkedMinSources = 2;

    private Scoring scoring = new Scoring();

    @Data
    public static class Scoring {
        private int suspectPoints = 30;
        private int victimPoints = 5;

        // Received tiers are strict lower bounds: > high, else > medium.
        private double receivedHighThreshold = 500_000;
        private int receivedHighPoints = 25;
        private double receivedMediumThreshold = 100_000;
        private int receivedMediumPoints = 15;

        private long frequentTransactionThreshold = 3;
        private int frequentTransactionPoints = 10;

        private int mixerPoints = 20;
        private int foreignTransferPoints = 15;

        private long frequentCallThreshold = 5;
        private int frequentCallPoints = 10;

        // Inclusive: sources >= minSources
        private int multiSourceMinSources = 3;
        private int multiSourcePoints = 10;

        private int maxScore = 100;
    }
}
