package com.investigation.linkage.service;

import com.investigation.linkage.config.LinkAnalysisConfig;
import com.investigation.linkage.engine.IdentityStore;
import com.investigation.linkage.model.EntityMetadata;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.RiskAssessment;
import com.investigation.linkage.model.RiskFactor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.investigation.linkage.engine.RecordValues.formatBaht;

/**
 * Additive, explainable risk score per entity, capped at the configured maximum.
 *
 * Factors in evaluation order (role and received tiers are each mutually exclusive):
 *   suspect +30 | victim +5
 *   received > 500K +25 | received > 100K +15
 *   transactions > 3 +10
 *   used mixer +20
 *   foreign transfer +15
 *   calls > 5 +10
 *   seen in >= 3 files +10
 */
@Service
public class RiskScoringService {

    private final LinkAnalysisConfig config;

    public RiskScoringService(LinkAnalysisConfig config) {
        this.config = config;
    }

    /** Score every entity in the store once all sources have been ingested. */
    public void scoreAll(IdentityStore store) {
        for (String key : store.keys()) {
            store.find(key).ifPresent(entity -> store.recordRisk(key, assess(entity)));
        }
    }

    public RiskAssessment assess(LinkedEntity entity) {
        LinkAnalysisConfig.Scoring s = config.getScoring();
        EntityMetadata m = entity.getMetadata() != null ? entity.getMetadata() : new EntityMetadata();
        List<RiskFactor> factors = new ArrayList<>();

        if (matchesRole(m.getRole(), config.getSuspectRoles())) {
            factors.add(factor("suspect", s.getSuspectPoints(), "named as a suspect in the case"));
        } else if (matchesRole(m.getRole(), config.getVictimRoles())) {
            factors.add(factor("victim", s.getVictimPoints(), "named as a victim in the case"));
        }

        if (m.getTotalReceived() > s.getReceivedHighThreshold()) {
            factors.add(factor("received > " + shortBaht(s.getReceivedHighThreshold()), s.getReceivedHighPoints(),
                    "received " + formatBaht(m.getTotalReceived())));
        } else if (m.getTotalReceived() > s.getReceivedMediumThreshold()) {
            factors.add(factor("received > " + shortBaht(s.getReceivedMediumThreshold()), s.getReceivedMediumPoints(),
                    "received " + formatBaht(m.getTotalReceived())));
        }

        if (m.getTransactionCount() > s.getFrequentTransactionThreshold()) {
            factors.add(factor("frequent transactions", s.getFrequentTransactionPoints(),
                    m.getTransactionCount() + " transactions"));
        }

        if (m.isUsedMixer()) {
            factors.add(factor("used mixer", s.getMixerPoints(), "transferred through a crypto mixer or exchange"));
        }

        if (m.isForeignTransfer()) {
            factors.add(factor("foreign transfer", s.getForeignTransferPoints(), "transferred to a foreign jurisdiction"));
        }

        if (m.getCallCount() > s.getFrequentCallThreshold()) {
            factors.add(factor("frequent calls", s.getFrequentCallPoints(), m.getCallCount() + " calls"));
        }

        int sourceCount = entity.getSources() != null ? entity.getSources().size() : 0;
        if (sourceCount >= s.getMultiSourceMinSources()) {
            factors.add(factor("multiple sources", s.getMultiSourcePoints(), "found in " + sourceCount + " sources"));
        }

        int total = factors.stream().mapToInt(RiskFactor::getScore).sum();
        return RiskAssessment.builder()
                .score(Math.min(s.getMaxScore(), total))
                .factors(factors)
                .build();
    }

    private boolean matchesRole(String role, List<String> accepted) {
        if (role == null || role.isBlank()) return false;
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        return accepted.stream().anyMatch(r -> r.trim().toLowerCase(Locale.ROOT).equals(normalized));
    }

    // 500000 -> "฿500K"
    private static String shortBaht(double amount) {
        if (amount >= 1000 && amount % 1000 == 0) {
            return "฿" + (long) (amount / 1000) + "K";
        }
        return formatBaht(amount);
    }

    private static RiskFactor factor(String name, int points, String description) {
        return RiskFactor.builder()
                .factor(name)
                .score(points)
                .description(description)
                .build();
    }
}
