package com.investigation.linkage.engine;

import com.investigation.linkage.model.EntityType;
import com.investigation.linkage.model.LinkedEntity;
import com.investigation.linkage.model.MetadataPatch;
import com.investigation.linkage.model.RiskAssessment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Keyed registry of every entity seen during one analysis.
 *
 * An entity's key is {@code type + ":" + normalize(value)} and is the only deduplication
 * mechanism: two different raw identifiers never merge. All mutation goes through this
 * class so that metadata accumulation stays in one place; readers get copies.
 *
 * Not thread-safe. One store belongs to one analysis run.
 */
public class IdentityStore {

    private final Map<String, LinkedEntity> entities = new LinkedHashMap<>();

    public static String normalize(String rawValue) {
        return rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
    }

    public static String keyOf(EntityType type, String rawValue) {
        return type.getCode() + ":" + normalize(rawValue);
    }

    public String getOrCreate(EntityType type, String rawValue, String label, String sourceFile) {
        return getOrCreate(type, rawValue, label, sourceFile, null);
    }

    /**
     * Resolve {@code (type, rawValue)} to its entity key, creating the entity on first sight.
     * An existing entity gains {@code sourceFile} in its sources and has {@code patch}
     * accumulated into its metadata. Blank identifiers are not rejected here; callers filter them.
     *
     * @return the entity key
     */
    public String getOrCreate(EntityType type, String rawValue, String label, String sourceFile,
                              MetadataPatch patch) {
        String key = keyOf(type, rawValue);
        LinkedEntity existing = entities.get(key);
        if (existing != null) {
            existing.getSources().add(sourceFile);
            upgradeLabel(existing, label);
            if (patch != null) {
                existing.getMetadata().accumulate(patch);
            }
            return key;
        }

        String value = rawValue == null ? "" : rawValue;
        LinkedEntity entity = LinkedEntity.builder()
                .key(key)
                .type(type)
                .value(value)
                .label(label == null || label.isBlank() ? value : label)
                .build();
        entity.getSources().add(sourceFile);
        if (patch != null) {
            entity.getMetadata().accumulate(patch);
        }
        entities.put(key, entity);
        return key;
    }

    public void applyMetadataPatch(String key, MetadataPatch patch) {
        require(key).getMetadata().accumulate(patch);
    }

    /** Record an undirected connection between two entities. Adding a present link is a no-op. */
    public void link(String keyA, String keyB) {
        LinkedEntity a = require(keyA);
        LinkedEntity b = require(keyB);
        a.getLinkedIds().add(keyB);
        b.getLinkedIds().add(keyA);
    }

    public void recordRisk(String key, RiskAssessment assessment) {
        LinkedEntity entity = require(key);
        entity.setRiskScore(assessment.getScore());
        entity.setRiskFactors(new ArrayList<>(assessment.getFactors()));
    }

    public boolean contains(String key) {
        return entities.containsKey(key);
    }

    public Optional<LinkedEntity> find(String key) {
        LinkedEntity entity = entities.get(key);
        return entity == null ? Optional.empty() : Optional.of(entity.copy());
    }

    public List<String> keys() {
        return new ArrayList<>(entities.keySet());
    }

    /** Copies of all entities in creation order. */
    public List<LinkedEntity> snapshot() {
        List<LinkedEntity> copies = new ArrayList<>(entities.size());
        for (LinkedEntity entity : entities.values()) {
            copies.add(entity.copy());
        }
        return copies;
    }

    public int size() {
        return entities.size();
    }

    // A raw identifier is replaced by the first real name or label that shows up later.
    private void upgradeLabel(LinkedEntity entity, String label) {
        if (label == null || label.isBlank()) return;
        String current = entity.getLabel();
        if (isRawLabel(current, entity.getValue()) && !label.equals(current) && !isRawLabel(label, entity.getValue())) {
            entity.setLabel(label);
        }
    }

    // The raw identifier itself, or an abbreviation of it such as "0x12ab34cd56ef..."
    private static boolean isRawLabel(String label, String value) {
        if (label == null || label.isBlank() || label.equals(value)) return true;
        return label.endsWith("...") && value.startsWith(label.substring(0, label.length() - 3));
    }

    private LinkedEntity require(String key) {
        LinkedEntity entity = entities.get(key);
        if (entity == null) {
            throw new IllegalArgumentException("Unknown entity key: " + key);
        }
        return entity;
    }
}
