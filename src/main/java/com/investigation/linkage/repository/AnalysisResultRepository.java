package com.investigation.linkage.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investigation.linkage.config.AerospikeConfig;
import com.investigation.linkage.model.AnalysisOverview;
import com.investigation.linkage.model.AnalysisResult;
import com.investigation.linkage.model.AnalysisSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Analysis snapshots keyed by analysisId. The full result is kept as a JSON bin;
 * summary bins allow listing without deserializing every graph.
 */
@Repository
public class AnalysisResultRepository {

    private static final Logger log = LoggerFactory.getLogger(AnalysisResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AnalysisResultRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void save(AnalysisResult result) throws JsonProcessingException {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RESULTS, result.getAnalysisId());

        Bin idBin = new Bin("analysisId", result.getAnalysisId());
        Bin analyzedAtBin = new Bin("analyzedAt", result.getAnalyzedAt());
        Bin summaryBin = new Bin("summary", objectMapper.writeValueAsString(result.getSummary()));
        Bin resultBin = new Bin("result", objectMapper.writeValueAsString(result));

        client.put(writePolicy, key, idBin, analyzedAtBin, summaryBin, resultBin);
    }

    public AnalysisResult findById(String analysisId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANALYSIS_RESULTS, analysisId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        String json = record.getString("result");
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, AnalysisResult.class);
        } catch (Exception e) {
            log.error("Failed to deserialize analysis {}", analysisId, e);
            return null;
        }
    }

    public List<AnalysisOverview> findRecent(int limit) {
        if (limit < 1) {
            return List.of();
        }
        List<AnalysisOverview> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANALYSIS_RESULTS,
                (key, record) -> {
                    AnalysisOverview overview = mapOverview(record);
                    synchronized (results) {
                        results.add(overview);
                    }
                }, "analysisId", "analyzedAt", "summary");

        results.sort(Comparator.comparingLong(AnalysisOverview::getAnalyzedAt).reversed());
        if (results.size() > limit) {
            return new ArrayList<>(results.subList(0, limit));
        }
        return results;
    }

    private AnalysisOverview mapOverview(Record record) {
        return AnalysisOverview.builder()
                .analysisId(record.getString("analysisId"))
                .analyzedAt(record.getLong("analyzedAt"))
                .summary(deserializeSummary(record.getString("summary")))
                .build();
    }

    private AnalysisSummary deserializeSummary(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, AnalysisSummary.class);
        } catch (Exception e) {
            log.error("Failed to deserialize analysis summary", e);
            return null;
        }
    }
}
