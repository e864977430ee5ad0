package com.investigation.linkage.engine;

import com.investigation.linkage.model.EdgeType;
import com.investigation.linkage.model.RelationshipEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one analysis run: the identity store plus the edges emitted so far.
 * Every edge also links both endpoints in the store.
 */
public class GraphWorkspace {

    private final IdentityStore store = new IdentityStore();
    private final List<RelationshipEdge> edges = new ArrayList<>();
    private int nextEdgeId = 0;

    public IdentityStore getStore() {
        return store;
    }

    public RelationshipEdge addEdge(String sourceKey, String targetKey, EdgeType edgeType,
                                    String label, Double amount, String date) {
        RelationshipEdge edge = RelationshipEdge.builder()
                .id("edge-" + nextEdgeId++)
                .source(sourceKey)
                .target(targetKey)
                .edgeType(edgeType)
                .label(label)
                .amount(amount)
                .date(date)
                .build();
        edges.add(edge);
        store.link(sourceKey, targetKey);
        return edge;
    }

    public List<RelationshipEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }
}
