package com.investigation.linkage.client;

/**
 * Case backend that persists money-flow graphs. Implementations throw on any failed create.
 */
public interface MoneyFlowClient {

    /**
     * @return the node id assigned by the backend
     */
    long createNode(long caseId, NodeCreateRequest request);

    void createEdge(long caseId, EdgeCreateRequest request);
}
