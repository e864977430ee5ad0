package com.investigation.linkage.engine;

import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.SourceType;

/**
 * Ingests one activity table (bank, phone or crypto) into the workspace.
 * Each implementation handles a single SourceType and may fold activity onto
 * persons through the already-built cross-reference index.
 */
public interface SourceHandler {

    SourceType getSupportedSourceType();

    /**
     * @param source    a parsed file of the supported type
     * @param workspace the run's identity store and edge list
     * @param index     owner lookup built by the person stage; never null
     */
    void ingest(ParsedSource source, GraphWorkspace workspace, CrossReferenceIndex index);
}
