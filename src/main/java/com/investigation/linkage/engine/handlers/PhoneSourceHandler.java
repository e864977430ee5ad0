package com.investigation.linkage.engine.handlers;

import com.investigation.linkage.engine.CrossReferenceIndex;
import com.investigation.linkage.engine.GraphWorkspace;
import com.investigation.linkage.engine.IdentityStore;
import com.investigation.linkage.engine.SourceHandler;
import com.investigation.linkage.model.EdgeType;
import com.investigation.linkage.model.EntityType;
import com.investigation.linkage.model.MetadataPatch;
import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.investigation.linkage.engine.RecordValues.firstNonBlank;
import static com.investigation.linkage.engine.RecordValues.optional;
import static com.investigation.linkage.engine.RecordValues.parseSeconds;
import static com.investigation.linkage.engine.RecordValues.text;

/**
 * Call records. Only the caller accumulates call count and duration.
 */
@Component
public class PhoneSourceHandler implements SourceHandler {

    private static final Logger log = LoggerFactory.getLogger(PhoneSourceHandler.class);

    @Override
    public SourceType getSupportedSourceType() {
        return SourceType.PHONE;
    }

    @Override
    public void ingest(ParsedSource source, GraphWorkspace workspace, CrossReferenceIndex index) {
        IdentityStore store = workspace.getStore();
        String file = source.getFileName();

        for (Map<String, String> record : source.getRecords()) {
            long duration = parseSeconds(record.get("duration_sec"));
            String fromNumber = text(record, "from_number");
            String toNumber = text(record, "to_number");
            MetadataPatch call = MetadataPatch.builder().callCount(1).callDuration(duration).build();

            String fromKey = null;
            if (!fromNumber.isEmpty()) {
                fromKey = store.getOrCreate(EntityType.PHONE, fromNumber,
                        firstNonBlank(text(record, "from_name"), fromNumber), file);
                store.applyMetadataPatch(fromKey, call);
            }

            String toKey = null;
            if (!toNumber.isEmpty()) {
                toKey = store.getOrCreate(EntityType.PHONE, toNumber,
                        firstNonBlank(text(record, "to_name"), toNumber), file);
            }

            if (fromKey != null && toKey != null) {
                workspace.addEdge(fromKey, toKey, EdgeType.PHONE_CALL, "call " + duration + "s", null,
                        optional(record, "date"));
            } else {
                log.debug("Phone record in {} is missing a number; no edge emitted", file);
            }

            if (!fromNumber.isEmpty()) {
                index.personForPhone(fromNumber)
                        .ifPresent(person -> store.applyMetadataPatch(person, call));
            }
        }
    }
}
