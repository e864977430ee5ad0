package com.investigation.linkage.engine;

import com.investigation.linkage.engine.handlers.PersonSourceHandler;
import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.SourceType;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the entity graph from parsed sources in a fixed stage order:
 * person first (producing the cross-reference index), then bank, phone and crypto,
 * each of which receives the finished index. Within a type, files are ingested in upload order.
 *
 * Activity handlers are auto-registered by SourceType. A handler failing on one file
 * skips that file only.
 */
@Component
public class RelationshipEngine {

    private static final Logger log = LoggerFactory.getLogger(RelationshipEngine.class);

    static final List<SourceType> ACTIVITY_STAGES = List.of(SourceType.BANK, SourceType.PHONE, SourceType.CRYPTO);

    private final PersonSourceHandler personHandler;
    private final Map<SourceType, SourceHandler> handlerMap;
    private final Tracer tracer;

    public RelationshipEngine(PersonSourceHandler personHandler, List<SourceHandler> handlers, Tracer tracer) {
        this.personHandler = personHandler;
        this.handlerMap = new EnumMap<>(SourceType.class);
        this.tracer = tracer;

        for (SourceHandler handler : handlers) {
            handlerMap.put(handler.getSupportedSourceType(), handler);
            log.info("Registered source handler: {} -> {}",
                    handler.getSupportedSourceType(), handler.getClass().getSimpleName());
        }
    }

    @Observed(name = "graph.build", contextualName = "build-entity-graph")
    public GraphWorkspace build(List<ParsedSource> sources) {
        GraphWorkspace workspace = new GraphWorkspace();

        List<ParsedSource> personSources = usable(sources, SourceType.PERSON);
        CrossReferenceIndex index = runPersonStage(personSources, workspace);

        for (SourceType type : ACTIVITY_STAGES) {
            SourceHandler handler = handlerMap.get(type);
            List<ParsedSource> stageSources = usable(sources, type);
            if (stageSources.isEmpty()) continue;
            if (handler == null) {
                log.warn("No handler registered for source type {}; {} files ignored", type, stageSources.size());
                continue;
            }
            for (ParsedSource source : stageSources) {
                runActivityStage(handler, source, workspace, index);
            }
        }

        log.info("Entity graph built: {} entities, {} edges, {} cross-references",
                workspace.getStore().size(), workspace.getEdges().size(), index.size());
        return workspace;
    }

    private CrossReferenceIndex runPersonStage(List<ParsedSource> personSources, GraphWorkspace workspace) {
        if (personSources.isEmpty()) {
            return CrossReferenceIndex.empty();
        }

        Span span = tracer.nextSpan()
                .name("ingest.person")
                .tag("source.files", String.valueOf(personSources.size()))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            return personHandler.ingest(personSources, workspace);
        } catch (Exception e) {
            span.error(e);
            log.error("Error ingesting person registry: {}", e.getMessage(), e);
            // Activity stages still run, they just cannot fold onto people
            return CrossReferenceIndex.empty();
        } finally {
            span.end();
        }
    }

    private void runActivityStage(SourceHandler handler, ParsedSource source,
                                  GraphWorkspace workspace, CrossReferenceIndex index) {
        Span span = tracer.nextSpan()
                .name("ingest." + source.getSourceType().getCode())
                .tag("source.file", source.getFileName())
                .tag("source.records", String.valueOf(source.getRecords().size()))
                .start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            handler.ingest(source, workspace, index);
        } catch (Exception e) {
            span.error(e);
            log.error("Error ingesting {} file {}: {}",
                    source.getSourceType().getCode(), source.getFileName(), e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    private static List<ParsedSource> usable(List<ParsedSource> sources, SourceType type) {
        return sources.stream()
                .filter(ParsedSource::isUsable)
                .filter(s -> s.getSourceType() == type)
                .toList();
    }
}
