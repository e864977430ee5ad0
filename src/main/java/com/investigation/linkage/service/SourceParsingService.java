package com.investigation.linkage.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.investigation.linkage.engine.ColumnAliasMapper;
import com.investigation.linkage.engine.SourceClassifier;
import com.investigation.linkage.engine.SourceValidator;
import com.investigation.linkage.model.ColumnMapping;
import com.investigation.linkage.model.FieldWarning;
import com.investigation.linkage.model.ParsedSource;
import com.investigation.linkage.model.SourceStatus;
import com.investigation.linkage.model.SourceType;
import com.investigation.linkage.model.WarningSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns an uploaded CSV file into a {@link ParsedSource}: rows keyed by canonical column
 * name, a detected source type, column warnings and a SHA-256 of the raw bytes.
 * An unreadable file comes back with status ERROR and no records instead of throwing.
 */
@Service
public class SourceParsingService {

    private static final Logger log = LoggerFactory.getLogger(SourceParsingService.class);

    private final ColumnAliasMapper aliasMapper;
    private final SourceClassifier classifier;
    private final SourceValidator validator;
    private final CsvMapper csvMapper;

    public SourceParsingService(ColumnAliasMapper aliasMapper, SourceClassifier classifier,
                                SourceValidator validator) {
        this.aliasMapper = aliasMapper;
        this.classifier = classifier;
        this.validator = validator;
        this.csvMapper = new CsvMapper();
    }

    public ParsedSource parse(String fileName, byte[] content) {
        String id = UUID.randomUUID().toString();
        if (content == null) {
            return failed(id, fileName, null, 0, "File could not be read");
        }

        String sha256 = sha256(content);
        List<List<String>> rows;
        try {
            rows = readRows(content);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to parse {} as CSV: {}", fileName, e.getMessage());
            return failed(id, fileName, sha256, content.length, "File is not readable as CSV: " + e.getMessage());
        }

        if (rows.isEmpty() || rows.get(0).stream().allMatch(String::isBlank)) {
            log.warn("File {} has no header row", fileName);
            return failed(id, fileName, sha256, content.length, "File has no header row");
        }

        List<String> columns = rows.get(0).stream().map(String::trim).toList();
        List<ColumnMapping> mappings = aliasMapper.map(columns);
        List<String> canonical = mappings.stream().map(ColumnMapping::getMapped).toList();

        List<Map<String, String>> records = new ArrayList<>(rows.size() - 1);
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.stream().allMatch(String::isBlank)) continue;
            records.add(toRecord(canonical, row));
        }

        SourceType type = classifier.classify(canonical);
        List<FieldWarning> warnings = validator.validate(type, mappings);
        long errors = warnings.stream().filter(w -> w.getSeverity() == WarningSeverity.ERROR).count();

        log.info("Parsed {}: type={}, records={}, columns={}, missing required={}",
                fileName, type.getCode(), records.size(), columns.size(), errors);

        return ParsedSource.builder()
                .id(id)
                .fileName(fileName)
                .sourceType(type)
                .status(SourceStatus.PARSED)
                .columns(columns)
                .columnMappings(mappings)
                .records(records)
                .warnings(warnings)
                .sha256(sha256)
                .fileSize(content.length)
                .build();
    }

    private List<List<String>> readRows(byte[] content) throws IOException {
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        try (MappingIterator<List<String>> it = csvMapper
                .readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(text)) {
            return it.readAll();
        }
    }

    // When two headers map to the same field, the first non-empty value is kept.
    private Map<String, String> toRecord(List<String> canonical, List<String> row) {
        Map<String, String> record = new LinkedHashMap<>();
        for (int i = 0; i < canonical.size(); i++) {
            String value = i < row.size() && row.get(i) != null ? row.get(i).trim() : "";
            String field = canonical.get(i);
            String existing = record.get(field);
            if (existing == null || existing.isEmpty()) {
                record.put(field, value);
            }
        }
        return record;
    }

    private ParsedSource failed(String id, String fileName, String sha256, long size, String message) {
        return ParsedSource.builder()
                .id(id)
                .fileName(fileName)
                .sourceType(SourceType.UNKNOWN)
                .status(SourceStatus.ERROR)
                .errorMessage(message)
                .warnings(new ArrayList<>(List.of(FieldWarning.builder()
                        .field("file")
                        .message(message)
                        .severity(WarningSeverity.ERROR)
                        .impact("File excluded from the analysis")
                        .build())))
                .sha256(sha256)
                .fileSize(size)
                .build();
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
