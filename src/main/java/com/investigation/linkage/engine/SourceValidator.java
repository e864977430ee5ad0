package com.investigation.linkage.engine;

import com.investigation.linkage.model.ColumnMapping;
import com.investigation.linkage.model.FieldWarning;
import com.investigation.linkage.model.SourceType;
import com.investigation.linkage.model.WarningSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reports missing required columns, missing cross-file link columns and low-confidence
 * auto-mappings. Warnings are advisory: a missing identifier column only means the
 * affected entities are not created.
 */
@Component
public class SourceValidator {

    private static final Map<SourceType, List<String>> REQUIRED = new EnumMap<>(SourceType.class);
    private static final Map<SourceType, List<String>> LINK_FIELDS = new EnumMap<>(SourceType.class);
    private static final Map<String, String> LINK_IMPACT = Map.ofEntries(
            Map.entry("phone", "Cannot link people to phone records"),
            Map.entry("bank_account", "Cannot link people to bank transactions"),
            Map.entry("wallet_address", "Cannot link people to crypto transfers"),
            Map.entry("from_name", "Sender names will show as raw identifiers"),
            Map.entry("to_name", "Receiver names will show as raw identifiers"),
            Map.entry("from_account", "Cannot link senders to account owners"),
            Map.entry("to_account", "Cannot link receivers to account owners"),
            Map.entry("from_number", "Cannot link callers to people"),
            Map.entry("to_number", "Cannot link callees to people"),
            Map.entry("from_wallet", "Cannot link senders to wallet owners"),
            Map.entry("to_wallet", "Cannot link receivers to wallet owners"),
            Map.entry("from_label", "Sender wallets will show as abbreviated addresses"),
            Map.entry("to_label", "Mixer and foreign destinations cannot be detected"));

    private static final int LOW_CONFIDENCE = 80;

    static {
        REQUIRED.put(SourceType.PERSON, List.of("first_name"));
        REQUIRED.put(SourceType.BANK, List.of("from_account", "to_account", "amount"));
        REQUIRED.put(SourceType.PHONE, List.of("from_number", "to_number"));
        REQUIRED.put(SourceType.CRYPTO, List.of("from_wallet", "to_wallet", "amount"));

        LINK_FIELDS.put(SourceType.PERSON, List.of("phone", "bank_account", "wallet_address"));
        LINK_FIELDS.put(SourceType.BANK, List.of("from_account", "to_account", "from_name", "to_name"));
        LINK_FIELDS.put(SourceType.PHONE, List.of("from_number", "to_number", "from_name", "to_name"));
        LINK_FIELDS.put(SourceType.CRYPTO, List.of("from_wallet", "to_wallet", "from_label", "to_label"));
    }

    public List<FieldWarning> validate(SourceType type, List<ColumnMapping> mappings) {
        List<FieldWarning> warnings = new ArrayList<>();
        if (type == SourceType.UNKNOWN) {
            return warnings;
        }

        Set<String> mapped = mappings.stream()
                .map(ColumnMapping::getMapped)
                .collect(Collectors.toSet());

        for (String field : REQUIRED.getOrDefault(type, List.of())) {
            if (!mapped.contains(field)) {
                warnings.add(FieldWarning.builder()
                        .field(field)
                        .message("Required field \"" + field + "\" not found")
                        .severity(WarningSeverity.ERROR)
                        .impact("Records without it are only partially analyzed")
                        .build());
            }
        }

        for (String field : LINK_FIELDS.getOrDefault(type, List.of())) {
            if (!mapped.contains(field)) {
                warnings.add(FieldWarning.builder()
                        .field(field)
                        .message("Link field \"" + field + "\" not found")
                        .severity(WarningSeverity.WARNING)
                        .impact(LINK_IMPACT.getOrDefault(field, "Cross-file linking may be incomplete"))
                        .build());
            }
        }

        for (ColumnMapping m : mappings) {
            if (m.isAutoMapped() && m.getConfidence() > 0 && m.getConfidence() < LOW_CONFIDENCE) {
                warnings.add(FieldWarning.builder()
                        .field(m.getOriginal())
                        .message("\"" + m.getOriginal() + "\" mapped to \"" + m.getMapped()
                                + "\" (" + m.getConfidence() + "% confident)")
                        .severity(WarningSeverity.INFO)
                        .impact("Check that the mapping is correct")
                        .build());
            }
        }
        return warnings;
    }
}
