package com.investigation.linkage.engine;

import com.investigation.linkage.model.SourceType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which kind of table a file holds from its canonical column names.
 * Rules are checked in priority order and the first match wins, because header
 * sets overlap (a person registry may carry a wallet column, a crypto file an amount).
 */
@Component
public class SourceClassifier {

    public SourceType classify(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            return SourceType.UNKNOWN;
        }
        Set<String> cols = columns.stream()
                .filter(c -> c != null)
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        if ((cols.contains("from_account") || cols.contains("to_account")) && cols.contains("amount")) {
            return SourceType.BANK;
        }
        if (cols.contains("id_card") || cols.contains("first_name") || cols.contains("role")) {
            return SourceType.PERSON;
        }
        if (cols.contains("from_number") || cols.contains("to_number")) {
            return SourceType.PHONE;
        }
        // from_wallet / to_wallet / wallet all qualify
        if (cols.stream().anyMatch(c -> c.contains("wallet") || c.contains("tx_hash"))) {
            return SourceType.CRYPTO;
        }
        return SourceType.UNKNOWN;
    }
}
