package com.investigation.linkage.engine.handlers;

import com.investigation.linkage.config.LinkAnalysisConfig;
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

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.investigation.linkage.engine.RecordValues.firstNonBlank;
import static com.investigation.linkage.engine.RecordValues.formatUnits;
import static com.investigation.linkage.engine.RecordValues.optional;
import static com.investigation.linkage.engine.RecordValues.parseAmount;
import static com.investigation.linkage.engine.RecordValues.text;

/**
 * Crypto transfers. Amounts are converted to THB (explicit amount_thb column, else the
 * configured fallback rate). Mixer and foreign-jurisdiction destinations flag the
 * sending wallet, which also accumulates totalSent; the declared owner of the sending
 * wallet gets the same flags and total.
 */
@Component
public class CryptoSourceHandler implements SourceHandler {

    private static final Logger log = LoggerFactory.getLogger(CryptoSourceHandler.class);

    private static final int ABBREVIATED_ADDRESS_LENGTH = 12;

    private final LinkAnalysisConfig config;

    public CryptoSourceHandler(LinkAnalysisConfig config) {
        this.config = config;
    }

    @Override
    public SourceType getSupportedSourceType() {
        return SourceType.CRYPTO;
    }

    @Override
    public void ingest(ParsedSource source, GraphWorkspace workspace, CrossReferenceIndex index) {
        IdentityStore store = workspace.getStore();
        String file = source.getFileName();

        for (Map<String, String> record : source.getRecords()) {
            double amount = parseAmount(record.get("amount"));
            double amountThb = parseAmount(record.get("amount_thb"));
            if (amountThb == 0.0) {
                amountThb = amount * config.getCryptoFallbackRate();
            }

            String fromWallet = text(record, "from_wallet");
            String toWallet = text(record, "to_wallet");
            String toLabel = text(record, "to_label").toLowerCase(Locale.ROOT);
            boolean mixer = containsAny(toLabel, config.getMixerKeywords());
            boolean foreign = containsAny(toLabel, config.getForeignKeywords());

            MetadataPatch outgoing = MetadataPatch.builder()
                    .totalSent(amountThb)
                    .usedMixer(mixer)
                    .foreignTransfer(foreign)
                    .build();

            String fromKey = null;
            if (!fromWallet.isEmpty()) {
                fromKey = store.getOrCreate(EntityType.WALLET, fromWallet,
                        firstNonBlank(text(record, "from_label"), abbreviate(fromWallet)), file);
                store.applyMetadataPatch(fromKey, outgoing);
            }

            String toKey = null;
            if (!toWallet.isEmpty()) {
                toKey = store.getOrCreate(EntityType.WALLET, toWallet,
                        firstNonBlank(text(record, "to_label"), abbreviate(toWallet)), file);
            }

            if (fromKey != null && toKey != null) {
                String currency = firstNonBlank(text(record, "currency"), config.getDefaultCryptoCurrency());
                workspace.addEdge(fromKey, toKey, EdgeType.CRYPTO_TRANSFER, formatUnits(amount) + " " + currency,
                        amountThb, optional(record, "date"));
            } else {
                log.debug("Crypto record in {} is missing a wallet address; no edge emitted", file);
            }

            if (!fromWallet.isEmpty()) {
                index.personForWallet(fromWallet)
                        .ifPresent(person -> store.applyMetadataPatch(person, outgoing));
            }
        }
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (!keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String address) {
        return address.length() > ABBREVIATED_ADDRESS_LENGTH
                ? address.substring(0, ABBREVIATED_ADDRESS_LENGTH) + "..."
                : address;
    }
}
