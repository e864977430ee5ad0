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

import java.util.Locale;
import java.util.Map;

import static com.investigation.linkage.engine.RecordValues.firstNonBlank;
import static com.investigation.linkage.engine.RecordValues.formatBaht;
import static com.investigation.linkage.engine.RecordValues.optional;
import static com.investigation.linkage.engine.RecordValues.parseAmount;
import static com.investigation.linkage.engine.RecordValues.text;

/**
 * Bank transfers: sender accumulates totalSent, receiver totalReceived, both one
 * transaction. A receiver whose name mentions an exchange is flagged as a mixer endpoint.
 * Totals and counts are repeated on the declared owner of either account.
 * A record with only one account number still accumulates on that side, but emits no
 * edge, so {@code summary.totalAmount} can be lower than the entity totals.
 */
@Component
public class BankSourceHandler implements SourceHandler {

    private static final Logger log = LoggerFactory.getLogger(BankSourceHandler.class);

    private final LinkAnalysisConfig config;

    public BankSourceHandler(LinkAnalysisConfig config) {
        this.config = config;
    }

    @Override
    public SourceType getSupportedSourceType() {
        return SourceType.BANK;
    }

    @Override
    public void ingest(ParsedSource source, GraphWorkspace workspace, CrossReferenceIndex index) {
        IdentityStore store = workspace.getStore();
        String file = source.getFileName();
        String exchangeKeyword = config.getExchangeKeyword().toLowerCase(Locale.ROOT);

        for (Map<String, String> record : source.getRecords()) {
            double amount = parseAmount(record.get("amount"));
            String fromAccount = text(record, "from_account");
            String toAccount = text(record, "to_account");
            String toName = text(record, "to_name");

            String fromKey = null;
            if (!fromAccount.isEmpty()) {
                fromKey = store.getOrCreate(EntityType.ACCOUNT, fromAccount,
                        firstNonBlank(text(record, "from_name"), fromAccount), file);
                store.applyMetadataPatch(fromKey, MetadataPatch.sent(amount));
            }

            String toKey = null;
            if (!toAccount.isEmpty()) {
                toKey = store.getOrCreate(EntityType.ACCOUNT, toAccount, firstNonBlank(toName, toAccount), file);
                boolean exchange = !exchangeKeyword.isEmpty()
                        && toName.toLowerCase(Locale.ROOT).contains(exchangeKeyword);
                store.applyMetadataPatch(toKey, MetadataPatch.builder()
                        .totalReceived(amount)
                        .transactionCount(1)
                        .usedMixer(exchange)
                        .build());
            }

            if (fromKey != null && toKey != null) {
                workspace.addEdge(fromKey, toKey, EdgeType.MONEY_TRANSFER, formatBaht(amount), amount,
                        optional(record, "date"));
            } else {
                log.debug("Bank record in {} is missing an account number; {} counted on one side only, no edge emitted",
                        file, amount);
            }

            if (!fromAccount.isEmpty()) {
                index.personForAccount(fromAccount)
                        .ifPresent(person -> store.applyMetadataPatch(person, MetadataPatch.sent(amount)));
            }
            if (!toAccount.isEmpty()) {
                index.personForAccount(toAccount)
                        .ifPresent(person -> store.applyMetadataPatch(person, MetadataPatch.received(amount)));
            }
        }
    }
}
