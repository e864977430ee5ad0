package com.investigation.linkage.engine.handlers;

import com.investigation.linkage.engine.CrossReferenceIndex;
import com.investigation.linkage.engine.GraphWorkspace;
import com.investigation.linkage.engine.IdentityStore;
import com.investigation.linkage.model.EdgeType;
import com.investigation.linkage.model.EntityType;
import com.investigation.linkage.model.MetadataPatch;
import com.investigation.linkage.model.ParsedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.investigation.linkage.engine.RecordValues.optional;
import static com.investigation.linkage.engine.RecordValues.text;

/**
 * First ingestion stage. Creates a person per registry row (keyed by ID card number,
 * or by full name when there is none), an owned phone/account/wallet for each declared
 * instrument with an ownership edge, and returns the cross-reference index the
 * activity stages use to fold transactions back onto people.
 */
@Component
public class PersonSourceHandler {

    private static final Logger log = LoggerFactory.getLogger(PersonSourceHandler.class);

    public CrossReferenceIndex ingest(List<ParsedSource> personSources, GraphWorkspace workspace) {
        CrossReferenceIndex.Builder index = CrossReferenceIndex.builder();
        IdentityStore store = workspace.getStore();

        for (ParsedSource source : personSources) {
            String file = source.getFileName();
            int skipped = 0;

            for (Map<String, String> record : source.getRecords()) {
                String name = fullName(record);
                String idCard = text(record, "id_card");
                String identifier = idCard.isEmpty() ? name : idCard;
                if (identifier.isEmpty()) {
                    skipped++;
                    continue;
                }

                String label = name.isEmpty() ? idCard : name;
                String personKey = store.getOrCreate(EntityType.PERSON, identifier, label, file,
                        MetadataPatch.role(optional(record, "role")));

                String phone = text(record, "phone");
                if (!phone.isEmpty()) {
                    String phoneKey = store.getOrCreate(EntityType.PHONE, phone, phone, file);
                    workspace.addEdge(personKey, phoneKey, EdgeType.OWNERSHIP, "phone owner", null, null);
                    index.phone(phone, personKey);
                }

                String account = text(record, "bank_account");
                if (!account.isEmpty()) {
                    String bank = text(record, "bank");
                    String accountLabel = bank.isEmpty() ? account : account + " (" + bank + ")";
                    String accountKey = store.getOrCreate(EntityType.ACCOUNT, account, accountLabel, file);
                    workspace.addEdge(personKey, accountKey, EdgeType.OWNERSHIP, "account owner", null, null);
                    index.account(account, personKey);
                }

                String wallet = text(record, "wallet_address");
                if (!wallet.isEmpty()) {
                    String walletKey = store.getOrCreate(EntityType.WALLET, wallet, wallet, file);
                    workspace.addEdge(personKey, walletKey, EdgeType.OWNERSHIP, "wallet owner", null, null);
                    index.wallet(wallet, personKey);
                }
            }

            if (skipped > 0) {
                log.debug("Skipped {} person records without ID card or name in {}", skipped, file);
            }
        }

        return index.build();
    }

    private String fullName(Map<String, String> record) {
        String joined = String.join(" ", text(record, "prefix"), text(record, "first_name"), text(record, "last_name"));
        return joined.trim().replaceAll("\\s+", " ");
    }
}
