package com.investigation.linkage.engine.handlers;

import com.investigation.linkage.config.LinkAnalysisConfig;
import com.investigation.linkage.engine.CrossReferenceIndex;
import com.investigation.linkage.engine.GraphWorkspace;
import com.investigation.linkage.engine.IdentityStore;
import com.investigation.linkage.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.investigation.linkage.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;

class BankSourceHandlerTest {

    private BankSourceHandler handler;
    private GraphWorkspace workspace;

    @BeforeEach
    void setUp() {
        handler = new BankSourceHandler(new LinkAnalysisConfig());
        workspace = new GraphWorkspace();
    }

    @Test
    void ingest_accumulatesSentAndReceived() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(
                transfer("ACC9", "ACC1", "Somchai", "1,500"),
                transfer("ACC9", "ACC1", "", "฿500.50")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        IdentityStore store = workspace.getStore();
        EntityMetadata sender = store.find("account:acc9").orElseThrow().getMetadata();
        EntityMetadata receiver = store.find("account:acc1").orElseThrow().getMetadata();
        assertThat(sender.getTotalSent()).isEqualTo(2000.5);
        assertThat(sender.getTransactionCount()).isEqualTo(2);
        assertThat(receiver.getTotalReceived()).isEqualTo(2000.5);
        assertThat(receiver.getTransactionCount()).isEqualTo(2);
        assertThat(store.find("account:acc1").orElseThrow().getLabel()).isEqualTo("Somchai");
    }

    @Test
    void ingest_emitsMoneyTransferEdge() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(transfer("ACC9", "ACC1", "", "600000")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        RelationshipEdge edge = workspace.getEdges().get(0);
        assertThat(edge.getEdgeType()).isEqualTo(EdgeType.MONEY_TRANSFER);
        assertThat(edge.getSource()).isEqualTo("account:acc9");
        assertThat(edge.getTarget()).isEqualTo("account:acc1");
        assertThat(edge.getAmount()).isEqualTo(600000.0);
        assertThat(edge.getLabel()).isEqualTo("฿600,000");
        assertThat(edge.getDate()).isEqualTo("2024-03-01");
    }

    @Test
    void ingest_exchangeReceiverIsFlaggedAsMixer() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(
                transfer("ACC9", "ACC7", "Bitkub Exchange Co.", "10000")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        assertThat(workspace.getStore().find("account:acc7").orElseThrow().getMetadata().isUsedMixer()).isTrue();
        assertThat(workspace.getStore().find("account:acc9").orElseThrow().getMetadata().isUsedMixer()).isFalse();
    }

    @Test
    void ingest_missingAccountCreatesNoEdge() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(transfer("", "ACC1", "", "100")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        assertThat(workspace.getEdges()).isEmpty();
        assertThat(workspace.getStore().keys()).containsExactly("account:acc1");
        assertThat(workspace.getStore().find("account:acc1").orElseThrow().getMetadata().getTotalReceived())
                .isEqualTo(100.0);
    }

    @Test
    void ingest_malformedAmountCountsAsZero() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(transfer("ACC9", "ACC1", "", "n/a")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        assertThat(workspace.getEdges().get(0).getAmount()).isZero();
        assertThat(workspace.getStore().find("account:acc1").orElseThrow().getMetadata().getTransactionCount())
                .isEqualTo(1);
    }

    @Test
    void ingest_foldsOntoDeclaredOwners() {
        IdentityStore store = workspace.getStore();
        String sender = store.getOrCreate(EntityType.PERSON, "1100", "Somchai", "persons.csv");
        String receiver = store.getOrCreate(EntityType.PERSON, "2200", "Malee", "persons.csv");
        CrossReferenceIndex index = CrossReferenceIndex.builder()
                .account("ACC9", sender)
                .account("ACC1", receiver)
                .build();

        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(
                transfer("ACC9", "ACC1", "Crypto Exchange", "150000")));

        handler.ingest(bank, workspace, index);

        EntityMetadata senderMeta = store.find(sender).orElseThrow().getMetadata();
        EntityMetadata receiverMeta = store.find(receiver).orElseThrow().getMetadata();
        assertThat(senderMeta.getTotalSent()).isEqualTo(150000.0);
        assertThat(senderMeta.getTransactionCount()).isEqualTo(1);
        assertThat(receiverMeta.getTotalReceived()).isEqualTo(150000.0);
        assertThat(receiverMeta.isUsedMixer()).isFalse();
        // folding does not create a person-to-account edge
        assertThat(workspace.getEdges()).hasSize(1);
    }

    @Test
    void ingest_signedDebitDoesNotReduceTotals() {
        ParsedSource bank = source("bank.csv", SourceType.BANK, List.of(
                transfer("ACC9", "ACC1", "", "600000"),
                transfer("ACC9", "ACC1", "", "-600000")));

        handler.ingest(bank, workspace, CrossReferenceIndex.empty());

        EntityMetadata sender = workspace.getStore().find("account:acc9").orElseThrow().getMetadata();
        EntityMetadata receiver = workspace.getStore().find("account:acc1").orElseThrow().getMetadata();
        assertThat(sender.getTotalSent()).isEqualTo(1200000.0);
        assertThat(receiver.getTotalReceived()).isEqualTo(1200000.0);
        assertThat(workspace.getEdges()).extracting(RelationshipEdge::getAmount)
                .containsExactly(600000.0, 600000.0);
        assertThat(workspace.getEdges()).extracting(RelationshipEdge::getLabel)
                .containsOnly("฿600,000");
    }
}
