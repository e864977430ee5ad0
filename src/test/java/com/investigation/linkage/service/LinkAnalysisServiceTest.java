package com.investigation.linkage.service;

import com.investigation.linkage.config.LinkAnalysisConfig;
import com.investigation.linkage.config.MetricsConfig;
import com.investigation.linkage.engine.ColumnAliasMapper;
import com.investigation.linkage.engine.RelationshipEngine;
import com.investigation.linkage.engine.SourceClassifier;
import com.investigation.linkage.engine.SourceValidator;
import com.investigation.linkage.engine.handlers.BankSourceHandler;
import com.investigation.linkage.engine.handlers.CryptoSourceHandler;
import com.investigation.linkage.engine.handlers.PersonSourceHandler;
import com.investigation.linkage.engine.handlers.PhoneSourceHandler;
import com.investigation.linkage.model.*;
import com.investigation.linkage.repository.AnalysisResultRepository;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.investigation.linkage.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkAnalysisServiceTest {

    @Mock private AnalysisResultRepository resultRepository;
    @Mock private MetricsConfig metricsConfig;

    private LinkAnalysisService analysisService;

    @BeforeEach
    void setUp() {
        LinkAnalysisConfig config = new LinkAnalysisConfig();
        SourceParsingService parsingService = new SourceParsingService(
                new ColumnAliasMapper(), new SourceClassifier(), new SourceValidator());
        RelationshipEngine engine = new RelationshipEngine(new PersonSourceHandler(),
                List.of(new BankSourceHandler(config), new PhoneSourceHandler(), new CryptoSourceHandler(config)),
                Tracer.NOOP);

        analysisService = new LinkAnalysisService(parsingService, engine, new RiskScoringService(config),
                new GraphAssemblerService(config), resultRepository, metricsConfig);
    }

    private static Map<String, LinkedEntity> byKey(AnalysisResult result) {
        return result.getEntities().stream().collect(Collectors.toMap(LinkedEntity::getKey, Function.identity()));
    }

    @Test
    void analyze_suspectOnlyRegistry() {
        AnalysisResult result = analysisService.analyze(List.of(
                upload("persons.csv", "id_card,role", "111,suspect")));

        assertThat(result.getEntities()).hasSize(1);
        LinkedEntity person = result.getEntities().get(0);
        assertThat(person.getType()).isEqualTo(EntityType.PERSON);
        assertThat(person.getRiskScore()).isEqualTo(30);
        assertThat(person.getRiskFactors()).extracting(RiskFactor::getFactor, RiskFactor::getScore)
                .containsExactly(tuple("suspect", 30));
    }

    @Test
    void analyze_largeBankTransferWithoutRegistry() {
        AnalysisResult result = analysisService.analyze(List.of(
                upload("bank.csv", "from_account,to_account,amount", "A,B,600000")));

        Map<String, LinkedEntity> entities = byKey(result);
        LinkedEntity a = entities.get("account:a");
        LinkedEntity b = entities.get("account:b");
        assertThat(b.getMetadata().getTotalReceived()).isEqualTo(600000.0);
        assertThat(b.getRiskFactors()).extracting(RiskFactor::getFactor).containsExactly("received > ฿500K");
        assertThat(b.getRiskScore()).isEqualTo(25);
        assertThat(a.getMetadata().getTotalSent()).isEqualTo(600000.0);
        assertThat(a.getMetadata().getTransactionCount()).isEqualTo(1);
        assertThat(b.getMetadata().getTransactionCount()).isEqualTo(1);
    }

    @Test
    void analyze_mixerDestinationFlagsSendingWalletOnly() {
        AnalysisResult result = analysisService.analyze(List.of(
                upload("crypto.csv", CRYPTO_HEADER, "W1,,W2,Mixer Service,100,USDT,3500,2024-03-01")));

        Map<String, LinkedEntity> entities = byKey(result);
        assertThat(entities.get("wallet:w1").getMetadata().isUsedMixer()).isTrue();
        assertThat(entities.get("wallet:w1").getRiskFactors())
                .anySatisfy(f -> {
                    assertThat(f.getFactor()).isEqualTo("used mixer");
                    assertThat(f.getScore()).isEqualTo(20);
                });
        assertThat(entities.get("wallet:w2").getMetadata().isUsedMixer()).isFalse();
        assertThat(entities.get("wallet:w2").getRiskScore()).isZero();
    }

    @Test
    void analyze_transfersFoldOntoAccountOwner() {
        AnalysisResult result = analysisService.analyze(List.of(
                upload("bank.csv", BANK_HEADER,
                        "X1,,ACC1,,50000,2024-03-01",
                        "X2,,ACC1,,50000,2024-03-02",
                        "X3,,ACC1,,50000,2024-03-03"),
                upload("persons.csv", PERSON_HEADER, ",Somchai,Jaidee,1100,,ACC1,KBank,,suspect")));

        Map<String, LinkedEntity> entities = byKey(result);
        LinkedEntity person = entities.get("person:1100");
        assertThat(person.getMetadata().getTotalReceived()).isEqualTo(150000.0);
        assertThat(person.getMetadata().getTransactionCount()).isEqualTo(3);
        assertThat(entities.get("account:acc1").getMetadata().getTotalReceived()).isEqualTo(150000.0);
        // suspect 30 + received > 100K 15
        assertThat(person.getRiskScore()).isEqualTo(45);
        assertThat(entities.get("account:acc1").getSources()).containsExactly("persons.csv", "bank.csv");
    }

    @Test
    void analyze_graphInvariantsHold() {
        AnalysisResult result = analysisService.analyze(fullCase());

        Map<String, LinkedEntity> entities = byKey(result);
        assertThat(result.getEntities()).allSatisfy(e ->
                assertThat(e.getRiskScore()).isBetween(0, 100));
        assertThat(result.getEdges()).allSatisfy(edge -> {
            assertThat(entities.get(edge.getSource()).getLinkedIds()).contains(edge.getTarget());
            assertThat(entities.get(edge.getTarget()).getLinkedIds()).contains(edge.getSource());
        });
        double moneyTotal = result.getEdges().stream()
                .filter(e -> e.getEdgeType() == EdgeType.MONEY_TRANSFER)
                .mapToDouble(RelationshipEdge::getAmount)
                .sum();
        assertThat(result.getSummary().getTotalAmount()).isEqualTo(moneyTotal);
    }

    @Test
    void analyze_isIdempotentAcrossRuns() {
        AnalysisResult first = analysisService.analyze(fullCase());
        AnalysisResult second = analysisService.analyze(fullCase());

        assertThat(second.getAnalysisId()).isNotEqualTo(first.getAnalysisId());
        assertThat(second.getEntities()).hasSameSizeAs(first.getEntities());
        assertThat(second.getEdges()).hasSameSizeAs(first.getEdges());
        assertThat(second.getEntities()).extracting(LinkedEntity::getKey, LinkedEntity::getRiskScore)
                .containsExactlyElementsOf(first.getEntities().stream()
                        .map(e -> tuple(e.getKey(), e.getRiskScore()))
                        .toList());
    }

    @Test
    void analyze_unreadableFileIsReportedAndSkipped() {
        AnalysisResult result = analysisService.analyze(List.of(
                new SourceUpload("broken.csv", null),
                upload("bank.csv", "from_account,to_account,amount", "A,B,100")));

        assertThat(result.getSources()).extracting(SourceReport::getFileName, SourceReport::getStatus)
                .containsExactly(
                        tuple("broken.csv", SourceStatus.ERROR),
                        tuple("bank.csv", SourceStatus.PARSED));
        assertThat(result.getSummary().getTotalRecords()).isEqualTo(1);
        assertThat(result.getEntities()).hasSize(2);
    }

    @Test
    void analyze_persistsAndRecordsMetrics() throws Exception {
        AnalysisResult result = analysisService.analyze(List.of(
                upload("bank.csv", "from_account,to_account,amount", "A,B,100")));

        ArgumentCaptor<AnalysisResult> captor = ArgumentCaptor.forClass(AnalysisResult.class);
        verify(resultRepository).save(captor.capture());
        assertThat(captor.getValue().getAnalysisId()).isEqualTo(result.getAnalysisId());
        assertThat(result.getAnalyzedAt()).isPositive();
        verify(metricsConfig).recordSource("bank", "PARSED");
        verify(metricsConfig).recordAnalysis(result.getSummary());
    }

    @Test
    void analyze_storageFailureStillReturnsResult() throws Exception {
        doThrow(new RuntimeException("Aerospike down")).when(resultRepository).save(any());

        AnalysisResult result = analysisService.analyze(List.of(
                upload("bank.csv", "from_account,to_account,amount", "A,B,100")));

        assertThat(result.getEntities()).hasSize(2);
    }

    @Test
    void getEntities_filtersAndSortsByScore() {
        LinkedEntity low = entity("account:a", EntityType.ACCOUNT, new EntityMetadata(), "bank.csv");
        low.setRiskScore(10);
        LinkedEntity high = entity("account:b", EntityType.ACCOUNT, new EntityMetadata(), "bank.csv");
        high.setRiskScore(80);
        LinkedEntity mid = entity("account:c", EntityType.ACCOUNT, new EntityMetadata(), "bank.csv");
        mid.setRiskScore(40);
        when(resultRepository.findById("an-1")).thenReturn(analysisResult("an-1", List.of(low, high, mid), List.of()));

        List<LinkedEntity> entities = analysisService.getEntities("an-1", 40);

        assertThat(entities).extracting(LinkedEntity::getKey).containsExactly("account:b", "account:c");
    }

    @Test
    void getEntities_unknownAnalysisIsNull() {
        when(resultRepository.findById(anyString())).thenReturn(null);

        assertThat(analysisService.getEntities("missing", 0)).isNull();
    }

    @Test
    void getRecentAnalyses_limitBelowOneIsRaisedToOne() {
        when(resultRepository.findRecent(1)).thenReturn(List.of());

        assertThat(analysisService.getRecentAnalyses(-1)).isEmpty();

        verify(resultRepository).findRecent(1);
    }

    private static List<SourceUpload> fullCase() {
        return List.of(
                upload("persons.csv", PERSON_HEADER,
                        "Mr.,Somchai,Jaidee,1100,0811,ACC1,KBank,0xW1,suspect",
                        "Ms.,Malee,Srisuk,2200,0822,ACC2,SCB,,victim"),
                upload("bank.csv", BANK_HEADER,
                        "ACC2,Malee,ACC1,Somchai,200000,2024-03-01",
                        "ACC2,Malee,ACC1,Somchai,350000,2024-03-02",
                        "ACC1,Somchai,EX1,Bitkub Exchange,400000,2024-03-03"),
                upload("calls.csv", PHONE_HEADER,
                        "0811,Somchai,0822,Malee,120,2024-03-01",
                        "0811,Somchai,0833,,30,2024-03-02"),
                upload("crypto.csv", CRYPTO_HEADER,
                        "0xW1,,0xW9,Cambodia Mixer,1000,USDT,35000,2024-03-04"));
    }
}
