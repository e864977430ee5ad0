package com.investigation.linkage.controller;

import com.investigation.linkage.model.*;
import com.investigation.linkage.service.GraphExportService;
import com.investigation.linkage.service.LinkAnalysisService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static com.investigation.linkage.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalysisController.class)
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LinkAnalysisService analysisService;

    @MockBean
    private GraphExportService exportService;

    private static AnalysisResult sampleResult() {
        LinkedEntity person = entity("person:1100", EntityType.PERSON,
                EntityMetadata.builder().role("suspect").build(), "persons.csv");
        person.setRiskScore(30);
        return analysisResult("an-1", List.of(person), List.of());
    }

    @Test
    @SuppressWarnings("unchecked")
    void analyze_success() throws Exception {
        when(analysisService.analyze(anyList())).thenReturn(sampleResult());

        MockMultipartFile persons = new MockMultipartFile("files", "persons.csv", "text/csv",
                "id_card,role\n1100,suspect\n".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile bank = new MockMultipartFile("files", "bank.csv", "text/csv",
                "from_account,to_account,amount\nA,B,100\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/v1/analyses").file(persons).file(bank))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysisId").value("an-1"))
                .andExpect(jsonPath("$.entities[0].key").value("person:1100"))
                .andExpect(jsonPath("$.entities[0].type").value("person"))
                .andExpect(jsonPath("$.entities[0].riskScore").value(30));

        ArgumentCaptor<List<SourceUpload>> captor = ArgumentCaptor.forClass(List.class);
        verify(analysisService).analyze(captor.capture());
        assertThat(captor.getValue()).extracting(SourceUpload::getFileName).containsExactly("persons.csv", "bank.csv");
    }

    @Test
    void analyze_withoutFilesReturns400() throws Exception {
        mockMvc.perform(multipart("/api/v1/analyses"))
                .andExpect(status().isBadRequest());

        verify(analysisService, never()).analyze(anyList());
    }

    @Test
    void getAnalysis_success() throws Exception {
        when(analysisService.getAnalysis("an-1")).thenReturn(sampleResult());

        mockMvc.perform(get("/api/v1/analyses/an-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysisId").value("an-1"))
                .andExpect(jsonPath("$.summary.totalEntities").value(1));
    }

    @Test
    void getAnalysis_notFound() throws Exception {
        when(analysisService.getAnalysis("missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/analyses/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getRecentAnalyses_usesDefaultLimit() throws Exception {
        when(analysisService.getRecentAnalyses(20)).thenReturn(List.of(AnalysisOverview.builder()
                .analysisId("an-1")
                .analyzedAt(1739886764000L)
                .summary(AnalysisSummary.builder().totalEntities(12).highRiskCount(2).build())
                .build()));

        mockMvc.perform(get("/api/v1/analyses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].analysisId").value("an-1"))
                .andExpect(jsonPath("$[0].summary.highRiskCount").value(2));
    }

    @Test
    void getEntities_withMinScore() throws Exception {
        when(analysisService.getEntities("an-1", 70)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/analyses/an-1/entities").param("minScore", "70"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());

        verify(analysisService).getEntities("an-1", 70);
    }

    @Test
    void getEntities_unknownAnalysis() throws Exception {
        when(analysisService.getEntities("missing", 0)).thenReturn(null);

        mockMvc.perform(get("/api/v1/analyses/missing/entities"))
                .andExpect(status().isNotFound());
    }

    @Test
    void export_success() throws Exception {
        AnalysisResult result = sampleResult();
        when(analysisService.getAnalysis("an-1")).thenReturn(result);
        when(exportService.export(42L, result)).thenReturn(ExportReport.builder()
                .caseId(42L).nodesCreated(1).build());

        mockMvc.perform(post("/api/v1/analyses/an-1/export").param("caseId", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseId").value(42))
                .andExpect(jsonPath("$.nodesCreated").value(1))
                .andExpect(jsonPath("$.edgesFailed").value(0));
    }

    @Test
    void export_unknownAnalysis() throws Exception {
        when(analysisService.getAnalysis("missing")).thenReturn(null);

        mockMvc.perform(post("/api/v1/analyses/missing/export").param("caseId", "42"))
                .andExpect(status().isNotFound());

        verifyNoInteractions(exportService);
    }

    @Test
    void export_missingCaseIdReturns400() throws Exception {
        mockMvc.perform(post("/api/v1/analyses/an-1/export"))
                .andExpect(status().isBadRequest());
    }
}
