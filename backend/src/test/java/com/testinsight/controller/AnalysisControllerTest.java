package com.testinsight.controller;

import com.testinsight.dto.AnalysisJobResponse;
import com.testinsight.dto.AnalysisRequest;
import com.testinsight.dto.KpiMetaResponse;
import com.testinsight.exception.GlobalExceptionHandler;
import com.testinsight.exception.NotFoundException;
import com.testinsight.model.enums.KpiType;
import com.testinsight.service.AnalysisJobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    @Mock
    private AnalysisJobService analysisJobService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AnalysisController(analysisJobService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void create_ReturnsAcceptedPendingJob() throws Exception {
        UUID id = UUID.randomUUID();
        when(analysisJobService.create(any())).thenReturn(AnalysisJobResponse.builder()
                .id(id).status("PENDING").progress(0).selectedKpis(List.of("keyword_frequency")).build());

        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectedKpis\":[\"keyword_frequency\"],\"dateFrom\":\"2024-01-01\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.progress").value(0));

        ArgumentCaptor<AnalysisRequest> request = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(analysisJobService).create(request.capture());
        assertEquals(List.of("keyword_frequency"), request.getValue().getSelectedKpis());
    }

    @Test
    void create_EmptySelection_Returns400() throws Exception {
        when(analysisJobService.create(any())).thenThrow(new IllegalArgumentException("At least one KPI must be selected"));

        mockMvc.perform(post("/api/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"selectedKpis\":null}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("At least one KPI must be selected"));
    }

    @Test
    void findById_Missing_Returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(analysisJobService.findById(id)).thenThrow(new NotFoundException("Analysis job not found: " + id));

        mockMvc.perform(get("/api/analysis/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void kpis_ListsCatalog() throws Exception {
        when(analysisJobService.kpiCatalog()).thenReturn(List.of(KpiMetaResponse.from(KpiType.REDUNDANCY_DETECTION)));

        mockMvc.perform(get("/api/analysis/kpis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("redundancy_detection"))
                .andExpect(jsonPath("$[0].category").value("maintenance"));
    }

    @Test
    void findAll_PassesRepositoryFilter() throws Exception {
        UUID repositoryId = UUID.randomUUID();
        when(analysisJobService.findAll(repositoryId)).thenReturn(List.of());

        mockMvc.perform(get("/api/analysis").param("repositoryId", repositoryId.toString()))
                .andExpect(status().isOk());

        verify(analysisJobService).findAll(repositoryId);
    }
}
