package com.testinsight.controller;

import com.testinsight.dto.AnalysisJobResponse;
import com.testinsight.dto.AnalysisRequest;
import com.testinsight.dto.KpiMetaResponse;
import com.testinsight.service.AnalysisJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisJobService analysisJobService;

    @GetMapping("/kpis")
    public List<KpiMetaResponse> kpis() {
        return analysisJobService.kpiCatalog();
    }

    @PostMapping
    public ResponseEntity<AnalysisJobResponse> create(@RequestBody AnalysisRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(analysisJobService.create(request));
    }

    @GetMapping("/{id}")
    public AnalysisJobResponse findById(@PathVariable UUID id) {
        return analysisJobService.findById(id);
    }

    @GetMapping
    public List<AnalysisJobResponse> findAll(@RequestParam(required = false) UUID repositoryId) {
        return analysisJobService.findAll(repositoryId);
    }
}
