package com.testinsight.controller;

import com.testinsight.dto.RunIngestRequest;
import com.testinsight.dto.RunRecordResponse;
import com.testinsight.service.RunIngestService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunController {

    private final RunIngestService runIngestService;

    @PostMapping
    public ResponseEntity<RunRecordResponse> ingest(@Valid @RequestBody RunIngestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(runIngestService.ingest(request));
    }

    @GetMapping("/{id}")
    public RunRecordResponse findById(@PathVariable UUID id) {
        return runIngestService.findById(id);
    }
}
