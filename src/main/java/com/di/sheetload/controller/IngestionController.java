package com.di.sheetload.controller;

import com.di.sheetload.report.FilterPreviewReport;
import com.di.sheetload.report.LoadReport;
import com.di.sheetload.report.ProfileReport;
import com.di.sheetload.report.ReconciliationReport;
import com.di.sheetload.service.IngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

/**
 * REST surface of the ingestion commands. {@code path} is a file on the server's file system.
 * Failures are mapped to status codes by {@link com.di.sheetload.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/ingest")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    /**
     * Example: GET /api/ingest/profile?path=/data/delivery.xlsx
     */
    @GetMapping(value = "/profile", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ProfileReport> profile(@RequestParam("path") String path) {
        return ResponseEntity.ok(ingestionService.profile(toPath(path)));
    }

    @GetMapping(value = "/reconcile", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationReport> reconcile(@RequestParam("path") String path) {
        return ResponseEntity.ok(ingestionService.reconcile(toPath(path)));
    }

    @GetMapping(value = "/filter-preview", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FilterPreviewReport> filterPreview(@RequestParam("path") String path) {
        return ResponseEntity.ok(ingestionService.filterPreview(toPath(path)));
    }

    /**
     * Loads the file into the resolved backend. Writes rows; not idempotent under APPEND.
     */
    @PostMapping(value = "/load", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LoadReport> load(@RequestParam("path") String path) {
        log.info("[LOAD] Load requested for {}", path);
        return ResponseEntity.ok(ingestionService.load(toPath(path)));
    }

    private static Path toPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Query parameter 'path' is required");
        }
        return Path.of(path.trim());
    }
}
