package com.example.docsync.controller;

import com.example.docsync.model.AnalysisRequest;
import com.example.docsync.model.ConsistencyReport;
import com.example.docsync.model.GateVerdict;
import com.example.docsync.model.SourceUnit;
import com.example.docsync.orchestrator.ConsistencyEngine;
import com.example.docsync.service.ConsistencyGate;
import com.example.docsync.service.IngestionException;
import com.example.docsync.service.SourceBundleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

/**
 * REST controller for code/documentation consistency analysis.
 */
@RestController
@RequestMapping("/api")
public class ConsistencyController {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyController.class);

    private final ConsistencyEngine engine;
    private final SourceBundleLoader bundleLoader;
    private final ConsistencyGate gate;

    public ConsistencyController(ConsistencyEngine engine,
                                 SourceBundleLoader bundleLoader,
                                 ConsistencyGate gate) {
        this.engine = engine;
        this.bundleLoader = bundleLoader;
        this.gate = gate;
    }

    /**
     * Scores pasted code against pasted documentation.
     *
     * <p>Endpoint: POST /api/analyze
     * <p>Body: {"code": "...", "documentation": "..."}
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConsistencyReport> analyze(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request ({} code chars, {} doc chars)",
                request.code().length(), request.documentation().length());
        return ResponseEntity.ok(engine.analyze(request.code(), request.documentation()));
    }

    /**
     * Scores an uploaded code bundle (single file or zip) against optional uploaded documentation.
     *
     * <p>Endpoint: POST /api/analyze/upload
     * <p>Content-Type: multipart/form-data
     * <p>Parameters: code_file (required), doc_file (optional)
     */
    @PostMapping(value = "/analyze/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyzeUpload(@RequestParam(value = "code_file", required = false) MultipartFile codeFile,
                                           @RequestParam(value = "doc_file", required = false) MultipartFile docFile) {
        // ── Input validation ──
        if (codeFile == null || codeFile.isEmpty()) {
            return badRequest("Missing code file. Please upload a source file or a zip archive as 'code_file'.");
        }
        String codeName = codeFile.getOriginalFilename();
        log.info("Received upload analysis request for '{}' ({} bytes), documentation: {}",
                codeName, codeFile.getSize(), docFile != null && !docFile.isEmpty() ? docFile.getOriginalFilename() : "none");

        try {
            List<SourceUnit> sources = bundleLoader.readCode(codeName, codeFile.getBytes());
            String documentation = docFile != null && !docFile.isEmpty()
                    ? bundleLoader.readDocumentation(docFile.getOriginalFilename(), docFile.getBytes())
                    : "";
            return ResponseEntity.ok(engine.analyze(sources, documentation));

        } catch (IngestionException e) {
            log.warn("Rejected upload '{}': {}", codeName, e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error during analysis of '{}'", codeName, e);
            return internalError(e);
        }
    }

    /**
     * Scores pasted code and documentation and applies the CI gate.
     * Responds 200 when the gate passes and 422 when it fails.
     *
     * <p>Endpoint: POST /api/gate
     */
    @PostMapping(value = "/gate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GateVerdict> gate(@RequestBody AnalysisRequest request) {
        GateVerdict verdict = gate.evaluate(engine.analyze(request.code(), request.documentation()));
        return ResponseEntity.status(verdict.passed() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY)
                .body(verdict);
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "DocSync-Agent"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private ResponseEntity<Map<String, String>> internalError(Exception e) {
        return ResponseEntity.internalServerError()
                .body(Map.of(
                        "error", "Error during analysis",
                        "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                ));
    }
}
