package com.smurthy.ai.tutor.controllers;

import com.smurthy.ai.tutor.dto.IngestPassagesRequest;
import com.smurthy.ai.tutor.retrieval.CurriculumIngestionService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Loads curriculum passages used for grounding.
 */
@RestController
@RequestMapping("/api/curriculum")
public class CurriculumController {

    private final CurriculumIngestionService ingestionService;

    public CurriculumController(CurriculumIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/passages")
    public ResponseEntity<Map<String, Integer>> ingest(@Valid @RequestBody IngestPassagesRequest request) {
        int ingested = ingestionService.ingest(request.toPassages());
        return ResponseEntity.ok(Map.of("ingested", ingested));
    }
}
