package com.example.supplymatch.interfaces.api;

import com.example.supplymatch.application.service.ReconciliationService;
import com.example.supplymatch.domain.model.LearnedMapping;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Learned mappings: confirm, look up and forget.
 */
@RestController
@RequestMapping(value = "/api/mappings", produces = MediaType.APPLICATION_JSON_VALUE)
public class MappingController {

    private final ReconciliationService reconciliationService;

    public MappingController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LearnedMapping> confirm(@RequestBody MappingRequest request) {
        LearnedMapping mapping = reconciliationService.confirmMapping(request.lineText(), request.catalogItemId());
        return ResponseEntity.status(HttpStatus.CREATED).body(mapping);
    }

    @GetMapping
    public ResponseEntity<LearnedMapping> find(@RequestParam("lineText") String lineText) {
        return reconciliationService.findMapping(lineText)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping
    public ResponseEntity<Void> remove(@RequestParam("lineText") String lineText) {
        reconciliationService.removeMapping(lineText);
        return ResponseEntity.noContent().build();
    }
}
