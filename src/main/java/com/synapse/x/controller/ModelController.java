package com.synapse.x.controller;

import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.RegisterModelRequest;
import com.synapse.x.exceptions.NotFoundException;
import com.synapse.x.service.ModelRegistry;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistry modelRegistry;

    @GetMapping
    public ResponseEntity<List<ModelVersion>> list() {
        return ResponseEntity.ok(modelRegistry.list());
    }

    @GetMapping("/active")
    public ResponseEntity<ModelVersion> active() {
        return ResponseEntity.ok(modelRegistry.getActive()
                .orElseThrow(() -> new NotFoundException("No active model version")));
    }

    @Operation(summary = "Register a staged model version")
    @PostMapping
    public ResponseEntity<ModelVersion> register(@Valid @RequestBody RegisterModelRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(modelRegistry.register(request.getVersionId(), request.getEmbeddingDim()));
    }

    @Operation(summary = "Activate a staged model version, retiring the current one")
    @PostMapping("/{versionId}/activate")
    public ResponseEntity<ModelVersion> activate(@PathVariable String versionId) {
        return ResponseEntity.ok(modelRegistry.activate(versionId));
    }
}
