package com.synapse.x.controller;

import com.synapse.x.dto.HealthStatus;
import com.synapse.x.dto.enums.HealthState;
import com.synapse.x.service.HealthReporter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthReporter healthReporter;

    @GetMapping
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = healthReporter.check();
        HttpStatus code = status.getStatus() == HealthState.DOWN ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(code).body(status);
    }
}
