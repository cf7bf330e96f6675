package com.mifinca.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.HealthEventService;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.HealthEventResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health-events")
public class HealthEventController {

    private final HealthEventService healthEventService;

    public HealthEventController(HealthEventService healthEventService) {
        this.healthEventService = healthEventService;
    }

    @PostMapping
    public ResponseEntity<HealthEventResponse> createHealthEvent(@Valid @RequestBody HealthEventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(healthEventService.createHealthEvent(request));
    }

    @GetMapping
    public ResponseEntity<List<HealthEventResponse>> listHealthEvents() {
        return ResponseEntity.ok(healthEventService.listHealthEvents());
    }

    @GetMapping("/{healthEventId}")
    public ResponseEntity<HealthEventResponse> getHealthEvent(@PathVariable("healthEventId") UUID healthEventId) {
        return ResponseEntity.ok(healthEventService.getHealthEvent(healthEventId));
    }

    @PutMapping("/{healthEventId}")
    public ResponseEntity<HealthEventResponse> updateHealthEvent(
            @PathVariable("healthEventId") UUID healthEventId,
            @Valid @RequestBody HealthEventRequest request
    ) {
        return ResponseEntity.ok(healthEventService.updateHealthEvent(healthEventId, request));
    }

    @DeleteMapping("/{healthEventId}")
    public ResponseEntity<Void> deleteHealthEvent(@PathVariable("healthEventId") UUID healthEventId) {
        healthEventService.deleteHealthEvent(healthEventId);
        return ResponseEntity.noContent().build();
    }
}
