package com.mifinca.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.ReproductiveEventService;
import com.mifinca.backend.modules.event.presentation.dto.OffspringBornRequest;
import com.mifinca.backend.modules.event.presentation.dto.OffspringBornResponse;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventRequest;
import com.mifinca.backend.modules.event.presentation.dto.ReproductiveEventResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReproductiveEventController {

    private final ReproductiveEventService reproductiveEventService;

    public ReproductiveEventController(ReproductiveEventService reproductiveEventService) {
        this.reproductiveEventService = reproductiveEventService;
    }

    @PostMapping("/reproductive-events")
    public ResponseEntity<ReproductiveEventResponse> createReproductiveEvent(
            @Valid @RequestBody ReproductiveEventRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reproductiveEventService.createReproductiveEvent(request));
    }

    @GetMapping("/reproductive-events")
    public ResponseEntity<List<ReproductiveEventResponse>> listReproductiveEvents() {
        return ResponseEntity.ok(reproductiveEventService.listReproductiveEvents());
    }

    @GetMapping("/reproductive-events/{eventId}")
    public ResponseEntity<ReproductiveEventResponse> getReproductiveEvent(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(reproductiveEventService.getReproductiveEvent(eventId));
    }

    @PutMapping("/reproductive-events/{eventId}")
    public ResponseEntity<ReproductiveEventResponse> updateReproductiveEvent(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody ReproductiveEventRequest request
    ) {
        return ResponseEntity.ok(reproductiveEventService.updateReproductiveEvent(eventId, request));
    }

    @DeleteMapping("/reproductive-events/{eventId}")
    public ResponseEntity<Void> deleteReproductiveEvent(@PathVariable("eventId") UUID eventId) {
        reproductiveEventService.deleteReproductiveEvent(eventId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Register an animal as born from this event")
    @PostMapping("/reproductive-events/{eventId}/offspring")
    public ResponseEntity<OffspringBornResponse> registerOffspring(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody OffspringBornRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(reproductiveEventService.registerOffspring(eventId, request));
    }

    @GetMapping("/reproductive-events/{eventId}/offspring")
    public ResponseEntity<List<OffspringBornResponse>> listOffspring(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(reproductiveEventService.listOffspring(eventId));
    }

    @GetMapping("/offspring-born/{offspringBornId}")
    public ResponseEntity<OffspringBornResponse> getOffspring(@PathVariable("offspringBornId") UUID offspringBornId) {
        return ResponseEntity.ok(reproductiveEventService.getOffspring(offspringBornId));
    }

    @DeleteMapping("/offspring-born/{offspringBornId}")
    public ResponseEntity<Void> deleteOffspring(@PathVariable("offspringBornId") UUID offspringBornId) {
        reproductiveEventService.deleteOffspring(offspringBornId);
        return ResponseEntity.noContent().build();
    }
}
