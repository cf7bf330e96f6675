package com.mifinca.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.FeedingService;
import com.mifinca.backend.modules.event.presentation.dto.FeedingRequest;
import com.mifinca.backend.modules.event.presentation.dto.FeedingResponse;

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
@RequestMapping("/feedings")
public class FeedingController {

    private final FeedingService feedingService;

    public FeedingController(FeedingService feedingService) {
        this.feedingService = feedingService;
    }

    @PostMapping
    public ResponseEntity<FeedingResponse> createFeeding(@Valid @RequestBody FeedingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedingService.createFeeding(request));
    }

    @GetMapping
    public ResponseEntity<List<FeedingResponse>> listFeedings() {
        return ResponseEntity.ok(feedingService.listFeedings());
    }

    @GetMapping("/{feedingId}")
    public ResponseEntity<FeedingResponse> getFeeding(@PathVariable("feedingId") UUID feedingId) {
        return ResponseEntity.ok(feedingService.getFeeding(feedingId));
    }

    @PutMapping("/{feedingId}")
    public ResponseEntity<FeedingResponse> updateFeeding(
            @PathVariable("feedingId") UUID feedingId,
            @Valid @RequestBody FeedingRequest request
    ) {
        return ResponseEntity.ok(feedingService.updateFeeding(feedingId, request));
    }

    @DeleteMapping("/{feedingId}")
    public ResponseEntity<Void> deleteFeeding(@PathVariable("feedingId") UUID feedingId) {
        feedingService.deleteFeeding(feedingId);
        return ResponseEntity.noContent().build();
    }
}
