package com.mifinca.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.BatchService;
import com.mifinca.backend.modules.event.presentation.dto.BatchRequest;
import com.mifinca.backend.modules.event.presentation.dto.BatchResponse;

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
@RequestMapping("/batches")
public class BatchController {

    private final BatchService batchService;

    public BatchController(BatchService batchService) {
        this.batchService = batchService;
    }

    @PostMapping
    public ResponseEntity<BatchResponse> createBatch(@Valid @RequestBody BatchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(batchService.createBatch(request));
    }

    @GetMapping
    public ResponseEntity<List<BatchResponse>> listBatches() {
        return ResponseEntity.ok(batchService.listBatches());
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<BatchResponse> getBatch(@PathVariable("batchId") UUID batchId) {
        return ResponseEntity.ok(batchService.getBatch(batchId));
    }

    @PutMapping("/{batchId}")
    public ResponseEntity<BatchResponse> updateBatch(
            @PathVariable("batchId") UUID batchId,
            @Valid @RequestBody BatchRequest request
    ) {
        return ResponseEntity.ok(batchService.updateBatch(batchId, request));
    }

    @DeleteMapping("/{batchId}")
    public ResponseEntity<Void> deleteBatch(@PathVariable("batchId") UUID batchId) {
        batchService.deleteBatch(batchId);
        return ResponseEntity.noContent().build();
    }
}
