package com.mifinca.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.event.application.WeighingService;
import com.mifinca.backend.modules.event.presentation.dto.WeighingRequest;
import com.mifinca.backend.modules.event.presentation.dto.WeighingResponse;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/weighings")
public class WeighingController {

    private final WeighingService weighingService;

    public WeighingController(WeighingService weighingService) {
        this.weighingService = weighingService;
    }

    @PostMapping
    public ResponseEntity<WeighingResponse> createWeighing(@Valid @RequestBody WeighingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(weighingService.createWeighing(request));
    }

    @GetMapping
    public ResponseEntity<List<WeighingResponse>> listWeighings(
            @RequestParam(name = "animalId", required = false) UUID animalId
    ) {
        return ResponseEntity.ok(weighingService.listWeighings(animalId));
    }

    @GetMapping("/{weighingId}")
    public ResponseEntity<WeighingResponse> getWeighing(@PathVariable("weighingId") UUID weighingId) {
        return ResponseEntity.ok(weighingService.getWeighing(weighingId));
    }

    @PutMapping("/{weighingId}")
    public ResponseEntity<WeighingResponse> updateWeighing(
            @PathVariable("weighingId") UUID weighingId,
            @Valid @RequestBody WeighingRequest request
    ) {
        return ResponseEntity.ok(weighingService.updateWeighing(weighingId, request));
    }

    @DeleteMapping("/{weighingId}")
    public ResponseEntity<Void> deleteWeighing(@PathVariable("weighingId") UUID weighingId) {
        weighingService.deleteWeighing(weighingId);
        return ResponseEntity.noContent().build();
    }
}
