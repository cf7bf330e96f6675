package com.mifinca.backend.modules.farm.presentation;

import java.util.UUID;

import com.mifinca.backend.modules.farm.application.LotService;
import com.mifinca.backend.modules.farm.presentation.dto.LotRequest;
import com.mifinca.backend.modules.farm.presentation.dto.LotResponse;

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
@RequestMapping("/lots")
public class LotController {

    private final LotService lotService;

    public LotController(LotService lotService) {
        this.lotService = lotService;
    }

    @PostMapping
    public ResponseEntity<LotResponse> createLot(@Valid @RequestBody LotRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lotService.createLot(request));
    }

    @GetMapping("/{lotId}")
    public ResponseEntity<LotResponse> getLot(@PathVariable("lotId") UUID lotId) {
        return ResponseEntity.ok(lotService.getLot(lotId));
    }

    @PutMapping("/{lotId}")
    public ResponseEntity<LotResponse> updateLot(
            @PathVariable("lotId") UUID lotId,
            @Valid @RequestBody LotRequest request
    ) {
        return ResponseEntity.ok(lotService.updateLot(lotId, request));
    }

    @DeleteMapping("/{lotId}")
    public ResponseEntity<Void> deleteLot(@PathVariable("lotId") UUID lotId) {
        lotService.deleteLot(lotId);
        return ResponseEntity.noContent().build();
    }
}
