package com.mifinca.backend.modules.farm.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.application.FarmAccessService;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessGrantRequest;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessResponse;
import com.mifinca.backend.modules.farm.presentation.dto.FarmAccessUpdateRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/farm-access")
public class FarmAccessController {

    private final FarmAccessService farmAccessService;

    public FarmAccessController(FarmAccessService farmAccessService) {
        this.farmAccessService = farmAccessService;
    }

    @Operation(summary = "Share a farm with another user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Grant created"),
            @ApiResponse(responseCode = "403", description = "Caller does not own the farm"),
            @ApiResponse(responseCode = "409", description = "`FARM_ACCESS_ALREADY_GRANTED`")
    })
    @PostMapping
    public ResponseEntity<FarmAccessResponse> grantAccess(@Valid @RequestBody FarmAccessGrantRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(farmAccessService.grantAccess(request));
    }

    @GetMapping
    public ResponseEntity<List<FarmAccessResponse>> listGrants() {
        return ResponseEntity.ok(farmAccessService.listGrants());
    }

    @GetMapping("/{userId}/{farmId}")
    public ResponseEntity<FarmAccessResponse> getGrant(
            @PathVariable("userId") UUID userId,
            @PathVariable("farmId") UUID farmId
    ) {
        return ResponseEntity.ok(farmAccessService.getGrant(userId, farmId));
    }

    @PatchMapping("/{userId}/{farmId}")
    public ResponseEntity<FarmAccessResponse> updateGrant(
            @PathVariable("userId") UUID userId,
            @PathVariable("farmId") UUID farmId,
            @Valid @RequestBody FarmAccessUpdateRequest request
    ) {
        return ResponseEntity.ok(farmAccessService.updateGrant(userId, farmId, request));
    }

    @DeleteMapping("/{userId}/{farmId}")
    public ResponseEntity<Void> revokeAccess(
            @PathVariable("userId") UUID userId,
            @PathVariable("farmId") UUID farmId
    ) {
        farmAccessService.revokeAccess(userId, farmId);
        return ResponseEntity.noContent().build();
    }
}
