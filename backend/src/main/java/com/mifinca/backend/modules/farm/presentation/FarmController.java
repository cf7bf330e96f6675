package com.mifinca.backend.modules.farm.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.farm.application.FarmService;
import com.mifinca.backend.modules.farm.application.LotService;
import com.mifinca.backend.modules.farm.application.ProductService;
import com.mifinca.backend.modules.farm.presentation.dto.FarmRequest;
import com.mifinca.backend.modules.farm.presentation.dto.FarmResponse;
import com.mifinca.backend.modules.farm.presentation.dto.LotResponse;
import com.mifinca.backend.modules.farm.presentation.dto.ProductResponse;

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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/farms")
public class FarmController {

    private final FarmService farmService;
    private final LotService lotService;
    private final ProductService productService;

    public FarmController(FarmService farmService, LotService lotService, ProductService productService) {
        this.farmService = farmService;
        this.lotService = lotService;
        this.productService = productService;
    }

    @PostMapping
    public ResponseEntity<FarmResponse> createFarm(@Valid @RequestBody FarmRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(farmService.createFarm(request));
    }

    @Operation(summary = "Farms owned by or shared with the caller")
    @GetMapping
    public ResponseEntity<List<FarmResponse>> listFarms() {
        return ResponseEntity.ok(farmService.listFarms());
    }

    @Operation(summary = "Every farm; requires the `farm:read_all` permission")
    @GetMapping("/all")
    public ResponseEntity<List<FarmResponse>> listAllFarms() {
        return ResponseEntity.ok(farmService.listAllFarms());
    }

    @GetMapping("/{farmId}")
    public ResponseEntity<FarmResponse> getFarm(@PathVariable("farmId") UUID farmId) {
        return ResponseEntity.ok(farmService.getFarm(farmId));
    }

    @PutMapping("/{farmId}")
    public ResponseEntity<FarmResponse> updateFarm(
            @PathVariable("farmId") UUID farmId,
            @Valid @RequestBody FarmRequest request
    ) {
        return ResponseEntity.ok(farmService.updateFarm(farmId, request));
    }

    @DeleteMapping("/{farmId}")
    public ResponseEntity<Void> deleteFarm(@PathVariable("farmId") UUID farmId) {
        farmService.deleteFarm(farmId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{farmId}/lots")
    public ResponseEntity<List<LotResponse>> listLots(@PathVariable("farmId") UUID farmId) {
        return ResponseEntity.ok(lotService.listLots(farmId));
    }

    @GetMapping("/{farmId}/products")
    public ResponseEntity<List<ProductResponse>> listProducts(@PathVariable("farmId") UUID farmId) {
        return ResponseEntity.ok(productService.listProducts(farmId));
    }
}
