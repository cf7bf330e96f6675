package com.mifinca.backend.modules.animal.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.animal.application.AnimalService;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalLocationResponse;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalRequest;
import com.mifinca.backend.modules.animal.presentation.dto.AnimalResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
@RequestMapping("/animals")
public class AnimalController {

    private final AnimalService animalService;

    public AnimalController(AnimalService animalService) {
        this.animalService = animalService;
    }

    @Operation(summary = "Register an animal owned by the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Animal created"),
            @ApiResponse(responseCode = "403", description = "No access to the lot, or parent not owned by the caller"),
            @ApiResponse(responseCode = "404", description = "Lot, parent or master data not found")
    })
    @PostMapping
    public ResponseEntity<AnimalResponse> createAnimal(@Valid @RequestBody AnimalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(animalService.createAnimal(request));
    }

    @GetMapping
    public ResponseEntity<List<AnimalResponse>> listAnimals(
            @RequestParam(name = "farmId", required = false) UUID farmId,
            @RequestParam(name = "lotId", required = false) UUID lotId
    ) {
        return ResponseEntity.ok(animalService.listAnimals(farmId, lotId));
    }

    @GetMapping("/{animalId}")
    public ResponseEntity<AnimalResponse> getAnimal(@PathVariable("animalId") UUID animalId) {
        return ResponseEntity.ok(animalService.getAnimal(animalId));
    }

    @PutMapping("/{animalId}")
    public ResponseEntity<AnimalResponse> updateAnimal(
            @PathVariable("animalId") UUID animalId,
            @Valid @RequestBody AnimalRequest request
    ) {
        return ResponseEntity.ok(animalService.updateAnimal(animalId, request));
    }

    @DeleteMapping("/{animalId}")
    public ResponseEntity<Void> deleteAnimal(@PathVariable("animalId") UUID animalId) {
        animalService.deleteAnimal(animalId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{animalId}/locations")
    public ResponseEntity<List<AnimalLocationResponse>> listLocationHistory(@PathVariable("animalId") UUID animalId) {
        return ResponseEntity.ok(animalService.listLocationHistory(animalId));
    }
}
