package com.mifinca.backend.modules.masterdata.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.masterdata.application.MasterDataService;
import com.mifinca.backend.modules.masterdata.domain.MasterDataCategory;
import com.mifinca.backend.modules.masterdata.presentation.dto.MasterDataRequest;
import com.mifinca.backend.modules.masterdata.presentation.dto.MasterDataResponse;

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
@RequestMapping("/master-data")
public class MasterDataController {

    private final MasterDataService masterDataService;

    public MasterDataController(MasterDataService masterDataService) {
        this.masterDataService = masterDataService;
    }

    @GetMapping
    public ResponseEntity<List<MasterDataResponse>> list(
            @RequestParam(name = "category", required = false) MasterDataCategory category
    ) {
        return ResponseEntity.ok(masterDataService.list(category));
    }

    @GetMapping("/{masterDataId}")
    public ResponseEntity<MasterDataResponse> get(@PathVariable("masterDataId") UUID masterDataId) {
        return ResponseEntity.ok(masterDataService.get(masterDataId));
    }

    @PostMapping
    public ResponseEntity<MasterDataResponse> create(@Valid @RequestBody MasterDataRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(masterDataService.create(request));
    }

    @PutMapping("/{masterDataId}")
    public ResponseEntity<MasterDataResponse> update(
            @PathVariable("masterDataId") UUID masterDataId,
            @Valid @RequestBody MasterDataRequest request
    ) {
        return ResponseEntity.ok(masterDataService.update(masterDataId, request));
    }

    @DeleteMapping("/{masterDataId}")
    public ResponseEntity<Void> delete(@PathVariable("masterDataId") UUID masterDataId) {
        masterDataService.delete(masterDataId);
        return ResponseEntity.noContent().build();
    }
}
