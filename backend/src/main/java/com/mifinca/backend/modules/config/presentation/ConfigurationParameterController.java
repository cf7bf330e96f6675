package com.mifinca.backend.modules.config.presentation;

import java.util.List;
import java.util.UUID;

import com.mifinca.backend.modules.config.application.ConfigurationParameterService;
import com.mifinca.backend.modules.config.presentation.dto.ConfigurationParameterRequest;
import com.mifinca.backend.modules.config.presentation.dto.ConfigurationParameterResponse;
import com.mifinca.backend.modules.config.presentation.dto.UpdateConfigurationParameterRequest;

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
@RequestMapping("/configuration-parameters")
public class ConfigurationParameterController {

    private final ConfigurationParameterService parameterService;

    public ConfigurationParameterController(ConfigurationParameterService parameterService) {
        this.parameterService = parameterService;
    }

    @GetMapping
    public ResponseEntity<List<ConfigurationParameterResponse>> list() {
        return ResponseEntity.ok(parameterService.list());
    }

    @GetMapping("/{parameterId}")
    public ResponseEntity<ConfigurationParameterResponse> get(@PathVariable("parameterId") UUID parameterId) {
        return ResponseEntity.ok(parameterService.get(parameterId));
    }

    @GetMapping("/by-name/{name}")
    @Operation(summary = "Look a parameter up by name, ignoring case")
    public ResponseEntity<ConfigurationParameterResponse> getByName(@PathVariable("name") String name) {
        return ResponseEntity.ok(parameterService.getByName(name));
    }

    @PostMapping
    @Operation(summary = "Create a parameter; superuser only")
    public ResponseEntity<ConfigurationParameterResponse> create(
            @Valid @RequestBody ConfigurationParameterRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(parameterService.create(request));
    }

    @PutMapping("/{parameterId}")
    @Operation(summary = "Partially update a parameter; superuser only")
    public ResponseEntity<ConfigurationParameterResponse> update(
            @PathVariable("parameterId") UUID parameterId,
            @Valid @RequestBody UpdateConfigurationParameterRequest request
    ) {
        return ResponseEntity.ok(parameterService.update(parameterId, request));
    }

    @DeleteMapping("/{parameterId}")
    public ResponseEntity<Void> delete(@PathVariable("parameterId") UUID parameterId) {
        parameterService.delete(parameterId);
        return ResponseEntity.noContent().build();
    }
}
