package com.mifinca.backend.modules.auth.presentation;

import com.mifinca.backend.modules.auth.application.AuthService;
import com.mifinca.backend.modules.auth.presentation.dto.LoginRequest;
import com.mifinca.backend.modules.auth.presentation.dto.LoginResponse;
import com.mifinca.backend.modules.auth.presentation.dto.RegisterRequest;
import com.mifinca.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Self-registration")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "409", description = "`EMAIL_ALREADY_REGISTERED`")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(summary = "Exchange credentials for a bearer token")
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
