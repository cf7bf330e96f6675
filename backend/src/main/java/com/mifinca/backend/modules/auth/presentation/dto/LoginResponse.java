package com.mifinca.backend.modules.auth.presentation.dto;

public record LoginResponse(TokenResponse tokens, UserProfileResponse user) {
}
