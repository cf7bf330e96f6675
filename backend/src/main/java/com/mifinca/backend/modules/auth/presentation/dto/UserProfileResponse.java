package com.mifinca.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.mifinca.backend.modules.auth.domain.AppUser;

public record UserProfileResponse(
        UUID userId,
        String email,
        String firstName,
        String lastName,
        String phoneNumber,
        boolean active,
        boolean superuser,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getPhoneNumber(),
                user.isActive(),
                user.isSuperuser(),
                user.getCreatedAt()
        );
    }
}
