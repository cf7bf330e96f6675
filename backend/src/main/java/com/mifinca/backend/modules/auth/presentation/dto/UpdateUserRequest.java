package com.mifinca.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

/**
 * Partial update; null fields are left untouched.
 */
public record UpdateUserRequest(
        @Size(max = 100) String firstName,
        @Size(max = 100) String lastName,
        @Size(max = 40) String phoneNumber,
        Boolean active,
        Boolean superuser
) {
}
