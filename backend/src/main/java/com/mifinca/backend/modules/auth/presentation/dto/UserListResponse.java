package com.mifinca.backend.modules.auth.presentation.dto;

import java.util.List;

public record UserListResponse(List<UserProfileResponse> items, long totalCount) {
}
