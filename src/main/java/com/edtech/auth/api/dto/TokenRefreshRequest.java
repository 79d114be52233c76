package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record TokenRefreshRequest(
        @NotBlank(message = "Refresh token is required") String refreshToken
) {

    @Override
    public String toString() {
        return "TokenRefreshRequest[refreshToken=***]";
    }
}
