package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ForgotPasswordRequest(
        @NotBlank(message = "Email or phone is required") String destination
) {
}
