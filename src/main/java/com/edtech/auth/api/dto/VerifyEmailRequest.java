package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyEmailRequest(
        @NotBlank(message = "Email is required") String email,
        @NotBlank(message = "Verification code is required") String code,
        String challengeId
) {
}
