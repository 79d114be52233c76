package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

public record OtpLoginRequest(
        @NotBlank(message = "Email or phone is required") String destination,
        @NotBlank(message = "Verification code is required") String code,
        String challengeId
) {
}
