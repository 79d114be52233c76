package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 重置密码请求。
 */
public record PasswordResetRequest(
        @NotBlank(message = "Email or phone is required") String destination,
        @NotBlank(message = "Verification code is required") String code,
        @NotBlank(message = "New password is required") String newPassword,
        String challengeId
) {

    @Override
    public String toString() {
        return "PasswordResetRequest[destination=" + destination + "]";
    }
}
