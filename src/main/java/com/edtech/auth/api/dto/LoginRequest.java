package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 密码登录请求：邮箱与用户名恰好提供一个。
 */
public record LoginRequest(
        String email,
        String username,
        @NotBlank(message = "Password is required") String password
) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + ", username=" + username + "]";
    }
}
