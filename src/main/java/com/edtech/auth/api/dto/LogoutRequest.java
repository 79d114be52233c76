package com.edtech.auth.api.dto;

/**
 * 登出请求：refreshToken 与 accessToken 恰好提供一个。
 */
public record LogoutRequest(
        String refreshToken,
        String accessToken
) {

    @Override
    public String toString() {
        return "LogoutRequest[refreshToken=" + (refreshToken != null ? "***" : null)
                + ", accessToken=" + (accessToken != null ? "***" : null) + "]";
    }
}
