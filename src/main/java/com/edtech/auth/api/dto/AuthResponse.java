package com.edtech.auth.api.dto;

/**
 * 认证响应。
 * <p>
 * 登录成功后返回：用户信息、令牌信息与会话 ID（会话登记失败时为空）。
 */
public record AuthResponse(
        AuthUserResponse user,
        TokenResponse token,
        Long sessionId
) {
}
