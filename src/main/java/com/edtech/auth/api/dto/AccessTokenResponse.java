package com.edtech.auth.api.dto;

import java.time.Instant;

/**
 * 刷新结果：只返回新的访问令牌，刷新令牌在过期前可继续使用。
 */
public record AccessTokenResponse(
        String accessToken,
        Instant accessTokenExpiresAt,
        String tokenType
) {
}
