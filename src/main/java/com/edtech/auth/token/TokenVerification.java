package com.edtech.auth.token;

import com.edtech.user.domain.UserRole;

import java.time.Instant;

/**
 * 令牌校验结果。
 * <p>
 * VALID 与 EXPIRED 时携带令牌声明（签名已验证）；INVALID 时声明字段为空。
 */
public record TokenVerification(
        TokenStatus status,
        long userId,
        UserRole role,
        String tokenId,
        String sessionKey,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt
) {

    public static TokenVerification invalid() {
        return new TokenVerification(TokenStatus.INVALID, 0L, null, null, null, null, null, null);
    }

    public boolean isValid() {
        return status == TokenStatus.VALID;
    }

    public boolean isAuthentic() {
        return status != TokenStatus.INVALID;
    }
}
