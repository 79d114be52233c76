package com.edtech.auth.token;

import java.time.Instant;

/**
 * 单个已签发令牌。
 *
 * @param token     JWT 字符串。
 * @param tokenId   令牌 ID（jti），每次签发唯一，用作吊销键。
 * @param sessionKey 会话键（sid），同一会话的令牌共用。
 * @param kind      令牌种类。
 * @param issuedAt  签发时间（秒精度，与 JWT 中的 iat 一致）。
 * @param expiresAt 过期时间（秒精度，与 JWT 中的 exp 一致）。
 */
public record IssuedToken(
        String token,
        String tokenId,
        String sessionKey,
        TokenKind kind,
        Instant issuedAt,
        Instant expiresAt
) {
}
