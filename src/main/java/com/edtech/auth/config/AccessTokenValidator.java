package com.edtech.auth.config;

import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.session.SessionRegistry;
import com.edtech.auth.token.TokenCodec;
import com.edtech.auth.token.TokenKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * 资源服务器令牌校验：只接受访问令牌，且令牌 ID 与所属会话均未被吊销、签发时间晚于用户级下限。
 * 吊销集合不可用时拒绝请求。
 */
@Slf4j
@RequiredArgsConstructor
class AccessTokenValidator implements OAuth2TokenValidator<Jwt> {

    private static final OAuth2Error WRONG_KIND = new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN,
            "Access token required", null);
    private static final OAuth2Error REVOKED = new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN,
            "Token has been revoked", null);

    private final SessionRegistry sessionRegistry;

    @Override
    public OAuth2TokenValidatorResult validate(Jwt jwt) {
        if (TokenKind.fromClaim(jwt.getClaims().get(TokenCodec.CLAIM_TOKEN_TYPE)) != TokenKind.ACCESS) {
            return OAuth2TokenValidatorResult.failure(WRONG_KIND);
        }
        Long userId = TokenCodec.extractUserId(jwt);
        if (userId == null || jwt.getId() == null) {
            return OAuth2TokenValidatorResult.failure(WRONG_KIND);
        }
        try {
            if (sessionRegistry.isRevoked(userId, jwt.getId(), TokenCodec.extractSessionKey(jwt), jwt.getIssuedAt())) {
                return OAuth2TokenValidatorResult.failure(REVOKED);
            }
        } catch (BusinessException ex) {
            log.warn("Revocation check unavailable jti={} reason={}", jwt.getId(), ex.getErrorCode());
            return OAuth2TokenValidatorResult.failure(REVOKED);
        }
        return OAuth2TokenValidatorResult.success();
    }
}
