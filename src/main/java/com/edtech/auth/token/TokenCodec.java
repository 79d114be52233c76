package com.edtech.auth.token;

import com.edtech.auth.config.AuthProperties;
import com.edtech.user.domain.User;
import com.edtech.user.domain.UserRole;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * JWT 令牌编解码。
 * <p>
 * 功能：签发 Access/Refresh Token（HS256），校验并解析令牌。
 * 声明：
 * - `token_type`：access 或 refresh；
 * - `uid`：用户 ID；
 * - `role`：用户角色；
 * - `jti`：令牌 ID，每次签发唯一，用作吊销键；
 * - `sid`：会话键，取该会话刷新令牌的 jti。同一会话的全部令牌共用，吊销会话键即结束整个会话。
 * 无副作用：结果只取决于配置的密钥、输入与时钟。过期判定由本类基于注入的时钟完成，
 * 以便把“过期”与“无效”区分为不同状态。
 */
@Service
public class TokenCodec {

    public static final String CLAIM_TOKEN_TYPE = "token_type";
    public static final String CLAIM_USER_ID = "uid";
    public static final String CLAIM_ROLE = "role";
    public static final String CLAIM_SESSION = "sid";

    private final JwtEncoder jwtEncoder;
    private final NimbusJwtDecoder signatureDecoder;
    private final AuthProperties.Jwt properties;
    private final Clock clock;

    public TokenCodec(JwtEncoder jwtEncoder, SecretKey jwtSigningKey, AuthProperties properties, Clock clock) {
        this.jwtEncoder = jwtEncoder;
        this.properties = properties.getJwt();
        this.clock = clock;
        this.signatureDecoder = NimbusJwtDecoder.withSecretKey(jwtSigningKey)
                .macAlgorithm(MacAlgorithm.HS256)
                .build();
        // 只校验签名与签发者，时间窗口在 verify 中按注入时钟判断
        this.signatureDecoder.setJwtValidator(new JwtIssuerValidator(this.properties.getIssuer()));
    }

    /**
     * 为用户签发指定种类的单个令牌，令牌自成一个会话。
     *
     * @param user 用户实体，提供 ID 与角色。
     * @param kind 令牌种类，决定有效期。
     * @return 令牌字符串、令牌 ID 与有效期。
     */
    public IssuedToken issue(User user, TokenKind kind) {
        String tokenId = UUID.randomUUID().toString();
        return issue(user, kind, tokenId, tokenId, null);
    }

    /**
     * 为已有会话签发访问令牌（刷新场景）。
     *
     * @param sessionKey 会话键，即刷新令牌的 jti。
     * @param notBefore  签发时间下限，可为空；用户级吊销之后签发的令牌不早于该时间。
     */
    public IssuedToken issueAccess(User user, String sessionKey, Instant notBefore) {
        return issue(user, TokenKind.ACCESS, UUID.randomUUID().toString(), sessionKey, notBefore);
    }

    /**
     * 签发访问令牌与刷新令牌，两者共用以刷新令牌 jti 为值的会话键。
     */
    public TokenPair issuePair(User user) {
        return issuePair(user, null);
    }

    public TokenPair issuePair(User user, Instant notBefore) {
        String sessionKey = UUID.randomUUID().toString();
        IssuedToken refresh = issue(user, TokenKind.REFRESH, sessionKey, sessionKey, notBefore);
        IssuedToken access = issue(user, TokenKind.ACCESS, UUID.randomUUID().toString(), sessionKey, notBefore);
        return new TokenPair(access, refresh);
    }

    private IssuedToken issue(User user, TokenKind kind, String tokenId, String sessionKey, Instant notBefore) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        if (notBefore != null && issuedAt.isBefore(notBefore)) {
            issuedAt = notBefore.truncatedTo(ChronoUnit.SECONDS);
        }
        Instant expiresAt = issuedAt.plus(kind == TokenKind.ACCESS
                ? properties.getAccessTokenTtl()
                : properties.getRefreshTokenTtl());
        UserRole role = user.getRole() != null ? user.getRole() : UserRole.STUDENT;

        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(String.valueOf(user.getId()))
                .id(tokenId)
                .claim(CLAIM_TOKEN_TYPE, kind.claimValue())
                .claim(CLAIM_USER_ID, user.getId())
                .claim(CLAIM_ROLE, role.name())
                .claim(CLAIM_SESSION, sessionKey)
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
        return new IssuedToken(token, tokenId, sessionKey, kind, issuedAt, expiresAt);
    }

    /**
     * 校验令牌。
     * <p>
     * 签名、结构、签发者或种类不符为 INVALID；签名有效但已到过期时间为 EXPIRED。
     *
     * @param token        JWT 字符串。
     * @param expectedKind 期望的令牌种类。
     * @return 校验结果。
     */
    public TokenVerification verify(String token, TokenKind expectedKind) {
        if (token == null || token.isBlank()) {
            return TokenVerification.invalid();
        }
        Jwt jwt;
        try {
            jwt = signatureDecoder.decode(token);
        } catch (JwtException ex) {
            return TokenVerification.invalid();
        }
        TokenKind kind = TokenKind.fromClaim(jwt.getClaims().get(CLAIM_TOKEN_TYPE));
        if (kind != expectedKind || jwt.getId() == null || jwt.getExpiresAt() == null) {
            return TokenVerification.invalid();
        }
        Long userId = extractUserId(jwt);
        UserRole role = extractRole(jwt);
        if (userId == null || role == null) {
            return TokenVerification.invalid();
        }
        TokenStatus status = clock.instant().isBefore(jwt.getExpiresAt()) ? TokenStatus.VALID : TokenStatus.EXPIRED;
        return new TokenVerification(status, userId, role, jwt.getId(), extractSessionKey(jwt), kind,
                jwt.getIssuedAt(), jwt.getExpiresAt());
    }

    /**
     * 提取会话键；缺失时以令牌自身 ID 代替。
     */
    public static String extractSessionKey(Jwt jwt) {
        String sessionKey = jwt.getClaimAsString(CLAIM_SESSION);
        return sessionKey != null && !sessionKey.isBlank() ? sessionKey : jwt.getId();
    }

    /**
     * 从 JWT 中提取用户 ID。
     *
     * @param jwt 已解析的 JWT。
     * @return 用户 ID；声明缺失或格式错误时为 null。
     */
    public static Long extractUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_USER_ID);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private static UserRole extractRole(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_ROLE);
        if (claim == null) {
            return null;
        }
        try {
            return UserRole.valueOf(claim.toString());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
