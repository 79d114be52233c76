package com.edtech.auth.session;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.model.ClientInfo;
import com.edtech.auth.support.BoundedCallRunner;
import com.edtech.auth.token.TokenPair;
import com.edtech.auth.token.TokenVerification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 会话登记与令牌吊销。
 * <p>
 * 吊销集合是令牌有效性的唯一依据，会话表仅作审计与会话管理。会话以刷新令牌的 jti 为会话键，
 * 同一会话签发的全部令牌在 {@code sid} 声明中携带该键。
 * 会话表写入失败只记录告警，不影响登录结果；吊销集合写入失败则向上抛出。
 */
@Slf4j
@Component
public class SessionRegistry {

    private final RevocationStore revocationStore;
    private final SessionMapper sessionMapper;
    private final BoundedCallRunner callRunner;
    private final AuthProperties.Jwt jwtProperties;
    private final Clock clock;

    public SessionRegistry(RevocationStore revocationStore,
                           SessionMapper sessionMapper,
                           BoundedCallRunner callRunner,
                           AuthProperties properties,
                           Clock clock) {
        this.revocationStore = revocationStore;
        this.sessionMapper = sessionMapper;
        this.callRunner = callRunner;
        this.jwtProperties = properties.getJwt();
        this.clock = clock;
    }

    /**
     * 登记新会话，尽力而为。
     *
     * @return 会话 ID；写入失败时为空。
     */
    public Optional<Long> createSession(long userId, TokenPair tokens, ClientInfo client) {
        ClientInfo info = client != null ? client : ClientInfo.unknown();
        SessionRecord record = SessionRecord.builder()
                .userId(userId)
                .accessTokenId(tokens.access().tokenId())
                .accessExpiresAt(tokens.access().expiresAt())
                .refreshTokenId(tokens.refresh().tokenId())
                .issuedAt(tokens.access().issuedAt())
                .expiresAt(tokens.refresh().expiresAt())
                .deviceInfo(info.userAgent())
                .sourceIp(info.ip())
                .build();
        try {
            callRunner.storeRun("session.create", () -> sessionMapper.insert(record));
            return Optional.ofNullable(record.getId());
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Session record not persisted userId={} reason={}", userId, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 原子吊销单个令牌，条目 TTL 为令牌自身的过期时间。
     *
     * @return 仅首次吊销返回 true。
     */
    public boolean revoke(String tokenId, Instant expiresAt) {
        return callRunner.store("revocation.add", () -> revocationStore.revoke(tokenId, expiresAt));
    }

    public boolean isRevoked(String tokenId) {
        return callRunner.store("revocation.check", () -> revocationStore.isRevoked(tokenId));
    }

    /**
     * 判断已通过签名校验的令牌是否已被吊销。
     */
    public boolean isRevoked(TokenVerification token) {
        return isRevoked(token.userId(), token.tokenId(), token.sessionKey(), token.issuedAt());
    }

    /**
     * 令牌自身被吊销、所属会话已结束或签发时间落在用户级下限内，任一成立即视为吊销。
     *
     * @param sessionKey 会话键，可为空。
     */
    public boolean isRevoked(long userId, String tokenId, String sessionKey, Instant issuedAt) {
        return callRunner.store("revocation.check",
                () -> revocationStore.isRevoked(tokenId)
                        || (sessionKey != null && !sessionKey.equals(tokenId) && revocationStore.isRevoked(sessionKey))
                        || revocationStore.isCoveredByCutoff(userId, issuedAt));
    }

    /**
     * 用户新令牌的最早签发时间：存在用户级下限时为下限的下一秒，否则为空。
     * 读取失败时返回空，此时新令牌可能被下限误伤，但不会漏判。
     */
    public Instant issuanceFloor(long userId) {
        try {
            return callRunner.store("revocation.cutoff", () -> revocationStore.cutoff(userId))
                    .map(cutoff -> cutoff.plusSeconds(1))
                    .orElse(null);
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Issuance floor unavailable userId={} reason={}", userId, ex.getMessage());
            return null;
        }
    }

    /**
     * 结束令牌所属会话：原子吊销所出示的令牌与会话键，会话键吊销后同一会话签发过的全部令牌失效。
     *
     * @return 所出示令牌是否为本次首次吊销；已吊销时返回 false 且无其他效果。
     */
    public boolean endSession(TokenVerification token, RevocationReason reason) {
        boolean first = revoke(token.tokenId(), token.expiresAt());
        if (!first) {
            return false;
        }
        String sessionKey = token.sessionKey() != null ? token.sessionKey() : token.tokenId();
        SessionRecord session = findSession(sessionKey);
        if (!sessionKey.equals(token.tokenId())) {
            Instant sessionExpiresAt = session != null && session.getExpiresAt() != null
                    ? session.getExpiresAt()
                    : clock.instant().plus(jwtProperties.getRefreshTokenTtl());
            revoke(sessionKey, sessionExpiresAt);
        }
        if (session != null) {
            markRevoked(session.getId(), reason);
        }
        return true;
    }

    /**
     * 吊销用户全部已签发令牌。
     * <p>
     * 会话表中记录的会话键逐一入吊销集合；另设置签发时间下限（当前秒，含），覆盖未登记在会话表中的令牌
     * （例如会话写入失败）。此后签发的令牌从下一秒起算，见 {@link #issuanceFloor(long)}。
     */
    public void revokeAllForUser(long userId, RevocationReason reason) {
        Instant now = clock.instant();
        Instant cutoff = now.truncatedTo(ChronoUnit.SECONDS);
        Instant retainUntil = now.plus(jwtProperties.getRefreshTokenTtl());
        callRunner.storeRun("revocation.watermark",
                () -> revocationStore.revokeIssuedUpTo(userId, cutoff, retainUntil));

        List<SessionRecord> sessions = listActiveSessions(userId);
        for (SessionRecord session : sessions) {
            revokeSessionKey(session);
        }
        try {
            int updated = callRunner.store("session.revoke-all",
                    () -> sessionMapper.revokeAllByUserId(userId, now, reason.name()));
            log.info("Revoked all sessions userId={} sessions={} reason={}", userId, updated, reason);
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Session rows not marked revoked userId={} reason={}", userId, ex.getMessage());
        }
    }

    /**
     * 列出用户未吊销且未过期的会话。
     */
    public List<SessionRecord> listActiveSessions(long userId) {
        try {
            List<SessionRecord> sessions = callRunner.store("session.list",
                    () -> sessionMapper.findActiveByUserId(userId, clock.instant()));
            return sessions != null ? sessions : List.of();
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Session list unavailable userId={} reason={}", userId, ex.getMessage());
            return List.of();
        }
    }

    /**
     * 按会话 ID 吊销当前用户的某个会话。
     *
     * @return 会话存在、属于该用户且本次完成吊销时返回 true。
     */
    public boolean revokeSession(long userId, long sessionId) {
        SessionRecord session = callRunner.store("session.find", () -> sessionMapper.findById(sessionId));
        if (session == null || session.getUserId() == null || session.getUserId() != userId
                || session.getRevokedAt() != null) {
            return false;
        }
        revokeSessionKey(session);
        markRevoked(session.getId(), RevocationReason.SESSION_REVOKED);
        return true;
    }

    /**
     * 清理过期吊销条目与过期会话行。
     */
    public int purgeExpired() {
        int purged = callRunner.store("revocation.purge", revocationStore::purgeExpired);
        Instant before = clock.instant();
        purged += callRunner.store("session.purge", () -> sessionMapper.deleteExpired(before));
        return purged;
    }

    private void revokeSessionKey(SessionRecord session) {
        if (session.getRefreshTokenId() != null && session.getExpiresAt() != null) {
            revoke(session.getRefreshTokenId(), session.getExpiresAt());
        }
    }

    private SessionRecord findSession(String sessionKey) {
        try {
            return callRunner.store("session.find", () -> sessionMapper.findBySessionKey(sessionKey));
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Session lookup failed reason={}", ex.getMessage());
            return null;
        }
    }

    private void markRevoked(Long sessionId, RevocationReason reason) {
        if (sessionId == null) {
            return;
        }
        try {
            callRunner.storeRun("session.revoke",
                    () -> sessionMapper.revokeById(sessionId, clock.instant(), reason.name()));
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Session row not marked revoked sessionId={} reason={}", sessionId, ex.getMessage());
        }
    }
}
