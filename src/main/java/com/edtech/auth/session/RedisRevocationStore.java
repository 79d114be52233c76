package com.edtech.auth.session;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Redis 的吊销集合。
 * <p>
 * 键空间：
 * - `auth:revoked:{tokenId}`：值固定为 "1"，SET NX PX 原子写入，TTL 为令牌剩余有效期；
 * - `auth:revoked-before:{userId}`：签发时间下限（epoch 秒，含该秒），Lua 脚本保证只增不减。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "mode", havingValue = "REDIS", matchIfMissing = true)
public class RedisRevocationStore implements RevocationStore {

    private static final String WATERMARK_LUA = """
            local current = redis.call('GET', KEYS[1])
            local cutoff = tonumber(ARGV[1])
            if current and tonumber(current) >= cutoff then
              redis.call('PEXPIRE', KEYS[1], ARGV[2])
              return 0
            end
            redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2])
            return 1
            """;

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;
    private final DefaultRedisScript<Long> watermarkScript;

    public RedisRevocationStore(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
        this.watermarkScript = new DefaultRedisScript<>();
        this.watermarkScript.setResultType(Long.class);
        this.watermarkScript.setScriptText(WATERMARK_LUA);
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            // 已过期令牌无需入集合，仍视为首次吊销
            return !isRevoked(tokenId);
        }
        Boolean added = redisTemplate.opsForValue().setIfAbsent(revokedKey(tokenId), "1", ttl);
        return Boolean.TRUE.equals(added);
    }

    @Override
    public boolean isRevoked(String tokenId) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(revokedKey(tokenId)));
    }

    @Override
    public void revokeIssuedUpTo(long userId, Instant cutoff, Instant retainUntil) {
        long ttlMillis = Math.max(1L, Duration.between(clock.instant(), retainUntil).toMillis());
        redisTemplate.execute(watermarkScript, List.of(watermarkKey(userId)),
                String.valueOf(cutoff.getEpochSecond()), String.valueOf(ttlMillis));
    }

    @Override
    public boolean isCoveredByCutoff(long userId, Instant issuedAt) {
        if (issuedAt == null) {
            return false;
        }
        return cutoff(userId)
                .map(cutoff -> issuedAt.getEpochSecond() <= cutoff.getEpochSecond())
                .orElse(false);
    }

    @Override
    public Optional<Instant> cutoff(long userId) {
        String value = redisTemplate.opsForValue().get(watermarkKey(userId));
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(value)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    @Override
    public int purgeExpired() {
        return 0;
    }

    private static String revokedKey(String tokenId) {
        return "auth:revoked:" + tokenId;
    }

    private static String watermarkKey(long userId) {
        return "auth:revoked-before:" + userId;
    }
}
