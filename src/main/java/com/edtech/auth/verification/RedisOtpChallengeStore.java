package com.edtech.auth.verification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 基于 Redis 的验证码挑战存储。
 * <p>
 * 挑战使用 Hash 结构：`id`、`hash`、`exp`（epoch 毫秒）、`attempts`、`max`、`consumed`。
 * 格式：auth:otp:用途:目标标识。保存与校验均为 Lua 脚本，单键原子执行。
 * 节流键：auth:otp:last:用途:目标标识（发送间隔），auth:otp:count:用途:目标标识:日期（每日计数）。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "mode", havingValue = "REDIS", matchIfMissing = true)
public class RedisOtpChallengeStore implements OtpChallengeStore {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private static final String SAVE_LUA = """
            redis.call('DEL', KEYS[1])
            redis.call('HSET', KEYS[1], 'id', ARGV[1], 'hash', ARGV[2], 'exp', ARGV[3],
                       'attempts', '0', 'max', ARGV[4], 'consumed', '0')
            redis.call('PEXPIRE', KEYS[1], ARGV[5])
            return 1
            """;

    /**
     * 返回 "状态码:错误次数:最大次数"。状态码：0 成功，1 过期，2 不匹配，3 已锁定，4 已使用。
     */
    private static final String CHECK_LUA = """
            local data = redis.call('HMGET', KEYS[1], 'id', 'hash', 'exp', 'attempts', 'max', 'consumed')
            if not data[1] then
              return '1:0:0'
            end
            local attempts = tonumber(data[4])
            local max = tonumber(data[5])
            if ARGV[2] ~= '' and ARGV[2] ~= data[1] then
              return '1:' .. attempts .. ':' .. max
            end
            if data[6] == '1' then
              return '4:' .. attempts .. ':' .. max
            end
            if tonumber(ARGV[3]) >= tonumber(data[3]) then
              return '1:' .. attempts .. ':' .. max
            end
            if attempts >= max then
              return '3:' .. attempts .. ':' .. max
            end
            if data[2] == ARGV[1] then
              redis.call('HSET', KEYS[1], 'consumed', '1')
              return '0:' .. attempts .. ':' .. max
            end
            attempts = attempts + 1
            redis.call('HSET', KEYS[1], 'attempts', tostring(attempts))
            return '2:' .. attempts .. ':' .. max
            """;

    private static final OtpStatus[] STATUS_CODES = {
            OtpStatus.SUCCESS, OtpStatus.EXPIRED, OtpStatus.MISMATCH, OtpStatus.EXHAUSTED, OtpStatus.ALREADY_CONSUMED
    };

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> saveScript;
    private final DefaultRedisScript<String> checkScript;

    public RedisOtpChallengeStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.saveScript = new DefaultRedisScript<>(SAVE_LUA, Long.class);
        this.checkScript = new DefaultRedisScript<>(CHECK_LUA, String.class);
    }

    @Override
    public void save(OtpChallenge challenge, Duration retention) {
        long keyTtlMillis = Math.max(1L,
                Duration.between(challenge.createdAt(), challenge.expiresAt()).plus(retention).toMillis());
        redisTemplate.execute(saveScript, List.of(key(challenge.purpose(), challenge.destination())),
                challenge.challengeId(),
                challenge.codeHash(),
                String.valueOf(challenge.expiresAt().toEpochMilli()),
                String.valueOf(challenge.maxAttempts()),
                String.valueOf(keyTtlMillis));
    }

    @Override
    public OtpCheckResult check(String destination, OtpPurpose purpose, String codeHash, String challengeId, Instant now) {
        String reply = redisTemplate.execute(checkScript, List.of(key(purpose, destination)),
                codeHash,
                challengeId == null ? "" : challengeId,
                String.valueOf(now.toEpochMilli()));
        return parseCheckReply(reply);
    }

    static OtpCheckResult parseCheckReply(String reply) {
        if (reply == null) {
            return OtpCheckResult.expired();
        }
        String[] parts = reply.split(":");
        if (parts.length < 3) {
            return OtpCheckResult.expired();
        }
        try {
            int code = Integer.parseInt(parts[0]);
            OtpStatus status = code >= 0 && code < STATUS_CODES.length ? STATUS_CODES[code] : OtpStatus.EXPIRED;
            return new OtpCheckResult(status, Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException ex) {
            return OtpCheckResult.expired();
        }
    }

    @Override
    public void invalidate(String destination, OtpPurpose purpose) {
        redisTemplate.delete(key(purpose, destination));
    }

    @Override
    public SendPermit acquireSendSlot(String destination, OtpPurpose purpose, Duration interval, int dailyLimit, Instant now) {
        if (!interval.isZero() && !interval.isNegative()) {
            String lastKey = "auth:otp:last:%s:%s".formatted(purpose.name(), destination);
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(lastKey, "1", interval);
            if (!Boolean.TRUE.equals(acquired)) {
                return SendPermit.TOO_SOON;
            }
        }
        if (dailyLimit > 0) {
            String countKey = "auth:otp:count:%s:%s:%s".formatted(purpose.name(), destination, DAY_FORMAT.format(now));
            Long count = redisTemplate.opsForValue().increment(countKey);
            if (count != null && count == 1L) {
                redisTemplate.expire(countKey, Duration.ofDays(1));
            }
            if (count != null && count > dailyLimit) {
                return SendPermit.DAILY_LIMIT_REACHED;
            }
        }
        return SendPermit.GRANTED;
    }

    @Override
    public int purgeExpired(Instant now) {
        return 0;
    }

    private static String key(OtpPurpose purpose, String destination) {
        return "auth:otp:%s:%s".formatted(purpose.name(), destination);
    }
}
