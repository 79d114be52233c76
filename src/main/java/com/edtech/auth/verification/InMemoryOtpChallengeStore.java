package com.edtech.auth.verification;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内验证码挑战存储，单实例或测试使用。
 * <p>
 * 校验通过 {@link ConcurrentHashMap#compute} 对单键原子读改写。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "mode", havingValue = "MEMORY")
public class InMemoryOtpChallengeStore implements OtpChallengeStore {

    private final Map<String, Entry> challenges = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();
    private final Map<String, DailyCount> dailyCounts = new ConcurrentHashMap<>();

    @Override
    public void save(OtpChallenge challenge, Duration retention) {
        challenges.put(key(challenge.purpose(), challenge.destination()),
                new Entry(challenge, challenge.expiresAt().plus(retention)));
    }

    @Override
    public OtpCheckResult check(String destination, OtpPurpose purpose, String codeHash, String challengeId, Instant now) {
        OtpCheckResult[] result = new OtpCheckResult[1];
        challenges.computeIfPresent(key(purpose, destination), (k, entry) -> {
            if (!entry.retainUntil().isAfter(now)) {
                result[0] = OtpCheckResult.expired();
                return null;
            }
            OtpChallenge challenge = entry.challenge();
            int attempts = challenge.attemptCount();
            int max = challenge.maxAttempts();
            if (challengeId != null && !challengeId.equals(challenge.challengeId())) {
                result[0] = new OtpCheckResult(OtpStatus.EXPIRED, attempts, max);
                return entry;
            }
            if (challenge.consumed()) {
                result[0] = new OtpCheckResult(OtpStatus.ALREADY_CONSUMED, attempts, max);
                return entry;
            }
            if (!now.isBefore(challenge.expiresAt())) {
                result[0] = new OtpCheckResult(OtpStatus.EXPIRED, attempts, max);
                return entry;
            }
            if (attempts >= max) {
                result[0] = new OtpCheckResult(OtpStatus.EXHAUSTED, attempts, max);
                return entry;
            }
            if (challenge.codeHash().equals(codeHash)) {
                result[0] = new OtpCheckResult(OtpStatus.SUCCESS, attempts, max);
                return new Entry(challenge.markConsumed(), entry.retainUntil());
            }
            result[0] = new OtpCheckResult(OtpStatus.MISMATCH, attempts + 1, max);
            return new Entry(challenge.withAttemptCount(attempts + 1), entry.retainUntil());
        });
        return result[0] != null ? result[0] : OtpCheckResult.expired();
    }

    @Override
    public void invalidate(String destination, OtpPurpose purpose) {
        challenges.remove(key(purpose, destination));
    }

    @Override
    public SendPermit acquireSendSlot(String destination, OtpPurpose purpose, Duration interval, int dailyLimit, Instant now) {
        String key = key(purpose, destination);
        if (!interval.isZero() && !interval.isNegative()) {
            boolean[] granted = new boolean[1];
            lastSent.compute(key, (k, last) -> {
                if (last != null && now.isBefore(last.plus(interval))) {
                    return last;
                }
                granted[0] = true;
                return now;
            });
            if (!granted[0]) {
                return SendPermit.TOO_SOON;
            }
        }
        if (dailyLimit > 0) {
            LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
            DailyCount count = dailyCounts.compute(key, (k, current) ->
                    current == null || !current.day().equals(today)
                            ? new DailyCount(today, 1)
                            : new DailyCount(today, current.count() + 1));
            if (count.count() > dailyLimit) {
                return SendPermit.DAILY_LIMIT_REACHED;
            }
        }
        return SendPermit.GRANTED;
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = challenges.size() + dailyCounts.size() + lastSent.size();
        challenges.values().removeIf(entry -> !entry.retainUntil().isAfter(now));
        lastSent.values().removeIf(last -> last.isBefore(now.minus(Duration.ofDays(1))));
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        dailyCounts.values().removeIf(count -> count.day().isBefore(today));
        return before - challenges.size() - dailyCounts.size() - lastSent.size();
    }

    private static String key(OtpPurpose purpose, String destination) {
        return purpose.name() + ':' + destination;
    }

    private record Entry(OtpChallenge challenge, Instant retainUntil) {
    }

    private record DailyCount(LocalDate day, int count) {
    }
}
