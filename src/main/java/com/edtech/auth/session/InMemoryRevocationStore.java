package com.edtech.auth.session;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内吊销集合，仅适用于单实例或测试。
 */
@Component
@ConditionalOnProperty(prefix = "auth.store", name = "mode", havingValue = "MEMORY")
public class InMemoryRevocationStore implements RevocationStore {

    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();
    private final Map<Long, Watermark> watermarks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRevocationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean revoke(String tokenId, Instant expiresAt) {
        Instant now = clock.instant();
        boolean[] added = new boolean[1];
        revoked.compute(tokenId, (id, existing) -> {
            if (existing != null && existing.isAfter(now)) {
                return existing;
            }
            added[0] = true;
            return expiresAt;
        });
        return added[0];
    }

    @Override
    public boolean isRevoked(String tokenId) {
        Instant until = revoked.get(tokenId);
        return until != null && until.isAfter(clock.instant());
    }

    @Override
    public void revokeIssuedUpTo(long userId, Instant cutoff, Instant retainUntil) {
        long cutoffSecond = cutoff.getEpochSecond();
        watermarks.merge(userId, new Watermark(cutoffSecond, retainUntil),
                (current, next) -> current.cutoffSecond() >= next.cutoffSecond()
                        ? new Watermark(current.cutoffSecond(), next.retainUntil())
                        : next);
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
        Watermark watermark = watermarks.get(userId);
        if (watermark == null || !watermark.retainUntil().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochSecond(watermark.cutoffSecond()));
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = revoked.size() + watermarks.size();
        revoked.values().removeIf(until -> !until.isAfter(now));
        watermarks.values().removeIf(w -> !w.retainUntil().isAfter(now));
        return before - revoked.size() - watermarks.size();
    }

    private record Watermark(long cutoffSecond, Instant retainUntil) {
    }
}
