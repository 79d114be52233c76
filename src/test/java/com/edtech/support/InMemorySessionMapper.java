package com.edtech.support;

import com.edtech.auth.session.SessionMapper;
import com.edtech.auth.session.SessionRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps session rows in memory with the same filters as the XML mapper.
 */
public class InMemorySessionMapper implements SessionMapper {

    private final Map<Long, SessionRecord> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public void insert(SessionRecord session) {
        session.setId(ids.incrementAndGet());
        rows.put(session.getId(), copy(session));
    }

    @Override
    public SessionRecord findBySessionKey(String sessionKey) {
        return rows.values().stream()
                .filter(row -> sessionKey.equals(row.getRefreshTokenId()))
                .findFirst()
                .map(InMemorySessionMapper::copy)
                .orElse(null);
    }

    @Override
    public SessionRecord findById(Long id) {
        SessionRecord row = rows.get(id);
        return row != null ? copy(row) : null;
    }

    @Override
    public List<SessionRecord> findActiveByUserId(Long userId, Instant now) {
        return rows.values().stream()
                .filter(row -> userId.equals(row.getUserId()))
                .filter(row -> row.getRevokedAt() == null && row.getExpiresAt().isAfter(now))
                .sorted(Comparator.comparing(SessionRecord::getIssuedAt).reversed())
                .map(InMemorySessionMapper::copy)
                .toList();
    }

    @Override
    public int revokeById(Long id, Instant revokedAt, String reason) {
        SessionRecord row = rows.get(id);
        if (row == null || row.getRevokedAt() != null) {
            return 0;
        }
        row.setRevokedAt(revokedAt);
        row.setRevokedReason(reason);
        return 1;
    }

    @Override
    public int revokeAllByUserId(Long userId, Instant revokedAt, String reason) {
        int updated = 0;
        for (SessionRecord row : rows.values()) {
            if (userId.equals(row.getUserId()) && row.getRevokedAt() == null) {
                row.setRevokedAt(revokedAt);
                row.setRevokedReason(reason);
                updated++;
            }
        }
        return updated;
    }

    @Override
    public int deleteExpired(Instant before) {
        int size = rows.size();
        rows.values().removeIf(row -> !row.getExpiresAt().isAfter(before));
        return size - rows.size();
    }

    private static SessionRecord copy(SessionRecord source) {
        return SessionRecord.builder()
                .id(source.getId())
                .userId(source.getUserId())
                .accessTokenId(source.getAccessTokenId())
                .accessExpiresAt(source.getAccessExpiresAt())
                .refreshTokenId(source.getRefreshTokenId())
                .issuedAt(source.getIssuedAt())
                .expiresAt(source.getExpiresAt())
                .deviceInfo(source.getDeviceInfo())
                .sourceIp(source.getSourceIp())
                .revokedAt(source.getRevokedAt())
                .revokedReason(source.getRevokedReason())
                .build();
    }
}
