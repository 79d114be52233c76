package com.edtech.auth.api.dto;

import java.time.Instant;

public record SessionResponse(
        Long id,
        String deviceInfo,
        String sourceIp,
        Instant issuedAt,
        Instant expiresAt,
        boolean current
) {
}
