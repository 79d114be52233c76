package com.edtech.auth.api.dto;

import com.edtech.user.domain.UserRole;

import java.time.Instant;

/**
 * 对外公开的用户信息，不含密码哈希。
 */
public record AuthUserResponse(
        Long id,
        String email,
        String username,
        String phone,
        String firstName,
        String lastName,
        UserRole role,
        boolean active,
        boolean emailVerified,
        Instant lastLoginAt,
        Instant createdAt
) {
}
