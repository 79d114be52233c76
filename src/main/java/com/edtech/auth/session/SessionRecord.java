package com.edtech.auth.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 登录会话记录。
 * <p>
 * 仅用于审计与会话管理，令牌是否有效以吊销集合为准。{@code refreshTokenId} 即会话键；
 * {@code accessTokenId} 为登录时签发的访问令牌。{@code expiresAt} 取刷新令牌过期时间，
 * 供外部或定时任务按过期列清理。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {

    private Long id;
    private Long userId;
    private String accessTokenId;
    private String refreshTokenId;
    private Instant accessExpiresAt;
    private Instant issuedAt;
    private Instant expiresAt;
    private String deviceInfo;
    private String sourceIp;
    private Instant revokedAt;
    private String revokedReason;
}
