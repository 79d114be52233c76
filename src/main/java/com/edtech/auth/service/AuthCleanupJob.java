package com.edtech.auth.service;

import com.edtech.auth.audit.LoginLogService;
import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.session.SessionRegistry;
import com.edtech.auth.verification.OtpService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * 定时清理：过期会话行、内存中的过期吊销条目与验证码、超出保留期的登录审计。
 * Redis 条目依赖 TTL 自行过期。周期取已绑定的 {@code auth.cleanup.interval}，支持 {@code 1h} 等简写。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AuthCleanupJob implements SchedulingConfigurer {

    private final SessionRegistry sessionRegistry;
    private final OtpService otpService;
    private final LoginLogService loginLogService;
    private final AuthProperties properties;
    private final Clock clock;

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = properties.getCleanup().getInterval();
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalStateException("auth.cleanup.interval must be positive");
        }
        registrar.addFixedDelayTask(new FixedDelayTask(this::purgeExpired, interval, interval));
        log.info("Auth cleanup scheduled interval={}", interval);
    }

    public void purgeExpired() {
        try {
            int sessions = sessionRegistry.purgeExpired();
            int challenges = otpService.purgeExpired();
            int loginLogs = loginLogService.purgeBefore(
                    clock.instant().minus(properties.getCleanup().getLoginLogRetention()));
            log.info("Auth cleanup finished sessions={} challenges={} loginLogs={}", sessions, challenges, loginLogs);
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Auth cleanup failed reason={}", ex.getMessage());
        }
    }
}
