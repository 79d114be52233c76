package com.edtech.auth.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 开发/测试用通知发送器。
 * <p>
 * 不实际发送，仅记录日志（含验证码正文），便于本地开发与集成测试。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.notification", name = "mode", havingValue = "LOGGING", matchIfMissing = true)
public class LoggingNotificationSender implements NotificationSender {

    @Override
    public DeliveryResult sendSms(String destination, String message) {
        log.info("Send SMS destination={} message={}", destination, message);
        return DeliveryResult.delivered("log-" + UUID.randomUUID());
    }

    @Override
    public DeliveryResult sendEmail(String destination, String subject, String body) {
        log.info("Send email destination={} subject={} body={}", destination, subject, body);
        return DeliveryResult.delivered("log-" + UUID.randomUUID());
    }
}
