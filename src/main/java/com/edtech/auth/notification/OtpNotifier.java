package com.edtech.auth.notification;

import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.IdentifierType;
import com.edtech.auth.support.BoundedCallRunner;
import com.edtech.auth.util.Masking;
import com.edtech.auth.verification.OtpPurpose;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 通过匹配的通道投递验证码与安全通知。
 * <p>
 * 验证码投递失败或超时即视为请求失败（{@link ErrorCode#NOTIFICATION_FAILED}）；
 * 安全通知尽力而为，失败只记录告警。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OtpNotifier {

    private final NotificationSender notificationSender;
    private final OtpMessageFormatter formatter;
    private final BoundedCallRunner callRunner;

    public DeliveryResult deliverOtp(IdentifierType channel, String destination, OtpPurpose purpose, String code) {
        DeliveryResult result;
        try {
            result = callRunner.notification("notify.otp", () -> send(channel, destination, purpose, code));
        } catch (BusinessException ex) {
            log.warn("OTP delivery aborted channel={} destination={} reason={}",
                    channel, Masking.mask(destination), ex.getErrorCode());
            throw new BusinessException(ErrorCode.NOTIFICATION_FAILED, ErrorCode.NOTIFICATION_FAILED.getDefaultMessage(), ex);
        }
        if (result == null || !result.delivered()) {
            log.warn("OTP not delivered channel={} destination={} reason={}",
                    channel, Masking.mask(destination), result != null ? result.failureReason() : "no result");
            throw new BusinessException(ErrorCode.NOTIFICATION_FAILED);
        }
        log.info("OTP delivered channel={} purpose={} destination={} messageId={}",
                channel, purpose, Masking.mask(destination), result.messageId());
        return result;
    }

    /**
     * 发送密码变更的安全通知，尽力而为。
     */
    public void sendPasswordChangedNotice(IdentifierType channel, String destination) {
        if (destination == null) {
            return;
        }
        try {
            DeliveryResult result = callRunner.notification("notify.security", () -> channel == IdentifierType.EMAIL
                    ? notificationSender.sendEmail(destination, formatter.passwordChangedSubject(), formatter.passwordChangedText())
                    : notificationSender.sendSms(destination, formatter.passwordChangedText()));
            if (result == null || !result.delivered()) {
                log.warn("Security notice not delivered destination={}", Masking.mask(destination));
            }
        } catch (BusinessException ex) {
            log.warn("Security notice aborted destination={} reason={}", Masking.mask(destination), ex.getErrorCode());
        }
    }

    private DeliveryResult send(IdentifierType channel, String destination, OtpPurpose purpose, String code) {
        return switch (channel) {
            case EMAIL -> notificationSender.sendEmail(destination, formatter.emailSubject(purpose), formatter.emailBody(purpose, code));
            case PHONE -> notificationSender.sendSms(destination, formatter.smsText(purpose, code));
        };
    }
}
