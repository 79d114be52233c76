package com.edtech.auth.notification;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.util.Masking;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.io.UnsupportedEncodingException;
import java.time.Duration;
import java.util.Map;

/**
 * 生产通知发送器：邮件走 SMTP（{@link JavaMailSender}），短信走 HTTP 短信网关。
 * <p>
 * 短信网关接口：GET {base}/{apiKey}/SMS/{号码（不含加号）}/{正文}/{发送方}，
 * 返回 {@code {"Status":"Success","Details":"<messageId>"}}。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.notification", name = "mode", havingValue = "PROVIDER")
public class ProviderNotificationSender implements NotificationSender {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE = new ParameterizedTypeReference<>() {
    };

    private final JavaMailSender mailSender;
    private final WebClient smsClient;
    private final AuthProperties.Notification properties;
    private final Duration timeout;

    public ProviderNotificationSender(JavaMailSender mailSender, WebClient.Builder webClientBuilder, AuthProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties.getNotification();
        this.timeout = properties.getTimeouts().getNotification();
        if (!StringUtils.hasText(this.properties.getSmsBaseUrl()) || !StringUtils.hasText(this.properties.getSmsApiKey())) {
            throw new IllegalStateException("auth.notification.sms-base-url and sms-api-key are required in provider mode");
        }
        this.smsClient = webClientBuilder.baseUrl(this.properties.getSmsBaseUrl()).build();
    }

    @Override
    public DeliveryResult sendSms(String destination, String message) {
        String phone = destination.startsWith("+") ? destination.substring(1) : destination;
        try {
            Map<String, Object> response = smsClient.get()
                    .uri("/{apiKey}/SMS/{phone}/{message}/{sender}",
                            properties.getSmsApiKey(), phone, message, properties.getSmsSenderId())
                    .retrieve()
                    .bodyToMono(RESPONSE_TYPE)
                    .block(timeout);
            if (response != null && "Success".equals(response.get("Status"))) {
                Object details = response.get("Details");
                return DeliveryResult.delivered(details != null ? details.toString() : null);
            }
            Object details = response != null ? response.get("Details") : null;
            log.warn("SMS rejected destination={} details={}", Masking.mask(destination), details);
            return DeliveryResult.failed("SMS gateway rejected the message");
        } catch (WebClientException | IllegalStateException ex) {
            // block(timeout) 超时抛出 IllegalStateException
            log.warn("SMS delivery failed destination={} reason={}", Masking.mask(destination), ex.getMessage());
            return DeliveryResult.failed("SMS gateway unavailable");
        }
    }

    @Override
    public DeliveryResult sendEmail(String destination, String subject, String body) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(new InternetAddress(properties.getFromAddress(), properties.getFromName(), "UTF-8"));
            helper.setTo(destination);
            helper.setSubject(subject);
            helper.setText(body, false);
            mailSender.send(message);
            return DeliveryResult.delivered(message.getMessageID());
        } catch (MailException | MessagingException | UnsupportedEncodingException ex) {
            log.warn("Email delivery failed destination={} reason={}", Masking.mask(destination), ex.getMessage());
            return DeliveryResult.failed("Mail server unavailable");
        }
    }
}
