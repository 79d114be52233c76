package com.edtech.auth.notification;

/**
 * 通知发送器接口。
 * <p>
 * 抽象真实发送行为（短信/邮件）。默认实现为日志输出，生产环境使用邮件服务与短信网关。
 * 发送失败以 {@link DeliveryResult} 返回，不抛出异常。
 */
public interface NotificationSender {

    /**
     * 发送短信。
     *
     * @param destination E.164 手机号。
     * @param message     短信正文。
     */
    DeliveryResult sendSms(String destination, String message);

    /**
     * 发送纯文本邮件。
     *
     * @param destination 收件邮箱。
     * @param subject     主题。
     * @param body        正文。
     */
    DeliveryResult sendEmail(String destination, String subject, String body);
}
