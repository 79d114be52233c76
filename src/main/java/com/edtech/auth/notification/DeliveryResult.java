package com.edtech.auth.notification;

/**
 * 通知投递结果。
 *
 * @param delivered     是否已被提供方接受。
 * @param messageId     提供方返回的消息 ID，可能为空。
 * @param failureReason 失败原因，成功时为空。
 */
public record DeliveryResult(boolean delivered, String messageId, String failureReason) {

    public static DeliveryResult delivered(String messageId) {
        return new DeliveryResult(true, messageId, null);
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(false, null, reason);
    }
}
