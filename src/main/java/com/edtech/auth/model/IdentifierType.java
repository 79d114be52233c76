package com.edtech.auth.model;

/**
 * 标识类型，同时也是验证码投递通道：邮箱走邮件，手机号走短信。
 */
public enum IdentifierType {
    PHONE,
    EMAIL;

    public static IdentifierType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("identifier type required");
        }
        return switch (value.toLowerCase()) {
            case "phone", "mobile", "sms" -> PHONE;
            case "email" -> EMAIL;
            default -> throw new IllegalArgumentException("Unsupported identifier type: " + value);
        };
    }

    /**
     * 按内容推断标识类型：包含 {@code @} 视为邮箱，否则视为手机号。
     */
    public static IdentifierType detect(String identifier) {
        return identifier != null && identifier.contains("@") ? EMAIL : PHONE;
    }
}
