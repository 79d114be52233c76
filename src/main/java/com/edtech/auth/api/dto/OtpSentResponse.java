package com.edtech.auth.api.dto;

import com.edtech.auth.model.IdentifierType;

/**
 * 验证码发送响应。未注册目标得到形状相同的响应。
 *
 * @param channel          投递通道。
 * @param destination      掩码后的目标标识。
 * @param challengeId      挑战 ID，校验时可回传。
 * @param expiresInSeconds 验证码有效秒数。
 */
public record OtpSentResponse(
        IdentifierType channel,
        String destination,
        String challengeId,
        long expiresInSeconds
) {
}
