package com.edtech.auth.verification;

import java.time.Instant;

/**
 * 新签发的验证码。明文只在内存中传给通知发送方，不落存储。
 */
public record IssuedOtp(String plaintextCode, String challengeId, Instant expiresAt) {

    @Override
    public String toString() {
        return "IssuedOtp[challengeId=" + challengeId + ", expiresAt=" + expiresAt + "]";
    }
}
