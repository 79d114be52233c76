package com.edtech.auth.verification;

/**
 * 验证码校验结果。
 *
 * @param status       校验状态。
 * @param attemptCount 校验后的错误次数。
 * @param maxAttempts  最大错误次数。
 */
public record OtpCheckResult(OtpStatus status, int attemptCount, int maxAttempts) {

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public static OtpCheckResult expired() {
        return new OtpCheckResult(OtpStatus.EXPIRED, 0, 0);
    }
}
