package com.edtech.auth.verification;

/**
 * 验证码用途，与目标标识共同构成验证码的键。
 */
public enum OtpPurpose {
    LOGIN,
    PASSWORD_RESET,
    EMAIL_VERIFICATION
}
