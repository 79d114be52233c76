package com.edtech.auth.verification;

public enum OtpStatus {
    SUCCESS,
    /** 已过有效期、不存在或已被新验证码取代。 */
    EXPIRED,
    MISMATCH,
    /** 错误次数达到上限，验证码被锁定。 */
    EXHAUSTED,
    ALREADY_CONSUMED;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
