package com.edtech.auth.audit;

public enum LoginChannel {
    PASSWORD,
    OTP,
    REGISTER,
    REFRESH,
    PASSWORD_RESET
}
