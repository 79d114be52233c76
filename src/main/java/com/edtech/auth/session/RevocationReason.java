package com.edtech.auth.session;

public enum RevocationReason {
    LOGOUT,
    SESSION_REVOKED,
    PASSWORD_RESET,
    PASSWORD_CHANGED,
    ACCOUNT_DEACTIVATED
}
