package com.edtech.auth.token;

/**
 * 令牌种类，写入 {@code token_type} 声明。
 */
public enum TokenKind {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenKind(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static TokenKind fromClaim(Object claim) {
        if (claim == null) {
            return null;
        }
        for (TokenKind kind : values()) {
            if (kind.claimValue.equals(claim.toString())) {
                return kind;
            }
        }
        return null;
    }
}
