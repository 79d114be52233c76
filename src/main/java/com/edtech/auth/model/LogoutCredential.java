package com.edtech.auth.model;

/**
 * 登出凭证：刷新令牌或访问令牌二选一。
 * <p>
 * 编排层按具体类型分支，而不是按字段是否为空判断。
 */
public sealed interface LogoutCredential permits LogoutCredential.RefreshToken, LogoutCredential.AccessToken {

    String token();

    record RefreshToken(String token) implements LogoutCredential {
    }

    record AccessToken(String token) implements LogoutCredential {
    }
}
