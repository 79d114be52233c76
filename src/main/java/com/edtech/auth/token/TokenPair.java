package com.edtech.auth.token;

/**
 * 访问令牌与刷新令牌的组合。
 * <p>
 * 两者共用会话键（刷新令牌的 jti），会话表以此定位会话。
 */
public record TokenPair(
        IssuedToken access,
        IssuedToken refresh
) {
}
