package com.edtech.auth.password;

import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 基于 Spring Security {@link PasswordEncoder}（BCrypt）的密码哈希实现。
 */
@Component
@RequiredArgsConstructor
public class BCryptPasswordHasher implements PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    @Override
    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * 校验明文与哈希是否匹配；哈希为空（仅验证码登录的账号）时一律不匹配。
     */
    @Override
    public boolean verify(String plaintext, String hash) {
        if (!StringUtils.hasText(hash) || plaintext == null) {
            return false;
        }
        return passwordEncoder.matches(plaintext, hash);
    }
}
