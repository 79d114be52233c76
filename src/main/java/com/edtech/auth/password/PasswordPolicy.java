package com.edtech.auth.password;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 密码策略：非空、最小长度、必须同时包含字母和数字。
 */
@Component
public class PasswordPolicy {

    private static final int MAX_LENGTH = 72;

    private final int minLength;

    public PasswordPolicy(AuthProperties properties) {
        this.minLength = properties.getPassword().getMinLength();
    }

    /**
     * @throws BusinessException 不满足策略时抛出 {@link ErrorCode#PASSWORD_POLICY_VIOLATION}。
     */
    public void validate(String password) {
        if (!StringUtils.hasText(password)) {
            throw new BusinessException(ErrorCode.PASSWORD_POLICY_VIOLATION, "Password must not be empty");
        }
        if (password.length() < minLength) {
            throw new BusinessException(ErrorCode.PASSWORD_POLICY_VIOLATION,
                    "Password must be at least " + minLength + " characters");
        }
        // BCrypt 只使用前 72 字节
        if (password.length() > MAX_LENGTH) {
            throw new BusinessException(ErrorCode.PASSWORD_POLICY_VIOLATION,
                    "Password must be at most " + MAX_LENGTH + " characters");
        }
        boolean hasLetter = password.chars().anyMatch(Character::isLetter);
        boolean hasDigit = password.chars().anyMatch(Character::isDigit);
        if (!hasLetter || !hasDigit) {
            throw new BusinessException(ErrorCode.PASSWORD_POLICY_VIOLATION,
                    "Password must contain both letters and digits");
        }
    }
}
