package com.edtech.auth.util;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.model.IdentifierType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * 标识标准化。
 * <p>
 * - 邮箱：去空白并转小写；
 * - 用户名：去空白并转小写；
 * - 手机号：去除空格、横线、括号等格式字符；无 {@code +} 前缀时补全配置的默认国家码，
 *   未配置默认国家码时原样保留（随后由格式校验拒绝）。
 */
@Component
public class IdentifierNormalizer {

    private final String defaultCountryCode;

    public IdentifierNormalizer(AuthProperties properties) {
        this.defaultCountryCode = properties.getPhone().getDefaultCountryCode();
    }

    public String normalize(IdentifierType type, String identifier) {
        return switch (type) {
            case PHONE -> normalizePhone(identifier);
            case EMAIL -> normalizeEmail(identifier);
        };
    }

    public String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public String normalizeUsername(String username) {
        return username == null ? null : username.trim().toLowerCase(Locale.ROOT);
    }

    public String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String cleaned = phone.replaceAll("[^\\d+]", "");
        if (cleaned.startsWith("00")) {
            cleaned = "+" + cleaned.substring(2);
        }
        if (!cleaned.startsWith("+") && StringUtils.hasText(defaultCountryCode)) {
            String prefix = defaultCountryCode.startsWith("+") ? defaultCountryCode : "+" + defaultCountryCode;
            cleaned = prefix + cleaned.replaceFirst("^0+", "");
        }
        return cleaned;
    }
}
