package com.edtech.auth.verification;

import com.edtech.auth.config.AuthProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;

/**
 * 验证码哈希：HMAC-SHA256，密钥为进程级配置的盐。
 * <p>
 * 哈希输入包含用途与目标标识，同一验证码在不同键下得到不同哈希。
 */
@Component
public class OtpCodeHasher {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public OtpCodeHasher(AuthProperties properties) {
        String salt = properties.getVerification().getHashSalt();
        if (!StringUtils.hasText(salt)) {
            throw new IllegalStateException("auth.verification.hash-salt must be configured");
        }
        this.key = new SecretKeySpec(salt.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String hash(String destination, OtpPurpose purpose, String code) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            String material = purpose.name() + ':' + destination + ':' + code;
            return HexFormat.of().formatHex(mac.doFinal(material.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", ex);
        }
    }
}
