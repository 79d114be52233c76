package com.edtech.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 认证相关配置属性，绑定前缀 {@code auth.*}。
 *
 * <p>包含以下分组：</p>
 * - Jwt：令牌签名密钥与有效期；
 * - Verification：一次性验证码（OTP）的位数、有效期、尝试次数与发送节流；
 * - Password：密码策略与哈希强度；
 * - Registration / OtpLogin：注册与验证码登录的部署策略；
 * - Phone：手机号标准化策略；
 * - Timeouts：外部调用（哈希、存储、通知）的超时上限；
 * - Store：吊销集合与验证码表的存储后端；
 * - Notification：通知通道选择与短信网关；
 * - Cleanup：过期数据清理任务。
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** JWT 配置项。 */
    private final Jwt jwt = new Jwt();
    /** 验证码配置项。 */
    private final Verification verification = new Verification();
    /** 密码策略配置项。 */
    private final Password password = new Password();
    /** 注册策略。 */
    private final Registration registration = new Registration();
    /** 验证码登录策略。 */
    private final OtpLogin otpLogin = new OtpLogin();
    /** 手机号策略。 */
    private final Phone phone = new Phone();
    /** 外部调用超时。 */
    private final Timeouts timeouts = new Timeouts();
    /** 存储后端。 */
    private final Store store = new Store();
    /** 通知通道。 */
    private final Notification notification = new Notification();
    /** 清理任务。 */
    private final Cleanup cleanup = new Cleanup();

    @Data
    public static class Jwt {
        /** JWT 签发者标识（iss）。 */
        private String issuer = "edtech-platform";
        /** HMAC 签名密钥，Base64 或原始文本，至少 32 字节。 */
        private String secret;
        /** 访问令牌有效期（TTL）。 */
        private Duration accessTokenTtl = Duration.ofMinutes(15);
        /** 刷新令牌有效期（TTL）。 */
        private Duration refreshTokenTtl = Duration.ofDays(7);
    }

    /**
     * 验证码配置：位数、有效期、最大尝试次数、哈希盐、发送间隔与每日上限。
     */
    @Data
    public static class Verification {
        /** 验证码位数。 */
        private int codeLength = 6;
        /** 验证码有效时间。 */
        private Duration ttl = Duration.ofMinutes(5);
        /** 最大校验尝试次数。 */
        private int maxAttempts = 5;
        /** 验证码哈希盐（进程级，启动后只读）。 */
        private String hashSalt;
        /** 过期/已使用的验证码记录保留时长，用于区分“过期”与“已使用”。 */
        private Duration retention = Duration.ofHours(24);
        /** 同标识连续发送的最小间隔。 */
        private Duration sendInterval = Duration.ofSeconds(60);
        /** 同标识每日发送上限。 */
        private int dailyLimit = 10;
    }

    /** 密码策略配置。 */
    @Data
    public static class Password {
        /** 密码哈希强度（BCrypt cost）。 */
        private int bcryptStrength = 12;
        /** 密码最小长度。 */
        private int minLength = 8;
    }

    @Data
    public static class Registration {
        /** 为 true 时新用户在邮箱验证前保持未激活。 */
        private boolean requireEmailVerification = false;
    }

    @Data
    public static class OtpLogin {
        /** 验证码登录时，标识未注册则自动创建学生账号。 */
        private boolean autoRegister = true;
    }

    @Data
    public static class Phone {
        /** 无国家码号码补全使用的默认国家码，如 "+91"；为空时要求调用方提供完整 E.164 号码。 */
        private String defaultCountryCode;
    }

    @Data
    public static class Timeouts {
        /** 密码哈希/校验。 */
        private Duration hash = Duration.ofSeconds(5);
        /** 数据库与 Redis 访问。 */
        private Duration store = Duration.ofSeconds(3);
        /** 短信/邮件发送。 */
        private Duration notification = Duration.ofSeconds(10);
    }

    @Data
    public static class Store {
        /** redis：多实例共享；memory：单实例内存。 */
        private StoreMode mode = StoreMode.REDIS;
    }

    public enum StoreMode {
        REDIS,
        MEMORY
    }

    @Data
    public static class Notification {
        /** provider：真实邮件/短信；logging：仅打印日志（开发环境）。 */
        private NotificationMode mode = NotificationMode.LOGGING;
        /** 发件人地址。 */
        private String fromAddress = "no-reply@edtech.local";
        /** 发件人名称。 */
        private String fromName = "EdTech Platform";
        /** 短信网关基础地址。 */
        private String smsBaseUrl;
        /** 短信网关 API Key。 */
        private String smsApiKey;
        /** 短信发送方标识。 */
        private String smsSenderId = "EDTECH";
    }

    public enum NotificationMode {
        PROVIDER,
        LOGGING
    }

    @Data
    public static class Cleanup {
        /** 是否启用定时清理。 */
        private boolean enabled = true;
        /** 清理周期。 */
        private Duration interval = Duration.ofHours(1);
        /** 登录审计日志保留时长。 */
        private Duration loginLogRetention = Duration.ofDays(90);
    }
}
