package com.edtech.auth.verification;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.IdentifierType;
import com.edtech.auth.support.BoundedCallRunner;
import com.edtech.auth.util.Masking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 验证码业务服务。
 * <p>
 * 负责签发与校验验证码：
 * - 发送间隔与日限额；
 * - 均匀分布的随机数字码，仅保存哈希；
 * - 同一 (目标, 用途) 仅保留最新挑战。
 * 配置来源于 `AuthProperties.Verification`。
 */
@Slf4j
@Service
public class OtpService {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final OtpChallengeStore challengeStore;
    private final OtpCodeHasher codeHasher;
    private final BoundedCallRunner callRunner;
    private final AuthProperties.Verification properties;
    private final Clock clock;

    public OtpService(OtpChallengeStore challengeStore,
                      OtpCodeHasher codeHasher,
                      BoundedCallRunner callRunner,
                      AuthProperties properties,
                      Clock clock) {
        this.challengeStore = challengeStore;
        this.codeHasher = codeHasher;
        this.callRunner = callRunner;
        this.properties = properties.getVerification();
        this.clock = clock;
    }

    /**
     * 检查发送节流并占用一次额度。
     *
     * @throws BusinessException 发送过于频繁或超出每日上限时抛出。
     */
    public void acquireSendSlot(String destination, OtpPurpose purpose) {
        SendPermit permit = callRunner.store("otp.throttle", () -> challengeStore.acquireSendSlot(
                destination, purpose, properties.getSendInterval(), properties.getDailyLimit(), clock.instant()));
        switch (permit) {
            case TOO_SOON -> throw new BusinessException(ErrorCode.OTP_RATE_LIMITED);
            case DAILY_LIMIT_REACHED -> throw new BusinessException(ErrorCode.OTP_DAILY_LIMIT);
            case GRANTED -> {
            }
        }
    }

    /**
     * 签发验证码并替换同键下的旧挑战。
     *
     * @param channel     发送通道。
     * @param destination 标准化后的目标标识。
     * @param purpose     用途。
     * @return 明文验证码、挑战 ID 与过期时间。
     */
    public IssuedOtp issue(IdentifierType channel, String destination, OtpPurpose purpose) {
        if (channel == null || purpose == null || !StringUtils.hasText(destination)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Destination, channel and purpose are required");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getTtl());
        String code = generateNumericCode(properties.getCodeLength());
        String challengeId = UUID.randomUUID().toString();
        OtpChallenge challenge = new OtpChallenge(challengeId, channel, destination, purpose,
                codeHasher.hash(destination, purpose, code), now, expiresAt, 0, properties.getMaxAttempts(), false);
        callRunner.storeRun("otp.save", () -> challengeStore.save(challenge, properties.getRetention()));
        log.info("OTP issued purpose={} destination={} challengeId={}", purpose, Masking.mask(destination), challengeId);
        return new IssuedOtp(code, challengeId, expiresAt);
    }

    public OtpCheckResult verify(String destination, OtpPurpose purpose, String code) {
        return verify(destination, purpose, code, null);
    }

    /**
     * 校验验证码。
     *
     * @param challengeId 可选的挑战 ID；若给出且不是当前挑战则返回 EXPIRED。
     */
    public OtpCheckResult verify(String destination, OtpPurpose purpose, String code, String challengeId) {
        if (purpose == null || !StringUtils.hasText(destination) || !StringUtils.hasText(code)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Destination, purpose and code are required");
        }
        String codeHash = codeHasher.hash(destination, purpose, code.trim());
        OtpCheckResult result = callRunner.store("otp.check",
                () -> challengeStore.check(destination, purpose, codeHash, challengeId, clock.instant()));
        if (!result.isSuccess()) {
            log.info("OTP check failed purpose={} destination={} status={} attempts={}/{}",
                    purpose, Masking.mask(destination), result.status(), result.attemptCount(), result.maxAttempts());
        }
        return result;
    }

    public void invalidate(String destination, OtpPurpose purpose) {
        callRunner.storeRun("otp.invalidate", () -> challengeStore.invalidate(destination, purpose));
    }

    public int purgeExpired() {
        return callRunner.store("otp.purge", () -> challengeStore.purgeExpired(clock.instant()));
    }

    /**
     * 把失败状态映射为错误码。
     */
    public static BusinessException toException(OtpCheckResult result) {
        return switch (result.status()) {
            case EXPIRED -> new BusinessException(ErrorCode.OTP_EXPIRED);
            case MISMATCH -> new BusinessException(ErrorCode.OTP_MISMATCH);
            case EXHAUSTED -> new BusinessException(ErrorCode.OTP_EXHAUSTED);
            case ALREADY_CONSUMED -> new BusinessException(ErrorCode.OTP_ALREADY_CONSUMED);
            case SUCCESS -> throw new IllegalArgumentException("successful check has no error");
        };
    }

    /**
     * 生成 [0, 10^length) 上均匀分布的数字码，左补零。
     */
    static String generateNumericCode(int length) {
        if (length < 4 || length > 9) {
            throw new IllegalStateException("auth.verification.code-length must be between 4 and 9");
        }
        int bound = (int) Math.pow(10, length);
        return String.format("%0" + length + "d", RANDOM.nextInt(bound));
    }
}
