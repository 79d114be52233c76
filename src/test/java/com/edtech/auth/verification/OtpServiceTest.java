package com.edtech.auth.verification;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.IdentifierType;
import com.edtech.support.AuthTestFixtures;
import com.edtech.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OtpServiceTest {

    private static final String PHONE = "+15551234567";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private OtpService otpService;

    @BeforeEach
    void setUp() {
        AuthProperties properties = AuthTestFixtures.properties();
        otpService = new OtpService(new InMemoryOtpChallengeStore(), new OtpCodeHasher(properties),
                AuthTestFixtures.callRunner(properties), properties, clock);
    }

    @Test
    void issuedCodeIsSixDigitsAndVerifiesOnce() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);

        assertThat(otp.plaintextCode()).matches("\\d{6}");
        assertThat(otp.expiresAt()).isEqualTo(Instant.parse("2026-03-01T08:05:00Z"));
        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status()).isEqualTo(OtpStatus.SUCCESS);
        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status())
                .isEqualTo(OtpStatus.ALREADY_CONSUMED);
    }

    @Test
    void wrongCodeCountsOneAttempt() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);

        OtpCheckResult result = otpService.verify(PHONE, OtpPurpose.LOGIN, otherCode(otp.plaintextCode()));

        assertThat(result.status()).isEqualTo(OtpStatus.MISMATCH);
        assertThat(result.attemptCount()).isEqualTo(1);
        assertThat(result.maxAttempts()).isEqualTo(5);
    }

    @Test
    void correctCodeRejectedAfterMaxMismatches() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);
        String wrong = otherCode(otp.plaintextCode());
        for (int i = 0; i < 5; i++) {
            assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, wrong).status()).isEqualTo(OtpStatus.MISMATCH);
        }

        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status())
                .isEqualTo(OtpStatus.EXHAUSTED);
    }

    @Test
    void newCodeSupersedesPrevious() {
        IssuedOtp first = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);
        IssuedOtp second = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);

        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, first.plaintextCode(), first.challengeId()).status())
                .isEqualTo(OtpStatus.EXPIRED);
        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, second.plaintextCode(), second.challengeId()).status())
                .isEqualTo(OtpStatus.SUCCESS);
    }

    @Test
    void codeExpiresAfterTtl() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);

        clock.advance(Duration.ofMinutes(5));

        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status()).isEqualTo(OtpStatus.EXPIRED);
    }

    @Test
    void codeIsBoundToPurpose() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.PASSWORD_RESET);

        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status()).isEqualTo(OtpStatus.EXPIRED);
    }

    @Test
    void invalidatedCodeIsExpired() {
        IssuedOtp otp = otpService.issue(IdentifierType.PHONE, PHONE, OtpPurpose.LOGIN);

        otpService.invalidate(PHONE, OtpPurpose.LOGIN);

        assertThat(otpService.verify(PHONE, OtpPurpose.LOGIN, otp.plaintextCode()).status()).isEqualTo(OtpStatus.EXPIRED);
    }

    @Test
    void secondSendWithinIntervalIsRateLimited() {
        otpService.acquireSendSlot(PHONE, OtpPurpose.LOGIN);

        BusinessException ex = assertThrows(BusinessException.class,
                () -> otpService.acquireSendSlot(PHONE, OtpPurpose.LOGIN));
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.OTP_RATE_LIMITED);

        clock.advance(Duration.ofSeconds(60));
        otpService.acquireSendSlot(PHONE, OtpPurpose.LOGIN);
    }

    @Test
    void blankCodeIsValidationError() {
        BusinessException ex = assertThrows(BusinessException.class,
                () -> otpService.verify(PHONE, OtpPurpose.LOGIN, " "));
        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void failureStatusesMapToErrorCodes() {
        assertThat(OtpService.toException(new OtpCheckResult(OtpStatus.EXHAUSTED, 5, 5)).getErrorCode())
                .isEqualTo(ErrorCode.OTP_EXHAUSTED);
        assertThat(OtpService.toException(new OtpCheckResult(OtpStatus.ALREADY_CONSUMED, 0, 5)).getErrorCode())
                .isEqualTo(ErrorCode.OTP_ALREADY_CONSUMED);
        assertThat(OtpService.toException(OtpCheckResult.expired()).getErrorCode()).isEqualTo(ErrorCode.OTP_EXPIRED);
    }

    @Test
    void generatedCodesKeepLeadingZerosAndLength() {
        for (int i = 0; i < 200; i++) {
            assertThat(OtpService.generateNumericCode(4)).matches("\\d{4}");
        }
        assertThrows(IllegalStateException.class, () -> OtpService.generateNumericCode(3));
    }

    @Test
    void hashSaltIsRequired() {
        AuthProperties properties = AuthTestFixtures.properties();
        properties.getVerification().setHashSalt(" ");

        assertThrows(IllegalStateException.class, () -> new OtpCodeHasher(properties));
    }

    private static String otherCode(String code) {
        return code.equals("000000") ? "111111" : "000000";
    }
}
