package com.edtech.auth.verification;

import com.edtech.auth.model.IdentifierType;

import java.time.Instant;

/**
 * 验证码挑战。只保存验证码的哈希。
 */
public record OtpChallenge(String challengeId,
                           IdentifierType channel,
                           String destination,
                           OtpPurpose purpose,
                           String codeHash,
                           Instant createdAt,
                           Instant expiresAt,
                           int attemptCount,
                           int maxAttempts,
                           boolean consumed) {

    OtpChallenge withAttemptCount(int attempts) {
        return new OtpChallenge(challengeId, channel, destination, purpose, codeHash, createdAt, expiresAt,
                attempts, maxAttempts, consumed);
    }

    OtpChallenge markConsumed() {
        return new OtpChallenge(challengeId, channel, destination, purpose, codeHash, createdAt, expiresAt,
                attemptCount, maxAttempts, true);
    }
}
