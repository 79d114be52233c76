package com.edtech.auth.verification;

import java.time.Duration;
import java.time.Instant;

/**
 * 验证码挑战存储。
 * <p>
 * 以 (purpose, destination) 为键，每个键最多一个有效挑战；校验的读改写对单个键原子执行。
 * 记录在过期后继续保留 {@code retention} 时长，用于区分“过期”“已使用”“已锁定”。
 */
public interface OtpChallengeStore {

    /**
     * 保存挑战，替换同键下已有的挑战（后写者胜）。
     */
    void save(OtpChallenge challenge, Duration retention);

    /**
     * 原子地校验并更新挑战。
     *
     * @param destination 标准化后的目标标识。
     * @param purpose     用途。
     * @param codeHash    提交验证码的哈希。
     * @param challengeId 期望的挑战 ID，可为空；与当前挑战不一致时视为过期。
     * @param now         当前时间。
     */
    OtpCheckResult check(String destination, OtpPurpose purpose, String codeHash, String challengeId, Instant now);

    void invalidate(String destination, OtpPurpose purpose);

    /**
     * 占用一次发送额度：最小发送间隔与按自然日（UTC）计数的每日上限。
     */
    SendPermit acquireSendSlot(String destination, OtpPurpose purpose, Duration interval, int dailyLimit, Instant now);

    /**
     * 清理过期条目，返回清理数量；依赖存储 TTL 的实现返回 0。
     */
    int purgeExpired(Instant now);
}
