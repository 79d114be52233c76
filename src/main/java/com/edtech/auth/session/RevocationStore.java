package com.edtech.auth.session;

import java.time.Instant;
import java.util.Optional;

/**
 * 令牌吊销集合（黑名单）。
 * <p>
 * 每个条目以令牌自身的过期时间作为 TTL，集合自行收缩。另维护按用户的“签发时间下限”，
 * 签发时间不晚于该秒的令牌一律视为吊销，用于重置密码、停用账号等整用户下线场景。
 * 多实例部署必须使用共享实现（Redis）。
 */
public interface RevocationStore {

    /**
     * 原子地加入吊销集合。
     *
     * @param tokenId   令牌 ID（jti）。
     * @param expiresAt 令牌原始过期时间，作为条目 TTL。
     * @return 本次调用是否首次吊销；重复吊销返回 false 且无其他效果。
     */
    boolean revoke(String tokenId, Instant expiresAt);

    boolean isRevoked(String tokenId);

    /**
     * 设置用户令牌的签发时间下限，只会向后推进。
     *
     * @param userId      用户 ID。
     * @param cutoff      签发时间（秒精度）不晚于该时间的令牌视为吊销。
     * @param retainUntil 下限记录保留到该时间（通常为最长令牌有效期之后）。
     */
    void revokeIssuedUpTo(long userId, Instant cutoff, Instant retainUntil);

    /**
     * 判断令牌是否因用户级下限而失效（{@code iat <= cutoff}，秒精度）。
     */
    boolean isCoveredByCutoff(long userId, Instant issuedAt);

    /**
     * 当前生效的用户级下限。
     */
    Optional<Instant> cutoff(long userId);

    /**
     * 清理已过期条目，返回清理数量；依赖存储 TTL 的实现返回 0。
     */
    int purgeExpired();
}
