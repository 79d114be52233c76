package com.edtech.auth.session;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * 会话表数据访问层。
 */
@Mapper
public interface SessionMapper {

    void insert(SessionRecord session);

    /**
     * 按会话键（刷新令牌 ID）查找会话。
     */
    SessionRecord findBySessionKey(@Param("sessionKey") String sessionKey);

    SessionRecord findById(@Param("id") Long id);

    List<SessionRecord> findActiveByUserId(@Param("userId") Long userId, @Param("now") Instant now);

    int revokeById(@Param("id") Long id, @Param("revokedAt") Instant revokedAt, @Param("reason") String reason);

    int revokeAllByUserId(@Param("userId") Long userId, @Param("revokedAt") Instant revokedAt, @Param("reason") String reason);

    /**
     * 删除过期时间不晚于 {@code before} 的会话，无论是否已吊销；已吊销但未过期的行保留供审计。
     *
     * @return 删除行数
     */
    int deleteExpired(@Param("before") Instant before);
}
