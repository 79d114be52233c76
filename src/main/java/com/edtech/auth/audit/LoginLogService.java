package com.edtech.auth.audit;

import com.edtech.auth.model.ClientInfo;
import com.edtech.auth.util.Masking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * 登录审计日志。写入失败只记录告警，不影响认证结果。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginLogService {

    static final String STATUS_SUCCESS = "SUCCESS";
    static final String STATUS_FAILED = "FAILED";

    private final LoginLogMapper loginLogMapper;
    private final Clock clock;

    public void recordSuccess(Long userId, String identifier, LoginChannel channel, ClientInfo client) {
        record(userId, identifier, channel, client, STATUS_SUCCESS, null);
    }

    public void recordFailure(Long userId, String identifier, LoginChannel channel, ClientInfo client, String failureCode) {
        record(userId, identifier, channel, client, STATUS_FAILED, failureCode);
    }

    /**
     * 删除早于指定时间的审计记录。
     */
    public int purgeBefore(Instant before) {
        return loginLogMapper.deleteBefore(before);
    }

    private void record(Long userId, String identifier, LoginChannel channel, ClientInfo client,
                        String status, String failureCode) {
        ClientInfo info = client != null ? client : ClientInfo.unknown();
        LoginLog entry = LoginLog.builder()
                .userId(userId)
                .identifier(Masking.mask(identifier))
                .channel(channel.name())
                .ip(info.ip())
                .userAgent(info.userAgent())
                .status(status)
                .failureCode(failureCode)
                .createdAt(clock.instant())
                .build();
        try {
            loginLogMapper.insert(entry);
        } catch (DataAccessException ex) {
            log.warn("Login log not persisted channel={} status={} reason={}", channel, status, ex.getMessage());
        }
    }
}
