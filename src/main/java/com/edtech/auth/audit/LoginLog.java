package com.edtech.auth.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoginLog {

    private Long id;
    private Long userId;
    /** 已脱敏的登录标识。 */
    private String identifier;
    private String channel;
    private String ip;
    private String userAgent;
    private String status;
    private String failureCode;
    private Instant createdAt;
}
