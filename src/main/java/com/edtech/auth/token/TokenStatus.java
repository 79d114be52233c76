package com.edtech.auth.token;

/**
 * 令牌校验状态：签名/结构/种类错误为 INVALID，仅过期为 EXPIRED，二者调用方处理方式不同。
 */
public enum TokenStatus {
    VALID,
    INVALID,
    EXPIRED
}
