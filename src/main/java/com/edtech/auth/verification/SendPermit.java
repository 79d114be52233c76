package com.edtech.auth.verification;

/**
 * 发送节流判定结果。
 */
public enum SendPermit {
    GRANTED,
    TOO_SOON,
    DAILY_LIMIT_REACHED
}
