package com.edtech.auth.util;

/**
 * 日志脱敏工具：日志中只出现掩码后的手机号/邮箱。
 */
public final class Masking {

    private Masking() {
    }

    public static String mask(String destination) {
        if (destination == null || destination.isEmpty()) {
            return "";
        }
        int at = destination.indexOf('@');
        if (at > 0) {
            String local = destination.substring(0, at);
            String visible = local.substring(0, Math.min(2, local.length()));
            return visible + "***" + destination.substring(at);
        }
        if (destination.length() <= 4) {
            return "****";
        }
        return destination.substring(0, 3) + "****" + destination.substring(destination.length() - 2);
    }
}
