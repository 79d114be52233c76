package com.edtech.auth.password;

/**
 * 单向密码哈希能力。
 * <p>
 * 哈希强度属于配置，不作为调用参数；{@link #verify} 的比较需为常量时间。
 */
public interface PasswordHasher {

    String hash(String plaintext);

    boolean verify(String plaintext, String hash);
}
