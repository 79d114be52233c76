package com.edtech.user.service;

import com.edtech.user.domain.User;

import java.util.Optional;

/**
 * 用户凭证存储接口。
 * <p>
 * 认证流程读取与修改用户记录的唯一入口；唯一性冲突以
 * {@code EMAIL_EXISTS} / {@code USERNAME_EXISTS} / {@code PHONE_EXISTS} 业务异常返回。
 */
public interface UserService {

    Optional<User> findById(long id);

    Optional<User> findByEmail(String email);

    Optional<User> findByUsername(String username);

    Optional<User> findByPhone(String phone);

    /**
     * 按邮箱或用户名查找用户，二者恰好提供一个。
     */
    Optional<User> findByEmailOrUsername(String email, String username);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    boolean existsByPhone(String phone);

    User createUser(User user);

    void updatePassword(User user);

    void markEmailVerified(long userId);

    void updateLastLogin(long userId);

    void deactivate(long userId);
}
