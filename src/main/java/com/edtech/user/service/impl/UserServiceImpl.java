package com.edtech.user.service.impl;

import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.user.domain.User;
import com.edtech.user.mapper.UserMapper;
import com.edtech.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final UserMapper userMapper;
    private final Clock clock;

    /**
     * 根据 ID 查询用户。
     *
     * @param id 用户 ID。
     * @return 用户 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(userMapper.findById(id));
    }

    /**
     * 根据邮箱查询用户。
     *
     * @param email 标准化后的邮箱地址。
     * @return 用户 Optional。
     */
    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(userMapper.findByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByUsername(String username) {
        return Optional.ofNullable(userMapper.findByUsername(username));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByPhone(String phone) {
        return Optional.ofNullable(userMapper.findByPhone(phone));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findByEmailOrUsername(String email, String username) {
        if (StringUtils.hasText(email)) {
            return findByEmail(email);
        }
        if (StringUtils.hasText(username)) {
            return findByUsername(username);
        }
        return Optional.empty();
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return userMapper.existsByEmail(email);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return userMapper.existsByUsername(username);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByPhone(String phone) {
        return userMapper.existsByPhone(phone);
    }

    /**
     * 创建用户，写入创建与更新时间并持久化。
     * <p>
     * 先做存在性检查给出明确的冲突类型；并发注册绕过检查时，由唯一索引兜底并按字段重新判定。
     *
     * @param user 待创建的用户实体。
     * @return 持久化后的用户实体（已回填 ID）。
     * @throws BusinessException 邮箱、用户名或手机号已存在时抛出。
     */
    @Override
    @Transactional
    public User createUser(User user) {
        ensureUnique(user);
        Instant now = clock.instant();
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException ex) {
            log.info("Concurrent registration conflict username={}", user.getUsername());
            ensureUnique(user);
            throw new BusinessException(ErrorCode.USERNAME_EXISTS);
        }
        return user;
    }

    /**
     * 更新用户密码哈希并写入更新时间。
     *
     * @param user 用户实体（需包含 ID 与新的 passwordHash）。
     */
    @Override
    @Transactional
    public void updatePassword(User user) {
        Instant now = clock.instant();
        user.setUpdatedAt(now);
        userMapper.updatePassword(user.getId(), user.getPasswordHash(), now);
    }

    @Override
    @Transactional
    public void markEmailVerified(long userId) {
        userMapper.markEmailVerified(userId, clock.instant());
    }

    @Override
    @Transactional
    public void updateLastLogin(long userId) {
        userMapper.updateLastLogin(userId, clock.instant());
    }

    @Override
    @Transactional
    public void deactivate(long userId) {
        userMapper.updateActive(userId, false, clock.instant());
    }

    private void ensureUnique(User user) {
        if (StringUtils.hasText(user.getEmail()) && userMapper.existsByEmail(user.getEmail())) {
            throw new BusinessException(ErrorCode.EMAIL_EXISTS);
        }
        if (StringUtils.hasText(user.getUsername()) && userMapper.existsByUsername(user.getUsername())) {
            throw new BusinessException(ErrorCode.USERNAME_EXISTS);
        }
        if (StringUtils.hasText(user.getPhone()) && userMapper.existsByPhone(user.getPhone())) {
            throw new BusinessException(ErrorCode.PHONE_EXISTS);
        }
    }
}
