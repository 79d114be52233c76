package com.edtech.user.mapper;

import com.edtech.user.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;

@Mapper
public interface UserMapper {

    User findById(@Param("id") Long id);

    User findByEmail(@Param("email") String email);

    User findByUsername(@Param("username") String username);

    User findByPhone(@Param("phone") String phone);

    boolean existsByEmail(@Param("email") String email);

    boolean existsByUsername(@Param("username") String username);

    boolean existsByPhone(@Param("phone") String phone);

    void insert(User user);

    int updatePassword(@Param("id") Long id, @Param("passwordHash") String passwordHash, @Param("updatedAt") Instant updatedAt);

    int markEmailVerified(@Param("id") Long id, @Param("verifiedAt") Instant verifiedAt);

    int updateLastLogin(@Param("id") Long id, @Param("lastLoginAt") Instant lastLoginAt);

    int updateActive(@Param("id") Long id, @Param("active") boolean active, @Param("updatedAt") Instant updatedAt);
}
