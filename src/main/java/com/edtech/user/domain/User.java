package com.edtech.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    private Long id;
    private String email;
    private String username;
    private String phone;
    private String firstName;
    private String lastName;
    private String passwordHash;
    private UserRole role;
    private boolean active;
    private boolean emailVerified;
    private Instant emailVerifiedAt;
    private Instant lastLoginAt;
    private Instant deactivatedAt;
    private Instant createdAt;
    private Instant updatedAt;
}
