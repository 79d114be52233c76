package com.edtech.user.domain;

public enum UserRole {
    STUDENT,
    INSTRUCTOR,
    ADMIN,
    SUPER_ADMIN;

    public static UserRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return STUDENT;
        }
        return switch (value.trim().toLowerCase()) {
            case "student" -> STUDENT;
            case "instructor" -> INSTRUCTOR;
            case "admin" -> ADMIN;
            case "super_admin", "super-admin", "superadmin" -> SUPER_ADMIN;
            default -> throw new IllegalArgumentException("Unsupported role: " + value);
        };
    }
}
