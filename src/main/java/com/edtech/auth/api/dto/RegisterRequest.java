package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 注册请求。
 * <p>
 * 字段：邮箱、用户名、密码、姓名，可选手机号与角色（仅 STUDENT/INSTRUCTOR 可自助注册）。
 */
public record RegisterRequest(
        @NotBlank(message = "Email is required") String email,
        @NotBlank(message = "Username is required") String username,
        @NotBlank(message = "Password is required") String password,
        @NotBlank(message = "First name is required") @Size(max = 50) String firstName,
        @NotBlank(message = "Last name is required") @Size(max = 50) String lastName,
        String phone,
        String role
) {

    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + ", username=" + username + "]";
    }
}
