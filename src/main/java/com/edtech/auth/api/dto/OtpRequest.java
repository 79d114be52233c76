package com.edtech.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * 验证码发送请求：目标为邮箱或手机号，按内容自动识别通道。
 */
public record OtpRequest(
        @NotBlank(message = "Email or phone is required") String destination
) {
}
