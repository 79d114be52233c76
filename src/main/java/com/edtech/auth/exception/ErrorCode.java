package com.edtech.auth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", "Request is missing required fields or contains invalid values", HttpStatus.BAD_REQUEST),
    EMAIL_EXISTS("EMAIL_EXISTS", "Email already exists", HttpStatus.CONFLICT),
    USERNAME_EXISTS("USERNAME_EXISTS", "Username already exists", HttpStatus.CONFLICT),
    PHONE_EXISTS("PHONE_EXISTS", "Phone number already exists", HttpStatus.CONFLICT),
    PASSWORD_POLICY_VIOLATION("PASSWORD_POLICY_VIOLATION", "Password does not meet the password policy", HttpStatus.BAD_REQUEST),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Invalid credentials", HttpStatus.UNAUTHORIZED),
    ACCOUNT_DISABLED("ACCOUNT_DISABLED", "Account is disabled", HttpStatus.FORBIDDEN),
    INVALID_TOKEN("INVALID_TOKEN", "Invalid token", HttpStatus.UNAUTHORIZED),
    EXPIRED_TOKEN("EXPIRED_TOKEN", "Token has expired", HttpStatus.UNAUTHORIZED),
    TOKEN_ALREADY_INVALIDATED("TOKEN_ALREADY_INVALIDATED", "Token is already invalidated", HttpStatus.UNAUTHORIZED),
    OTP_EXPIRED("OTP_EXPIRED", "Verification code is invalid or has expired", HttpStatus.BAD_REQUEST),
    OTP_MISMATCH("OTP_MISMATCH", "Verification code is incorrect", HttpStatus.BAD_REQUEST),
    OTP_EXHAUSTED("OTP_EXHAUSTED", "Too many incorrect attempts, please request a new code", HttpStatus.TOO_MANY_REQUESTS),
    OTP_ALREADY_CONSUMED("OTP_ALREADY_CONSUMED", "Verification code has already been used", HttpStatus.BAD_REQUEST),
    OTP_RATE_LIMITED("OTP_RATE_LIMITED", "Verification codes are being requested too often", HttpStatus.TOO_MANY_REQUESTS),
    OTP_DAILY_LIMIT("OTP_DAILY_LIMIT", "Daily verification code limit reached", HttpStatus.TOO_MANY_REQUESTS),
    NOTIFICATION_FAILED("NOTIFICATION_FAILED", "Could not deliver the verification code, please try again", HttpStatus.SERVICE_UNAVAILABLE),
    USER_NOT_FOUND("USER_NOT_FOUND", "User not found", HttpStatus.NOT_FOUND),
    SESSION_NOT_FOUND("SESSION_NOT_FOUND", "Session not found", HttpStatus.NOT_FOUND),
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", "Service temporarily unavailable, please retry later", HttpStatus.SERVICE_UNAVAILABLE),
    TIMEOUT("TIMEOUT", "Operation timed out, please retry later", HttpStatus.GATEWAY_TIMEOUT),
    INTERNAL_ERROR("INTERNAL_ERROR", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String defaultMessage, HttpStatus httpStatus) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }
}
