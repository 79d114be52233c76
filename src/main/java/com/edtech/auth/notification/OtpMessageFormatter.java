package com.edtech.auth.notification;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.verification.OtpPurpose;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * 验证码与安全通知的文案。
 */
@Component
public class OtpMessageFormatter {

    private final AuthProperties.Verification verification;
    private final Clock clock;

    public OtpMessageFormatter(AuthProperties properties, Clock clock) {
        this.verification = properties.getVerification();
        this.clock = clock;
    }

    public String smsText(OtpPurpose purpose, String code) {
        return "Your EdTech OTP for " + smsAction(purpose) + " is: " + code
                + ". This code expires in " + ttlMinutes() + " minutes. Do not share this code with anyone.";
    }

    public String emailSubject(OtpPurpose purpose) {
        String title = switch (purpose) {
            case LOGIN -> "Login Verification";
            case PASSWORD_RESET -> "Password Reset";
            case EMAIL_VERIFICATION -> "Email Verification";
        };
        return title + " - OTP Code";
    }

    public String emailBody(OtpPurpose purpose, String code) {
        String action = switch (purpose) {
            case LOGIN -> "login to your account";
            case PASSWORD_RESET -> "reset your password";
            case EMAIL_VERIFICATION -> "verify your email address";
        };
        return "EdTech Platform - " + emailSubject(purpose) + "\n\n"
                + "Your OTP Code: " + code + "\n\n"
                + "You requested an OTP to " + action + ". This code will expire in " + ttlMinutes() + " minutes.\n\n"
                + "For your security, do not share this code with anyone.\n\n"
                + "If you didn't request this code, please ignore this email or contact support.\n\n"
                + footer();
    }

    public String passwordChangedSubject() {
        return "Your EdTech password was changed";
    }

    public String passwordChangedText() {
        return "Your EdTech Platform password was just changed and all devices were signed out. "
                + "If this wasn't you, contact support immediately.";
    }

    private String smsAction(OtpPurpose purpose) {
        return switch (purpose) {
            case LOGIN -> "login to your account";
            case PASSWORD_RESET -> "reset your password";
            case EMAIL_VERIFICATION -> "verify your email";
        };
    }

    private long ttlMinutes() {
        return Math.max(1, verification.getTtl().toMinutes());
    }

    private String footer() {
        return "© " + clock.instant().atZone(ZoneOffset.UTC).getYear() + " EdTech Platform. All rights reserved.";
    }
}
