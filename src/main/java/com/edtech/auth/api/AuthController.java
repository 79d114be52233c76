package com.edtech.auth.api;

import com.edtech.auth.api.dto.AccessTokenResponse;
import com.edtech.auth.api.dto.AuthResponse;
import com.edtech.auth.api.dto.AuthUserResponse;
import com.edtech.auth.api.dto.ChangePasswordRequest;
import com.edtech.auth.api.dto.EmailVerificationRequest;
import com.edtech.auth.api.dto.ForgotPasswordRequest;
import com.edtech.auth.api.dto.LoginRequest;
import com.edtech.auth.api.dto.LogoutRequest;
import com.edtech.auth.api.dto.OtpLoginRequest;
import com.edtech.auth.api.dto.OtpRequest;
import com.edtech.auth.api.dto.OtpSentResponse;
import com.edtech.auth.api.dto.PasswordResetRequest;
import com.edtech.auth.api.dto.RegisterRequest;
import com.edtech.auth.api.dto.SessionResponse;
import com.edtech.auth.api.dto.TokenRefreshRequest;
import com.edtech.auth.api.dto.VerifyEmailRequest;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.ClientInfo;
import com.edtech.auth.model.LogoutCredential;
import com.edtech.auth.service.AuthService;
import com.edtech.auth.token.TokenCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 认证 API 控制器。
 * <p>
 * 暴露 REST 接口：注册、密码登录、验证码登录、刷新令牌、登出、找回/重置密码、邮箱验证、
 * 修改密码、当前用户与会话管理。
 * 需要登录的接口通过 `@AuthenticationPrincipal Jwt` 提取用户。
 * 客户端信息：从请求头解析 IP 与 UA，用于会话记录与审计。
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<AuthUserResponse> register(@Valid @RequestBody RegisterRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request, resolveClient(httpRequest)));
    }

    /**
     * 邮箱或用户名加密码登录，成功后签发 Access/Refresh Token。
     */
    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return authService.login(request, resolveClient(httpRequest));
    }

    @PostMapping("/otp/request")
    public OtpSentResponse requestOtp(@Valid @RequestBody OtpRequest request) {
        return authService.requestOtp(request.destination());
    }

    @PostMapping("/otp/login")
    public AuthResponse loginWithOtp(@Valid @RequestBody OtpLoginRequest request, HttpServletRequest httpRequest) {
        return authService.loginWithOtp(request.destination(), request.code(), request.challengeId(), resolveClient(httpRequest));
    }

    /**
     * 使用 Refresh Token 获取新的 Access Token。
     */
    @PostMapping("/token/refresh")
    public AccessTokenResponse refresh(@Valid @RequestBody TokenRefreshRequest request) {
        return authService.refresh(request.refreshToken());
    }

    /**
     * 登出：吊销提交的 Refresh Token 或 Access Token（二选一），返回 204。
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@RequestBody LogoutRequest request) {
        authService.logout(toCredential(request));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/password/forgot")
    public OtpSentResponse forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return authService.forgotPassword(request.destination());
    }

    /**
     * 使用验证码重置密码，该用户所有已签发令牌随之失效。
     */
    @PostMapping("/password/reset")
    public ResponseEntity<Void> resetPassword(@Valid @RequestBody PasswordResetRequest request, HttpServletRequest httpRequest) {
        authService.resetPassword(request, resolveClient(httpRequest));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/password/change")
    public AuthResponse changePassword(@AuthenticationPrincipal Jwt jwt,
                                       @Valid @RequestBody ChangePasswordRequest request,
                                       HttpServletRequest httpRequest) {
        return authService.changePassword(currentUserId(jwt), request.currentPassword(), request.newPassword(),
                resolveClient(httpRequest));
    }

    @PostMapping("/email/verification")
    public OtpSentResponse requestEmailVerification(@Valid @RequestBody EmailVerificationRequest request) {
        return authService.requestEmailVerification(request.email());
    }

    @PostMapping("/email/verify")
    public AuthUserResponse verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return authService.verifyEmail(request.email(), request.code(), request.challengeId());
    }

    @GetMapping("/me")
    public AuthUserResponse me(@AuthenticationPrincipal Jwt jwt) {
        return authService.me(currentUserId(jwt));
    }

    @GetMapping("/sessions")
    public List<SessionResponse> sessions(@AuthenticationPrincipal Jwt jwt) {
        return authService.listSessions(currentUserId(jwt), TokenCodec.extractSessionKey(jwt));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> revokeSession(@AuthenticationPrincipal Jwt jwt, @PathVariable long sessionId) {
        authService.revokeSession(currentUserId(jwt), sessionId);
        return ResponseEntity.noContent().build();
    }

    static LogoutCredential toCredential(LogoutRequest request) {
        boolean hasRefresh = request != null && StringUtils.hasText(request.refreshToken());
        boolean hasAccess = request != null && StringUtils.hasText(request.accessToken());
        if (hasRefresh == hasAccess) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Provide exactly one of refreshToken or accessToken");
        }
        return hasRefresh
                ? new LogoutCredential.RefreshToken(request.refreshToken())
                : new LogoutCredential.AccessToken(request.accessToken());
    }

    static long currentUserId(Jwt jwt) {
        Long userId = jwt != null ? TokenCodec.extractUserId(jwt) : null;
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        return userId;
    }

    private ClientInfo resolveClient(HttpServletRequest request) {
        String ip = extractClientIp(request);
        String ua = request.getHeader("User-Agent");
        return new ClientInfo(ip, ua);
    }

    /**
     * 提取客户端 IP 地址。
     * <p>
     * 优先使用代理头：`X-Forwarded-For`（取第一个）、`X-Real-IP`；否则回退到 `request.getRemoteAddr()`。
     */
    private String extractClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
