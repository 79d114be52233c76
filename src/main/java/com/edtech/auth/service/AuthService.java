package com.edtech.auth.service;

import com.edtech.auth.api.dto.AccessTokenResponse;
import com.edtech.auth.api.dto.AuthResponse;
import com.edtech.auth.api.dto.AuthUserResponse;
import com.edtech.auth.api.dto.LoginRequest;
import com.edtech.auth.api.dto.OtpSentResponse;
import com.edtech.auth.api.dto.PasswordResetRequest;
import com.edtech.auth.api.dto.RegisterRequest;
import com.edtech.auth.api.dto.SessionResponse;
import com.edtech.auth.api.dto.TokenResponse;
import com.edtech.auth.audit.LoginChannel;
import com.edtech.auth.audit.LoginLogService;
import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.ClientInfo;
import com.edtech.auth.model.IdentifierType;
import com.edtech.auth.model.LogoutCredential;
import com.edtech.auth.notification.OtpNotifier;
import com.edtech.auth.password.PasswordHasher;
import com.edtech.auth.password.PasswordPolicy;
import com.edtech.auth.session.RevocationReason;
import com.edtech.auth.session.SessionRecord;
import com.edtech.auth.session.SessionRegistry;
import com.edtech.auth.support.BoundedCallRunner;
import com.edtech.auth.token.IssuedToken;
import com.edtech.auth.token.TokenCodec;
import com.edtech.auth.token.TokenKind;
import com.edtech.auth.token.TokenPair;
import com.edtech.auth.token.TokenStatus;
import com.edtech.auth.token.TokenVerification;
import com.edtech.auth.util.IdentifierNormalizer;
import com.edtech.auth.util.IdentifierValidator;
import com.edtech.auth.util.Masking;
import com.edtech.auth.verification.IssuedOtp;
import com.edtech.auth.verification.OtpCheckResult;
import com.edtech.auth.verification.OtpPurpose;
import com.edtech.auth.verification.OtpService;
import com.edtech.user.domain.User;
import com.edtech.user.domain.UserRole;
import com.edtech.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 认证业务服务。
 * <p>
 * 职责：注册、密码登录、验证码登录、刷新令牌、登出、忘记/重置密码、邮箱验证、修改密码、
 * 会话管理与账号停用。
 * 安全策略：
 * - 标识格式校验与标准化（手机号/邮箱/用户名），校验先于任何写操作；
 * - 验证码状态检查（过期/错误/锁定/已使用）；
 * - 密码策略校验（长度与字符类型）；
 * - 吊销集合判定令牌有效性，重置密码、修改密码、停用账号后使该用户全部旧令牌失效；
 * - 验证码发送与找回密码对未注册目标同样保存挑战但不发送，响应与校验结果都不泄露注册状态。
 * 审计：记录注册/登录成功与失败，包含渠道、IP、UA。
 * 错误：业务异常原样返回；其他运行时异常在边界记录日志并映射为 {@link ErrorCode#INTERNAL_ERROR}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String TOKEN_TYPE_BEARER = "Bearer";
    private static final int AUTO_USERNAME_ATTEMPTS = 3;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final UserService userService;
    private final PasswordHasher passwordHasher;
    private final PasswordPolicy passwordPolicy;
    private final TokenCodec tokenCodec;
    private final SessionRegistry sessionRegistry;
    private final OtpService otpService;
    private final OtpNotifier otpNotifier;
    private final LoginLogService loginLogService;
    private final IdentifierNormalizer normalizer;
    private final BoundedCallRunner callRunner;
    private final AuthProperties authProperties;

    /**
     * 注册新用户。
     * <p>
     * 校验输入与唯一性后保存密码哈希并创建用户；开启邮箱验证时账号保持未激活并发送邮箱验证码。
     *
     * @param request    注册请求。
     * @param clientInfo 客户端信息，用于审计。
     * @return 公开的用户信息。
     * @throws BusinessException 输入不合法、密码不合规或邮箱/用户名/手机号冲突时抛出。
     */
    public AuthUserResponse register(RegisterRequest request, ClientInfo clientInfo) {
        return boundary("register", () -> {
            String email = normalizer.normalizeEmail(request.email());
            String username = normalizer.normalizeUsername(request.username());
            String phone = StringUtils.hasText(request.phone()) ? normalizer.normalizePhone(request.phone()) : null;
            if (!IdentifierValidator.isValidEmail(email)) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid email address");
            }
            if (!IdentifierValidator.isValidUsername(username)) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR,
                        "Username must be 3-20 characters of letters, digits, '_' or '.'");
            }
            if (phone != null && !IdentifierValidator.isValidPhone(phone)) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid phone number");
            }
            if (!StringUtils.hasText(request.firstName()) || !StringUtils.hasText(request.lastName())) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "First and last name are required");
            }
            UserRole role = parseSelfServiceRole(request.role());
            passwordPolicy.validate(request.password());

            if (callRunner.store("user.exists-email", () -> userService.existsByEmail(email))) {
                throw new BusinessException(ErrorCode.EMAIL_EXISTS);
            }
            if (callRunner.store("user.exists-username", () -> userService.existsByUsername(username))) {
                throw new BusinessException(ErrorCode.USERNAME_EXISTS);
            }
            if (phone != null && callRunner.store("user.exists-phone", () -> userService.existsByPhone(phone))) {
                throw new BusinessException(ErrorCode.PHONE_EXISTS);
            }

            boolean requireVerification = authProperties.getRegistration().isRequireEmailVerification();
            String passwordHash = callRunner.hash("password.hash", () -> passwordHasher.hash(request.password()));
            User user = User.builder()
                    .email(email)
                    .username(username)
                    .phone(phone)
                    .firstName(request.firstName().trim())
                    .lastName(request.lastName().trim())
                    .passwordHash(passwordHash)
                    .role(role)
                    .active(!requireVerification)
                    .emailVerified(false)
                    .build();
            User created = callRunner.store("user.create", () -> userService.createUser(user));
            loginLogService.recordSuccess(created.getId(), email, LoginChannel.REGISTER, clientInfo);
            log.info("User registered userId={} role={} pendingVerification={}", created.getId(), role, requireVerification);

            if (requireVerification) {
                try {
                    issueAndDeliver(IdentifierType.EMAIL, email, OtpPurpose.EMAIL_VERIFICATION);
                } catch (BusinessException ex) {
                    log.warn("Email verification code not sent after registration userId={} reason={}",
                            created.getId(), ex.getErrorCode());
                }
            }
            return mapUser(created);
        });
    }

    /**
     * 使用邮箱或用户名加密码登录。
     *
     * @throws BusinessException 凭证错误（{@link ErrorCode#INVALID_CREDENTIALS}）或账号停用时抛出。
     */
    public AuthResponse login(LoginRequest request, ClientInfo clientInfo) {
        return boundary("login", () -> {
            boolean hasEmail = StringUtils.hasText(request.email());
            boolean hasUsername = StringUtils.hasText(request.username());
            if (hasEmail == hasUsername) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Provide exactly one of email or username");
            }
            String email = hasEmail ? normalizer.normalizeEmail(request.email()) : null;
            String username = hasUsername ? normalizer.normalizeUsername(request.username()) : null;
            String identifier = hasEmail ? email : username;

            Optional<User> found = callRunner.store("user.find-login",
                    () -> userService.findByEmailOrUsername(email, username));
            if (found.isEmpty()) {
                loginLogService.recordFailure(null, identifier, LoginChannel.PASSWORD, clientInfo,
                        ErrorCode.INVALID_CREDENTIALS.getCode());
                throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
            }
            User user = found.get();
            boolean matches = callRunner.hash("password.verify",
                    () -> passwordHasher.verify(request.password(), user.getPasswordHash()));
            if (!matches) {
                loginLogService.recordFailure(user.getId(), identifier, LoginChannel.PASSWORD, clientInfo,
                        ErrorCode.INVALID_CREDENTIALS.getCode());
                throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
            }
            if (!user.isActive()) {
                loginLogService.recordFailure(user.getId(), identifier, LoginChannel.PASSWORD, clientInfo,
                        ErrorCode.ACCOUNT_DISABLED.getCode());
                throw new BusinessException(ErrorCode.ACCOUNT_DISABLED);
            }
            return startSession(user, identifier, LoginChannel.PASSWORD, clientInfo);
        });
    }

    /**
     * 发送登录验证码。
     * <p>
     * 未注册目标且未开启自动注册时只保存挑战不发送，响应形状相同。
     *
     * @param destination 邮箱或手机号。
     * @return 通道、掩码目标、挑战 ID 与有效秒数。
     * @throws BusinessException 格式错误、发送过频或投递失败时抛出。
     */
    public OtpSentResponse requestOtp(String destination) {
        return boundary("requestOtp", () -> {
            Destination target = resolveDestination(destination);
            otpService.acquireSendSlot(target.value(), OtpPurpose.LOGIN);
            boolean known = findByDestination(target).isPresent();
            if (!known && !authProperties.getOtpLogin().isAutoRegister()) {
                log.info("Login OTP requested for unknown destination={}", Masking.mask(target.value()));
                return decoyChallenge(target, OtpPurpose.LOGIN);
            }
            return issueAndDeliver(target.channel(), target.value(), OtpPurpose.LOGIN);
        });
    }

    /**
     * 使用验证码登录；目标未注册且开启自动注册时创建学生账号。
     *
     * @param challengeId 可选的挑战 ID，与当前挑战不一致时视为过期。
     */
    public AuthResponse loginWithOtp(String destination, String code, String challengeId, ClientInfo clientInfo) {
        return boundary("loginWithOtp", () -> {
            Destination target = resolveDestination(destination);
            OtpCheckResult result = otpService.verify(target.value(), OtpPurpose.LOGIN, code, challengeId);
            if (!result.isSuccess()) {
                loginLogService.recordFailure(null, target.value(), LoginChannel.OTP, clientInfo, result.status().name());
                throw OtpService.toException(result);
            }
            Optional<User> found = findByDestination(target);
            User user;
            if (found.isPresent()) {
                user = found.get();
            } else if (authProperties.getOtpLogin().isAutoRegister()) {
                user = autoRegister(target);
                loginLogService.recordSuccess(user.getId(), target.value(), LoginChannel.REGISTER, clientInfo);
            } else {
                throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
            }
            if (!user.isActive()) {
                loginLogService.recordFailure(user.getId(), target.value(), LoginChannel.OTP, clientInfo,
                        ErrorCode.ACCOUNT_DISABLED.getCode());
                throw new BusinessException(ErrorCode.ACCOUNT_DISABLED);
            }
            return startSession(user, target.value(), LoginChannel.OTP, clientInfo);
        });
    }

    /**
     * 使用刷新令牌签发新的访问令牌；刷新令牌本身不轮换。
     *
     * @throws BusinessException 令牌无效或已吊销（INVALID_TOKEN）、已过期（EXPIRED_TOKEN）、账号停用时抛出。
     */
    public AccessTokenResponse refresh(String refreshToken) {
        return boundary("refresh", () -> {
            TokenVerification verification = tokenCodec.verify(refreshToken, TokenKind.REFRESH);
            if (verification.status() == TokenStatus.INVALID) {
                throw new BusinessException(ErrorCode.INVALID_TOKEN);
            }
            if (verification.status() == TokenStatus.EXPIRED) {
                throw new BusinessException(ErrorCode.EXPIRED_TOKEN);
            }
            if (sessionRegistry.isRevoked(verification)) {
                log.info("Revoked refresh token presented jti={} userId={}", verification.tokenId(), verification.userId());
                throw new BusinessException(ErrorCode.INVALID_TOKEN);
            }
            User user = callRunner.store("user.find", () -> userService.findById(verification.userId()))
                    .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_TOKEN));
            if (!user.isActive()) {
                throw new BusinessException(ErrorCode.ACCOUNT_DISABLED);
            }
            IssuedToken access = tokenCodec.issueAccess(user, verification.sessionKey(),
                    sessionRegistry.issuanceFloor(user.getId()));
            return new AccessTokenResponse(access.token(), access.expiresAt(), TOKEN_TYPE_BEARER);
        });
    }

    /**
     * 登出：吊销所出示的令牌，并结束其所属会话。
     * <p>
     * 已过期但签名有效的令牌同样接受。
     *
     * @throws BusinessException 令牌格式或签名无效（INVALID_TOKEN）、已被吊销（TOKEN_ALREADY_INVALIDATED）时抛出。
     */
    public void logout(LogoutCredential credential) {
        boundary("logout", () -> {
            if (credential == null || !StringUtils.hasText(credential.token())) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Provide exactly one of refreshToken or accessToken");
            }
            TokenKind kind = credential instanceof LogoutCredential.RefreshToken ? TokenKind.REFRESH : TokenKind.ACCESS;
            TokenVerification verification = tokenCodec.verify(credential.token(), kind);
            if (!verification.isAuthentic()) {
                throw new BusinessException(ErrorCode.INVALID_TOKEN);
            }
            if (sessionRegistry.isRevoked(verification)
                    || !sessionRegistry.endSession(verification, RevocationReason.LOGOUT)) {
                throw new BusinessException(ErrorCode.TOKEN_ALREADY_INVALIDATED);
            }
            log.info("Logout userId={} kind={} jti={}", verification.userId(), kind, verification.tokenId());
            return null;
        });
    }

    /**
     * 找回密码：向已注册的邮箱或手机号发送重置验证码；未注册目标只保存挑战不发送。
     */
    public OtpSentResponse forgotPassword(String destination) {
        return boundary("forgotPassword", () -> {
            Destination target = resolveDestination(destination);
            otpService.acquireSendSlot(target.value(), OtpPurpose.PASSWORD_RESET);
            if (findByDestination(target).isEmpty()) {
                log.info("Password reset requested for unknown destination={}", Masking.mask(target.value()));
                return decoyChallenge(target, OtpPurpose.PASSWORD_RESET);
            }
            return issueAndDeliver(target.channel(), target.value(), OtpPurpose.PASSWORD_RESET);
        });
    }

    /**
     * 使用验证码重置密码，并使该用户全部旧令牌失效。
     *
     * @throws BusinessException 密码不合规、验证码失败时抛出。
     */
    public void resetPassword(PasswordResetRequest request, ClientInfo clientInfo) {
        boundary("resetPassword", () -> {
            Destination target = resolveDestination(request.destination());
            passwordPolicy.validate(request.newPassword());
            OtpCheckResult result = otpService.verify(target.value(), OtpPurpose.PASSWORD_RESET,
                    request.code(), request.challengeId());
            if (!result.isSuccess()) {
                throw OtpService.toException(result);
            }
            User user = findByDestination(target)
                    .orElseThrow(() -> new BusinessException(ErrorCode.OTP_EXPIRED));
            user.setPasswordHash(callRunner.hash("password.hash", () -> passwordHasher.hash(request.newPassword())));
            callRunner.storeRun("user.update-password", () -> userService.updatePassword(user));
            sessionRegistry.revokeAllForUser(user.getId(), RevocationReason.PASSWORD_RESET);
            loginLogService.recordSuccess(user.getId(), target.value(), LoginChannel.PASSWORD_RESET, clientInfo);
            log.info("Password reset userId={}", user.getId());
            otpNotifier.sendPasswordChangedNotice(target.channel(), target.value());
            return null;
        });
    }

    /**
     * 发送邮箱验证码；邮箱未注册或已验证时只保存挑战不发送。
     */
    public OtpSentResponse requestEmailVerification(String email) {
        return boundary("requestEmailVerification", () -> {
            String normalized = normalizer.normalizeEmail(email);
            if (!IdentifierValidator.isValidEmail(normalized)) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid email address");
            }
            Destination target = new Destination(IdentifierType.EMAIL, normalized);
            otpService.acquireSendSlot(normalized, OtpPurpose.EMAIL_VERIFICATION);
            Optional<User> user = findByDestination(target);
            if (user.isEmpty() || user.get().isEmailVerified()) {
                return decoyChallenge(target, OtpPurpose.EMAIL_VERIFICATION);
            }
            return issueAndDeliver(IdentifierType.EMAIL, normalized, OtpPurpose.EMAIL_VERIFICATION);
        });
    }

    /**
     * 校验邮箱验证码，标记邮箱已验证；待验证的新账号同时被激活。
     */
    public AuthUserResponse verifyEmail(String email, String code, String challengeId) {
        return boundary("verifyEmail", () -> {
            String normalized = normalizer.normalizeEmail(email);
            if (!IdentifierValidator.isValidEmail(normalized)) {
                throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Invalid email address");
            }
            OtpCheckResult result = otpService.verify(normalized, OtpPurpose.EMAIL_VERIFICATION, code, challengeId);
            if (!result.isSuccess()) {
                throw OtpService.toException(result);
            }
            User user = callRunner.store("user.find-email", () -> userService.findByEmail(normalized))
                    .orElseThrow(() -> new BusinessException(ErrorCode.OTP_EXPIRED));
            callRunner.storeRun("user.mark-email-verified", () -> userService.markEmailVerified(user.getId()));
            log.info("Email verified userId={}", user.getId());
            return mapUser(loadUser(user.getId()));
        });
    }

    /**
     * 修改密码：校验当前密码后更新，吊销该用户全部旧令牌并签发新会话。
     */
    public AuthResponse changePassword(long userId, String currentPassword, String newPassword, ClientInfo clientInfo) {
        return boundary("changePassword", () -> {
            passwordPolicy.validate(newPassword);
            User user = loadUser(userId);
            if (!user.isActive()) {
                throw new BusinessException(ErrorCode.ACCOUNT_DISABLED);
            }
            boolean matches = callRunner.hash("password.verify",
                    () -> passwordHasher.verify(currentPassword, user.getPasswordHash()));
            if (!matches) {
                throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
            }
            user.setPasswordHash(callRunner.hash("password.hash", () -> passwordHasher.hash(newPassword)));
            callRunner.storeRun("user.update-password", () -> userService.updatePassword(user));
            sessionRegistry.revokeAllForUser(userId, RevocationReason.PASSWORD_CHANGED);
            log.info("Password changed userId={}", userId);
            if (StringUtils.hasText(user.getEmail())) {
                otpNotifier.sendPasswordChangedNotice(IdentifierType.EMAIL, user.getEmail());
            } else {
                otpNotifier.sendPasswordChangedNotice(IdentifierType.PHONE, user.getPhone());
            }
            String identifier = user.getEmail() != null ? user.getEmail() : user.getUsername();
            return startSession(user, identifier, LoginChannel.PASSWORD, clientInfo);
        });
    }

    /**
     * 查询用户概要信息。
     *
     * @throws BusinessException 用户不存在时抛出。
     */
    public AuthUserResponse me(long userId) {
        return boundary("me", () -> mapUser(loadUser(userId)));
    }

    /**
     * 列出用户的有效会话。
     *
     * @param currentSessionKey 当前访问令牌的会话键，用于标记当前会话，可为空。
     */
    public List<SessionResponse> listSessions(long userId, String currentSessionKey) {
        return boundary("listSessions", () -> sessionRegistry.listActiveSessions(userId).stream()
                .map(session -> mapSession(session, currentSessionKey))
                .toList());
    }

    /**
     * 吊销当前用户的指定会话。
     *
     * @throws BusinessException 会话不存在、不属于该用户或已吊销时抛出 {@link ErrorCode#SESSION_NOT_FOUND}。
     */
    public void revokeSession(long userId, long sessionId) {
        boundary("revokeSession", () -> {
            if (!sessionRegistry.revokeSession(userId, sessionId)) {
                throw new BusinessException(ErrorCode.SESSION_NOT_FOUND);
            }
            log.info("Session revoked userId={} sessionId={}", userId, sessionId);
            return null;
        });
    }

    /**
     * 停用账号并吊销其全部令牌。
     *
     * @param actorId 执行操作的管理员 ID，仅用于日志。
     */
    public void deactivateUser(long actorId, long userId) {
        boundary("deactivateUser", () -> {
            User user = loadUser(userId);
            callRunner.storeRun("user.deactivate", () -> userService.deactivate(user.getId()));
            sessionRegistry.revokeAllForUser(user.getId(), RevocationReason.ACCOUNT_DEACTIVATED);
            log.info("User deactivated userId={} actorId={}", userId, actorId);
            return null;
        });
    }

    private AuthResponse startSession(User user, String identifier, LoginChannel channel, ClientInfo clientInfo) {
        TokenPair tokens = tokenCodec.issuePair(user, sessionRegistry.issuanceFloor(user.getId()));
        Optional<Long> sessionId = sessionRegistry.createSession(user.getId(), tokens, clientInfo);
        try {
            callRunner.storeRun("user.update-last-login", () -> userService.updateLastLogin(user.getId()));
        } catch (BusinessException | DataAccessException ex) {
            log.warn("Last login not updated userId={} reason={}", user.getId(), ex.getMessage());
        }
        loginLogService.recordSuccess(user.getId(), identifier, channel, clientInfo);
        log.info("Login success userId={} channel={} accessJti={}", user.getId(), channel, tokens.access().tokenId());
        return new AuthResponse(mapUser(user), mapToken(tokens), sessionId.orElse(null));
    }

    private OtpSentResponse issueAndDeliver(IdentifierType channel, String destination, OtpPurpose purpose) {
        IssuedOtp otp = otpService.issue(channel, destination, purpose);
        try {
            otpNotifier.deliverOtp(channel, destination, purpose, otp.plaintextCode());
        } catch (BusinessException ex) {
            invalidateQuietly(destination, purpose);
            throw ex;
        }
        return new OtpSentResponse(channel, Masking.mask(destination), otp.challengeId(), ttlSeconds());
    }

    /**
     * 为未注册目标保存一个不发送的挑战，错误码、错误次数与锁定行为与已注册目标一致。
     */
    private OtpSentResponse decoyChallenge(Destination target, OtpPurpose purpose) {
        IssuedOtp otp = otpService.issue(target.channel(), target.value(), purpose);
        return new OtpSentResponse(target.channel(), Masking.mask(target.value()), otp.challengeId(), ttlSeconds());
    }

    private void invalidateQuietly(String destination, OtpPurpose purpose) {
        try {
            otpService.invalidate(destination, purpose);
        } catch (BusinessException ex) {
            log.warn("Undelivered OTP not invalidated purpose={} destination={} reason={}",
                    purpose, Masking.mask(destination), ex.getErrorCode());
        }
    }

    private User autoRegister(Destination target) {
        BusinessException lastConflict = null;
        for (int attempt = 0; attempt < AUTO_USERNAME_ATTEMPTS; attempt++) {
            User user = User.builder()
                    .email(target.channel() == IdentifierType.EMAIL ? target.value() : null)
                    .phone(target.channel() == IdentifierType.PHONE ? target.value() : null)
                    .username(generateUsername())
                    .role(UserRole.STUDENT)
                    .active(true)
                    .emailVerified(target.channel() == IdentifierType.EMAIL)
                    .build();
            try {
                User created = callRunner.store("user.create", () -> userService.createUser(user));
                log.info("User auto-registered via OTP userId={} channel={}", created.getId(), target.channel());
                return created;
            } catch (BusinessException ex) {
                if (ex.getErrorCode() != ErrorCode.USERNAME_EXISTS) {
                    throw ex;
                }
                lastConflict = ex;
            }
        }
        throw lastConflict;
    }

    private Destination resolveDestination(String raw) {
        if (!StringUtils.hasText(raw)) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Email or phone is required");
        }
        IdentifierType type = IdentifierType.detect(raw.trim());
        String normalized = normalizer.normalize(type, raw);
        boolean valid = type == IdentifierType.EMAIL
                ? IdentifierValidator.isValidEmail(normalized)
                : IdentifierValidator.isValidPhone(normalized);
        if (!valid) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR,
                    type == IdentifierType.EMAIL ? "Invalid email address" : "Invalid phone number");
        }
        return new Destination(type, normalized);
    }

    private Optional<User> findByDestination(Destination target) {
        return switch (target.channel()) {
            case EMAIL -> callRunner.store("user.find-email", () -> userService.findByEmail(target.value()));
            case PHONE -> callRunner.store("user.find-phone", () -> userService.findByPhone(target.value()));
        };
    }

    private User loadUser(long userId) {
        return callRunner.store("user.find", () -> userService.findById(userId))
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
    }

    private UserRole parseSelfServiceRole(String value) {
        UserRole role;
        try {
            role = UserRole.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Unsupported role");
        }
        if (role == UserRole.ADMIN || role == UserRole.SUPER_ADMIN) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Role cannot be self-assigned");
        }
        return role;
    }

    private long ttlSeconds() {
        return authProperties.getVerification().getTtl().toSeconds();
    }

    private static String generateUsername() {
        byte[] bytes = new byte[4];
        RANDOM.nextBytes(bytes);
        return "user_" + HexFormat.of().formatHex(bytes);
    }

    /**
     * 编排层边界：业务异常原样返回，其余运行时异常记录后映射为内部错误。
     */
    private <T> T boundary(String operation, Supplier<T> flow) {
        try {
            return flow.get();
        } catch (BusinessException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Auth flow failed op={} type={}", operation, ex.getClass().getSimpleName(), ex);
            throw new BusinessException(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getDefaultMessage(), ex);
        }
    }

    private AuthUserResponse mapUser(User user) {
        return new AuthUserResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getPhone(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole(),
                user.isActive(),
                user.isEmailVerified(),
                user.getLastLoginAt(),
                user.getCreatedAt()
        );
    }

    private TokenResponse mapToken(TokenPair tokens) {
        return new TokenResponse(
                tokens.access().token(),
                tokens.access().expiresAt(),
                tokens.refresh().token(),
                tokens.refresh().expiresAt(),
                TOKEN_TYPE_BEARER
        );
    }

    private SessionResponse mapSession(SessionRecord session, String currentSessionKey) {
        boolean current = currentSessionKey != null && currentSessionKey.equals(session.getRefreshTokenId());
        return new SessionResponse(session.getId(), session.getDeviceInfo(), session.getSourceIp(),
                session.getIssuedAt(), session.getExpiresAt(), current);
    }

    private record Destination(IdentifierType channel, String value) {
    }
}
