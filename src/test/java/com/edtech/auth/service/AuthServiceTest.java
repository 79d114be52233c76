package com.edtech.auth.service;

import com.edtech.auth.api.dto.AccessTokenResponse;
import com.edtech.auth.api.dto.AuthResponse;
import com.edtech.auth.api.dto.AuthUserResponse;
import com.edtech.auth.api.dto.LoginRequest;
import com.edtech.auth.api.dto.OtpSentResponse;
import com.edtech.auth.api.dto.PasswordResetRequest;
import com.edtech.auth.api.dto.RegisterRequest;
import com.edtech.auth.audit.LoginLog;
import com.edtech.auth.audit.LoginLogMapper;
import com.edtech.auth.audit.LoginLogService;
import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import com.edtech.auth.model.ClientInfo;
import com.edtech.auth.model.IdentifierType;
import com.edtech.auth.model.LogoutCredential;
import com.edtech.auth.notification.OtpMessageFormatter;
import com.edtech.auth.notification.OtpNotifier;
import com.edtech.auth.password.BCryptPasswordHasher;
import com.edtech.auth.password.PasswordPolicy;
import com.edtech.auth.session.InMemoryRevocationStore;
import com.edtech.auth.session.SessionRegistry;
import com.edtech.auth.support.BoundedCallRunner;
import com.edtech.auth.token.TokenCodec;
import com.edtech.auth.token.TokenKind;
import com.edtech.auth.token.TokenStatus;
import com.edtech.auth.token.TokenVerification;
import com.edtech.auth.util.IdentifierNormalizer;
import com.edtech.auth.verification.InMemoryOtpChallengeStore;
import com.edtech.auth.verification.OtpCodeHasher;
import com.edtech.auth.verification.OtpService;
import com.edtech.support.AuthTestFixtures;
import com.edtech.support.InMemorySessionMapper;
import com.edtech.support.InMemoryUserService;
import com.edtech.support.MutableClock;
import com.edtech.support.RecordingNotificationSender;
import com.edtech.user.domain.User;
import com.edtech.user.domain.UserRole;
import com.edtech.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class AuthServiceTest {

    private static final String EMAIL = "alice@example.com";
    private static final String PASSWORD = "Password123";
    private static final String PHONE = "+15551234567";
    private static final ClientInfo CLIENT = new ClientInfo("203.0.113.7", "JUnit");

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private final RecordingNotificationSender sender = new RecordingNotificationSender();
    private final LoginLogMapper loginLogMapper = mock(LoginLogMapper.class);
    private AuthProperties properties;
    private TokenCodec tokenCodec;
    private InMemoryUserService userService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        properties = AuthTestFixtures.properties();
        userService = new InMemoryUserService(clock);
        authService = newService(userService);
    }

    private AuthService newService(UserService users) {
        BoundedCallRunner callRunner = AuthTestFixtures.callRunner(properties);
        tokenCodec = AuthTestFixtures.tokenCodec(properties, clock);
        SessionRegistry sessionRegistry = new SessionRegistry(new InMemoryRevocationStore(clock),
                new InMemorySessionMapper(), callRunner, properties, clock);
        OtpService otpService = new OtpService(new InMemoryOtpChallengeStore(), new OtpCodeHasher(properties),
                callRunner, properties, clock);
        OtpNotifier notifier = new OtpNotifier(sender, new OtpMessageFormatter(properties, clock), callRunner);
        return new AuthService(
                users,
                new BCryptPasswordHasher(new BCryptPasswordEncoder(4)),
                new PasswordPolicy(properties),
                tokenCodec,
                sessionRegistry,
                otpService,
                notifier,
                new LoginLogService(loginLogMapper, clock),
                new IdentifierNormalizer(properties),
                callRunner,
                properties);
    }

    @Test
    void registerCreatesActiveStudentByDefault() {
        AuthUserResponse user = register(EMAIL, "alice");

        assertThat(user.id()).isNotNull();
        assertThat(user.email()).isEqualTo(EMAIL);
        assertThat(user.role()).isEqualTo(UserRole.STUDENT);
        assertThat(user.active()).isTrue();
        assertThat(user.emailVerified()).isFalse();
        assertThat(userService.findById(user.id()).orElseThrow().getPasswordHash())
                .isNotBlank()
                .isNotEqualTo(PASSWORD);
    }

    @Test
    void registerNormalizesEmailAndUsername() {
        AuthUserResponse user = authService.register(new RegisterRequest(" Alice@Example.COM ", "Alice_01", PASSWORD,
                "Alice", "Doe", null, "instructor"), CLIENT);

        assertThat(user.email()).isEqualTo(EMAIL);
        assertThat(user.username()).isEqualTo("alice_01");
        assertThat(user.role()).isEqualTo(UserRole.INSTRUCTOR);
    }

    @Test
    void registerRejectsDuplicateEmailAndUsername() {
        register(EMAIL, "alice");

        assertError(ErrorCode.EMAIL_EXISTS, () -> register(EMAIL, "alice2"));
        assertError(ErrorCode.USERNAME_EXISTS, () -> register("other@example.com", "alice"));
    }

    @Test
    void registerRejectsWeakPassword() {
        assertError(ErrorCode.PASSWORD_POLICY_VIOLATION, () -> authService.register(
                new RegisterRequest(EMAIL, "alice", "short", "Alice", "Doe", null, null), CLIENT));
        assertThat(userService.existsByEmail(EMAIL)).isFalse();
    }

    @Test
    void registerRejectsSelfAssignedAdminRole() {
        assertError(ErrorCode.VALIDATION_ERROR, () -> authService.register(
                new RegisterRequest(EMAIL, "alice", PASSWORD, "Alice", "Doe", null, "admin"), CLIENT));
    }

    @Test
    void registerRejectsMalformedPhone() {
        assertError(ErrorCode.VALIDATION_ERROR, () -> authService.register(
                new RegisterRequest(EMAIL, "alice", PASSWORD, "Alice", "Doe", "12-34", null), CLIENT));
    }

    @Test
    void loginIssuesTokensCarryingUserAndRole() {
        AuthUserResponse registered = register(EMAIL, "alice");

        AuthResponse response = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);

        assertThat(response.user().id()).isEqualTo(registered.id());
        assertThat(response.token().tokenType()).isEqualTo("Bearer");
        TokenVerification access = tokenCodec.verify(response.token().accessToken(), TokenKind.ACCESS);
        assertThat(access.status()).isEqualTo(TokenStatus.VALID);
        assertThat(access.userId()).isEqualTo(registered.id());
        assertThat(access.role()).isEqualTo(UserRole.STUDENT);
        assertThat(tokenCodec.verify(response.token().refreshToken(), TokenKind.REFRESH).isValid()).isTrue();
        assertThat(userService.findById(registered.id()).orElseThrow().getLastLoginAt()).isEqualTo(clock.instant());
    }

    @Test
    void loginByUsernameIgnoresCase() {
        register(EMAIL, "alice");

        AuthResponse response = authService.login(new LoginRequest(null, "ALICE", PASSWORD), CLIENT);

        assertThat(response.user().username()).isEqualTo("alice");
    }

    @Test
    void loginFailuresDoNotRevealWhichPartWasWrong() {
        register(EMAIL, "alice");

        BusinessException wrongPassword = assertThrows(BusinessException.class,
                () -> authService.login(new LoginRequest(EMAIL, null, "Wrong12345"), CLIENT));
        BusinessException unknownUser = assertThrows(BusinessException.class,
                () -> authService.login(new LoginRequest("nobody@example.com", null, PASSWORD), CLIENT));

        assertThat(wrongPassword.getErrorCode()).isEqualTo(ErrorCode.INVALID_CREDENTIALS);
        assertThat(unknownUser.getErrorCode()).isEqualTo(ErrorCode.INVALID_CREDENTIALS);
        assertThat(unknownUser.getMessage()).isEqualTo(wrongPassword.getMessage());
    }

    @Test
    void failedLoginIsAuditedWithMaskedIdentifier() {
        register(EMAIL, "alice");

        assertError(ErrorCode.INVALID_CREDENTIALS,
                () -> authService.login(new LoginRequest(EMAIL, null, "Wrong12345"), CLIENT));

        ArgumentCaptor<LoginLog> captor = ArgumentCaptor.forClass(LoginLog.class);
        verify(loginLogMapper, atLeastOnce()).insert(captor.capture());
        LoginLog failure = captor.getAllValues().get(captor.getAllValues().size() - 1);
        assertThat(failure.getStatus()).isEqualTo("FAILED");
        assertThat(failure.getFailureCode()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(failure.getIdentifier()).doesNotContain("alice@");
        assertThat(failure.getIp()).isEqualTo("203.0.113.7");
    }

    @Test
    void loginRequiresExactlyOneIdentifier() {
        assertError(ErrorCode.VALIDATION_ERROR,
                () -> authService.login(new LoginRequest(EMAIL, "alice", PASSWORD), CLIENT));
        assertError(ErrorCode.VALIDATION_ERROR,
                () -> authService.login(new LoginRequest(null, " ", PASSWORD), CLIENT));
    }

    @Test
    void deactivatedAccountCannotLogIn() {
        AuthUserResponse user = register(EMAIL, "alice");
        userService.deactivate(user.id());

        assertError(ErrorCode.ACCOUNT_DISABLED,
                () -> authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT));
    }

    @Test
    void refreshIssuesNewAccessTokenOnly() {
        register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);

        clock.advance(Duration.ofMinutes(1));
        AccessTokenResponse refreshed = authService.refresh(login.token().refreshToken());

        assertThat(refreshed.accessToken()).isNotEqualTo(login.token().accessToken());
        assertThat(refreshed.accessTokenExpiresAt()).isAfter(login.token().accessTokenExpiresAt());
        assertThat(tokenCodec.verify(refreshed.accessToken(), TokenKind.ACCESS).isValid()).isTrue();
        assertThat(authService.refresh(login.token().refreshToken()).accessToken()).isNotBlank();
    }

    @Test
    void refreshRejectsAccessTokenAndExpiredRefreshToken() {
        register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(login.token().accessToken()));
        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh("garbage"));

        clock.advance(Duration.ofDays(7));
        assertError(ErrorCode.EXPIRED_TOKEN, () -> authService.refresh(login.token().refreshToken()));
    }

    @Test
    void logoutTwiceReportsAlreadyInvalidated() {
        register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        LogoutCredential credential = new LogoutCredential.AccessToken(login.token().accessToken());

        authService.logout(credential);

        assertError(ErrorCode.TOKEN_ALREADY_INVALIDATED, () -> authService.logout(credential));
    }

    @Test
    void logoutWithRefreshTokenBlocksFurtherRefresh() {
        register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);

        authService.logout(new LogoutCredential.RefreshToken(login.token().refreshToken()));

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(login.token().refreshToken()));
    }

    @Test
    void logoutWithOriginalAccessTokenEndsRefreshedSession() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofMinutes(1));
        AccessTokenResponse refreshed = authService.refresh(login.token().refreshToken());

        authService.logout(new LogoutCredential.AccessToken(login.token().accessToken()));

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(login.token().refreshToken()));
        assertError(ErrorCode.TOKEN_ALREADY_INVALIDATED,
                () -> authService.logout(new LogoutCredential.AccessToken(refreshed.accessToken())));
        assertThat(authService.listSessions(user.id(), null)).isEmpty();
    }

    @Test
    void logoutWithRefreshTokenEndsEveryAccessTokenOfTheSession() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofMinutes(1));
        AccessTokenResponse first = authService.refresh(login.token().refreshToken());
        clock.advance(Duration.ofMinutes(1));
        AccessTokenResponse second = authService.refresh(login.token().refreshToken());

        authService.logout(new LogoutCredential.RefreshToken(login.token().refreshToken()));

        for (String access : new String[]{login.token().accessToken(), first.accessToken(), second.accessToken()}) {
            assertError(ErrorCode.TOKEN_ALREADY_INVALIDATED,
                    () -> authService.logout(new LogoutCredential.AccessToken(access)));
        }
        assertThat(authService.listSessions(user.id(), null)).isEmpty();
    }

    @Test
    void listSessionsMarksTheCallersSession() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse first = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofSeconds(1));
        authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        String sessionKey = tokenCodec.verify(first.token().accessToken(), TokenKind.ACCESS).sessionKey();

        assertThat(authService.listSessions(user.id(), sessionKey))
                .hasSize(2)
                .filteredOn(session -> session.current())
                .singleElement()
                .satisfies(session -> assertThat(session.id()).isEqualTo(first.sessionId()));
    }

    @Test
    void logoutAcceptsExpiredButAuthenticToken() {
        register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofHours(1));

        authService.logout(new LogoutCredential.AccessToken(login.token().accessToken()));

        assertError(ErrorCode.INVALID_TOKEN,
                () -> authService.logout(new LogoutCredential.AccessToken("not-a-token")));
    }

    @Test
    void passwordResetRevokesEarlierSessions() {
        register(EMAIL, "alice");
        AuthResponse before = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofSeconds(5));

        OtpSentResponse sent = authService.forgotPassword(EMAIL);
        String code = sender.lastCode(EMAIL);
        authService.resetPassword(new PasswordResetRequest(EMAIL, code, "NewPassword456", sent.challengeId()), CLIENT);

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(before.token().refreshToken()));
        assertError(ErrorCode.INVALID_CREDENTIALS,
                () -> authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT));
        AuthResponse after = authService.login(new LoginRequest(EMAIL, null, "NewPassword456"), CLIENT);
        assertThat(authService.refresh(after.token().refreshToken()).accessToken()).isNotBlank();
        assertThat(sender.sent()).anySatisfy(message ->
                assertThat(message.subject()).isEqualTo("Your EdTech password was changed"));
    }

    @Test
    void passwordResetWithWrongCodeKeepsPassword() {
        register(EMAIL, "alice");
        authService.forgotPassword(EMAIL);
        String wrong = sender.lastCode(EMAIL).equals("000000") ? "111111" : "000000";

        assertError(ErrorCode.OTP_MISMATCH, () -> authService.resetPassword(
                new PasswordResetRequest(EMAIL, wrong, "NewPassword456", null), CLIENT));
        assertThat(authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT).token()).isNotNull();
    }

    @Test
    void forgotPasswordForUnknownDestinationLooksTheSame() {
        register(EMAIL, "alice");

        OtpSentResponse known = authService.forgotPassword(EMAIL);
        OtpSentResponse unknown = authService.forgotPassword("ghost@example.com");

        assertThat(unknown.channel()).isEqualTo(known.channel());
        assertThat(unknown.expiresInSeconds()).isEqualTo(known.expiresInSeconds());
        assertThat(unknown.challengeId()).isNotBlank();
        assertThat(sender.sent()).noneMatch(message -> message.destination().equals("ghost@example.com"));
    }

    @Test
    void resetCodeErrorsDoNotRevealRegistration() {
        register(EMAIL, "alice");
        String ghost = "ghost@example.com";
        authService.forgotPassword(EMAIL);
        authService.forgotPassword(ghost);
        String wrong = sender.lastCode(EMAIL).equals("000000") ? "111111" : "000000";

        for (int i = 0; i < properties.getVerification().getMaxAttempts(); i++) {
            assertError(ErrorCode.OTP_MISMATCH, () -> authService.resetPassword(
                    new PasswordResetRequest(EMAIL, wrong, "NewPassword456", null), CLIENT));
            assertError(ErrorCode.OTP_MISMATCH, () -> authService.resetPassword(
                    new PasswordResetRequest(ghost, wrong, "NewPassword456", null), CLIENT));
        }
        assertError(ErrorCode.OTP_EXHAUSTED, () -> authService.resetPassword(
                new PasswordResetRequest(EMAIL, wrong, "NewPassword456", null), CLIENT));
        assertError(ErrorCode.OTP_EXHAUSTED, () -> authService.resetPassword(
                new PasswordResetRequest(ghost, wrong, "NewPassword456", null), CLIENT));
    }

    @Test
    void otpLoginErrorsDoNotRevealRegistrationWhenAutoRegisterIsOff() {
        properties.getOtpLogin().setAutoRegister(false);
        register(EMAIL, "alice");
        String ghost = "ghost@example.com";
        authService.requestOtp(EMAIL);
        authService.requestOtp(ghost);
        String wrong = sender.lastCode(EMAIL).equals("000000") ? "111111" : "000000";

        assertError(ErrorCode.OTP_MISMATCH, () -> authService.loginWithOtp(EMAIL, wrong, null, CLIENT));
        assertError(ErrorCode.OTP_MISMATCH, () -> authService.loginWithOtp(ghost, wrong, null, CLIENT));
        clock.advance(properties.getVerification().getTtl());
        assertError(ErrorCode.OTP_EXPIRED, () -> authService.loginWithOtp(EMAIL, wrong, null, CLIENT));
        assertError(ErrorCode.OTP_EXPIRED, () -> authService.loginWithOtp(ghost, wrong, null, CLIENT));
    }

    @Test
    void otpLoginAutoRegistersStudentOnFirstUse() {
        OtpSentResponse sent = authService.requestOtp("+1 (555) 123-4567");
        String code = sender.lastCode(PHONE);

        assertThat(sent.channel()).isEqualTo(IdentifierType.PHONE);
        assertThat(sent.destination()).doesNotContain("1234");
        assertThat(sent.expiresInSeconds()).isEqualTo(300);

        AuthResponse response = authService.loginWithOtp(PHONE, code, sent.challengeId(), CLIENT);

        assertThat(response.user().phone()).isEqualTo(PHONE);
        assertThat(response.user().role()).isEqualTo(UserRole.STUDENT);
        assertThat(response.user().username()).startsWith("user_");
        assertThat(userService.findByPhone(PHONE)).isPresent();
        assertError(ErrorCode.OTP_ALREADY_CONSUMED, () -> authService.loginWithOtp(PHONE, code, sent.challengeId(), CLIENT));
    }

    @Test
    void otpLoginWithWrongCodeThenCorrectCodeSucceeds() {
        register(EMAIL, "alice");
        OtpSentResponse sent = authService.requestOtp(EMAIL);
        String code = sender.lastCode(EMAIL);
        String wrong = code.equals("000000") ? "111111" : "000000";

        assertError(ErrorCode.OTP_MISMATCH, () -> authService.loginWithOtp(EMAIL, wrong, null, CLIENT));
        AuthResponse response = authService.loginWithOtp(EMAIL, code, sent.challengeId(), CLIENT);

        assertThat(response.user().email()).isEqualTo(EMAIL);
    }

    @Test
    void otpLoginLocksAfterMaxMismatches() {
        authService.requestOtp(PHONE);
        String code = sender.lastCode(PHONE);
        String wrong = code.equals("000000") ? "111111" : "000000";
        for (int i = 0; i < properties.getVerification().getMaxAttempts(); i++) {
            assertError(ErrorCode.OTP_MISMATCH, () -> authService.loginWithOtp(PHONE, wrong, null, CLIENT));
        }

        assertError(ErrorCode.OTP_EXHAUSTED, () -> authService.loginWithOtp(PHONE, code, null, CLIENT));
    }

    @Test
    void newerOtpInvalidatesEarlierChallenge() {
        OtpSentResponse first = authService.requestOtp(PHONE);
        String firstCode = sender.lastCode(PHONE);
        clock.advance(Duration.ofSeconds(61));
        OtpSentResponse second = authService.requestOtp(PHONE);
        String secondCode = sender.lastCode(PHONE);

        assertError(ErrorCode.OTP_EXPIRED,
                () -> authService.loginWithOtp(PHONE, firstCode, first.challengeId(), CLIENT));
        assertThat(authService.loginWithOtp(PHONE, secondCode, second.challengeId(), CLIENT).token()).isNotNull();
    }

    @Test
    void repeatedOtpRequestIsRateLimited() {
        authService.requestOtp(PHONE);

        assertError(ErrorCode.OTP_RATE_LIMITED, () -> authService.requestOtp(PHONE));
    }

    @Test
    void otpForUnknownDestinationIsNotSentWhenAutoRegisterIsOff() {
        properties.getOtpLogin().setAutoRegister(false);

        OtpSentResponse response = authService.requestOtp(PHONE);

        assertThat(response.channel()).isEqualTo(IdentifierType.PHONE);
        assertThat(response.challengeId()).isNotBlank();
        assertThat(sender.sent()).isEmpty();
    }

    @Test
    void undeliveredOtpCannotBeUsed() {
        sender.setFailing(true);

        assertError(ErrorCode.NOTIFICATION_FAILED, () -> authService.requestOtp(PHONE));
        assertError(ErrorCode.OTP_EXPIRED, () -> authService.loginWithOtp(PHONE, "123456", null, CLIENT));
    }

    @Test
    void malformedDestinationIsRejected() {
        assertError(ErrorCode.VALIDATION_ERROR, () -> authService.requestOtp("not-an-email@"));
        assertError(ErrorCode.VALIDATION_ERROR, () -> authService.requestOtp("5551234"));
    }

    @Test
    void emailVerificationActivatesPendingAccount() {
        properties.getRegistration().setRequireEmailVerification(true);
        AuthUserResponse registered = register(EMAIL, "alice");
        String code = sender.lastCode(EMAIL);

        assertThat(registered.active()).isFalse();
        assertError(ErrorCode.ACCOUNT_DISABLED,
                () -> authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT));

        AuthUserResponse verified = authService.verifyEmail(EMAIL, code, null);

        assertThat(verified.emailVerified()).isTrue();
        assertThat(verified.active()).isTrue();
        assertThat(authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT).token()).isNotNull();
    }

    @Test
    void emailVerificationIsNotResentForVerifiedAddress() {
        register(EMAIL, "alice");
        authService.requestEmailVerification(EMAIL);
        authService.verifyEmail(EMAIL, sender.lastCode(EMAIL), null);
        int sentBefore = sender.sent().size();
        clock.advance(Duration.ofSeconds(61));

        OtpSentResponse response = authService.requestEmailVerification(EMAIL);

        assertThat(response.challengeId()).isNotBlank();
        assertThat(sender.sent()).hasSize(sentBefore);
    }

    @Test
    void changePasswordRevokesOldTokensAndStartsNewSession() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse before = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofSeconds(2));

        assertError(ErrorCode.INVALID_CREDENTIALS,
                () -> authService.changePassword(user.id(), "Wrong12345", "NewPassword456", CLIENT));
        AuthResponse after = authService.changePassword(user.id(), PASSWORD, "NewPassword456", CLIENT);

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(before.token().refreshToken()));
        assertThat(authService.refresh(after.token().refreshToken()).accessToken()).isNotBlank();
    }

    @Test
    void changePasswordInSameSecondAsLoginStillSeparatesSessions() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse before = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);

        AuthResponse after = authService.changePassword(user.id(), PASSWORD, "NewPassword456", CLIENT);

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(before.token().refreshToken()));
        assertThat(authService.refresh(after.token().refreshToken()).accessToken()).isNotBlank();
    }

    @Test
    void deactivationRevokesTokensAndBlocksLogin() {
        AuthUserResponse user = register(EMAIL, "alice");
        AuthResponse login = authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT);
        clock.advance(Duration.ofSeconds(2));

        authService.deactivateUser(1L, user.id());

        assertError(ErrorCode.INVALID_TOKEN, () -> authService.refresh(login.token().refreshToken()));
        assertError(ErrorCode.ACCOUNT_DISABLED,
                () -> authService.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT));
    }

    @Test
    void unknownUserAndSessionAreNotFound() {
        assertError(ErrorCode.USER_NOT_FOUND, () -> authService.me(404L));
        assertError(ErrorCode.SESSION_NOT_FOUND, () -> authService.revokeSession(1L, 404L));
    }

    @Test
    void unexpectedFailureSurfacesAsInternalError() {
        AuthService failing = newService(new InMemoryUserService(clock) {
            @Override
            public Optional<User> findByEmailOrUsername(String email, String username) {
                throw new IllegalStateException("driver bug");
            }
        });

        assertError(ErrorCode.INTERNAL_ERROR,
                () -> failing.login(new LoginRequest(EMAIL, null, PASSWORD), CLIENT));
    }

    private AuthUserResponse register(String email, String username) {
        return authService.register(new RegisterRequest(email, username, PASSWORD, "Alice", "Doe", null, null), CLIENT);
    }

    private static void assertError(ErrorCode expected, Executable call) {
        BusinessException ex = assertThrows(BusinessException.class, call);
        assertThat(ex.getErrorCode()).isEqualTo(expected);
    }
}
