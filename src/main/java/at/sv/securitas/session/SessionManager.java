package at.sv.securitas.session;

import at.sv.securitas.api.ApiFailure;
import at.sv.securitas.api.ConnectionFailure;
import at.sv.securitas.api.DeviceIdentity;
import at.sv.securitas.api.Futures;
import at.sv.securitas.api.GraphQlCall;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.JwtExpiry;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.api.OtpAnswer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Owns the single shared {@link Session} of a client: login including the one-time passcode device validation,
 * renewal and logout.
 * <p>
 * All returned futures complete exceptionally with {@link AuthException} if the backend rejected the credentials,
 * the passcode or the session, with {@link ConnectionFailure} if the backend could not be reached, and with
 * {@link ApiFailure} for server errors without a GraphQL response. These two never change the shared session.
 */
@Slf4j
public final class SessionManager {

    /**
     * Sessions are renewed this long before they expire.
     */
    public static final Duration RENEWAL_MARGIN = Duration.ofMinutes(1);

    private final GraphQlClient client;
    private final Supplier<ZonedDateTime> currentTime;
    private final boolean otpEnabled;
    private final Duration fallbackTokenLifetime;
    private final AtomicReference<Session> current = new AtomicReference<>();
    private final AtomicReference<Session> rejected = new AtomicReference<>();
    private final Object refreshLock = new Object();
    private CompletableFuture<Session> refreshInFlight;
    private volatile Credentials credentials;

    public SessionManager(GraphQlClient client, Supplier<ZonedDateTime> currentTime, boolean otpEnabled,
                          Duration fallbackTokenLifetime) {
        this.client = client;
        this.currentTime = currentTime;
        this.otpEnabled = otpEnabled;
        this.fallbackTokenLifetime = fallbackTokenLifetime;
    }

    /**
     * Logs in with the given credentials. If the backend does not trust this device yet, device validation is
     * requested and the returned result carries the {@link AuthChallenge} to answer with
     * {@link #submitOtp(AuthChallenge, String)}.
     *
     * @return a future with either the active session or the challenge. Completes exceptionally with
     * {@link AuthException} for rejected credentials, or if a passcode is required while OTP is disabled.
     */
    public CompletableFuture<LoginResult> login(String user, String password) {
        log.info("Logging in as '{}'", user);
        return login(new Credentials(user, password), true);
    }

    /**
     * Asks the backend to send the passcode of the given challenge to one of its phones.
     *
     * @return a future with true if the backend accepted the request
     */
    public CompletableFuture<Boolean> requestOtp(AuthChallenge challenge, int phoneId) {
        log.info("Requesting one-time passcode for phone {}", phoneId);
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.SEND_OTP)
                                      .user(challenge.credentials().user())
                                      .variable("recordId", phoneId)
                                      .variable("otpHash", challenge.otpHash())
                                      .build();
        return client.execute(call)
                     .handle((result, error) -> {
                         if (error != null) {
                             throw toAuthException(Futures.unwrap(error), "Sending the one-time passcode");
                         }
                         return "OK".equals(result.path("res").asText());
                     });
    }

    /**
     * Validates this device with the passcode the user received and completes the pending login.
     *
     * @return a future with the new session. Completes exceptionally with {@link AuthException} if the code was
     * rejected or the challenge expired.
     */
    public CompletableFuture<Session> submitOtp(AuthChallenge challenge, String code) {
        log.info("Validating device with one-time passcode");
        return client.execute(validateDeviceCall(challenge.credentials().user(),
                             new OtpAnswer(challenge.otpHash(), code)))
                     .handle((result, error) -> {
                         if (error != null) {
                             return CompletableFuture.<Session>failedFuture(
                                     toAuthException(Futures.unwrap(error), "One-time passcode validation"));
                         }
                         log.debug("Device validated, logging in again");
                         return login(challenge.credentials(), false).thenApply(LoginResult::getSession);
                     })
                     .thenCompose(Function.identity());
    }

    /**
     * Returns the given session if it is still valid by its local expiry estimate and was not
     * {@link #invalidate(Session) invalidated}, otherwise renews it. Concurrent callers share a single renewal and
     * observe the same resulting session.
     *
     * @return a future with a valid session. Completes exceptionally with {@link AuthException} if the renewal was
     * rejected; the shared session is cleared and a new login is required.
     */
    public CompletableFuture<Session> ensureValid(Session session) {
        if (session != rejected.get() && session.isValidAt(currentTime.get().toInstant(), RENEWAL_MARGIN)) {
            return CompletableFuture.completedFuture(session);
        }
        return refresh(session);
    }

    /**
     * Marks a session the server rejected as invalid, although it did not expire yet. The next
     * {@link #ensureValid(Session)} renews it.
     */
    public void invalidate(Session session) {
        if (rejected.getAndSet(session) != session) {
            log.info("Session of '{}' was rejected by the server", session.user());
        }
    }

    public CompletableFuture<Void> logout(Session session) {
        log.info("Logging out '{}'", session.user());
        GraphQlCall call = GraphQlCall.builder()
                                      .operationName(OperationRegistry.LOGOUT)
                                      .session(session)
                                      .build();
        return client.execute(call)
                     .whenComplete((result, error) -> {
                         current.compareAndSet(session, null);
                         credentials = null;
                     })
                     .thenApply(result -> null);
    }

    public Optional<Session> currentSession() {
        return Optional.ofNullable(current.get());
    }

    private CompletableFuture<Session> refresh(Session expired) {
        CompletableFuture<Session> pending;
        synchronized (refreshLock) {
            if (refreshInFlight != null) {
                log.debug("Joining session renewal in progress");
                return refreshInFlight.copy();
            }
            Session latest = current.get();
            if (latest != null && latest != expired && latest != rejected.get()
                && latest.user().equals(expired.user())
                && latest.isValidAt(currentTime.get().toInstant(), RENEWAL_MARGIN)) {
                return CompletableFuture.completedFuture(latest);
            }
            pending = new CompletableFuture<>();
            refreshInFlight = pending;
        }
        log.info("Renewing session of '{}' expiring at {}", expired.user(), expired.expiresAt());
        renew(expired).whenComplete((session, error) -> {
            synchronized (refreshLock) {
                refreshInFlight = null;
            }
            if (error != null) {
                pending.completeExceptionally(Futures.unwrap(error));
            } else {
                pending.complete(session);
            }
        });
        return pending.copy();
    }

    private CompletableFuture<Session> renew(Session expired) {
        CompletableFuture<Session> renewal;
        if (expired.hasRefreshToken()) {
            renewal = client.execute(refreshCall(expired))
                            .thenApply(result -> onRefreshResponse(expired, client.readValue(result, LoginResponse.class)));
        } else {
            Credentials remembered = credentials;
            if (remembered == null || !remembered.user().equals(expired.user())) {
                current.compareAndSet(expired, null);
                return CompletableFuture.failedFuture(
                        new AuthException("Session of '" + expired.user() + "' expired and cannot be renewed"));
            }
            renewal = login(remembered, false).thenApply(LoginResult::getSession);
        }
        return renewal.handle((session, error) -> {
            if (error == null) {
                return session;
            }
            Throwable cause = Futures.unwrap(error);
            if (isTransient(cause)) {
                log.warn("Session renewal failed: {}", cause.getLocalizedMessage());
                throw (RuntimeException) cause;
            }
            log.warn("Session renewal rejected: {}", cause.getLocalizedMessage());
            current.compareAndSet(expired, null);
            throw toAuthException(cause, "Session renewal");
        });
    }

    private Session onRefreshResponse(Session expired, LoginResponse response) {
        if (!response.hasHash()) {
            throw new AuthException("Session renewal rejected: " + response.getMsg());
        }
        String refreshToken = response.getRefreshToken() != null ? response.getRefreshToken() : expired.refreshToken();
        Session renewed = createSession(expired.user(), response.getHash(), refreshToken);
        current.set(renewed);
        log.info("Session renewed, valid until {}", renewed.expiresAt());
        return renewed;
    }

    private CompletableFuture<LoginResult> login(Credentials credentials, boolean allowChallenge) {
        return client.execute(loginCall(credentials))
                     .handle((result, error) -> {
                         if (error == null) {
                             return onLoginResponse(credentials, client.readValue(result, LoginResponse.class),
                                     allowChallenge);
                         }
                         Throwable cause = Futures.unwrap(error);
                         if (cause instanceof ApiFailure failure && needsDeviceAuthorization(failure.getResponse())) {
                             return requestDeviceValidation(credentials, allowChallenge);
                         }
                         return CompletableFuture.<LoginResult>failedFuture(toAuthException(cause, "Login"));
                     })
                     .thenCompose(Function.identity());
    }

    private CompletableFuture<LoginResult> onLoginResponse(Credentials credentials, LoginResponse response,
                                                           boolean allowChallenge) {
        if (response.hasHash()) {
            Session session = createSession(credentials.user(), response.getHash(), response.getRefreshToken());
            this.credentials = credentials;
            current.set(session);
            log.info("Logged in as '{}', session valid until {}", session.user(), session.expiresAt());
            return CompletableFuture.completedFuture(LoginResult.of(session));
        }
        if (Boolean.TRUE.equals(response.getNeedDeviceAuthorization())) {
            return requestDeviceValidation(credentials, allowChallenge);
        }
        return CompletableFuture.failedFuture(new AuthException("Login rejected: " + response.getMsg()));
    }

    private CompletableFuture<LoginResult> requestDeviceValidation(Credentials credentials, boolean allowChallenge) {
        if (!allowChallenge) {
            return CompletableFuture.failedFuture(new AuthException("Device is still not authorized"));
        }
        if (!otpEnabled) {
            return CompletableFuture.failedFuture(
                    new AuthException("Device authorization with a one-time passcode is required, but OTP is disabled"));
        }
        log.info("Device authorization required, requesting one-time passcode challenge");
        return client.execute(validateDeviceCall(credentials.user(), null))
                     .handle((result, error) -> {
                         if (error == null) {
                             log.debug("Device accepted without passcode, logging in again");
                             return login(credentials, false);
                         }
                         Throwable cause = Futures.unwrap(error);
                         if (cause instanceof ApiFailure failure) {
                             Optional<AuthChallenge> challenge = readChallenge(failure.getResponse(), credentials);
                             if (challenge.isPresent()) {
                                 log.info("One-time passcode can be sent to {}", challenge.get().phones());
                                 return CompletableFuture.completedFuture(LoginResult.challenge(challenge.get()));
                             }
                         }
                         return CompletableFuture.<LoginResult>failedFuture(
                                 toAuthException(cause, "Device authorization"));
                     })
                     .thenCompose(Function.identity());
    }

    private static boolean needsDeviceAuthorization(JsonNode response) {
        return response != null
               && response.path("data").path("xSLoginToken").path("needDeviceAuthorization").asBoolean(false);
    }

    private static Optional<AuthChallenge> readChallenge(JsonNode response, Credentials credentials) {
        if (response == null) {
            return Optional.empty();
        }
        JsonNode data = response.path("errors").path(0).path("data");
        String otpHash = data.path("auth-otp-hash").asText(null);
        if (otpHash == null || otpHash.isBlank()) {
            return Optional.empty();
        }
        List<OtpPhone> phones = new ArrayList<>();
        for (JsonNode phone : data.path("auth-phones")) {
            phones.add(new OtpPhone(phone.path("id").asInt(), phone.path("phone").asText()));
        }
        return Optional.of(new AuthChallenge(otpHash, phones, credentials));
    }

    /**
     * Connection failures and server errors without a GraphQL response body say nothing about the credentials.
     */
    private static boolean isTransient(Throwable cause) {
        return cause instanceof ConnectionFailure
               || (cause instanceof ApiFailure failure && failure.getResponse() == null);
    }

    private static RuntimeException toAuthException(Throwable cause, String action) {
        if (isTransient(cause)) {
            return (RuntimeException) cause;
        }
        if (cause instanceof AuthException authException) {
            return authException;
        }
        return new AuthException(action + " failed: " + cause.getLocalizedMessage(), cause);
    }

    private Session createSession(String user, String token, String refreshToken) {
        Instant now = currentTime.get().toInstant();
        Instant expiresAt = JwtExpiry.read(token).orElseGet(() -> now.plus(fallbackTokenLifetime));
        return new Session(user, token, refreshToken, now.toEpochMilli(), now, expiresAt);
    }

    private GraphQlCall loginCall(Credentials credentials) {
        return withDeviceVariables(GraphQlCall.builder(), credentials.user())
                .operationName(OperationRegistry.LOGIN)
                .user(credentials.user())
                .variable("user", credentials.user())
                .variable("password", credentials.password())
                .build();
    }

    private GraphQlCall refreshCall(Session session) {
        return withDeviceVariables(GraphQlCall.builder(), session.user())
                .operationName(OperationRegistry.REFRESH_LOGIN)
                .user(session.user())
                .variable("refreshToken", session.refreshToken())
                .build();
    }

    private GraphQlCall validateDeviceCall(String user, OtpAnswer answer) {
        DeviceIdentity device = client.getDevice();
        return GraphQlCall.builder()
                          .operationName(OperationRegistry.VALIDATE_DEVICE)
                          .user(user)
                          .otpAnswer(answer)
                          .variable("idDevice", device.idDevice())
                          .variable("idDeviceIndigitall", device.idDeviceIndigitall())
                          .variable("uuid", device.uuid())
                          .variable("deviceName", device.deviceName())
                          .variable("deviceBrand", device.deviceBrand())
                          .variable("deviceOsVersion", device.deviceOsVersion())
                          .variable("deviceVersion", device.deviceVersion())
                          .build();
    }

    private GraphQlCall.GraphQlCallBuilder withDeviceVariables(GraphQlCall.GraphQlCallBuilder builder, String user) {
        DeviceIdentity device = client.getDevice();
        return builder.variable("id", client.createRequestId(user))
                      .variable("country", client.getDomain().country())
                      .variable("lang", client.getDomain().language())
                      .variable("callby", GraphQlClient.CALL_BY)
                      .variable("idDevice", device.idDevice())
                      .variable("idDeviceIndigitall", device.idDeviceIndigitall())
                      .variable("deviceType", device.deviceType())
                      .variable("deviceVersion", device.deviceVersion())
                      .variable("deviceResolution", device.deviceResolution())
                      .variable("deviceName", device.deviceName())
                      .variable("deviceBrand", device.deviceBrand())
                      .variable("deviceOsVersion", device.deviceOsVersion())
                      .variable("uuid", device.uuid());
    }
}
