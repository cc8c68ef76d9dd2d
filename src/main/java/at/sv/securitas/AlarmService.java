package at.sv.securitas;

import at.sv.securitas.api.ApiDomain;
import at.sv.securitas.api.AuthenticationFailure;
import at.sv.securitas.api.DeviceIdentity;
import at.sv.securitas.api.Futures;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.OkHttpGraphQlTransport;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.command.AlarmMode;
import at.sv.securitas.command.AlarmRequest;
import at.sv.securitas.command.AlarmStatus;
import at.sv.securitas.command.CommandDispatcher;
import at.sv.securitas.command.CommandOutcome;
import at.sv.securitas.command.CommandPoller;
import at.sv.securitas.installation.Device;
import at.sv.securitas.installation.Installation;
import at.sv.securitas.installation.InstallationResolver;
import at.sv.securitas.installation.SentinelReader;
import at.sv.securitas.installation.SentinelReading;
import at.sv.securitas.session.AuthChallenge;
import at.sv.securitas.session.AuthException;
import at.sv.securitas.session.LoginResult;
import at.sv.securitas.session.Session;
import at.sv.securitas.session.SessionManager;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The operations a host uses: login, installations, status, arming and disarming, and Sentinel readings. Every
 * operation after login uses the shared session of the {@link SessionManager} and renews it when needed.
 */
@Slf4j
public final class AlarmService {

    private final ClientSettings settings;
    private final SessionManager sessions;
    private final InstallationResolver resolver;
    private final CommandDispatcher dispatcher;
    private final CommandPoller poller;
    private final SentinelReader sentinelReader;
    private final PinGate pinGate;
    private final Map<String, String> lastProtomResponses = new ConcurrentHashMap<>();

    public AlarmService(ClientSettings settings, SessionManager sessions, InstallationResolver resolver,
                        CommandDispatcher dispatcher, CommandPoller poller, SentinelReader sentinelReader) {
        this.settings = settings;
        this.sessions = sessions;
        this.resolver = resolver;
        this.dispatcher = dispatcher;
        this.poller = poller;
        this.sentinelReader = sentinelReader;
        pinGate = new PinGate(settings.getPin());
    }

    /**
     * Creates a service talking to the API of the configured country.
     *
     * @param device    the device identity to present, reuse it across runs to avoid repeated device validation
     * @param scheduler schedules the status polls of commands
     */
    public static AlarmService create(ClientSettings settings, OkHttpClient httpClient, DeviceIdentity device,
                                      ScheduledExecutorService scheduler) {
        GraphQlClient client = new GraphQlClient(new OkHttpGraphQlTransport(httpClient), OperationRegistry.defaults(),
                ApiDomain.forCountry(settings.getCountry()), device, ZonedDateTime::now);
        SessionManager sessions = new SessionManager(client, ZonedDateTime::now, settings.isOtpEnabled(),
                settings.getFallbackTokenLifetime());
        CommandDispatcher dispatcher = new CommandDispatcher(client);
        return new AlarmService(settings, sessions,
                new InstallationResolver(client, ZonedDateTime::now, settings.isPerimetral(),
                        settings.getFallbackTokenLifetime()),
                dispatcher,
                new CommandPoller(dispatcher, client, sessions, scheduler, ZonedDateTime::now),
                new SentinelReader(client, ZonedDateTime::now, Ticker.systemTicker(), settings.getScanInterval()));
    }

    public CompletableFuture<LoginResult> login(String user, String password) {
        return sessions.login(user, password);
    }

    public CompletableFuture<Boolean> requestOtp(AuthChallenge challenge, int phoneId) {
        return sessions.requestOtp(challenge, phoneId);
    }

    public CompletableFuture<Session> submitOtp(AuthChallenge challenge, String code) {
        return sessions.submitOtp(challenge, code);
    }

    public CompletableFuture<Void> logout() {
        return sessions.currentSession()
                       .map(sessions::logout)
                       .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    public CompletableFuture<List<Installation>> installations() {
        return withSession(resolver::resolveInstallations);
    }

    /**
     * Reads the alarm status, either from the panel itself or the last status known to the backend, depending on
     * {@link ClientSettings#isVerifyAgainstPanel()}. If the panel did not answer in time, the returned status has
     * state {@link at.sv.securitas.command.AlarmState#UNKNOWN}.
     */
    public CompletableFuture<AlarmStatus> status(Installation installation) {
        return withSession(session -> resolver.ensureCapabilities(session, installation)
                                              .thenCompose(resolved -> readStatus(session, resolved)))
                .thenApply(this::remember);
    }

    /**
     * Arms the installation in the given mode, after checking the local PIN.
     *
     * @return a future with the outcome of the command. Completes exceptionally with {@link InvalidPinException} if
     * the PIN did not match; nothing was sent in that case.
     */
    public CompletableFuture<CommandOutcome> arm(Installation installation, AlarmMode mode, String pin) {
        try {
            pinGate.check(pin);
        } catch (InvalidPinException e) {
            log.warn("Rejected {} for installation {}: {}", mode, installation.number(), e.getLocalizedMessage());
            return CompletableFuture.failedFuture(e);
        }
        return execute(installation, mode.requestFor(installation.perimetral()));
    }

    public CompletableFuture<CommandOutcome> disarm(Installation installation, String pin) {
        return arm(installation, AlarmMode.DISARMED, pin);
    }

    public CompletableFuture<List<SentinelReading>> sentinels(Installation installation) {
        return withSession(session -> resolver.ensureCapabilities(session, installation)
                                              .thenCompose(resolved -> readSentinels(session, resolved)));
    }

    /**
     * Drops the command in progress of the given installation, so that a new one can be issued.
     */
    public void supersede(Installation installation) {
        dispatcher.supersede(installation.number());
    }

    public boolean isPinRequired() {
        return pinGate.isEnabled();
    }

    private CompletableFuture<Session> validSession() {
        Optional<Session> session = sessions.currentSession();
        if (session.isEmpty()) {
            return CompletableFuture.failedFuture(new AuthException("Not logged in"));
        }
        return sessions.ensureValid(session.get());
    }

    /**
     * Runs the given action with a valid session. A session the server rejects is marked invalid, so that the next
     * operation renews it.
     */
    private <T> CompletableFuture<T> withSession(Function<Session, CompletableFuture<T>> action) {
        return validSession().thenCompose(session -> action.apply(session).whenComplete((result, error) -> {
            if (error != null && Futures.isCausedBy(error, AuthenticationFailure.class)) {
                sessions.invalidate(session);
            }
        }));
    }

    private CompletableFuture<AlarmStatus> readStatus(Session session, Installation installation) {
        if (!settings.isVerifyAgainstPanel()) {
            return dispatcher.queryLastKnownStatus(session, installation);
        }
        return dispatcher.checkAlarm(session, installation)
                         .thenCompose(check -> poller.drive(session, check, settings.getPollPolicy()))
                         .thenApply(outcome -> {
                             if (outcome.isConfirmed()) {
                                 return outcome.status();
                             }
                             log.warn("Panel status of installation {} unknown: {}", installation.number(),
                                     outcome.message());
                             return AlarmStatus.unknown(installation.number(), outcome.message());
                         });
    }

    private CompletableFuture<CommandOutcome> execute(Installation installation, AlarmRequest request) {
        return withSession(session -> resolver.ensureCapabilities(session, installation)
                                              .thenCompose(resolved -> issueAndPoll(session, resolved, request)))
                .thenApply(outcome -> {
                    if (outcome.isConfirmed()) {
                        remember(outcome.status());
                    }
                    return outcome;
                });
    }

    private CompletableFuture<CommandOutcome> issueAndPoll(Session session, Installation installation,
                                                           AlarmRequest request) {
        String currentStatus = lastProtomResponses.get(installation.number());
        return dispatcher.issueCommand(session, installation, request, currentStatus)
                         .thenCompose(command -> poller.drive(session, command, settings.getPollPolicy()));
    }

    private CompletableFuture<List<SentinelReading>> readSentinels(Session session, Installation installation) {
        List<CompletableFuture<SentinelReading>> readings = new ArrayList<>();
        for (Device device : installation.sentinels()) {
            readings.add(sentinelReader.read(session, installation, device));
        }
        return CompletableFuture.allOf(readings.toArray(new CompletableFuture[0]))
                                .thenApply(ignored -> readings.stream()
                                                              .map(CompletableFuture::join)
                                                              .collect(Collectors.toList()));
    }

    private AlarmStatus remember(AlarmStatus status) {
        if (status.protomResponse() != null && status.installationNumber() != null) {
            lastProtomResponses.put(status.installationNumber(), status.protomResponse());
        }
        return status;
    }
}
