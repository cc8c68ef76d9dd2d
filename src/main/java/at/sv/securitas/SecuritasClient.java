package at.sv.securitas;

import at.sv.securitas.api.AuthenticationFailure;
import at.sv.securitas.api.DeviceIdentity;
import at.sv.securitas.api.Futures;
import at.sv.securitas.command.AlarmMode;
import at.sv.securitas.command.AlarmStatus;
import at.sv.securitas.command.CommandOutcome;
import at.sv.securitas.command.PollPolicy;
import at.sv.securitas.installation.Installation;
import at.sv.securitas.installation.SentinelReading;
import at.sv.securitas.session.AuthChallenge;
import at.sv.securitas.session.AuthException;
import at.sv.securitas.session.LoginResult;
import at.sv.securitas.session.OtpPhone;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Command(name = "SecuritasClient", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class SecuritasClient implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SecuritasClient.class);

    enum Action {
        INSTALLATIONS,
        STATUS,
        ARM_AWAY,
        ARM_HOME,
        ARM_NIGHT,
        ARM_CUSTOM_BYPASS,
        DISARM,
        SENTINELS
    }

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            defaultValue = "${env:ACTION:-STATUS}",
            description = "The action to perform. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Action action;
    @Option(names = "--user", required = true,
            defaultValue = "${env:SECURITAS_USER}",
            description = "The user name of your Securitas Direct / Verisure account.")
    String user;
    @Option(names = "--password", required = true,
            defaultValue = "${env:SECURITAS_PASSWORD}",
            description = "The password of your account.")
    String password;
    @Option(names = "--country",
            defaultValue = "${env:COUNTRY:-ES}",
            description = "The country code of your account, e.g. ES, IT, GB, FR. Default: ${DEFAULT-VALUE}")
    String country;
    @Option(names = "--installation", paramLabel = "<numinst>",
            defaultValue = "${env:INSTALLATION}",
            description = "The number of the installation to use. Required for arming and disarming if the account " +
                          "has more than one installation.")
    String installationNumber;
    @Option(names = "--pin",
            defaultValue = "${env:PIN}",
            description = "An optional local PIN that has to be entered with --code before arming or disarming. " +
                          "The PIN is never sent to Securitas.")
    String pin;
    @Option(names = "--code",
            defaultValue = "${env:CODE}",
            description = "The code to confirm arming or disarming with, if a --pin is set.")
    String code;
    @Option(names = "--no-verify-against-panel",
            defaultValue = "${env:NO_VERIFY_AGAINST_PANEL:-false}",
            description = "Read the last status known to Securitas instead of asking the alarm panel." +
                          " Default: ${DEFAULT-VALUE}")
    boolean noVerifyAgainstPanel;
    @Option(names = "--disable-otp",
            defaultValue = "${env:DISABLE_OTP:-false}",
            description = "Fail instead of asking for a one-time passcode, if Securitas requires device validation." +
                          " Default: ${DEFAULT-VALUE}")
    boolean disableOtp;
    @Option(names = "--perimetral",
            defaultValue = "${env:PERIMETRAL:-false}",
            description = "Treat all installations as having a perimeter alarm. Default: ${DEFAULT-VALUE}")
    boolean perimetral;
    @Option(names = "--force-arming",
            defaultValue = "${env:FORCE_ARMING:-false}",
            description = "Arm anyway, if arming is blocked by e.g. an open window and the panel allows forcing." +
                          " Default: ${DEFAULT-VALUE}")
    boolean forceArming;
    @Option(names = "--poll-interval", paramLabel = "<seconds>",
            defaultValue = "${env:POLL_INTERVAL:-2}",
            description = "The delay in seconds between status polls of a command. Default: ${DEFAULT-VALUE} seconds.")
    int pollIntervalInSeconds;
    @Option(names = "--max-poll-attempts", paramLabel = "<attempts>",
            defaultValue = "${env:MAX_POLL_ATTEMPTS:-30}",
            description = "The maximum number of status polls per command. Default: ${DEFAULT-VALUE}")
    int maxPollAttempts;
    @Option(names = "--poll-timeout", paramLabel = "<seconds>",
            defaultValue = "${env:POLL_TIMEOUT:-60}",
            description = "The maximum time in seconds to wait for a command to complete. Default: ${DEFAULT-VALUE} seconds.")
    int pollTimeoutInSeconds;
    @Option(names = "--scan-interval", paramLabel = "<seconds>",
            defaultValue = "${env:SCAN_INTERVAL:-120}",
            description = "How long Sentinel readings are reused, in seconds. Default: ${DEFAULT-VALUE} seconds.")
    int scanIntervalInSeconds;
    @Option(names = "--token-lifetime", paramLabel = "<minutes>",
            defaultValue = "${env:TOKEN_LIFETIME:-15}",
            description = "The lifetime in minutes assumed for tokens without readable expiry. Default: ${DEFAULT-VALUE} minutes.")
    int tokenLifetimeInMinutes;
    @Option(names = "--device-file", paramLabel = "<file>",
            defaultValue = "${env:DEVICE_FILE}",
            description = "File to store the generated device identity in. Reusing it avoids a new device validation " +
                          "with a one-time passcode on every run.")
    Path deviceFile;

    private final ObjectMapper mapper;

    public SecuritasClient() {
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new SecuritasClient()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        OkHttpClient httpClient = new OkHttpClient();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            AlarmService service = AlarmService.create(createSettings(), httpClient, loadDeviceIdentity(), scheduler);
            MDC.put("context", "login");
            login(service);
            MDC.put("context", action.name().toLowerCase(Locale.ROOT));
            perform(service);
            service.logout().join();
        } catch (CommandLine.ParameterException e) {
            throw e;
        } catch (RuntimeException e) {
            handleFailure(Futures.unwrap(e));
        } finally {
            scheduler.shutdownNow();
            httpClient.dispatcher().executorService().shutdown();
            httpClient.connectionPool().evictAll();
        }
    }

    ClientSettings createSettings() {
        return ClientSettings.builder()
                             .country(country)
                             .pin(pin)
                             .verifyAgainstPanel(!noVerifyAgainstPanel)
                             .otpEnabled(!disableOtp)
                             .perimetral(perimetral)
                             .pollPolicy(new PollPolicy(Duration.ofSeconds(pollIntervalInSeconds), maxPollAttempts,
                                     Duration.ofSeconds(pollTimeoutInSeconds), forceArming))
                             .scanInterval(Duration.ofSeconds(scanIntervalInSeconds))
                             .fallbackTokenLifetime(Duration.ofMinutes(tokenLifetimeInMinutes))
                             .build();
    }

    void assertConfigurationParameters() {
        if (user == null || user.isBlank()) {
            fail("--user must not be empty");
        }
        if (password == null || password.isEmpty()) {
            fail("--password must not be empty");
        }
        if (country == null || !country.matches("[A-Za-z]{2}")) {
            fail("--country must be a two letter country code");
        }
        if (pollIntervalInSeconds < 1) {
            fail("--poll-interval must be >= 1");
        }
        if (maxPollAttempts < 1) {
            fail("--max-poll-attempts must be >= 1");
        }
        if (pollTimeoutInSeconds < pollIntervalInSeconds) {
            fail("--poll-timeout must be >= --poll-interval");
        }
        if (scanIntervalInSeconds < 0) {
            fail("--scan-interval must be >= 0");
        }
        if (tokenLifetimeInMinutes < 2) {
            fail("--token-lifetime must be >= 2");
        }
        if (code != null && (pin == null || pin.isEmpty())) {
            fail("--code requires --pin");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private DeviceIdentity loadDeviceIdentity() {
        if (deviceFile == null) {
            return DeviceIdentity.generate();
        }
        try {
            if (Files.isReadable(deviceFile)) {
                return mapper.readValue(deviceFile.toFile(), DeviceIdentity.class);
            }
            DeviceIdentity device = DeviceIdentity.generate();
            mapper.writeValue(deviceFile.toFile(), device);
            LOG.info("Stored new device identity in '{}'", deviceFile.toAbsolutePath());
            return device;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to access device file '" + deviceFile + "'", e);
        }
    }

    private void login(AlarmService service) {
        LoginResult result = service.login(user, password).join();
        if (!result.requiresOtp()) {
            return;
        }
        AuthChallenge challenge = result.getChallenge();
        BufferedReader input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Securitas requires a one-time passcode to validate this device. Send it to:");
        for (OtpPhone phone : challenge.phones()) {
            System.out.println("  [" + phone.id() + "] " + phone.phone());
        }
        int phoneId = Integer.parseInt(prompt(input, "Phone id: "));
        if (!service.requestOtp(challenge, phoneId).join()) {
            throw new AuthException("Securitas did not send the one-time passcode");
        }
        service.submitOtp(challenge, prompt(input, "Passcode: ")).join();
    }

    private static String prompt(BufferedReader input, String message) {
        System.out.print(message);
        System.out.flush();
        try {
            String line = input.readLine();
            if (line == null) {
                throw new AuthException("No input for one-time passcode");
            }
            return line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void perform(AlarmService service) {
        List<Installation> installations = service.installations().join();
        switch (action) {
            case INSTALLATIONS -> installations.forEach(installation -> System.out.println(installation + " " +
                                                                                           installation.devices()));
            case STATUS -> selectAll(installations).forEach(installation -> printStatus(service.status(installation).join()));
            case SENTINELS -> selectAll(installations).forEach(installation ->
                    service.sentinels(installation).join().forEach(this::printReading));
            case ARM_AWAY -> printOutcome(service.arm(selectOne(installations), AlarmMode.ARMED_AWAY, code).join());
            case ARM_HOME -> printOutcome(service.arm(selectOne(installations), AlarmMode.ARMED_HOME, code).join());
            case ARM_NIGHT -> printOutcome(service.arm(selectOne(installations), AlarmMode.ARMED_NIGHT, code).join());
            case ARM_CUSTOM_BYPASS ->
                    printOutcome(service.arm(selectOne(installations), AlarmMode.ARMED_CUSTOM_BYPASS, code).join());
            case DISARM -> printOutcome(service.disarm(selectOne(installations), code).join());
        }
    }

    private List<Installation> selectAll(List<Installation> installations) {
        if (installationNumber == null) {
            return installations;
        }
        return List.of(selectOne(installations));
    }

    private Installation selectOne(List<Installation> installations) {
        if (installationNumber == null) {
            if (installations.size() != 1) {
                fail("--installation is required, the account has " + installations.size() + " installations");
            }
            return installations.get(0);
        }
        for (Installation installation : installations) {
            if (installation.number().equals(installationNumber)) {
                return installation;
            }
        }
        fail("Unknown installation '" + installationNumber + "'");
        return null;
    }

    private void printStatus(AlarmStatus status) {
        System.out.println(status.installationNumber() + ": " + status.state() +
                           (status.protomResponseDate() != null ? " (" + status.protomResponseDate() + ")" : ""));
    }

    private void printOutcome(CommandOutcome outcome) {
        System.out.println(outcome.command().installation().number() + ": " + outcome.state() + " - " +
                           outcome.message());
        if (outcome.status() != null) {
            printStatus(outcome.status());
        }
    }

    private void printReading(SentinelReading reading) {
        System.out.println(reading.alias() + ": " + reading.temperature() + " °C, " + reading.humidity() + " %, " +
                           "air quality " + reading.airQualityMessage());
    }

    private void handleFailure(Throwable cause) {
        if (cause instanceof AuthException || cause instanceof AuthenticationFailure) {
            System.err.println("Securitas rejected the login: " + cause.getLocalizedMessage());
            System.exit(3);
        }
        if (cause instanceof InvalidPinException) {
            System.err.println(cause.getLocalizedMessage());
            System.exit(2);
        }
        LOG.error("{} failed: {}", action, cause.getLocalizedMessage(), cause);
        System.exit(1);
    }
}
