package at.sv.securitas.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphQlClientTest {

    private static final ZonedDateTime NOW = ZonedDateTime.of(2024, 3, 10, 10, 15, 30, 123_456_000, ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private ScriptedTransport transport;
    private GraphQlClient client;
    private DeviceIdentity device;

    private record TestSession(String user, String token, long loginTimestamp) implements SessionCredentials {
    }

    private record TestInstallation(String number, String panel, String capabilities) implements InstallationRef {
    }

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        device = DeviceIdentity.generate();
        client = new GraphQlClient(transport, OperationRegistry.defaults(), ApiDomain.forCountry("ES"), device,
                () -> NOW);
    }

    @Test
    void execute_sessionOperation_returnsResponseField_sendsAuthAndInstallationHeaders() throws Exception {
        transport.reply(OperationRegistry.STATUS, "xSStatus", "{\"status\":\"T\",\"timestampUpdate\":\"2024-03-10\"}");

        JsonNode result = client.execute(GraphQlCall.builder()
                                                    .operationName(OperationRegistry.STATUS)
                                                    .session(new TestSession("user@example.com", "token-1", 1700L))
                                                    .installation(new TestInstallation("12345", "SDVFAST", "cap-1"))
                                                    .variable("numinst", "12345")
                                                    .build()).join();

        assertThat(result.path("status").asText()).isEqualTo("T");
        ScriptedTransport.SentRequest request = transport.getRequests(OperationRegistry.STATUS).get(0);
        assertThat(request.variable("numinst")).isEqualTo("12345");
        Map<String, String> headers = request.headers();
        assertThat(headers).containsEntry("numinst", "12345")
                           .containsEntry("panel", "SDVFAST")
                           .containsEntry("X-Capabilities", "cap-1")
                           .containsEntry("X-APOLLO-OPERATION-NAME", "Status")
                           .containsKey("User-Agent");
        JsonNode auth = mapper.readTree(headers.get("auth"));
        assertThat(auth.path("user").asText()).isEqualTo("user@example.com");
        assertThat(auth.path("hash").asText()).isEqualTo("token-1");
        assertThat(auth.path("loginTimestamp").asLong()).isEqualTo(1700L);
        assertThat(auth.path("callby").asText()).isEqualTo("OWA_10");
        assertThat(auth.path("country").asText()).isEqualTo("ES");
        assertThat(auth.path("lang").asText()).isEqualTo("es");
        assertThat(auth.has("refreshToken")).isFalse();
        JsonNode app = mapper.readTree(headers.get("app"));
        assertThat(app.path("appVersion").asText()).isEqualTo(device.deviceVersion());
    }

    @Test
    void execute_deviceValidation_emptyHashAndRefreshToken_securityHeaderWithOtp() throws Exception {
        transport.reply(OperationRegistry.VALIDATE_DEVICE, "xSValidateDevice", "{\"res\":\"OK\"}");

        client.execute(GraphQlCall.builder()
                                  .operationName(OperationRegistry.VALIDATE_DEVICE)
                                  .user("user@example.com")
                                  .otpAnswer(new OtpAnswer("otp-hash", "123456"))
                                  .build()).join();

        Map<String, String> headers = transport.getRequests(OperationRegistry.VALIDATE_DEVICE).get(0).headers();
        JsonNode auth = mapper.readTree(headers.get("auth"));
        assertThat(auth.path("hash").asText()).isEmpty();
        assertThat(auth.path("refreshToken").asText()).isEmpty();
        assertThat(auth.path("user").asText()).isEqualTo("user@example.com");
        assertThat(auth.path("loginTimestamp").asLong()).isZero();
        JsonNode security = mapper.readTree(headers.get("security"));
        assertThat(security.path("token").asText()).isEqualTo("123456");
        assertThat(security.path("type").asText()).isEqualTo("OTP");
        assertThat(security.path("otpHash").asText()).isEqualTo("otp-hash");
    }

    @Test
    void execute_login_noAuthHeader() {
        transport.reply(OperationRegistry.LOGIN, "xSLoginToken", "{\"res\":\"OK\",\"hash\":\"abc\"}");

        client.execute(GraphQlCall.builder().operationName(OperationRegistry.LOGIN).user("user").build()).join();

        assertThat(transport.getRequests(OperationRegistry.LOGIN).get(0).headers()).doesNotContainKey("auth");
    }

    @Test
    void execute_graphQlError_apiFailureWithResponse() {
        transport.replyBody(OperationRegistry.LOGIN, """
                {"errors":[{"message":"Unauthorized","data":{"status":401}}],"data":{"xSLoginToken":null}}""");

        assertThatThrownBy(() -> executeLogin().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(ApiFailure.class)
                .hasMessage("mkLoginToken failed: Unauthorized")
                .satisfies(error -> assertThat(((ApiFailure) error).getResponse()
                        .path("errors").path(0).path("data").path("status").asInt()).isEqualTo(401));
    }

    @Test
    void execute_invalidSessionError_authenticationFailure() {
        transport.replyBody(OperationRegistry.LOGIN, """
                {"errors":[{"message":"Invalid token: Expired"}],"data":{"xSLoginToken":null}}""");

        assertThatThrownBy(() -> executeLogin().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(AuthenticationFailure.class)
                .hasMessage("mkLoginToken failed: Invalid token: Expired");
    }

    @Test
    void execute_missingResponseField_apiFailure() {
        transport.replyBody(OperationRegistry.LOGIN, "{\"data\":{}}");

        assertThatThrownBy(() -> executeLogin().join())
                .cause()
                .isInstanceOf(ApiFailure.class)
                .hasMessageContaining("data.xSLoginToken");
    }

    @Test
    void execute_invalidJson_apiFailure() {
        transport.replyBody(OperationRegistry.LOGIN, "<html>");

        assertThatThrownBy(() -> executeLogin().join())
                .cause()
                .isInstanceOf(ApiFailure.class);
    }

    @Test
    void execute_connectionFailure_propagated() {
        transport.fail(OperationRegistry.LOGIN, new ConnectionFailure("down"));

        assertThatThrownBy(() -> executeLogin().join())
                .cause()
                .isInstanceOf(ConnectionFailure.class);
    }

    @Test
    void execute_cancelled_cancelsTransportRequest() {
        CompletableFuture<String> response = transport.pending(OperationRegistry.LOGIN);

        executeLogin().cancel(true);

        assertThat(response).isCancelled();
    }

    @Test
    void execute_unknownOperation_exception() {
        assertThatThrownBy(() -> client.execute(GraphQlCall.builder().operationName("Nope").build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createRequestId_containsUserAndTime() {
        assertThat(client.createRequestId("user")).isEqualTo("OWA_______________user_______________20243101015123456");
    }

    @Test
    void readValue_wrongShape_apiFailure() {
        JsonNode node = mapper.createArrayNode();

        assertThatThrownBy(() -> client.readValue(node, Payload.class)).isInstanceOf(ApiFailure.class);
    }

    private static final class Payload {
        public String res;
    }

    private CompletableFuture<JsonNode> executeLogin() {
        return client.execute(GraphQlCall.builder().operationName(OperationRegistry.LOGIN).user("user").build());
    }
}
