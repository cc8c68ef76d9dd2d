package at.sv.securitas.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URL;
import java.security.SecureRandom;
import java.time.ZonedDateTime;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Sends registered operations to the customer API of one country, attaching the vendor specific headers.
 */
@Slf4j
public final class GraphQlClient {

    public static final String CALL_BY = "OWA_10";
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 " +
                                             "(KHTML, like Gecko) Chrome/102.0.5005.124 Safari/537.36 Edg/102.0.1245.41";
    private static final Set<String> SESSION_REJECTED_MESSAGES = Set.of("Invalid session. Please, try again later.",
            "Invalid token: Expired");

    private final GraphQlTransport transport;
    private final OperationRegistry operations;
    private final ApiDomain domain;
    private final DeviceIdentity device;
    private final Supplier<ZonedDateTime> currentTime;
    private final ObjectMapper mapper;
    private final URL url;
    private final String apolloOperationId;

    public GraphQlClient(GraphQlTransport transport, OperationRegistry operations, ApiDomain domain,
                         DeviceIdentity device, Supplier<ZonedDateTime> currentTime) {
        this.transport = transport;
        this.operations = operations;
        this.domain = domain;
        this.device = device;
        this.currentTime = currentTime;
        url = domain.toUrl();
        mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        byte[] operationId = new byte[64];
        new SecureRandom().nextBytes(operationId);
        apolloOperationId = HexFormat.of().formatHex(operationId);
    }

    /**
     * @return a future with the {@code data.<responseField>} node of the response. Completes exceptionally with
     * {@link ApiFailure} if the response contained GraphQL errors or could not be parsed, with
     * {@link AuthenticationFailure} if the errors reject the session, or with the failures
     * of {@link GraphQlTransport#post}. Cancelling the returned future cancels the request.
     * @throws IllegalArgumentException if the operation is not registered
     */
    public CompletableFuture<JsonNode> execute(GraphQlCall call) {
        GraphQlOperation operation = operations.get(call.getOperationName());
        Map<String, String> headers = createHeaders(operation, call);
        String body = createBody(operation, call);
        log.debug("Executing {}", operation.name());
        CompletableFuture<String> request = transport.post(url, headers, body);
        CompletableFuture<JsonNode> result = request.thenApply(response -> parseResponse(operation, response));
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                request.cancel(true);
            }
        });
        return result;
    }

    public <T> T readValue(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ApiFailure("Failed to parse " + type.getSimpleName() + " from '" + node + "': " + e.getLocalizedMessage());
        }
    }

    public ApiDomain getDomain() {
        return domain;
    }

    public DeviceIdentity getDevice() {
        return device;
    }

    /**
     * @return the request id the backend expects in the {@code auth} header and login variables
     */
    public String createRequestId(String user) {
        ZonedDateTime now = currentTime.get();
        return "OWA_______________" + user + "_______________" +
               now.getYear() + now.getMonthValue() + now.getDayOfMonth() + now.getHour() + now.getMinute() +
               now.getNano() / 1000;
    }

    private Map<String, String> createHeaders(GraphQlOperation operation, GraphQlCall call) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("app", toJson(Map.of("appVersion", device.deviceVersion(), "origin", "native")));
        headers.put("User-Agent", USER_AGENT);
        headers.put("X-APOLLO-OPERATION-ID", apolloOperationId);
        headers.put("X-APOLLO-OPERATION-NAME", operation.name());
        headers.put("extension", "{\"mode\":\"full\"}");
        InstallationRef installation = call.getInstallation();
        if (installation != null) {
            headers.put("numinst", installation.number());
            headers.put("panel", installation.panel());
            if (installation.capabilities() != null) {
                headers.put("X-Capabilities", installation.capabilities());
            }
        }
        switch (operation.authMode()) {
            case SESSION -> {
                if (call.getSession() != null) {
                    headers.put("auth", toJson(createAuth(call, call.getSession().token(), false)));
                }
            }
            case DEVICE_VALIDATION -> headers.put("auth", toJson(createAuth(call, "", true)));
            case NONE -> {
            }
        }
        OtpAnswer otpAnswer = call.getOtpAnswer();
        if (otpAnswer != null) {
            Map<String, String> security = new LinkedHashMap<>();
            security.put("token", otpAnswer.code());
            security.put("type", "OTP");
            security.put("otpHash", otpAnswer.otpHash());
            headers.put("security", toJson(security));
        }
        return headers;
    }

    private Map<String, Object> createAuth(GraphQlCall call, String hash, boolean withRefreshToken) {
        String user = call.getEffectiveUser();
        Map<String, Object> auth = new LinkedHashMap<>();
        auth.put("loginTimestamp", call.getLoginTimestamp());
        auth.put("user", user);
        auth.put("id", createRequestId(user));
        auth.put("country", domain.country());
        auth.put("lang", domain.language());
        auth.put("callby", CALL_BY);
        auth.put("hash", hash);
        if (withRefreshToken) {
            auth.put("refreshToken", "");
        }
        return auth;
    }

    private String createBody(GraphQlOperation operation, GraphQlCall call) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("operationName", operation.name());
        body.put("variables", call.getVariables());
        body.put("query", operation.query());
        return toJson(body);
    }

    private JsonNode parseResponse(GraphQlOperation operation, String response) {
        JsonNode root;
        try {
            root = mapper.readTree(response);
        } catch (JsonProcessingException e) {
            log.error("Problems decoding response of {}: {}", operation.name(), response);
            throw new ApiFailure("Failed to parse response of " + operation.name() + ": " + e.getOriginalMessage());
        }
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("Unknown error");
            log.debug("{} returned error: {}", operation.name(), message);
            if (SESSION_REJECTED_MESSAGES.contains(message)) {
                throw new AuthenticationFailure(operation.name() + " failed: " + message);
            }
            throw new ApiFailure(operation.name() + " failed: " + message, root);
        }
        JsonNode result = root.path("data").path(operation.responseField());
        if (result.isMissingNode() || result.isNull()) {
            throw new ApiFailure("Missing 'data." + operation.responseField() + "' in response of " + operation.name(), root);
        }
        return result;
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize request", e);
        }
    }
}
