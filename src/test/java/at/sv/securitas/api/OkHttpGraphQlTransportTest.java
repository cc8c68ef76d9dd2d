package at.sv.securitas.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Slf4j
class OkHttpGraphQlTransportTest {
    private OkHttpGraphQlTransport transport;
    private MockWebServer mockServer;
    private URL url;

    @BeforeEach
    void setUp() throws IOException {
        OkHttpClient client = new OkHttpClient.Builder().build();
        transport = new OkHttpGraphQlTransport(client);
        mockServer = new MockWebServer();
        mockServer.start();
        url = mockServer.url("/owa-api/graphql").url();
    }

    @AfterEach
    void tearDown() {
        shutdownIgnoringException();
    }

    private void shutdownIgnoringException() {
        try {
            mockServer.shutdown();
        } catch (IOException e) {
            log.error("MockWebServer shutdown error (ignored): {}", e.getMessage());
        }
    }

    @Test
    void post_success_returnsBody_sendsHeadersAndJson() throws InterruptedException {
        mockServer.enqueue(new MockResponse().setBody("{\"data\":{}}"));

        String body = transport.post(url, Map.of("numinst", "12345"), "{\"operationName\":\"Status\"}").join();

        assertThat(body).isEqualTo("{\"data\":{}}");
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("numinst")).isEqualTo("12345");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"operationName\":\"Status\"}");
    }

    @Test
    void post_serverDown_connectionFailure() {
        shutdownIgnoringException();

        assertFailure(ConnectionFailure.class);
    }

    @Test
    void code_401_authenticationFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(401));

        assertFailure(AuthenticationFailure.class);
    }

    @Test
    void code_403_authenticationFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(403));

        assertFailure(AuthenticationFailure.class);
    }

    @Test
    void code_429_apiFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("Too many requests"));

        assertThatThrownBy(() -> post().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(ApiFailure.class)
                .hasMessage("Rate limit exceeded: Too many requests");
    }

    @Test
    void code_500_apiFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(500).setBody("Internal"));

        assertThatThrownBy(() -> post().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(ApiFailure.class)
                .hasMessage("Server error: Internal");
    }

    @Test
    void code_404_connectionFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(404).setBody("Not found"));

        assertFailure(ConnectionFailure.class);
    }

    @Test
    void cancel_cancelsCall_noResult() {
        mockServer.enqueue(new MockResponse().setBody("{}").setBodyDelay(5, TimeUnit.SECONDS));
        CompletableFuture<String> result = post();

        result.cancel(true);

        assertThat(result).isCancelled();
    }

    private CompletableFuture<String> post() {
        return transport.post(url, Map.of(), "{}");
    }

    private void assertFailure(Class<? extends Throwable> type) {
        assertThatThrownBy(() -> post().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(type);
    }
}
