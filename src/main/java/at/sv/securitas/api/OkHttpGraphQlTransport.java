package at.sv.securitas.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.URL;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
public class OkHttpGraphQlTransport implements GraphQlTransport {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;

    public OkHttpGraphQlTransport(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<String> post(URL url, Map<String, String> headers, String body) {
        log.trace("Post: {}: {}", url, getTruncatedBody(body));
        Call call = httpClient.newCall(postRequest(url, headers, body));
        CompletableFuture<String> result = new CompletableFuture<>();
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                if (!result.isDone()) {
                    log.error("Failed '{}'", failedCall.request());
                }
                result.completeExceptionally(new ConnectionFailure("Failed '" + failedCall.request() + "'", e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    assertSuccessful(response);
                    result.complete(getBody(response));
                } catch (IOException e) {
                    result.completeExceptionally(new ConnectionFailure("Failed '" + completedCall.request() + "'", e));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }
        });
        return result;
    }

    private static String getTruncatedBody(String body) {
        return body.length() > 150 ? body.substring(0, 150) + "..." : body;
    }

    private static Request postRequest(URL url, Map<String, String> headers, String json) {
        RequestBody requestBody = RequestBody.create(json, JSON);
        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(requestBody);
        headers.forEach(builder::header);
        return builder.build();
    }

    private static void assertSuccessful(Response response) throws IOException {
        if (response.code() == 401 || response.code() == 403) {
            throw new AuthenticationFailure();
        }
        if (response.code() == 429) {
            throw new ApiFailure("Rate limit exceeded: " + getBody(response));
        }
        if (response.code() >= 500) {
            throw new ApiFailure("Server error: " + getBody(response));
        }
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected return code " + response + ". " + getBody(response));
        }
    }

    private static String getBody(Response response) throws IOException {
        return response.body().string();
    }
}
