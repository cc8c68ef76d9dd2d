package at.sv.securitas.installation;

import at.sv.securitas.api.ApiFailure;
import at.sv.securitas.api.GraphQlCall;
import at.sv.securitas.api.GraphQlClient;
import at.sv.securitas.api.OperationRegistry;
import at.sv.securitas.session.Session;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Reads temperature, humidity and air quality of Sentinel devices. Readings are cached per installation and zone for
 * the scan interval, failed reads are not cached.
 */
@Slf4j
public final class SentinelReader {

    private final GraphQlClient client;
    private final Supplier<ZonedDateTime> currentTime;
    private final AsyncCache<String, SentinelReading> readings;

    public SentinelReader(GraphQlClient client, Supplier<ZonedDateTime> currentTime, Ticker ticker,
                          Duration scanInterval) {
        this.client = client;
        this.currentTime = currentTime;
        readings = Caffeine.newBuilder()
                           .ticker(ticker)
                           .expireAfterWrite(scanInterval)
                           .buildAsync();
    }

    /**
     * @throws IllegalArgumentException if the given device is no Sentinel
     */
    public CompletableFuture<SentinelReading> read(Session session, Installation installation, Device device) {
        if (!device.isSentinel()) {
            throw new IllegalArgumentException("Device " + device.serviceId() + " is no Sentinel");
        }
        String key = installation.number() + "/" + device.zone();
        return readings.get(key, (ignored, executor) -> fetch(session, installation, device));
    }

    private CompletableFuture<SentinelReading> fetch(Session session, Installation installation, Device device) {
        log.debug("Reading Sentinel in zone {} of installation {}", device.zone(), installation.number());
        CompletableFuture<JsonNode> sentinel = client.execute(createCall(OperationRegistry.SENTINEL, session,
                installation, device));
        CompletableFuture<JsonNode> airQuality = client.execute(createCall(OperationRegistry.AIR_QUALITY, session,
                installation, device));
        return sentinel.thenCombine(airQuality, (sentinelResult, airQualityResult) ->
                createReading(device, sentinelResult, airQualityResult));
    }

    private static GraphQlCall createCall(String operation, Session session, Installation installation, Device device) {
        return GraphQlCall.builder()
                          .operationName(operation)
                          .session(session)
                          .installation(installation)
                          .variable("numinst", installation.number())
                          .variable("zone", device.zone())
                          .build();
    }

    private SentinelReading createReading(Device device, JsonNode sentinelResult, JsonNode airQualityResult) {
        JsonNode ddi = sentinelResult.path(0).path("ddi");
        JsonNode status = ddi.path("status");
        if (status.isMissingNode() || status.isNull()) {
            throw new ApiFailure("No Sentinel status for zone " + device.zone() + ": " + sentinelResult);
        }
        JsonNode airQuality = airQualityResult.path("graphData").path("status");
        Integer airQualityValue = airQuality.hasNonNull("current") ? airQuality.get("current").asInt() : null;
        return new SentinelReading(device.zone(), ddi.path("alias").asText(device.alias()),
                status.path("temperature").asInt(), status.path("humidity").asInt(), airQualityValue,
                airQuality.path("currentMsg").asText(status.path("airQualityMsg").asText(null)),
                currentTime.get().toInstant());
    }
}
