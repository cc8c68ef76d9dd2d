package at.sv.securitas.installation;

import java.time.Duration;
import java.time.Instant;

/**
 * @param temperature       in degrees Celsius
 * @param humidity          relative humidity in percent
 * @param airQuality        the current air quality value
 * @param airQualityMessage the backend's rating of the air quality
 */
public record SentinelReading(String zone, String alias, int temperature, int humidity, Integer airQuality,
                              String airQualityMessage, Instant readAt) {

    public boolean isStale(Instant now, Duration maxAge) {
        return readAt.plus(maxAge).isBefore(now);
    }
}
