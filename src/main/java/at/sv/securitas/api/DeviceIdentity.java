package at.sv.securitas.api;

import lombok.Builder;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.UUID;

/**
 * The mobile device this client presents itself as. The backend binds OTP device validation to these ids, so a
 * generated identity should be stored by the host and reused across logins.
 */
@Builder(toBuilder = true)
public record DeviceIdentity(String idDevice, String uuid, String idDeviceIndigitall, String deviceBrand,
                             String deviceName, String deviceOsVersion, String deviceVersion, String deviceType,
                             String deviceResolution) {

    private static final SecureRandom RANDOM = new SecureRandom();

    public static DeviceIdentity generate() {
        return DeviceIdentity.builder()
                             .idDevice(randomUrlSafe(16) + ":APA91b" + truncate(randomUrlSafe(130), 134))
                             .uuid(UUID.randomUUID().toString().replace("-", "").substring(0, 16))
                             .idDeviceIndigitall(UUID.randomUUID().toString())
                             .deviceBrand("samsung")
                             .deviceName("SM-S901U")
                             .deviceOsVersion("12")
                             .deviceVersion("10.102.0")
                             .deviceType("")
                             .deviceResolution("")
                             .build();
    }

    private static String randomUrlSafe(int bytes) {
        byte[] buffer = new byte[bytes];
        RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }

    private static String truncate(String value, int length) {
        return value.length() > length ? value.substring(0, length) : value;
    }
}
