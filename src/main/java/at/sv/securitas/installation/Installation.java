package at.sv.securitas.installation;

import at.sv.securitas.api.InstallationRef;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A site of the account with everything needed to send commands to it. Immutable, a new capabilities token results
 * in a new Installation.
 *
 * @param number             the installation number ({@code numinst})
 * @param panel              the vendor panel type, e.g. {@code SDVFAST}
 * @param country            the country code of the API the installation was resolved from
 * @param capabilities       the capabilities token sent as {@code X-Capabilities}
 * @param capabilitiesExpiry read from the {@code exp} claim of the capabilities token
 * @param perimetral         true if the panel supports perimeter arming
 */
@Builder(toBuilder = true)
public record Installation(String number, String alias, String panel, String type, String name, String lastName,
                           String address, String city, String postcode, String country, String capabilities,
                           Instant capabilitiesExpiry, boolean perimetral, List<Device> devices)
        implements InstallationRef {

    public Installation {
        devices = devices == null ? List.of() : List.copyOf(devices);
    }

    public List<Device> sentinels() {
        return devices.stream()
                      .filter(Device::isSentinel)
                      .toList();
    }

    /**
     * @return true if the capabilities token does not expire within the given margin
     */
    public boolean hasValidCapabilities(Instant now, Duration margin) {
        return capabilities != null && !capabilities.isBlank() && capabilitiesExpiry != null
               && now.plus(margin).isBefore(capabilitiesExpiry);
    }

    @Override
    public String toString() {
        return "Installation{number=" + number + ", alias=" + alias + ", panel=" + panel + ", perimetral=" +
               perimetral + ", devices=" + devices.size() + "}";
    }
}
