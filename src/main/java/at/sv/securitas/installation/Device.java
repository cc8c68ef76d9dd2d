package at.sv.securitas.installation;

/**
 * An auxiliary service of an installation.
 *
 * @param serviceId the id of the service
 * @param zone      the zone of the device, read from the first service attribute
 * @param request   the request code of the service, e.g. {@code CONFORT} for Sentinels
 */
public record Device(String serviceId, String zone, String alias, String request, Kind kind) {

    public enum Kind {
        SENTINEL,
        OTHER
    }

    public boolean isSentinel() {
        return kind == Kind.SENTINEL;
    }
}
