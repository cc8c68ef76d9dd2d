package at.sv.securitas.api;

/**
 * The parts of an authenticated session that are sent with each request.
 */
public interface SessionCredentials {
    String user();

    /**
     * @return the bearer token ({@code hash}) issued at login
     */
    String token();

    long loginTimestamp();
}
