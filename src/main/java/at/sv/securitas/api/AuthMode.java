package at.sv.securitas.api;

/**
 * How the {@code auth} header of an operation is built.
 */
public enum AuthMode {
    /**
     * No {@code auth} header, used by the login itself.
     */
    NONE,
    /**
     * The session token is sent as {@code hash}.
     */
    SESSION,
    /**
     * Device validation, OTP and refresh calls send an empty {@code hash} and {@code refreshToken}.
     */
    DEVICE_VALIDATION
}
