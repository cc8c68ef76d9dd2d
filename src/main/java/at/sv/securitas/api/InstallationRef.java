package at.sv.securitas.api;

/**
 * Identifies the installation an operation targets; sent as {@code numinst}, {@code panel} and
 * {@code X-Capabilities} headers.
 */
public interface InstallationRef {
    String number();

    String panel();

    String capabilities();
}
