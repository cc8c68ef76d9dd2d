package at.sv.securitas;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Local confirmation before a command is sent. The PIN only lives in the client.
 */
final class PinGate {

    private final String pin;

    PinGate(String pin) {
        this.pin = pin;
    }

    boolean isEnabled() {
        return pin != null && !pin.isEmpty();
    }

    /**
     * @throws InvalidPinException if a PIN is configured and the given code does not match it
     */
    void check(String code) {
        if (!isEnabled()) {
            return;
        }
        if (code == null || !MessageDigest.isEqual(pin.getBytes(StandardCharsets.UTF_8),
                code.getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidPinException();
        }
    }
}
