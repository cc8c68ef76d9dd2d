package at.sv.securitas.session;

import lombok.Data;

/**
 * Result of {@code mkLoginToken}, {@code RefreshLogin} and {@code mkValidateDevice}.
 */
@Data
final class LoginResponse {
    String res;
    String msg;
    String hash;
    String refreshToken;
    Boolean needDeviceAuthorization;

    boolean isOk() {
        return "OK".equals(res);
    }

    boolean hasHash() {
        return hash != null && !hash.isBlank();
    }
}
