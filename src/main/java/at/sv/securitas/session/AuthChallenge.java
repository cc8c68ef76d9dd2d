package at.sv.securitas.session;

import java.util.List;

/**
 * The second factor the backend asks for before it accepts this device. Answered with
 * {@link SessionManager#submitOtp(AuthChallenge, String)}.
 *
 * @param otpHash     identifies the challenge, sent back together with the code
 * @param phones      the phones the code can be sent to
 * @param credentials the credentials of the pending login, used to log in again once the device is validated
 */
public record AuthChallenge(String otpHash, List<OtpPhone> phones, Credentials credentials) {

    public AuthChallenge {
        phones = List.copyOf(phones);
    }

    @Override
    public String toString() {
        return "AuthChallenge{otpHash=" + otpHash + ", phones=" + phones + "}";
    }
}
