package at.sv.securitas.session;

/**
 * A phone the one-time passcode can be sent to.
 *
 * @param phone the masked phone number, as shown to the user
 */
public record OtpPhone(int id, String phone) {
}
