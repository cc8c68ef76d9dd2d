package at.sv.securitas.api;

/**
 * A one-time passcode entered by the user, together with the hash of the challenge it answers.
 */
public record OtpAnswer(String otpHash, String code) {

    @Override
    public String toString() {
        return "OtpAnswer{otpHash=" + otpHash + ", code=***}";
    }
}
