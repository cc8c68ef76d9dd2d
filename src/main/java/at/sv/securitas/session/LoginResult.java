package at.sv.securitas.session;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * Either an active {@link Session} or the {@link AuthChallenge} that has to be answered first.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public final class LoginResult {
    private final Session session;
    private final AuthChallenge challenge;

    public static LoginResult of(Session session) {
        return new LoginResult(Objects.requireNonNull(session), null);
    }

    public static LoginResult challenge(AuthChallenge challenge) {
        return new LoginResult(null, Objects.requireNonNull(challenge));
    }

    public boolean requiresOtp() {
        return challenge != null;
    }

    /**
     * @throws IllegalStateException if the login still requires a second factor
     */
    public Session getSession() {
        if (session == null) {
            throw new IllegalStateException("Login requires a one-time passcode");
        }
        return session;
    }

    /**
     * @throws IllegalStateException if the login did not require a second factor
     */
    public AuthChallenge getChallenge() {
        if (challenge == null) {
            throw new IllegalStateException("Login did not require a one-time passcode");
        }
        return challenge;
    }
}
