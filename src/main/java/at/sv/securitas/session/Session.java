package at.sv.securitas.session;

import at.sv.securitas.api.SessionCredentials;

import java.time.Duration;
import java.time.Instant;

/**
 * An authenticated session. Renewal never changes a Session, it produces a new one.
 *
 * @param token          the bearer token ({@code hash}) sent in the {@code auth} header
 * @param refreshToken   token for {@code RefreshLogin}, may be null
 * @param loginTimestamp epoch millis of the login, echoed in the {@code auth} header
 * @param expiresAt      read from the token's {@code exp} claim, or estimated with the fallback lifetime
 */
public record Session(String user, String token, String refreshToken, long loginTimestamp, Instant issuedAt,
                      Instant expiresAt) implements SessionCredentials {

    /**
     * @return true if the session does not expire within the given margin
     */
    public boolean isValidAt(Instant now, Duration margin) {
        return now.plus(margin).isBefore(expiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    @Override
    public String toString() {
        return "Session{user=" + user + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "}";
    }
}
