package at.sv.securitas.api;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import lombok.extern.slf4j.Slf4j;

import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Reads the {@code exp} claim of the tokens issued by the backend. Signatures are not verified, the expiry is only
 * used to estimate when a token has to be renewed.
 */
@Slf4j
public final class JwtExpiry {

    private JwtExpiry() {
    }

    public static Optional<Instant> read(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            JWTClaimsSet claims = JWTParser.parse(token).getJWTClaimsSet();
            return Optional.ofNullable(claims.getExpirationTime()).map(Date::toInstant);
        } catch (ParseException e) {
            log.debug("Token is no readable JWT: {}", e.getLocalizedMessage());
            return Optional.empty();
        }
    }
}
