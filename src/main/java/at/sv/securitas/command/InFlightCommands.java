package at.sv.securitas.command;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allows at most one command in progress per installation.
 */
public final class InFlightCommands {

    private final ConcurrentMap<String, Claim> claims = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * The slot of one command. Releasing a claim that was superseded in the meantime has no effect.
     */
    public record Claim(String installationNumber, long id) {
    }

    Optional<Claim> tryClaim(String installationNumber) {
        Claim claim = new Claim(installationNumber, sequence.incrementAndGet());
        if (claims.putIfAbsent(installationNumber, claim) != null) {
            return Optional.empty();
        }
        return Optional.of(claim);
    }

    boolean release(Claim claim) {
        return claims.remove(claim.installationNumber(), claim);
    }

    boolean supersede(String installationNumber) {
        return claims.remove(installationNumber) != null;
    }

    boolean isBusy(String installationNumber) {
        return claims.containsKey(installationNumber);
    }
}
