package at.sv.securitas.installation;

/**
 * The backend returned malformed or incomplete installation data.
 */
public final class ResolutionException extends RuntimeException {

    public ResolutionException(String message) {
        super(message);
    }
}
