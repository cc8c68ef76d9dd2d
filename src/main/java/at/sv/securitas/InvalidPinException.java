package at.sv.securitas;

public final class InvalidPinException extends RuntimeException {
    public InvalidPinException() {
        super("The entered PIN is not correct");
    }
}
