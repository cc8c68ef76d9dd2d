package at.sv.securitas.api;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {

    private Futures() {
    }

    /**
     * @return the failure a dependent stage reported, without the {@link CompletionException} wrapper added by
     * {@link java.util.concurrent.CompletableFuture}.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * @return true if the given failure or one of its causes is of the given type
     */
    public static boolean isCausedBy(Throwable error, Class<? extends Throwable> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }
}
