package net.fortytwo.rewrite.eval;

/**
 * Thrown when an evaluation exhausts its step or time budget.
 * The query which raised it is abandoned; no partial mutation is committed.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ResourceExceededException extends RuntimeException {
    public ResourceExceededException(final String message) {
        super(message);
    }
}
