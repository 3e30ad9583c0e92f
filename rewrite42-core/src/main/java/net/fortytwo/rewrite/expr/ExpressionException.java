package net.fortytwo.rewrite.expr;

/**
 * A type error or other failure to compute the value of an expression.
 * In a filter, the error makes the filter false; in an assignment, it leaves the variable unbound.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ExpressionException extends Exception {
    public ExpressionException(final String message) {
        super(message);
    }

    public ExpressionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
