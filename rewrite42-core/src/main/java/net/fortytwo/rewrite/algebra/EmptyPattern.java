package net.fortytwo.rewrite.algebra;

import java.util.Set;

/**
 * A pattern with no solutions
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public final class EmptyPattern extends Pattern {
    public static final EmptyPattern INSTANCE = new EmptyPattern();

    private EmptyPattern() {
    }

    @Override
    public void collectVariables(final Set<String> variables) {
    }

    @Override
    public String toString() {
        return "empty";
    }
}
