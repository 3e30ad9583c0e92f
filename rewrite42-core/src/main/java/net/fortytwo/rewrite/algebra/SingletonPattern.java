package net.fortytwo.rewrite.algebra;

import java.util.Set;

/**
 * The empty group pattern, which has exactly one solution binding no variables
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public final class SingletonPattern extends Pattern {
    public static final SingletonPattern INSTANCE = new SingletonPattern();

    private SingletonPattern() {
    }

    @Override
    public void collectVariables(final Set<String> variables) {
    }

    @Override
    public String toString() {
        return "{}";
    }
}
