package net.fortytwo.rewrite.algebra;

import java.util.Set;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class UnionPattern extends Pattern {
    private final Pattern left;
    private final Pattern right;

    public UnionPattern(final Pattern left, final Pattern right) {
        this.left = left;
        this.right = right;
    }

    public Pattern getLeft() {
        return left;
    }

    public Pattern getRight() {
        return right;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        left.collectVariables(variables);
        right.collectVariables(variables);
    }

    @Override
    public String toString() {
        return "union(" + left + ", " + right + ")";
    }
}
