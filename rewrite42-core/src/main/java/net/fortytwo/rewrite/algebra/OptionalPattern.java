package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.expr.Expression;

import java.util.Set;

/**
 * A left outer join, with an optional condition on the combined solutions
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class OptionalPattern extends Pattern {
    private final Pattern left;
    private final Pattern right;
    private final Expression condition;

    /**
     * @param condition a condition on the combined solutions, or null if there is none
     */
    public OptionalPattern(final Pattern left, final Pattern right, final Expression condition) {
        this.left = left;
        this.right = right;
        this.condition = condition;
    }

    public Pattern getLeft() {
        return left;
    }

    public Pattern getRight() {
        return right;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        left.collectVariables(variables);
        right.collectVariables(variables);
    }

    @Override
    public String toString() {
        return "optional(" + left + ", " + right + (null == condition ? "" : ", " + condition) + ")";
    }
}
