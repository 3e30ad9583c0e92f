package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.expr.Expression;

import java.util.Set;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class FilterPattern extends Pattern {
    private final Pattern inner;
    private final Expression condition;

    public FilterPattern(final Pattern inner, final Expression condition) {
        this.inner = inner;
        this.condition = condition;
    }

    public Pattern getInner() {
        return inner;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        inner.collectVariables(variables);
    }

    @Override
    public String toString() {
        return "filter(" + condition + ", " + inner + ")";
    }
}
