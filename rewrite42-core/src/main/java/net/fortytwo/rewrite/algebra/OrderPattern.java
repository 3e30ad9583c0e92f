package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class OrderPattern extends Pattern {

    public static class OrderCondition {
        private final Expression expression;
        private final boolean ascending;

        public OrderCondition(final Expression expression, final boolean ascending) {
            this.expression = expression;
            this.ascending = ascending;
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isAscending() {
            return ascending;
        }

        @Override
        public String toString() {
            return (ascending ? "asc(" : "desc(") + expression + ")";
        }
    }

    private final Pattern inner;
    private final List<OrderCondition> conditions;

    public OrderPattern(final Pattern inner, final List<OrderCondition> conditions) {
        this.inner = inner;
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public Pattern getInner() {
        return inner;
    }

    public List<OrderCondition> getConditions() {
        return conditions;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        inner.collectVariables(variables);
    }

    @Override
    public String toString() {
        return "order(" + conditions + ", " + inner + ")";
    }
}
