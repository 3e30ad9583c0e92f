package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Extends each solution of an inner pattern with computed values.
 * An assignment whose expression cannot be evaluated leaves its variable unbound.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class BindPattern extends Pattern {

    public static class Assignment {
        private final String variable;
        private final Expression expression;

        public Assignment(final String variable, final Expression expression) {
            this.variable = variable;
            this.expression = expression;
        }

        public String getVariable() {
            return variable;
        }

        public Expression getExpression() {
            return expression;
        }

        @Override
        public String toString() {
            return expression + " AS ?" + variable;
        }
    }

    private final Pattern inner;
    private final List<Assignment> assignments;

    public BindPattern(final Pattern inner, final List<Assignment> assignments) {
        this.inner = inner;
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public Pattern getInner() {
        return inner;
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        inner.collectVariables(variables);
        for (Assignment a : assignments) {
            variables.add(a.getVariable());
        }
    }

    @Override
    public String toString() {
        return "bind(" + assignments + ", " + inner + ")";
    }
}
