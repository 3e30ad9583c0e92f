package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * EXISTS and NOT EXISTS, evaluated against the bindings of the current solution
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ExistsExpression extends Expression {
    private final Pattern pattern;
    private final boolean negated;

    public ExistsExpression(final Pattern pattern, final boolean negated) {
        this.pattern = pattern;
        this.negated = negated;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) {
        return negated != context.exists(pattern, solution);
    }

    @Override
    public String toString() {
        return (negated ? "not exists " : "exists ") + pattern;
    }
}
