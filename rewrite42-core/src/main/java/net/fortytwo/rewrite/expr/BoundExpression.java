package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class BoundExpression extends Expression {
    private final String variable;

    public BoundExpression(final String variable) {
        this.variable = variable;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) {
        return context.getValueFactory().createLiteral(solution.isBound(variable));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) {
        return solution.isBound(variable);
    }

    @Override
    public String toString() {
        return "bound(?" + variable + ")";
    }
}
