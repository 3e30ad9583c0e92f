package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class SameTermExpression extends Expression {
    private final Expression left;
    private final Expression right;

    public SameTermExpression(final Expression left, final Expression right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return left.evaluate(solution, context).equals(right.evaluate(solution, context));
    }

    @Override
    public String toString() {
        return "sameTerm(" + left + ", " + right + ")";
    }
}
