package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IfExpression extends Expression {
    private final Expression condition;
    private final Expression thenExpr;
    private final Expression elseExpr;

    public IfExpression(final Expression condition, final Expression thenExpr, final Expression elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return condition.test(solution, context)
                ? thenExpr.evaluate(solution, context)
                : elseExpr.evaluate(solution, context);
    }

    @Override
    public String toString() {
        return "if(" + condition + ", " + thenExpr + ", " + elseExpr + ")";
    }
}
