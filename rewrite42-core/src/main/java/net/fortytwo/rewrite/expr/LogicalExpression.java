package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * A conjunction or disjunction with three-valued logic:
 * an error on one side is overridden by a decisive value on the other side.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class LogicalExpression extends Expression {
    public enum Operator {AND, OR}

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public LogicalExpression(final Operator operator, final Expression left, final Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        boolean decisive = operator == Operator.OR;

        ExpressionException error = null;
        try {
            if (left.test(solution, context) == decisive) {
                return decisive;
            }
        } catch (ExpressionException e) {
            error = e;
        }

        boolean r = right.test(solution, context);
        if (r == decisive) {
            return decisive;
        } else if (null != error) {
            throw error;
        } else {
            return !decisive;
        }
    }

    @Override
    public String toString() {
        return "(" + left + (operator == Operator.AND ? " && " : " || ") + right + ")";
    }
}
