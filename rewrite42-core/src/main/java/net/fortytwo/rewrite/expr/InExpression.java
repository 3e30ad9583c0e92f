package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * IN and NOT IN: equality against each member of a list.
 * An error comparing against one member is overridden by a match with another.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class InExpression extends Expression {
    private final Expression operand;
    private final List<Expression> members;
    private final boolean negated;

    public InExpression(final Expression operand, final List<Expression> members, final boolean negated) {
        this.operand = operand;
        this.members = new ArrayList<>(members);
        this.negated = negated;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        Value v = operand.evaluate(solution, context);

        ExpressionException error = null;
        for (Expression m : members) {
            try {
                if (CompareExpression.compare(CompareExpression.Operator.EQ, v, m.evaluate(solution, context))) {
                    return !negated;
                }
            } catch (ExpressionException e) {
                error = e;
            }
        }

        if (null != error) {
            throw error;
        }
        return negated;
    }

    @Override
    public String toString() {
        return operand + (negated ? " not in " : " in ") + members;
    }
}
