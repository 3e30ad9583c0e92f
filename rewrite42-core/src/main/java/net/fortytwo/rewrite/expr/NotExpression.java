package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class NotExpression extends Expression {
    private final Expression operand;

    public NotExpression(final Expression operand) {
        this.operand = operand;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(!operand.test(solution, context));
    }

    @Override
    public String toString() {
        return "!" + operand;
    }
}
