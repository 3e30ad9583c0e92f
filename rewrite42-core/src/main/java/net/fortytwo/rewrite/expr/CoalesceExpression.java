package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * The value of the first argument which evaluates without error
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class CoalesceExpression extends Expression {
    private final List<Expression> args;

    public CoalesceExpression(final List<Expression> args) {
        this.args = new ArrayList<>(args);
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        for (Expression e : args) {
            try {
                return e.evaluate(solution, context);
            } catch (ExpressionException ignored) {
                // try the next argument
            }
        }

        throw new ExpressionException("no argument of coalesce could be evaluated");
    }

    @Override
    public String toString() {
        return "coalesce" + args;
    }
}
