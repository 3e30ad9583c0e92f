package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ConstantExpression extends Expression {
    private final Value value;

    public ConstantExpression(final Value value) {
        if (null == value) {
            throw new IllegalArgumentException("null constant");
        }
        this.value = value;
    }

    public Value getValue() {
        return value;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) {
        return value;
    }

    @Override
    public String toString() {
        return Terms.toString(value);
    }
}
