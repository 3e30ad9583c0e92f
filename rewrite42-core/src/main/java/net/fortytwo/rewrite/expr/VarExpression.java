package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Value;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class VarExpression extends Expression {
    private final String name;

    public VarExpression(final String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return checkBound(solution.get(name), name);
    }

    @Override
    public String toString() {
        return "?" + name;
    }
}
