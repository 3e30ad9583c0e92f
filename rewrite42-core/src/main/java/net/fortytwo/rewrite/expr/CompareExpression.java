package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Literal;
import org.openrdf.model.Value;

import java.math.BigDecimal;

/**
 * A comparison of two terms.
 * Numeric literals compare by value, string literals and other literals of a common datatype
 * by lexical form; other terms support only equality.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class CompareExpression extends Expression {
    public enum Operator {
        EQ("="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        Operator(final String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public CompareExpression(final Operator operator, final Expression left, final Expression right) {
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
        return compare(operator, left.evaluate(solution, context), right.evaluate(solution, context));
    }

    public static boolean compare(final Operator operator, final Value a, final Value b) throws ExpressionException {
        BigDecimal na = Terms.numericValue(a);
        BigDecimal nb = Terms.numericValue(b);
        if (null != na && null != nb) {
            return holds(operator, na.compareTo(nb));
        }

        if (operator == Operator.EQ || operator == Operator.NE) {
            boolean equal = equal(a, b);
            return operator == Operator.EQ ? equal : !equal;
        }

        if (isStringLiteral(a) && isStringLiteral(b)
                && !((Literal) a).getLanguage().isPresent() && !((Literal) b).getLanguage().isPresent()) {
            return holds(operator, ((Literal) a).getLabel().compareTo(((Literal) b).getLabel()));
        }

        if (a instanceof Literal && b instanceof Literal
                && ((Literal) a).getDatatype().equals(((Literal) b).getDatatype())
                && !Terms.isNumeric(a)) {
            return holds(operator, ((Literal) a).getLabel().compareTo(((Literal) b).getLabel()));
        }

        throw new ExpressionException("cannot compare " + Terms.toString(a) + " and " + Terms.toString(b));
    }

    private static boolean equal(final Value a, final Value b) throws ExpressionException {
        if (a.equals(b)) {
            return true;
        }

        if (a instanceof Literal && b instanceof Literal) {
            Literal la = (Literal) a;
            Literal lb = (Literal) b;
            // distinct literals of the same, or of well-known, datatypes are simply unequal
            if (la.getDatatype().equals(lb.getDatatype())
                    || isStringLiteral(la) || isStringLiteral(lb)
                    || Terms.isNumeric(la) || Terms.isNumeric(lb)) {
                return false;
            }
            throw new ExpressionException("cannot compare literals of unrelated datatypes "
                    + la.getDatatype() + " and " + lb.getDatatype());
        }

        return false;
    }

    private static boolean holds(final Operator operator, final int cmp) {
        switch (operator) {
            case EQ:
                return cmp == 0;
            case NE:
                return cmp != 0;
            case LT:
                return cmp < 0;
            case LE:
                return cmp <= 0;
            case GT:
                return cmp > 0;
            case GE:
                return cmp >= 0;
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
