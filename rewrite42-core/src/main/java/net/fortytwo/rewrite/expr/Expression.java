package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Literal;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.XMLSchema;

import java.math.BigDecimal;

/**
 * An expression over the terms of a solution, as used in filters and assignments
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public abstract class Expression {

    /**
     * @param solution the solution providing variable bindings
     * @param context  evaluation services
     * @return the value of this expression. Never null
     * @throws ExpressionException if the value cannot be computed
     */
    public abstract Value evaluate(Solution solution, ExpressionContext context) throws ExpressionException;

    /**
     * Evaluates this expression as a condition
     *
     * @return the effective boolean value of this expression
     * @throws ExpressionException if the value cannot be computed or has no boolean value
     */
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return effectiveBooleanValue(evaluate(solution, context));
    }

    public static boolean effectiveBooleanValue(final Value value) throws ExpressionException {
        if (!(value instanceof Literal)) {
            throw new ExpressionException("no boolean value for " + Terms.toString(value));
        }

        Literal l = (Literal) value;
        if (XMLSchema.BOOLEAN.equals(l.getDatatype())) {
            String label = l.getLabel().trim();
            if (label.equals("true") || label.equals("1")) {
                return true;
            } else if (label.equals("false") || label.equals("0")) {
                return false;
            } else {
                throw new ExpressionException("invalid boolean: " + label);
            }
        } else if (Terms.isNumeric(l)) {
            BigDecimal d = Terms.numericValue(l);
            if (null == d) {
                // NaN and malformed numbers are false
                return false;
            }
            return d.signum() != 0;
        } else if (isStringLiteral(l)) {
            return l.getLabel().length() > 0;
        } else {
            throw new ExpressionException("no boolean value for " + Terms.toString(value));
        }
    }

    /**
     * @return whether the value is a simple, xsd:string or language-tagged literal
     */
    public static boolean isStringLiteral(final Value value) {
        if (!(value instanceof Literal)) {
            return false;
        }

        Literal l = (Literal) value;
        return l.getLanguage().isPresent()
                || XMLSchema.STRING.equals(l.getDatatype())
                || RDF.LANGSTRING.equals(l.getDatatype());
    }

    /**
     * @return the lexical form of a string literal
     * @throws ExpressionException if the value is not a string literal
     */
    public static String stringArgument(final Value value) throws ExpressionException {
        if (!isStringLiteral(value)) {
            throw new ExpressionException("expected a string literal, found " + Terms.toString(value));
        }
        return ((Literal) value).getLabel();
    }

    protected static Value checkBound(final Value value, final String variable) throws ExpressionException {
        if (null == value) {
            throw new ExpressionException("unbound variable: " + variable);
        }
        return value;
    }
}
