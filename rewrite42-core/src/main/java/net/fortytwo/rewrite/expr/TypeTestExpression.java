package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Value;

/**
 * isIRI, isBlank, isLiteral and isNumeric
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TypeTestExpression extends Expression {
    public enum Kind {IRI, BLANK, LITERAL, NUMERIC}

    private final Kind kind;
    private final Expression operand;

    public TypeTestExpression(final Kind kind, final Expression operand) {
        this.kind = kind;
        this.operand = operand;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        Value v = operand.evaluate(solution, context);
        switch (kind) {
            case IRI:
                return Terms.isIRI(v);
            case BLANK:
                return Terms.isBlankNode(v);
            case LITERAL:
                return Terms.isLiteral(v);
            case NUMERIC:
                return Terms.isNumeric(v);
            default:
                throw new IllegalStateException();
        }
    }

    @Override
    public String toString() {
        return "is" + kind + "(" + operand + ")";
    }
}
