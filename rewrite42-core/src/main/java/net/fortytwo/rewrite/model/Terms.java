package net.fortytwo.rewrite.model;

import org.openrdf.model.BNode;
import org.openrdf.model.IRI;
import org.openrdf.model.Literal;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.XMLSchema;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Type tests, string forms and a total ordering over RDF terms.
 * Terms are the closed family of Sesame values: {@link IRI}, {@link BNode} and {@link Literal}.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public final class Terms {

    private static final Set<IRI> NUMERIC_TYPES = new HashSet<>(Arrays.asList(
            XMLSchema.INTEGER, XMLSchema.DECIMAL, XMLSchema.DOUBLE, XMLSchema.FLOAT,
            XMLSchema.LONG, XMLSchema.INT, XMLSchema.SHORT, XMLSchema.BYTE,
            XMLSchema.NON_NEGATIVE_INTEGER, XMLSchema.POSITIVE_INTEGER,
            XMLSchema.NON_POSITIVE_INTEGER, XMLSchema.NEGATIVE_INTEGER,
            XMLSchema.UNSIGNED_LONG, XMLSchema.UNSIGNED_INT, XMLSchema.UNSIGNED_SHORT, XMLSchema.UNSIGNED_BYTE));

    /**
     * Orders terms as: unbound (null), blank nodes, IRIs, literals.
     * Numeric literals come before other literals and compare by value;
     * other literals compare by lexical form, then datatype, then language.
     */
    public static final Comparator<Value> ORDER = Terms::compare;

    private Terms() {
    }

    public static boolean isIRI(final Value v) {
        return v instanceof IRI;
    }

    public static boolean isBlankNode(final Value v) {
        return v instanceof BNode;
    }

    public static boolean isLiteral(final Value v) {
        return v instanceof Literal;
    }

    public static boolean isNumeric(final Value v) {
        return v instanceof Literal && NUMERIC_TYPES.contains(((Literal) v).getDatatype());
    }

    /**
     * @param v a term
     * @return the lexical form of a literal or the string of an IRI,
     * or null for a blank node, which has no string form
     */
    public static String stringForm(final Value v) {
        if (v instanceof Literal) {
            return ((Literal) v).getLabel();
        } else if (v instanceof IRI) {
            return v.stringValue();
        } else {
            return null;
        }
    }

    /**
     * @param v a literal
     * @return the numeric value of the literal, or null if it is not a well-formed numeric literal
     */
    public static BigDecimal numericValue(final Value v) {
        if (!isNumeric(v)) {
            return null;
        }

        try {
            return new BigDecimal(((Literal) v).getLabel().trim());
        } catch (NumberFormatException e) {
            // e.g. "NaN" or "INF"
            return null;
        }
    }

    public static int compare(final Value first, final Value second) {
        if (first == second) {
            return 0;
        }
        if (null == first) {
            return -1;
        }
        if (null == second) {
            return 1;
        }

        int k = Integer.compare(rank(first), rank(second));
        if (0 != k) {
            return k;
        }

        if (first instanceof Literal) {
            return compareLiterals((Literal) first, (Literal) second);
        } else {
            return first.stringValue().compareTo(second.stringValue());
        }
    }

    private static int rank(final Value v) {
        if (v instanceof BNode) {
            return 0;
        } else if (v instanceof IRI) {
            return 1;
        } else {
            return 2;
        }
    }

    private static int compareLiterals(final Literal first, final Literal second) {
        BigDecimal n1 = numericValue(first);
        BigDecimal n2 = numericValue(second);
        if ((null == n1) != (null == n2)) {
            return null == n1 ? 1 : -1;
        }
        if (null != n1) {
            int c = n1.compareTo(n2);
            if (0 != c) {
                return c;
            }
        }

        int c = first.getLabel().compareTo(second.getLabel());
        if (0 != c) {
            return c;
        }

        c = first.getDatatype().stringValue().compareTo(second.getDatatype().stringValue());
        if (0 != c) {
            return c;
        }

        Optional<String> l1 = first.getLanguage();
        Optional<String> l2 = second.getLanguage();
        return l1.orElse("").compareTo(l2.orElse(""));
    }

    /**
     * @param v a term
     * @return an N-Triples-like rendering of the term, for logging
     */
    public static String toString(final Value v) {
        if (null == v) {
            return "UNDEF";
        } else if (v instanceof IRI) {
            return "<" + v.stringValue() + ">";
        } else if (v instanceof BNode) {
            return "_:" + ((BNode) v).getID();
        } else {
            Literal l = (Literal) v;
            StringBuilder sb = new StringBuilder("\"").append(l.getLabel()).append("\"");
            if (l.getLanguage().isPresent()) {
                sb.append("@").append(l.getLanguage().get());
            } else if (!XMLSchema.STRING.equals(l.getDatatype())) {
                sb.append("^^<").append(l.getDatatype().stringValue()).append(">");
            }
            return sb.toString();
        }
    }
}
