package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.BNode;
import org.openrdf.model.IRI;
import org.openrdf.model.Literal;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.XMLSchema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * A call to one of the built-in term and string functions
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class FunctionExpression extends Expression {
    private static final String FN = "http://www.w3.org/2005/xpath-functions#";

    public enum Function {
        STR(null, 1, 1),
        IRI(null, 1, 1),
        LANG(null, 1, 1),
        DATATYPE(null, 1, 1),
        CONCAT(FN + "concat", 0, Integer.MAX_VALUE),
        STRAFTER(FN + "substring-after", 2, 2),
        STRBEFORE(FN + "substring-before", 2, 2),
        STRSTARTS(FN + "starts-with", 2, 2),
        STRENDS(FN + "ends-with", 2, 2),
        CONTAINS(FN + "contains", 2, 2),
        REPLACE(FN + "replace", 3, 4),
        UCASE(FN + "upper-case", 1, 1),
        LCASE(FN + "lower-case", 1, 1),
        STRLEN(FN + "string-length", 1, 1),
        SUBSTR(FN + "substring", 2, 3),
        ENCODE_FOR_URI(FN + "encode-for-uri", 1, 1);

        private final String iri;
        private final int minArgs;
        private final int maxArgs;

        Function(final String iri, final int minArgs, final int maxArgs) {
            this.iri = iri;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        /**
         * @return the IRI by which the function is called, or null for a built-in with only a keyword form
         */
        public String getIri() {
            return iri;
        }

        /**
         * @param iri the IRI of a function
         * @return the matching function, or null if there is none
         */
        public static Function forIri(final String iri) {
            for (Function f : values()) {
                if (null != f.iri && f.iri.equals(iri)) {
                    return f;
                }
            }
            return null;
        }
    }

    private final Function function;
    private final List<Expression> args;

    public FunctionExpression(final Function function, final List<Expression> args) {
        if (args.size() < function.minArgs || args.size() > function.maxArgs) {
            throw new IllegalArgumentException("wrong number of arguments to " + function + ": " + args.size());
        }

        this.function = function;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public Function getFunction() {
        return function;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        List<Value> values = new ArrayList<>(args.size());
        for (Expression e : args) {
            values.add(e.evaluate(solution, context));
        }

        ValueFactory vf = context.getValueFactory();

        switch (function) {
            case STR:
                return str(values.get(0), vf);
            case IRI:
                return iri(values.get(0), context);
            case LANG:
                return vf.createLiteral(languageOf(literalArgument(values.get(0))).orElse(""));
            case DATATYPE:
                return literalArgument(values.get(0)).getDatatype();
            case CONCAT:
                return concat(values, vf);
            case STRAFTER:
                return strAfter(values.get(0), values.get(1), vf);
            case STRBEFORE:
                return strBefore(values.get(0), values.get(1), vf);
            case STRSTARTS:
                return vf.createLiteral(stringArgument(values.get(0)).startsWith(stringArgument(values.get(1))));
            case STRENDS:
                return vf.createLiteral(stringArgument(values.get(0)).endsWith(stringArgument(values.get(1))));
            case CONTAINS:
                return vf.createLiteral(stringArgument(values.get(0)).contains(stringArgument(values.get(1))));
            case REPLACE:
                return replace(values, vf);
            case UCASE:
                return sameLanguage(values.get(0), stringArgument(values.get(0)).toUpperCase(Locale.ROOT), vf);
            case LCASE:
                return sameLanguage(values.get(0), stringArgument(values.get(0)).toLowerCase(Locale.ROOT), vf);
            case STRLEN:
                String s = stringArgument(values.get(0));
                return vf.createLiteral(String.valueOf(s.codePointCount(0, s.length())), XMLSchema.INTEGER);
            case SUBSTR:
                return substr(values, vf);
            case ENCODE_FOR_URI:
                return vf.createLiteral(encodeForUri(stringArgument(values.get(0))));
            default:
                throw new IllegalStateException("unexpected function: " + function);
        }
    }

    private static Value str(final Value v, final ValueFactory vf) throws ExpressionException {
        if (v instanceof BNode) {
            throw new ExpressionException("blank node has no string form");
        }
        return vf.createLiteral(Terms.stringForm(v));
    }

    private static Value iri(final Value v, final ExpressionContext context) throws ExpressionException {
        if (v instanceof IRI) {
            return v;
        }

        String s = stringArgument(v);
        String base = context.getBaseIri();
        try {
            if (null != base && !isAbsolute(s)) {
                s = URI.create(base).resolve(s).toString();
            }
            return context.getValueFactory().createIRI(s);
        } catch (IllegalArgumentException e) {
            throw new ExpressionException("invalid IRI: " + s, e);
        }
    }

    private static boolean isAbsolute(final String s) {
        int colon = s.indexOf(':');
        if (colon < 1) {
            return false;
        }
        for (int i = 0; i < colon; i++) {
            char c = s.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.')) {
                return false;
            }
        }
        return true;
    }

    private static Value concat(final List<Value> values, final ValueFactory vf) throws ExpressionException {
        StringBuilder sb = new StringBuilder();
        String language = null;
        boolean sameLanguage = true;
        for (int i = 0; i < values.size(); i++) {
            Value v = values.get(i);
            sb.append(stringArgument(v));
            String lang = languageOf((Literal) v).orElse(null);
            if (0 == i) {
                language = lang;
            } else if (null == lang ? null != language : !lang.equals(language)) {
                sameLanguage = false;
            }
        }

        return sameLanguage && null != language
                ? vf.createLiteral(sb.toString(), language)
                : vf.createLiteral(sb.toString());
    }

    private static Value strAfter(final Value arg, final Value sep, final ValueFactory vf)
            throws ExpressionException {
        String a = stringArgument(arg);
        String b = stringArgument(sep);
        checkCompatibleLanguage(arg, sep);

        int i = a.indexOf(b);
        return i < 0 ? vf.createLiteral("") : sameLanguage(arg, a.substring(i + b.length()), vf);
    }

    private static Value strBefore(final Value arg, final Value sep, final ValueFactory vf)
            throws ExpressionException {
        String a = stringArgument(arg);
        String b = stringArgument(sep);
        checkCompatibleLanguage(arg, sep);

        int i = a.indexOf(b);
        return i < 0 ? vf.createLiteral("") : sameLanguage(arg, a.substring(0, i), vf);
    }

    private static Value replace(final List<Value> values, final ValueFactory vf) throws ExpressionException {
        String input = stringArgument(values.get(0));
        String pattern = stringArgument(values.get(1));
        String replacement = stringArgument(values.get(2));
        String flags = values.size() > 3 ? stringArgument(values.get(3)) : "";

        Matcher m = RegexExpression.compile(pattern, flags).matcher(input);
        try {
            return sameLanguage(values.get(0), m.replaceAll(replacement), vf);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new ExpressionException("invalid replacement: " + replacement, e);
        }
    }

    private static Value substr(final List<Value> values, final ValueFactory vf) throws ExpressionException {
        String s = stringArgument(values.get(0));
        int[] codePoints = s.codePoints().toArray();

        long start = roundedInteger(values.get(1));
        long end = values.size() > 2 ? start + roundedInteger(values.get(2)) : Long.MAX_VALUE;

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < codePoints.length; i++) {
            long position = i + 1;
            if (position >= start && position < end) {
                sb.appendCodePoint(codePoints[i]);
            }
        }
        return sameLanguage(values.get(0), sb.toString(), vf);
    }

    private static long roundedInteger(final Value v) throws ExpressionException {
        BigDecimal d = Terms.numericValue(v);
        if (null == d) {
            throw new ExpressionException("expected a number, found " + Terms.toString(v));
        }
        return d.setScale(0, RoundingMode.HALF_UP).longValue();
    }

    static String encodeForUri(final String s) {
        StringBuilder sb = new StringBuilder();
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            char c = (char) (b & 0xff);
            if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_' || c == '.' || c == '~') {
                sb.append(c);
            } else {
                sb.append('%').append(String.format("%02X", b & 0xff));
            }
        }
        return sb.toString();
    }

    private static Literal literalArgument(final Value v) throws ExpressionException {
        if (!(v instanceof Literal)) {
            throw new ExpressionException("expected a literal, found " + Terms.toString(v));
        }
        return (Literal) v;
    }

    private static Optional<String> languageOf(final Literal l) {
        return l.getLanguage();
    }

    private static void checkCompatibleLanguage(final Value arg, final Value other) throws ExpressionException {
        Optional<String> l2 = ((Literal) other).getLanguage();
        if (l2.isPresent() && !l2.equals(((Literal) arg).getLanguage())) {
            throw new ExpressionException("incompatible language tags");
        }
    }

    private static Value sameLanguage(final Value original, final String label, final ValueFactory vf) {
        Optional<String> lang = ((Literal) original).getLanguage();
        return lang.isPresent() ? vf.createLiteral(label, lang.get()) : vf.createLiteral(label);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(function.name().toLowerCase(Locale.ROOT)).append("(");
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args.get(i));
        }
        return sb.append(")").toString();
    }
}
