package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Value;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * regex(text, pattern [, flags]), matching anywhere in the lexical form of a literal or the string of an IRI
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class RegexExpression extends Expression {
    private static final int MAX_CACHED = 1000;
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private final Expression text;
    private final Expression pattern;
    private final Expression flags;

    /**
     * @param flags the regex flags, or null for none
     */
    public RegexExpression(final Expression text, final Expression pattern, final Expression flags) {
        this.text = text;
        this.pattern = pattern;
        this.flags = flags;
    }

    @Override
    public Value evaluate(final Solution solution, final ExpressionContext context) throws ExpressionException {
        return context.getValueFactory().createLiteral(test(solution, context));
    }

    @Override
    public boolean test(final Solution solution, final ExpressionContext context) throws ExpressionException {
        Value v = text.evaluate(solution, context);
        String t = Terms.stringForm(v);
        if (null == t) {
            throw new ExpressionException("no string form: " + Terms.toString(v));
        }
        String p = stringArgument(pattern.evaluate(solution, context));
        String f = null == flags ? "" : stringArgument(flags.evaluate(solution, context));

        return compile(p, f).matcher(t).find();
    }

    static Pattern compile(final String regex, final String flagString) throws ExpressionException {
        String key = flagString + "/" + regex;
        Pattern p = CACHE.get(key);
        if (null != p) {
            return p;
        }

        try {
            p = Pattern.compile(regex, parseFlags(flagString));
        } catch (PatternSyntaxException e) {
            throw new ExpressionException("invalid regular expression: " + regex, e);
        }
        synchronized (CACHE) {
            Pattern cached = CACHE.get(key);
            if (null != cached) {
                return cached;
            }
            if (CACHE.size() < MAX_CACHED) {
                CACHE.put(key, p);
            }
        }
        return p;
    }

    private static int parseFlags(final String flagString) throws ExpressionException {
        int f = 0;
        for (char c : flagString.toCharArray()) {
            switch (c) {
                case 'i':
                    f |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
                    break;
                case 's':
                    f |= Pattern.DOTALL;
                    break;
                case 'm':
                    f |= Pattern.MULTILINE;
                    break;
                case 'x':
                    f |= Pattern.COMMENTS;
                    break;
                case 'q':
                    f |= Pattern.LITERAL;
                    break;
                default:
                    throw new ExpressionException("unsupported regex flag: " + c);
            }
        }
        return f;
    }

    @Override
    public String toString() {
        return "regex(" + text + ", " + pattern + (null == flags ? "" : ", " + flags) + ")";
    }
}
