package net.fortytwo.rewrite.sparql;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A lexical pass over SPARQL query text which finds the prefixes a query declares and uses,
 * and the keyword of its query form, without parsing it
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
final class QueryScanner {
    private static final Pattern PREFIX_DECLARATION
            = Pattern.compile("(?i)\\bPREFIX\\s+([A-Za-z][A-Za-z0-9_.-]*)?\\s*:");
    private static final Pattern PROLOGUE
            = Pattern.compile("(?i)^\\s*((PREFIX\\s+([A-Za-z][A-Za-z0-9_.-]*)?\\s*:\\s*)|(BASE\\s*))*");
    private static final Pattern KEYWORD = Pattern.compile("[A-Za-z]+");

    private QueryScanner() {
    }

    /**
     * @return the query text with IRI references, string literals and comments blanked out
     */
    static String strip(final String query) {
        char[] chars = query.toCharArray();
        StringBuilder sb = new StringBuilder(chars.length);
        int i = 0;
        while (i < chars.length) {
            char c = chars[i];
            int end;
            if (c == '<' && (end = endOfIri(chars, i)) > 0) {
                blank(sb, end - i);
                i = end;
            } else if (c == '"' || c == '\'') {
                end = endOfString(chars, i);
                blank(sb, end - i);
                i = end;
            } else if (c == '#') {
                end = i;
                while (end < chars.length && chars[end] != '\n') {
                    end++;
                }
                blank(sb, end - i);
                i = end;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * @return the prefixes declared in the prologue of the query; the empty prefix is ""
     */
    static Set<String> declaredPrefixes(final String stripped) {
        Set<String> prefixes = new LinkedHashSet<>();
        Matcher m = PREFIX_DECLARATION.matcher(stripped);
        while (m.find()) {
            prefixes.add(null == m.group(1) ? "" : m.group(1));
        }
        return prefixes;
    }

    /**
     * @return the prefixes of all prefixed names in the query, in order of first use
     */
    static Set<String> usedPrefixes(final String stripped) {
        Set<String> prefixes = new LinkedHashSet<>();
        for (int i = 0; i < stripped.length(); i++) {
            if (stripped.charAt(i) != ':') {
                continue;
            }

            int start = i;
            while (start > 0 && isNameChar(stripped.charAt(start - 1))) {
                start--;
            }

            // a colon within the local part of a prefixed name
            if (start > 0 && stripped.charAt(start - 1) == ':') {
                continue;
            }
            // variables
            if (start > 0 && (stripped.charAt(start - 1) == '?' || stripped.charAt(start - 1) == '$')) {
                continue;
            }

            // blank node labels
            if (stripped.substring(start, i).equals("_")) {
                continue;
            }

            while (start < i && !Character.isLetter(stripped.charAt(start))) {
                start++;
            }

            prefixes.add(stripped.substring(start, i));
        }
        return prefixes;
    }

    /**
     * @return the first keyword after the prologue, in upper case, e.g. SELECT or INSERT
     */
    static String queryKeyword(final String stripped) {
        Matcher prologue = PROLOGUE.matcher(stripped);
        String rest = prologue.find() ? stripped.substring(prologue.end()) : stripped;
        Matcher keyword = KEYWORD.matcher(rest);
        return keyword.find() ? keyword.group().toUpperCase(Locale.ROOT) : "";
    }

    private static boolean isNameChar(final char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }

    private static void blank(final StringBuilder sb, final int length) {
        for (int j = 0; j < length; j++) {
            sb.append(' ');
        }
    }

    // an IRI reference contains no whitespace; a '<' without a closing '>' is the less-than operator
    private static int endOfIri(final char[] chars, final int start) {
        for (int j = start + 1; j < chars.length; j++) {
            char c = chars[j];
            if (c == '>') {
                return j + 1;
            }
            if (Character.isWhitespace(c) || c == '<' || c == '"' || c == '{' || c == '}') {
                return -1;
            }
        }
        return -1;
    }

    private static int endOfString(final char[] chars, final int start) {
        char quote = chars[start];
        boolean isLong = start + 2 < chars.length && chars[start + 1] == quote && chars[start + 2] == quote;
        int j = isLong ? start + 3 : start + 1;
        while (j < chars.length) {
            char c = chars[j];
            if (c == '\\') {
                j += 2;
            } else if (isLong) {
                if (c == quote && j + 2 < chars.length && chars[j + 1] == quote && chars[j + 2] == quote) {
                    return j + 3;
                }
                j++;
            } else if (c == quote || c == '\n') {
                return j + 1;
            } else {
                j++;
            }
        }
        return chars.length;
    }
}
