package net.fortytwo.rewrite.sparql.remap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A registry of domain models and their two-digit codes.
 * Both domains and codes are unique; a domain is a non-empty name without whitespace.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class DomainCodes {
    private final Map<String, String> domainToCode = new LinkedHashMap<>();
    private final Map<String, String> codeToDomain = new LinkedHashMap<>();

    /**
     * @param code a code between 0 and 99, e.g. "7" or "07"
     * @return the code in its two-digit form
     */
    public static String formatCode(final String code) {
        int n;
        try {
            n = Integer.parseInt(code.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("domain code is not a number: " + code, e);
        }
        if (n < 0 || n > 99) {
            throw new IllegalArgumentException("domain code " + code + " is out of bounds: 0 <= code < 100");
        }
        return String.format("%02d", n);
    }

    /**
     * Registers a domain with a code. Registering an identical pair again has no effect.
     */
    public void register(final String domain, final String code) {
        String c = formatCode(code);
        if (c.equals(domainToCode.get(domain))) {
            return;
        }

        if (null == domain || domain.isEmpty() || !domain.equals(domain.trim()) || domain.split("\\s+").length != 1) {
            throw new IllegalArgumentException("domain cannot be empty or contain whitespace: '" + domain + "'");
        }
        if (domainToCode.containsKey(domain)) {
            throw new IllegalArgumentException("domain " + domain
                    + " is already registered with domain code " + domainToCode.get(domain));
        }
        if (codeToDomain.containsKey(c)) {
            throw new IllegalArgumentException("domain code " + c
                    + " is already registered for domain " + codeToDomain.get(c));
        }

        domainToCode.put(domain, c);
        codeToDomain.put(c, domain);
    }

    public String getCode(final String domain) {
        String code = domainToCode.get(domain);
        if (null == code) {
            throw new IllegalArgumentException("domain " + domain + " is not registered");
        }
        return code;
    }

    public String getDomain(final String code) {
        String c = formatCode(code);
        String domain = codeToDomain.get(c);
        if (null == domain) {
            throw new IllegalArgumentException("domain code " + c + " is not registered");
        }
        return domain;
    }

    public boolean containsCode(final String code) {
        return codeToDomain.containsKey(formatCode(code));
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(domainToCode);
    }
}
