package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.PrefixTable;
import net.fortytwo.rewrite.sparql.QueryEngine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Records of public IRIs and the local IRIs which replace them.
 * Keys and values may be given as CURIEs, and are stored as full IRIs.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriMapping {
    private final PrefixTable prefixes;
    private final Map<String, String> records = new LinkedHashMap<>();

    public IriMapping(final PrefixTable prefixes) {
        this.prefixes = prefixes;
    }

    public PrefixTable getPrefixes() {
        return prefixes;
    }

    /**
     * Adds a record. Adding an identical record again has no effect.
     *
     * @throws RecordExistsException if the key is already mapped to a different value
     */
    public void put(final String key, final String value)
            throws RecordExistsException, QueryEngine.UnknownPrefixException {
        String k = expand(key);
        String v = expand(value);

        String existing = records.get(k);
        if (null != existing) {
            if (existing.equals(v)) {
                return;
            }
            throw new RecordExistsException(k);
        }

        records.put(k, v);
    }

    /**
     * @return the full IRI to which the key is mapped, or null if there is no record for the key
     */
    public String get(final String key) {
        return records.get(prefixes.expandOrSelf(key));
    }

    public boolean containsKey(final String key) {
        return records.containsKey(prefixes.expandOrSelf(key));
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(records.keySet());
    }

    public Collection<String> values() {
        return Collections.unmodifiableCollection(records.values());
    }

    public int size() {
        return records.size();
    }

    // full IRIs whose namespace is not in the table are kept as they are
    private String expand(final String curieOrIri) throws QueryEngine.UnknownPrefixException {
        if (curieOrIri.contains("://") || curieOrIri.startsWith("urn:")) {
            return curieOrIri;
        }
        return prefixes.expand(curieOrIri);
    }

    /**
     * An exception thrown when a record would overwrite an existing, different record
     */
    public static class RecordExistsException extends Exception {
        private final String key;

        public RecordExistsException(final String key) {
            super("record for key '" + key + "' already exists");
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }
}
