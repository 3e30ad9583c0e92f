package net.fortytwo.rewrite.sparql;

import org.openrdf.model.vocabulary.DCTERMS;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SKOS;
import org.openrdf.model.vocabulary.XMLSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A mapping of short prefixes to namespace IRIs, used to bind queries and to expand and compress CURIEs
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class PrefixTable {
    public static final String
            SKOSXL_PREFIX = "skosxl",
            SKOSXL_NAMESPACE = "http://www.w3.org/2008/05/skos-xl#";

    private final Map<String, String> prefixToNamespace = new LinkedHashMap<>();

    /**
     * @return a table of the namespaces common to OWL and SKOS data
     */
    public static PrefixTable withDefaults() {
        return new PrefixTable()
                .add(RDF.PREFIX, RDF.NAMESPACE)
                .add(RDFS.PREFIX, RDFS.NAMESPACE)
                .add(OWL.PREFIX, OWL.NAMESPACE)
                .add(SKOS.PREFIX, SKOS.NAMESPACE)
                .add(SKOSXL_PREFIX, SKOSXL_NAMESPACE)
                .add(XMLSchema.PREFIX, XMLSchema.NAMESPACE)
                .add(DCTERMS.PREFIX, DCTERMS.NAMESPACE);
    }

    public PrefixTable add(final String prefix, final String namespace) {
        if (null == prefix || null == namespace) {
            throw new IllegalArgumentException("null prefix or namespace");
        }

        prefixToNamespace.put(prefix, namespace);
        return this;
    }

    public String getNamespace(final String prefix) {
        return prefixToNamespace.get(prefix);
    }

    public boolean contains(final String prefix) {
        return prefixToNamespace.containsKey(prefix);
    }

    public Set<String> getPrefixes() {
        return Collections.unmodifiableSet(prefixToNamespace.keySet());
    }

    /**
     * @param curie a compact IRI such as skos:Concept, or an IRI in angle brackets
     * @return the full IRI
     * @throws QueryEngine.UnknownPrefixException if the prefix of the CURIE is not in the table
     */
    public String expand(final String curie) throws QueryEngine.UnknownPrefixException {
        if (curie.startsWith("<") && curie.endsWith(">")) {
            return curie.substring(1, curie.length() - 1);
        }

        int i = curie.indexOf(':');
        String prefix = i < 0 ? curie : curie.substring(0, i);
        String namespace = prefixToNamespace.get(prefix);
        if (null == namespace || i < 0) {
            throw new QueryEngine.UnknownPrefixException(prefix);
        }

        return namespace + curie.substring(i + 1);
    }

    /**
     * @return the expanded IRI, or the argument itself if it cannot be expanded
     */
    public String expandOrSelf(final String curie) {
        try {
            return expand(curie);
        } catch (QueryEngine.UnknownPrefixException e) {
            return curie;
        }
    }

    /**
     * @param iri a full IRI
     * @return the IRI as a CURIE, using the longest namespace which matches
     * @throws QueryEngine.UnknownPrefixException if no namespace in the table matches
     */
    public String compress(final String iri) throws QueryEngine.UnknownPrefixException {
        String bestPrefix = null;
        String bestNamespace = null;
        for (Map.Entry<String, String> e : prefixToNamespace.entrySet()) {
            String ns = e.getValue();
            if (iri.startsWith(ns) && (null == bestNamespace || ns.length() > bestNamespace.length())) {
                bestPrefix = e.getKey();
                bestNamespace = ns;
            }
        }

        if (null == bestPrefix) {
            throw new QueryEngine.UnknownPrefixException(iri);
        }

        return bestPrefix + ":" + iri.substring(bestNamespace.length());
    }

    /**
     * @return the CURIE form of the IRI, or the IRI itself if no namespace matches
     */
    public String compressOrSelf(final String iri) {
        try {
            return compress(iri);
        } catch (QueryEngine.UnknownPrefixException e) {
            return iri;
        }
    }

    /**
     * @return SPARQL PREFIX declarations for every entry in the table
     */
    public String toPrologue() {
        return toPrologue(Collections.<String>emptySet());
    }

    /**
     * @param excluded prefixes to leave out, such as those a query declares itself
     * @return SPARQL PREFIX declarations for every other entry in the table
     */
    public String toPrologue(final Set<String> excluded) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : prefixToNamespace.entrySet()) {
            if (excluded.contains(e.getKey())) {
                continue;
            }
            sb.append("PREFIX ").append(e.getKey()).append(": <").append(e.getValue()).append(">\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return prefixToNamespace.toString();
    }
}
