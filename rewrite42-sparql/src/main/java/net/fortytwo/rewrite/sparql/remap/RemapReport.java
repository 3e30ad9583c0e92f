package net.fortytwo.rewrite.sparql.remap;

import org.openrdf.model.IRI;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of remapping a graph: the IRIs replaced, and the numbers of triples rewritten and added
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class RemapReport {
    private final Map<IRI, IRI> replacements;
    private final int minted;
    private final long replaced;
    private final long added;

    public RemapReport(final Map<IRI, IRI> replacements, final int minted, final long replaced, final long added) {
        this.replacements = Collections.unmodifiableMap(new LinkedHashMap<>(replacements));
        this.minted = minted;
        this.replaced = replaced;
        this.added = added;
    }

    /**
     * @return each public IRI which was replaced, mapped to its local IRI
     */
    public Map<IRI, IRI> getReplacements() {
        return replacements;
    }

    /**
     * @return the number of local IRIs minted, as opposed to found in the mapping
     */
    public int getMinted() {
        return minted;
    }

    public long getReplaced() {
        return replaced;
    }

    public long getAdded() {
        return added;
    }

    @Override
    public String toString() {
        return "remapped " + replacements.size() + " IRIs (" + minted + " minted): replaced "
                + replaced + " and added " + added + " triples";
    }
}
