package net.fortytwo.rewrite.store;

import org.openrdf.model.IRI;
import org.openrdf.model.Statement;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A batch of triple removals and additions, keyed by graph name (null for the default graph),
 * to be committed together by {@link Dataset#apply(ChangeSet)}.
 * Removals are applied before additions.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ChangeSet {
    private final Map<IRI, Set<Statement>> removals = new LinkedHashMap<>();
    private final Map<IRI, Set<Statement>> additions = new LinkedHashMap<>();

    public void add(final IRI graph, final Statement triple) {
        additions.computeIfAbsent(graph, g -> new LinkedHashSet<>()).add(triple);
    }

    public void remove(final IRI graph, final Statement triple) {
        removals.computeIfAbsent(graph, g -> new LinkedHashSet<>()).add(triple);
    }

    public Map<IRI, Set<Statement>> getAdditions() {
        return additions;
    }

    public Map<IRI, Set<Statement>> getRemovals() {
        return removals;
    }

    public boolean isEmpty() {
        return additions.isEmpty() && removals.isEmpty();
    }
}
