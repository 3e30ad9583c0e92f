package net.fortytwo.rewrite.template;

import org.openrdf.model.BNode;
import org.openrdf.model.ValueFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Allocates fresh blank nodes for template labels, one per (solution, label) pair
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class BlankNodeArena {
    private final ValueFactory valueFactory;
    private final Map<String, BNode> nodes = new HashMap<>();

    public BlankNodeArena(final ValueFactory valueFactory) {
        this.valueFactory = valueFactory;
    }

    /**
     * @param solutionIndex the position of the solution in its sequence
     * @param label         a blank node label of the template
     * @return the blank node for this label in this solution, created on first use
     */
    public BNode get(final int solutionIndex, final String label) {
        return nodes.computeIfAbsent(solutionIndex + " " + label, k -> valueFactory.createBNode());
    }

    public int size() {
        return nodes.size();
    }
}
