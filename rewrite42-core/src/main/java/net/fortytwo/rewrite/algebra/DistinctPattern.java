package net.fortytwo.rewrite.algebra;

import java.util.Set;

/**
 * Eliminates duplicate solutions, keeping the first occurrence of each
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class DistinctPattern extends Pattern {
    private final Pattern inner;
    private final boolean reduced;

    public DistinctPattern(final Pattern inner, final boolean reduced) {
        this.inner = inner;
        this.reduced = reduced;
    }

    public Pattern getInner() {
        return inner;
    }

    /**
     * @return whether duplicate elimination is merely permitted (REDUCED) rather than required (DISTINCT)
     */
    public boolean isReduced() {
        return reduced;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        inner.collectVariables(variables);
    }

    @Override
    public String toString() {
        return (reduced ? "reduced(" : "distinct(") + inner + ")";
    }
}
