package net.fortytwo.rewrite.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A conjunction of triple and path patterns, joined in the order written
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class BasicGraphPattern extends Pattern {
    private final List<Pattern> patterns;

    public BasicGraphPattern(final List<Pattern> patterns) {
        for (Pattern p : patterns) {
            if (!(p instanceof TriplePattern) && !(p instanceof PathPattern)) {
                throw new IllegalArgumentException("not a triple or path pattern: " + p);
            }
        }

        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    /**
     * @return whether every pattern shares a variable, directly or transitively, with every other,
     * so that evaluation involves no cross product
     */
    public boolean isConnected() {
        if (patterns.size() < 2) {
            return true;
        }

        Set<String> reached = new HashSet<>(patterns.get(0).getVariables());
        List<Pattern> remaining = new ArrayList<>(patterns.subList(1, patterns.size()));
        boolean changed = true;
        while (changed && !remaining.isEmpty()) {
            changed = false;
            for (int i = 0; i < remaining.size(); i++) {
                Set<String> vars = remaining.get(i).getVariables();
                if (vars.isEmpty() || !Collections.disjoint(vars, reached)) {
                    reached.addAll(vars);
                    remaining.remove(i);
                    i--;
                    changed = true;
                }
            }
        }

        return remaining.isEmpty();
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        for (Pattern p : patterns) {
            p.collectVariables(variables);
        }
    }

    @Override
    public String toString() {
        return "bgp" + patterns;
    }
}
