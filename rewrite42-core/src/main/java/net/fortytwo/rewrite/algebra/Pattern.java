package net.fortytwo.rewrite.algebra;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A graph pattern: a node of the algebra evaluated by the pattern matcher
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public abstract class Pattern {

    /**
     * Adds the names of all variables which may be bound by solutions of this pattern
     *
     * @param variables the set to which to add variable names
     */
    public abstract void collectVariables(Set<String> variables);

    public Set<String> getVariables() {
        Set<String> variables = new LinkedHashSet<>();
        collectVariables(variables);
        return variables;
    }
}
