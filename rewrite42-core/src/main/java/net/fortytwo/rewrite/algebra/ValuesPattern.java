package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.model.Solution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * An inline table of solutions, as in a VALUES block
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ValuesPattern extends Pattern {
    private final List<String> variables;
    private final List<Solution> rows;

    public ValuesPattern(final List<String> variables, final List<Solution> rows) {
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public List<Solution> getRows() {
        return rows;
    }

    @Override
    public void collectVariables(final Set<String> vars) {
        vars.addAll(variables);
    }

    @Override
    public String toString() {
        return "values" + variables + rows;
    }
}
