package net.fortytwo.rewrite.sparql;

import org.openrdf.query.BindingSet;

import java.util.Collections;
import java.util.List;

/**
 * The ordered rows of a SELECT query, together with its projected binding names
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class SelectResult {
    private final List<String> bindingNames;
    private final List<BindingSet> rows;

    public SelectResult(final List<String> bindingNames, final List<BindingSet> rows) {
        this.bindingNames = Collections.unmodifiableList(bindingNames);
        this.rows = Collections.unmodifiableList(rows);
    }

    public List<String> getBindingNames() {
        return bindingNames;
    }

    public List<BindingSet> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    @Override
    public String toString() {
        return bindingNames + " x " + rows.size();
    }
}
