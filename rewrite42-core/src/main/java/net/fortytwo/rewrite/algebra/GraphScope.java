package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.model.VariableOrConstant;
import org.openrdf.model.Value;

/**
 * The graph(s) against which a triple or path pattern is matched:
 * either the default graph, or the named graph(s) given by a constant or a variable
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public final class GraphScope {
    public static final GraphScope DEFAULT = new GraphScope(null);

    private final VariableOrConstant<String, Value> graph;

    private GraphScope(final VariableOrConstant<String, Value> graph) {
        this.graph = graph;
    }

    public static GraphScope named(final VariableOrConstant<String, Value> graph) {
        if (null == graph) {
            throw new IllegalArgumentException("null graph");
        }
        return new GraphScope(graph);
    }

    public boolean isDefault() {
        return null == graph;
    }

    /**
     * @return the graph name or graph variable, or null for the default graph
     */
    public VariableOrConstant<String, Value> getGraph() {
        return graph;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof GraphScope
                && (null == graph ? null == ((GraphScope) other).graph : graph.equals(((GraphScope) other).graph));
    }

    @Override
    public int hashCode() {
        return null == graph ? 0 : graph.hashCode();
    }

    @Override
    public String toString() {
        return null == graph ? "" : "GRAPH " + graph + " ";
    }
}
