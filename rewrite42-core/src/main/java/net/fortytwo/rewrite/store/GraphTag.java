package net.fortytwo.rewrite.store;

import org.openrdf.model.IRI;

/**
 * A (graph, tag) pair, as supplied by a {@link GraphControlSource}
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class GraphTag {
    private final IRI graph;
    private final String tag;

    public GraphTag(final IRI graph, final String tag) {
        if (null == graph || null == tag) {
            throw new IllegalArgumentException("null graph or tag");
        }

        this.graph = graph;
        this.tag = tag;
    }

    public IRI getGraph() {
        return graph;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof GraphTag
                && graph.equals(((GraphTag) other).graph)
                && tag.equals(((GraphTag) other).tag);
    }

    @Override
    public int hashCode() {
        return graph.hashCode() + 31 * tag.hashCode();
    }

    @Override
    public String toString() {
        return "<" + graph.stringValue() + "> " + tag;
    }
}
