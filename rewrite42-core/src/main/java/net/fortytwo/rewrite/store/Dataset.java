package net.fortytwo.rewrite.store;

import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

/**
 * A default graph together with any number of named graphs.
 * Named graphs are created on first write and are listed in IRI order.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class Dataset {
    private static final Logger logger = Logger.getLogger(Dataset.class.getName());

    private final Graph defaultGraph = new Graph(null);
    private final Map<String, Graph> namedGraphs = new ConcurrentSkipListMap<>();

    private GraphControlSource graphControlSource;

    public Graph getDefaultGraph() {
        return defaultGraph;
    }

    /**
     * @param name the name of a graph
     * @return the named graph, or null if there is no such graph
     */
    public Graph getNamedGraph(final IRI name) {
        return namedGraphs.get(name.stringValue());
    }

    /**
     * @param name the name of a graph, or null for the default graph
     * @return the graph, or null if it is a named graph which does not exist
     */
    public Graph getGraph(final IRI name) {
        return null == name ? defaultGraph : getNamedGraph(name);
    }

    /**
     * @param name the name of a graph, or null for the default graph
     * @return the graph, created if necessary
     */
    public Graph getOrCreateGraph(final IRI name) {
        if (null == name) {
            return defaultGraph;
        }

        return namedGraphs.computeIfAbsent(name.stringValue(), k -> {
            logger.fine("creating " + name);
            return new Graph(name);
        });
    }

    /**
     * Adds a triple to the graph named by its context, or to the default graph if it has none
     *
     * @param statement a statement whose context, if any, is an IRI
     * @return whether the dataset changed
     */
    public boolean add(final Statement statement) {
        return addTriple(contextOf(statement), statement);
    }

    public void addAll(final Iterable<Statement> statements) {
        for (Statement st : statements) {
            add(st);
        }
    }

    /**
     * @param graph  the name of the target graph, or null for the default graph
     * @param triple the triple to add
     * @return whether the dataset changed
     */
    public boolean addTriple(final IRI graph, final Statement triple) {
        return getOrCreateGraph(graph).addTriple(triple);
    }

    /**
     * @param graph  the name of the target graph, or null for the default graph
     * @param triple the triple to remove
     * @return whether the dataset changed
     */
    public boolean removeTriple(final IRI graph, final Statement triple) {
        Graph g = getGraph(graph);
        return null != g && g.removeTriple(triple);
    }

    /**
     * Matches a triple pattern against a single graph.
     * A named graph which does not exist matches nothing.
     *
     * @param graph the graph to match in, or null for the default graph
     * @return the matching triples, in insertion order
     */
    public List<Statement> match(final IRI graph,
                                 final Resource subject,
                                 final IRI predicate,
                                 final Value object) {
        Graph g = getGraph(graph);
        return null == g ? Collections.<Statement>emptyList() : g.match(subject, predicate, object);
    }

    /**
     * @return the names of all named graphs, in IRI order
     */
    public List<IRI> listGraphs() {
        List<IRI> names = new ArrayList<>();
        for (Graph g : namedGraphs.values()) {
            names.add(g.getName());
        }
        return names;
    }

    /**
     * @param tag a tag known to the graph control source
     * @return the names of the named graphs carrying the tag, in IRI order
     */
    public List<IRI> listGraphs(final String tag) {
        Set<String> tagged = new LinkedHashSet<>();
        for (GraphTag gt : getGraphTags()) {
            if (gt.getTag().equals(tag)) {
                tagged.add(gt.getGraph().stringValue());
            }
        }

        List<IRI> names = new ArrayList<>();
        for (Graph g : namedGraphs.values()) {
            if (tagged.contains(g.getName().stringValue())) {
                names.add(g.getName());
            }
        }
        return names;
    }

    /**
     * @return the (graph, tag) pairs of the attached graph control source, or an empty collection if none
     */
    public Collection<GraphTag> getGraphTags() {
        GraphControlSource source = graphControlSource;
        return null == source ? Collections.<GraphTag>emptyList() : source.getGraphTags();
    }

    public GraphControlSource getGraphControlSource() {
        return graphControlSource;
    }

    public void setGraphControlSource(final GraphControlSource graphControlSource) {
        this.graphControlSource = graphControlSource;
    }

    /**
     * @return the total number of triples in all graphs
     */
    public long size() {
        long total = defaultGraph.size();
        for (Graph g : namedGraphs.values()) {
            total += g.size();
        }
        return total;
    }

    /**
     * Commits a batch of changes as a unit.
     * All affected graphs are write-locked, in a fixed order, for the duration of the commit,
     * so that no reader observes a partially applied batch.
     *
     * @param changes the removals and additions to apply. Removals are applied first
     * @return the number of triples actually added and removed
     */
    public MutationReport apply(final ChangeSet changes) {
        if (changes.isEmpty()) {
            return new MutationReport(0, 0);
        }

        for (Statement st : allOf(changes.getAdditions())) {
            validate(st);
        }

        List<Graph> affected = new ArrayList<>();
        if (changes.getAdditions().containsKey(null) || changes.getRemovals().containsKey(null)) {
            affected.add(defaultGraph);
        }
        for (IRI name : changes.getAdditions().keySet()) {
            if (null != name) {
                getOrCreateGraph(name);
            }
        }
        for (Graph g : namedGraphs.values()) {
            IRI name = g.getName();
            if (changes.getAdditions().containsKey(name) || changes.getRemovals().containsKey(name)) {
                affected.add(g);
            }
        }

        long added = 0, removed = 0;
        for (Graph g : affected) {
            g.lockForWrite();
        }
        try {
            for (Graph g : affected) {
                Set<Statement> toRemove = changes.getRemovals().get(g.getName());
                if (null != toRemove) {
                    for (Statement st : toRemove) {
                        if (g.removeInternal(st)) {
                            removed++;
                        }
                    }
                }
            }
            for (Graph g : affected) {
                Set<Statement> toAdd = changes.getAdditions().get(g.getName());
                if (null != toAdd) {
                    for (Statement st : toAdd) {
                        if (g.addInternal(st)) {
                            added++;
                        }
                    }
                }
            }
        } finally {
            for (int i = affected.size() - 1; i >= 0; i--) {
                affected.get(i).unlockForWrite();
            }
        }

        logger.fine("applied changes: added " + added + ", removed " + removed);
        return new MutationReport(added, removed);
    }

    private static Collection<Statement> allOf(final Map<IRI, Set<Statement>> byGraph) {
        List<Statement> all = new ArrayList<>();
        for (Set<Statement> s : byGraph.values()) {
            all.addAll(s);
        }
        return all;
    }

    private static void validate(final Statement st) {
        if (null == st.getSubject() || null == st.getPredicate() || null == st.getObject()) {
            throw new IllegalArgumentException("incomplete triple: " + st);
        }
    }

    private static IRI contextOf(final Statement statement) {
        Resource c = statement.getContext();
        if (null == c) {
            return null;
        } else if (c instanceof IRI) {
            return (IRI) c;
        } else {
            throw new IllegalArgumentException("graph name is not an IRI: " + c);
        }
    }
}
