package net.fortytwo.rewrite.path;

import net.fortytwo.rewrite.eval.EvaluationBudget;
import net.fortytwo.rewrite.store.Dataset;
import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Evaluates property paths against a single graph of a dataset.
 * All path forms are evaluated by one traversal, in either direction.
 * Closures are breadth-first searches guarded by a visited set, so they terminate on cyclic data
 * and reach each node at most once.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class PathEvaluator {

    public enum Direction {
        FORWARD, BACKWARD;

        public Direction flip() {
            return this == FORWARD ? BACKWARD : FORWARD;
        }
    }

    private final Dataset dataset;
    private final EvaluationBudget budget;

    public PathEvaluator(final Dataset dataset, final EvaluationBudget budget) {
        this.dataset = dataset;
        this.budget = budget;
    }

    /**
     * Finds all (start, end) pairs connected by a path
     *
     * @param graph   the graph to traverse, or null for the default graph
     * @param path    the path to evaluate
     * @param subject the start node, or null if unbound
     * @param object  the end node, or null if unbound
     * @return the connected pairs, as two-element arrays, without duplicates
     */
    public List<Value[]> evaluate(final IRI graph, final Path path, final Value subject, final Value object) {
        List<Value[]> pairs = new ArrayList<>();

        if (null != subject) {
            for (Value end : traverse(graph, path, subject, Direction.FORWARD)) {
                if (null == object || object.equals(end)) {
                    pairs.add(new Value[]{subject, end});
                }
            }
        } else if (null != object) {
            for (Value start : traverse(graph, path, object, Direction.BACKWARD)) {
                pairs.add(new Value[]{start, object});
            }
        } else {
            for (Value start : startCandidates(graph, path)) {
                for (Value end : traverse(graph, path, start, Direction.FORWARD)) {
                    pairs.add(new Value[]{start, end});
                }
            }
        }

        return pairs;
    }

    /**
     * Finds the nodes reachable from a given node along a path
     *
     * @param graph     the graph to traverse, or null for the default graph
     * @param path      the path to follow
     * @param start     the node to start from
     * @param direction whether to follow the path from subject to object, or in reverse
     * @return the reachable nodes, in order of discovery
     */
    public Set<Value> traverse(final IRI graph, final Path path, final Value start, final Direction direction) {
        budget.step();

        if (path instanceof Path.Atomic) {
            return step(graph, ((Path.Atomic) path).getPredicate(), start, direction);
        } else if (path instanceof Path.Inverse) {
            return traverse(graph, ((Path.Inverse) path).getOperand(), start, direction.flip());
        } else if (path instanceof Path.Sequence) {
            Path.Sequence seq = (Path.Sequence) path;
            Path first = direction == Direction.FORWARD ? seq.getFirst() : seq.getSecond();
            Path second = direction == Direction.FORWARD ? seq.getSecond() : seq.getFirst();
            Set<Value> results = new LinkedHashSet<>();
            for (Value middle : traverse(graph, first, start, direction)) {
                results.addAll(traverse(graph, second, middle, direction));
            }
            return results;
        } else if (path instanceof Path.Alternation) {
            Path.Alternation alt = (Path.Alternation) path;
            Set<Value> results = new LinkedHashSet<>(traverse(graph, alt.getFirst(), start, direction));
            results.addAll(traverse(graph, alt.getSecond(), start, direction));
            return results;
        } else if (path instanceof Path.ZeroOrMore) {
            return closure(graph, ((Path.ZeroOrMore) path).getOperand(), start, direction, true);
        } else if (path instanceof Path.OneOrMore) {
            return closure(graph, ((Path.OneOrMore) path).getOperand(), start, direction, false);
        } else if (path instanceof Path.ZeroOrOne) {
            Set<Value> results = new LinkedHashSet<>();
            results.add(start);
            results.addAll(traverse(graph, ((Path.ZeroOrOne) path).getOperand(), start, direction));
            return results;
        } else if (path instanceof Path.Identity) {
            return Collections.singleton(start);
        } else {
            throw new IllegalArgumentException("unsupported path: " + path);
        }
    }

    private Set<Value> closure(final IRI graph,
                               final Path operand,
                               final Value start,
                               final Direction direction,
                               final boolean includeStart) {
        Set<Value> visited = new LinkedHashSet<>();
        Queue<Value> queue = new LinkedList<>();

        if (includeStart) {
            visited.add(start);
            queue.add(start);
        } else {
            for (Value next : traverse(graph, operand, start, direction)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }

        while (!queue.isEmpty()) {
            Value current = queue.remove();
            for (Value next : traverse(graph, operand, current, direction)) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }

        return visited;
    }

    private Set<Value> step(final IRI graph, final IRI predicate, final Value node, final Direction direction) {
        Set<Value> results = new LinkedHashSet<>();

        if (direction == Direction.FORWARD) {
            if (node instanceof Resource) {
                for (Statement st : dataset.match(graph, (Resource) node, predicate, null)) {
                    results.add(st.getObject());
                }
            }
        } else {
            for (Statement st : dataset.match(graph, null, predicate, node)) {
                results.add(st.getSubject());
            }
        }

        return results;
    }

    // subjects and objects of the path's atomic predicates, in order of appearance
    private Set<Value> startCandidates(final IRI graph, final Path path) {
        Set<IRI> predicates = new LinkedHashSet<>();
        path.collectPredicates(predicates);

        Set<Value> candidates = new LinkedHashSet<>();
        for (IRI p : predicates) {
            for (Statement st : dataset.match(graph, null, p, null)) {
                candidates.add(st.getSubject());
                candidates.add(st.getObject());
            }
        }
        return candidates;
    }
}
