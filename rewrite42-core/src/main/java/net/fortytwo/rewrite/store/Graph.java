package net.fortytwo.rewrite.store;

import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A set of triples, indexed by subject, predicate and object.
 * Triples are stored without context and are kept in insertion order.
 * Reads materialize their results under a shared lock, so that a reader observes the graph
 * either before or after a batch of changes applied through {@link Dataset#apply(ChangeSet)}.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class Graph {
    private static final ValueFactory valueFactory = SimpleValueFactory.getInstance();

    private final IRI name;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Set<Statement> triples = new LinkedHashSet<>();
    private final Map<Resource, Set<Statement>> bySubject = new HashMap<>();
    private final Map<IRI, Set<Statement>> byPredicate = new HashMap<>();
    private final Map<Value, Set<Statement>> byObject = new HashMap<>();

    /**
     * @param name the name of the graph, or null for the default graph
     */
    public Graph(final IRI name) {
        this.name = name;
    }

    /**
     * @return the name of this graph, or null if this is the default graph
     */
    public IRI getName() {
        return name;
    }

    public boolean isDefault() {
        return null == name;
    }

    /**
     * Adds a triple to this graph. Adding a triple which is already present has no effect.
     *
     * @param triple the triple to add. Any context is ignored
     * @return whether the graph changed
     */
    public boolean addTriple(final Statement triple) {
        lock.writeLock().lock();
        try {
            return addInternal(triple);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param triple the triple to remove. Any context is ignored
     * @return whether the graph changed
     */
    public boolean removeTriple(final Statement triple) {
        lock.writeLock().lock();
        try {
            return removeInternal(triple);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean contains(final Statement triple) {
        lock.readLock().lock();
        try {
            return triples.contains(normalize(triple));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds all triples matching a pattern, in insertion order
     *
     * @param subject   the subject to match, or null as a wildcard
     * @param predicate the predicate to match, or null as a wildcard
     * @param object    the object to match, or null as a wildcard
     * @return the matching triples
     */
    public List<Statement> match(final Resource subject, final IRI predicate, final Value object) {
        lock.readLock().lock();
        try {
            Collection<Statement> candidates = triples;
            if (null != subject) {
                candidates = smallest(candidates, bySubject.get(subject));
            }
            if (null != predicate) {
                candidates = smallest(candidates, byPredicate.get(predicate));
            }
            if (null != object) {
                candidates = smallest(candidates, byObject.get(object));
            }

            List<Statement> results = new ArrayList<>();
            for (Statement st : candidates) {
                if ((null == subject || subject.equals(st.getSubject()))
                        && (null == predicate || predicate.equals(st.getPredicate()))
                        && (null == object || object.equals(st.getObject()))) {
                    results.add(st);
                }
            }
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return triples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return a snapshot of all triples in this graph
     */
    public List<Statement> getTriples() {
        return match(null, null, null);
    }

    void lockForWrite() {
        lock.writeLock().lock();
    }

    void unlockForWrite() {
        lock.writeLock().unlock();
    }

    boolean addInternal(final Statement triple) {
        Statement st = normalize(triple);
        if (!triples.add(st)) {
            return false;
        }

        index(bySubject, st.getSubject(), st);
        index(byPredicate, st.getPredicate(), st);
        index(byObject, st.getObject(), st);
        return true;
    }

    boolean removeInternal(final Statement triple) {
        Statement st = normalize(triple);
        if (!triples.remove(st)) {
            return false;
        }

        unindex(bySubject, st.getSubject(), st);
        unindex(byPredicate, st.getPredicate(), st);
        unindex(byObject, st.getObject(), st);
        return true;
    }

    private static Collection<Statement> smallest(final Collection<Statement> current,
                                                  final Set<Statement> indexed) {
        if (null == indexed) {
            return Collections.emptySet();
        }
        return indexed.size() < current.size() ? indexed : current;
    }

    private static <K> void index(final Map<K, Set<Statement>> index, final K key, final Statement st) {
        Set<Statement> set = index.get(key);
        if (null == set) {
            set = new LinkedHashSet<>();
            index.put(key, set);
        }
        set.add(st);
    }

    private static <K> void unindex(final Map<K, Set<Statement>> index, final K key, final Statement st) {
        Set<Statement> set = index.get(key);
        if (null != set) {
            set.remove(st);
            if (set.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private static Statement normalize(final Statement triple) {
        if (null == triple.getSubject() || null == triple.getPredicate() || null == triple.getObject()) {
            throw new IllegalArgumentException("incomplete triple: " + triple);
        }

        return null == triple.getContext()
                ? triple
                : valueFactory.createStatement(triple.getSubject(), triple.getPredicate(), triple.getObject());
    }

    @Override
    public String toString() {
        return null == name ? "default graph" : "graph <" + name.stringValue() + ">";
    }
}
