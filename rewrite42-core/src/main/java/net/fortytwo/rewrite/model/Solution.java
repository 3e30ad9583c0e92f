package net.fortytwo.rewrite.model;

import org.openrdf.model.Value;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A solution mapping: an immutable, partial mapping of variable names to RDF terms.
 * Unbound variables are simply absent. Bindings keep the order in which they were made.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public final class Solution {

    public static final Solution EMPTY = new Solution(Collections.<String, Value>emptyMap());

    private final Map<String, Value> map;

    private Integer hash;

    private Solution(final Map<String, Value> map) {
        this.map = map;
    }

    /**
     * @param bindings variable/value pairs. Null values are ignored
     * @return a new solution containing the given bindings
     */
    public static Solution of(final Map<String, Value> bindings) {
        Map<String, Value> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            if (null != e.getValue()) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        return copy.isEmpty() ? EMPTY : new Solution(Collections.unmodifiableMap(copy));
    }

    public Value get(final String variable) {
        return map.get(variable);
    }

    public boolean isBound(final String variable) {
        return map.containsKey(variable);
    }

    public Set<String> getBindingNames() {
        return map.keySet();
    }

    public Map<String, Value> asMap() {
        return map;
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Two solution mappings are compatible if every variable bound in both is bound to the same term.
     *
     * @param other the other solution
     * @return whether this solution is compatible with the other
     */
    public boolean isCompatibleWith(final Solution other) {
        Map<String, Value> smaller = map.size() <= other.map.size() ? map : other.map;
        Map<String, Value> larger = smaller == map ? other.map : map;

        for (Map.Entry<String, Value> e : smaller.entrySet()) {
            Value v = larger.get(e.getKey());
            if (null != v && !v.equals(e.getValue())) {
                return false;
            }
        }

        return true;
    }

    /**
     * Merges two compatible solutions.
     * An argument is returned as-is if it already contains all of the bindings of the other.
     *
     * @param other a solution compatible with this one
     * @return a solution containing the bindings of both
     */
    public Solution merge(final Solution other) {
        if (other.map.size() <= map.size() && map.keySet().containsAll(other.map.keySet())) {
            return this;
        } else if (map.size() <= other.map.size() && other.map.keySet().containsAll(map.keySet())) {
            return other;
        }

        Map<String, Value> merged = new LinkedHashMap<>(map);
        for (Map.Entry<String, Value> e : other.map.entrySet()) {
            merged.putIfAbsent(e.getKey(), e.getValue());
        }
        return new Solution(Collections.unmodifiableMap(merged));
    }

    /**
     * @param variable a variable not already bound in this solution
     * @param value    the value to bind
     * @return a new solution with the additional binding
     */
    public Solution extend(final String variable, final Value value) {
        Map<String, Value> extended = new LinkedHashMap<>(map);
        extended.put(variable, value);
        return new Solution(Collections.unmodifiableMap(extended));
    }

    /**
     * @param variables the variables to keep
     * @return a solution restricted to the given variables
     */
    public Solution project(final Collection<String> variables) {
        Map<String, Value> projected = new LinkedHashMap<>();
        for (String v : variables) {
            Value value = map.get(v);
            if (null != value) {
                projected.put(v, value);
            }
        }
        return projected.isEmpty() ? EMPTY : new Solution(Collections.unmodifiableMap(projected));
    }

    @Override
    public boolean equals(final Object other) {
        return this == other
                || (other instanceof Solution
                && hashCode() == other.hashCode()
                && map.equals(((Solution) other).map));
    }

    @Override
    public int hashCode() {
        if (null == hash) {
            int h = 0;
            for (Map.Entry<String, Value> e : map.entrySet()) {
                h += e.getKey().hashCode() * e.getValue().hashCode();
            }
            hash = h;
        }

        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Value> e : map.entrySet()) {
            if (first) {
                first = false;
            } else {
                sb.append(", ");
            }
            sb.append(e.getKey()).append(":").append(Terms.toString(e.getValue()));
        }
        return sb.append("}").toString();
    }
}
