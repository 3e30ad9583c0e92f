package net.fortytwo.rewrite.algebra;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Restricts the solutions of an inner pattern to a list of variables, optionally renaming them
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ProjectionPattern extends Pattern {
    private final Pattern inner;
    private final Map<String, String> targetToSource;

    /**
     * @param targetToSource the projected variables, in order, each mapped to the inner variable it takes its value from
     */
    public ProjectionPattern(final Pattern inner, final Map<String, String> targetToSource) {
        this.inner = inner;
        this.targetToSource = Collections.unmodifiableMap(new LinkedHashMap<>(targetToSource));
    }

    public Pattern getInner() {
        return inner;
    }

    public Map<String, String> getTargetToSource() {
        return targetToSource;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        variables.addAll(targetToSource.keySet());
    }

    @Override
    public String toString() {
        return "project(" + targetToSource.keySet() + ", " + inner + ")";
    }
}
