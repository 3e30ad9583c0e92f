package net.fortytwo.rewrite.algebra;

import java.util.Set;

/**
 * OFFSET and LIMIT
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class SlicePattern extends Pattern {
    private final Pattern inner;
    private final long offset;
    private final long limit;

    /**
     * @param offset the number of solutions to skip, or 0
     * @param limit  the maximum number of solutions, or a negative number for no limit
     */
    public SlicePattern(final Pattern inner, final long offset, final long limit) {
        this.inner = inner;
        this.offset = Math.max(0, offset);
        this.limit = limit;
    }

    public Pattern getInner() {
        return inner;
    }

    public long getOffset() {
        return offset;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        inner.collectVariables(variables);
    }

    @Override
    public String toString() {
        return "slice(" + offset + ", " + limit + ", " + inner + ")";
    }
}
