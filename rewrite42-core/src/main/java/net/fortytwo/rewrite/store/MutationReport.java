package net.fortytwo.rewrite.store;

/**
 * The outcome of a committed {@link ChangeSet}
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class MutationReport {
    private final long added;
    private final long removed;

    public MutationReport(final long added, final long removed) {
        this.added = added;
        this.removed = removed;
    }

    /**
     * @return the number of triples actually added, excluding any which were already present
     */
    public long getAdded() {
        return added;
    }

    /**
     * @return the number of triples actually removed, excluding any which were absent
     */
    public long getRemoved() {
        return removed;
    }

    @Override
    public String toString() {
        return "added " + added + ", removed " + removed;
    }
}
