package net.fortytwo.rewrite.store;

import java.util.Collection;

/**
 * An external registry of graphs under some party's control, each with one or more tags.
 * The engine treats the registry as opaque: it only asks for the current (graph, tag) pairs.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public interface GraphControlSource {

    /**
     * @return all (graph, tag) pairs currently known to the registry
     */
    Collection<GraphTag> getGraphTags();
}
