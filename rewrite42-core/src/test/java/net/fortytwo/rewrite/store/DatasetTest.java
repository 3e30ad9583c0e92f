package net.fortytwo.rewrite.store;

import net.fortytwo.rewrite.RewriteTestBase;
import org.junit.Test;
import org.openrdf.model.IRI;
import org.openrdf.model.Statement;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class DatasetTest extends RewriteTestBase {
    private final IRI g1 = iri("graph1"), g2 = iri("graph2"), g3 = iri("graph3");

    @Test
    public void testAddIsIdempotent() {
        assertTrue(dataset.addTriple(null, triple(ARTHUR, knows, FORD)));
        assertFalse(dataset.addTriple(null, triple(ARTHUR, knows, FORD)));
        assertEquals(1, dataset.getDefaultGraph().size());
        assertEquals(1, dataset.size());
    }

    @Test
    public void testContextSelectsGraph() {
        dataset.add(vf.createStatement(ARTHUR, knows, FORD, g1));
        dataset.add(triple(ARTHUR, knows, ZAPHOD));

        assertEquals(1, dataset.match(g1, null, null, null).size());
        assertEquals(1, dataset.match(null, null, null, null).size());
        assertEquals(ZAPHOD, dataset.match(null, ARTHUR, knows, null).get(0).getObject());

        // triples are stored without context
        assertNull(dataset.match(g1, null, null, null).get(0).getContext());
    }

    @Test
    public void testBlankNodeGraphNameIsRejected() {
        try {
            dataset.add(vf.createStatement(ARTHUR, knows, FORD, vf.createBNode()));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testMatchWithWildcards() {
        addTriples(
                triple(ARTHUR, knows, FORD),
                triple(ARTHUR, knows, ZAPHOD),
                triple(FORD, knows, ARTHUR),
                triple(ARTHUR, name, literal("Arthur Dent")));

        assertEquals(4, dataset.match(null, null, null, null).size());
        assertEquals(3, dataset.match(null, ARTHUR, null, null).size());
        assertEquals(3, dataset.match(null, null, knows, null).size());
        assertEquals(1, dataset.match(null, null, null, ARTHUR).size());
        assertEquals(0, dataset.match(null, ZAPHOD, null, null).size());

        List<Statement> ordered = dataset.match(null, ARTHUR, knows, null);
        assertEquals(FORD, ordered.get(0).getObject());
        assertEquals(ZAPHOD, ordered.get(1).getObject());
    }

    @Test
    public void testMissingGraphMatchesNothing() {
        addTriples(g1, triple(ARTHUR, knows, FORD));

        assertEquals(0, dataset.match(g2, null, null, null).size());
        assertNull(dataset.getNamedGraph(g2));
        assertEquals(Collections.singletonList(g1), dataset.listGraphs());
    }

    @Test
    public void testRemove() {
        addTriples(g1, triple(ARTHUR, knows, FORD), triple(ARTHUR, knows, ZAPHOD));

        assertTrue(dataset.removeTriple(g1, triple(ARTHUR, knows, FORD)));
        assertFalse(dataset.removeTriple(g1, triple(ARTHUR, knows, FORD)));
        assertFalse(dataset.removeTriple(g2, triple(ARTHUR, knows, ZAPHOD)));
        assertEquals(0, dataset.match(g1, null, null, FORD).size());
        assertEquals(1, dataset.match(g1, ARTHUR, null, null).size());
    }

    @Test
    public void testGraphsAreListedInIriOrder() {
        addTriples(g3, triple(ARTHUR, knows, FORD));
        addTriples(g1, triple(ARTHUR, knows, FORD));
        addTriples(g2, triple(ARTHUR, knows, FORD));

        assertEquals(Arrays.asList(g1, g2, g3), dataset.listGraphs());
    }

    @Test
    public void testListGraphsByTag() {
        addTriples(g1, triple(ARTHUR, knows, FORD));
        addTriples(g2, triple(ARTHUR, knows, FORD));
        addTriples(g3, triple(ARTHUR, knows, FORD));

        assertEquals(0, dataset.listGraphs("team").size());

        dataset.setGraphControlSource(new GraphControlSource() {
            @Override
            public Collection<GraphTag> getGraphTags() {
                return Arrays.asList(
                        new GraphTag(g3, "team"),
                        new GraphTag(g1, "team"),
                        new GraphTag(g2, "other"),
                        new GraphTag(iri("absent"), "team"));
            }
        });

        assertEquals(Arrays.asList(g1, g3), dataset.listGraphs("team"));
        assertEquals(Collections.singletonList(g2), dataset.listGraphs("other"));
    }

    @Test
    public void testApplyCountsActualChanges() {
        addTriples(g1, triple(ARTHUR, knows, FORD), triple(ARTHUR, knows, ZAPHOD));

        ChangeSet changes = new ChangeSet();
        changes.remove(g1, triple(ARTHUR, knows, FORD));
        changes.remove(g1, triple(ARTHUR, knows, TRILLIAN));
        changes.add(g1, triple(ARTHUR, knows, ZAPHOD));
        changes.add(g2, triple(FORD, knows, ZAPHOD));
        changes.add(null, triple(ZAPHOD, knows, TRILLIAN));

        MutationReport report = dataset.apply(changes);
        assertEquals(1, report.getRemoved());
        assertEquals(2, report.getAdded());

        assertEquals(1, dataset.match(g1, null, null, null).size());
        assertEquals(1, dataset.match(g2, null, null, null).size());
        assertEquals(1, dataset.match(null, null, null, null).size());
    }

    @Test
    public void testRemovalsPrecedeAdditions() {
        addTriples(g1, triple(ARTHUR, knows, FORD));

        ChangeSet changes = new ChangeSet();
        changes.remove(g1, triple(ARTHUR, knows, FORD));
        changes.add(g1, triple(ARTHUR, knows, FORD));

        MutationReport report = dataset.apply(changes);
        assertEquals(1, report.getRemoved());
        assertEquals(1, report.getAdded());
        assertEquals(1, dataset.match(g1, ARTHUR, knows, FORD).size());
    }

    @Test
    public void testConcurrentReadersSeeWholeBatches() throws Exception {
        final int batches = 50, batchSize = 20;
        final boolean[] torn = {false};

        Thread reader = new Thread(() -> {
            for (int i = 0; i < 2000; i++) {
                int n = dataset.match(g1, null, knows, null).size();
                if (0 != n % batchSize) {
                    torn[0] = true;
                }
            }
        });
        reader.start();

        for (int b = 0; b < batches; b++) {
            ChangeSet changes = new ChangeSet();
            for (int i = 0; i < batchSize; i++) {
                changes.add(g1, triple(iri("s" + b + "_" + i), knows, ARTHUR));
            }
            dataset.apply(changes);
        }
        reader.join();

        assertFalse(torn[0]);
        assertEquals(batches * batchSize, dataset.match(g1, null, null, null).size());
    }
}
