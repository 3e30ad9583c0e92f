package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.PrefixTable;
import net.fortytwo.rewrite.store.Dataset;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.IRI;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SKOS;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriRemapperTest {
    private static final String
            EX = "http://example.org/animals/",
            LOCAL = "http://example.org/local/";

    private final ValueFactory vf = SimpleValueFactory.getInstance();

    private final IRI
            prefLabel = vf.createIRI(PrefixTable.SKOSXL_NAMESPACE + "prefLabel"),
            label = vf.createIRI(PrefixTable.SKOSXL_NAMESPACE + "Label"),
            literalForm = vf.createIRI(PrefixTable.SKOSXL_NAMESPACE + "literalForm");

    private final IRI
            dog = ex("Dog"),
            dogLabel = ex("Dog_label"),
            cat = ex("Cat"),
            species = ex("Species"),
            localConcept = vf.createIRI(LOCAL + "01000050");

    private Dataset dataset;
    private IriMapping mapping;
    private IriRemapper remapper;

    private IRI ex(final String localName) {
        return vf.createIRI(EX + localName);
    }

    private IRI local(final String localName) {
        return vf.createIRI(LOCAL + localName);
    }

    private void addTriples(final IRI graph) {
        dataset.addTriple(graph, vf.createStatement(dog, RDF.TYPE, SKOS.CONCEPT));
        dataset.addTriple(graph, vf.createStatement(dog, prefLabel, dogLabel));
        dataset.addTriple(graph, vf.createStatement(dogLabel, RDF.TYPE, label));
        dataset.addTriple(graph, vf.createStatement(dogLabel, literalForm, vf.createLiteral("Dog")));
        dataset.addTriple(graph, vf.createStatement(species, RDFS.SUBCLASSOF, SKOS.CONCEPT));
        dataset.addTriple(graph, vf.createStatement(cat, RDF.TYPE, species));
        dataset.addTriple(graph, vf.createStatement(cat, SKOS.RELATED, dog));
        dataset.addTriple(graph, vf.createStatement(cat, RDFS.COMMENT, vf.createLiteral("see " + EX + "Dog")));
        dataset.addTriple(graph, vf.createStatement(localConcept, RDF.TYPE, SKOS.CONCEPT));
    }

    @Before
    public void setUp() throws Exception {
        dataset = new Dataset();
        mapping = new IriMapping(PrefixTable.withDefaults().add("ex", EX));
        mapping.put(EX + "Cat", LOCAL + "01000001");
        remapper = new IriRemapper(new IriMinter(mapping, LOCAL, "1"));
    }

    @Test
    public void testRemapDefaultGraph() throws Exception {
        addTriples(null);
        long sizeBefore = dataset.size();

        RemapReport report = remapper.remap(dataset, null);

        IRI localCat = local("01000001");
        IRI localDog = local("01000002");
        assertEquals(2, report.getReplacements().size());
        assertEquals(localCat, report.getReplacements().get(cat));
        assertEquals(localDog, report.getReplacements().get(dog));
        assertEquals(1, report.getMinted());
        assertEquals(7, report.getReplaced());
        assertEquals(2, report.getAdded());
        assertEquals(sizeBefore + 2, dataset.size());

        // no occurrences of the public IRIs remain
        assertTrue(dataset.match(null, dog, null, null).isEmpty());
        assertTrue(dataset.match(null, null, null, dog).isEmpty());
        assertTrue(dataset.match(null, cat, null, null).isEmpty());
        assertTrue(dataset.match(null, dogLabel, null, null).isEmpty());

        assertEquals(1, dataset.match(null, localCat, SKOS.RELATED, localDog).size());
        assertEquals(1, dataset.match(null, localCat, RDF.TYPE, species).size());

        // labels follow their concepts
        IRI localLabel = local("01000002_label");
        assertEquals(1, dataset.match(null, localDog, prefLabel, localLabel).size());
        assertEquals(1, dataset.match(null, localLabel, RDF.TYPE, label).size());

        // literals and local concepts are left alone
        assertEquals(1, dataset.match(null, null, RDFS.COMMENT,
                vf.createLiteral("see " + EX + "Dog")).size());
        assertEquals(1, dataset.match(null, localConcept, RDF.TYPE, SKOS.CONCEPT).size());

        List<Statement> sources = dataset.match(null, localDog, remapper.getSourcedFrom(), null);
        assertEquals(1, sources.size());
        assertEquals("ex:Dog", ((Literal) sources.get(0).getObject()).getLabel());
        assertEquals(LOCAL + "property/sourced_from", remapper.getSourcedFrom().stringValue());

        assertEquals(LOCAL + "01000002", mapping.get("ex:Dog"));
    }

    @Test
    public void testRemapIsIdempotent() throws Exception {
        addTriples(null);
        remapper.remap(dataset, null);
        long size = dataset.size();

        RemapReport second = remapper.remap(dataset, null);
        assertEquals(0, second.getReplacements().size());
        assertEquals(0, second.getReplaced());
        assertEquals(0, second.getAdded());
        assertEquals(size, dataset.size());
    }

    @Test
    public void testRemapNamedGraphOnly() throws Exception {
        IRI g = vf.createIRI("http://example.org/graphs/animals");
        addTriples(g);
        dataset.add(vf.createStatement(cat, RDF.TYPE, SKOS.CONCEPT));

        RemapReport report = remapper.remap(dataset, g);
        assertEquals(2, report.getReplacements().size());

        assertTrue(dataset.match(g, cat, null, null).isEmpty());
        assertEquals(1, dataset.match(null, cat, RDF.TYPE, SKOS.CONCEPT).size());
        assertEquals(1, dataset.match(g, local("01000001"), RDF.TYPE, species).size());
    }

    @Test
    public void testFailedRemapRecordsNothing() throws Exception {
        addTriples(null);
        IRI bird = ex("Bird");
        dataset.add(vf.createStatement(bird, RDF.TYPE, SKOS.CONCEPT));
        long sizeBefore = dataset.size();

        // Bird takes the last free id, leaving none for Dog
        IriRemapper cramped = new IriRemapper(new IriMinter(mapping, LOCAL, "1", 3));
        try {
            cramped.remap(dataset, null);
            fail();
        } catch (IllegalStateException e) {
            // expected
        }

        assertEquals(1, mapping.size());
        assertNull(mapping.get("ex:Bird"));
        assertEquals(sizeBefore, dataset.size());
        assertEquals(1, dataset.match(null, bird, RDF.TYPE, SKOS.CONCEPT).size());
        assertEquals(1, dataset.match(null, cat, SKOS.RELATED, dog).size());

        // the ids which were not recorded are still available
        RemapReport report = remapper.remap(dataset, null);
        assertEquals(2, report.getMinted());
        assertEquals(LOCAL + "01000002", mapping.get("ex:Bird"));
        assertEquals(LOCAL + "01000003", mapping.get("ex:Dog"));
    }
}
