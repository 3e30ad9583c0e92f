package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.RewriteTestBase;
import net.fortytwo.rewrite.algebra.GraphScope;
import net.fortytwo.rewrite.algebra.PathPattern;
import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.eval.EvaluationBudget;
import net.fortytwo.rewrite.eval.ResourceExceededException;
import net.fortytwo.rewrite.path.Path;
import net.fortytwo.rewrite.store.MutationReport;
import org.junit.Test;
import org.openrdf.model.IRI;
import org.openrdf.model.Statement;
import org.openrdf.model.vocabulary.SKOS;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class UpdateExecutorTest extends RewriteTestBase {
    private final IRI a = iri("A"), b = iri("B"), c = iri("C");

    private final List<TemplateTriple> broaderTemplate = Arrays.asList(
            new TemplateTriple(var("sub"), constant(SKOS.BROADER), var("super")),
            new TemplateTriple(var("super"), constant(SKOS.NARROWER), var("sub")));

    private void addHierarchy() {
        addTriples(triple(a, subClassOf, b), triple(b, subClassOf, c), triple(a, subClassOf, c));
    }

    @Test
    public void testConstructIsASetAndLeavesDatasetUnchanged() {
        addHierarchy();
        Pattern where = bgp(pattern("?sub", subClassOf, "?super"));

        Set<Statement> results = new ConstructExecutor(matcher()).construct(where, Arrays.asList(
                new TemplateTriple(var("sub"), constant(type), constant(SKOS.CONCEPT)),
                new TemplateTriple(var("super"), constant(type), constant(SKOS.CONCEPT))));

        assertEquals(new HashSet<>(Arrays.asList(
                triple(a, type, SKOS.CONCEPT),
                triple(b, type, SKOS.CONCEPT),
                triple(c, type, SKOS.CONCEPT))), results);
        assertEquals(3, dataset.size());
    }

    @Test
    public void testInsertIsIdempotent() {
        addHierarchy();
        Pattern where = bgp(pattern("?sub", subClassOf, "?super"));

        MutationReport first = new UpdateExecutor(matcher()).insert(where, broaderTemplate);
        assertEquals(6, first.getAdded());
        long size = dataset.size();

        MutationReport second = new UpdateExecutor(matcher()).insert(where, broaderTemplate);
        assertEquals(0, second.getAdded());
        assertEquals(size, dataset.size());
    }

    @Test
    public void testInsertIntoNamedGraph() {
        addHierarchy();
        IRI target = iri("skos");
        Pattern where = bgp(pattern("?sub", subClassOf, "?super"));

        new UpdateExecutor(matcher()).insert(where, Collections.singletonList(
                new TemplateTriple(var("sub"), constant(SKOS.BROADER), var("super"), constant(target))));

        assertEquals(3, dataset.match(target, null, SKOS.BROADER, null).size());
        assertEquals(0, dataset.match(null, null, SKOS.BROADER, null).size());
    }

    @Test
    public void testDeleteInsert() {
        addHierarchy();
        Pattern where = bgp(pattern("?sub", subClassOf, "?super"));

        MutationReport report = new UpdateExecutor(matcher()).execute(where,
                Collections.singletonList(new TemplateTriple(var("sub"), constant(subClassOf), var("super"))),
                Collections.singletonList(new TemplateTriple(var("sub"), constant(SKOS.BROADER), var("super"))));

        assertEquals(3, report.getRemoved());
        assertEquals(3, report.getAdded());
        assertEquals(0, dataset.match(null, null, subClassOf, null).size());
        assertEquals(3, dataset.match(null, null, SKOS.BROADER, null).size());
    }

    @Test
    public void testExceededBudgetLeavesDatasetUnchanged() {
        for (int i = 0; i < 20; i++) {
            for (int j = 0; j < 20; j++) {
                addTriples(triple(iri("n" + i), subClassOf, iri("n" + j)));
            }
        }
        long size = dataset.size();
        Pattern where = bgp(new PathPattern(
                var("sub"), Path.oneOrMore(Path.atomic(subClassOf)), var("super"), GraphScope.DEFAULT));

        try {
            new UpdateExecutor(matcher(new EvaluationBudget(100, EvaluationBudget.UNLIMITED)))
                    .insert(where, broaderTemplate);
            fail();
        } catch (ResourceExceededException e) {
            // expected
        }

        assertEquals(size, dataset.size());
    }
}
