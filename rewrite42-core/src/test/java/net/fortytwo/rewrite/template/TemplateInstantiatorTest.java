package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.RewriteTestBase;
import net.fortytwo.rewrite.model.Solution;
import org.junit.Test;
import org.openrdf.model.BNode;
import org.openrdf.model.Statement;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TemplateInstantiatorTest extends RewriteTestBase {

    @Test
    public void testUnboundVariableDropsTriple() {
        TemplateInstantiator instantiator = new TemplateInstantiator(Arrays.asList(
                new TemplateTriple(var("x"), constant(knows), var("y")),
                new TemplateTriple(var("x"), constant(name), var("n"))), vf);

        List<Statement> results = instantiator.instantiate(Arrays.asList(
                solution("x", ARTHUR, "y", FORD),
                solution("x", FORD, "y", ZAPHOD, "n", literal("Ford Prefect"))));

        assertEquals(Arrays.asList(
                triple(ARTHUR, knows, FORD),
                triple(FORD, knows, ZAPHOD),
                triple(FORD, name, literal("Ford Prefect"))), results);
    }

    @Test
    public void testIllTypedTermDropsTriple() {
        TemplateInstantiator instantiator = new TemplateInstantiator(Collections.singletonList(
                new TemplateTriple(var("x"), var("p"), constant(ARTHUR))), vf);

        List<Statement> results = instantiator.instantiate(Arrays.asList(
                solution("x", literal("not a subject"), "p", knows),
                solution("x", FORD, "p", literal("not a predicate")),
                solution("x", FORD, "p", knows)));

        assertEquals(Collections.singletonList(triple(FORD, knows, ARTHUR)), results);
    }

    @Test
    public void testBlankNodesAreFreshPerSolution() {
        BNode label = vf.createBNode("b");
        TemplateInstantiator instantiator = new TemplateInstantiator(Arrays.asList(
                new TemplateTriple(var("x"), constant(knows), constant(label)),
                new TemplateTriple(constant(label), constant(name), var("n"))), vf);

        List<Statement> results = instantiator.instantiate(Arrays.asList(
                solution("x", ARTHUR, "n", literal("one")),
                solution("x", FORD, "n", literal("two"))));

        assertEquals(4, results.size());
        // same label, same solution: same node
        assertEquals(results.get(0).getObject(), results.get(1).getSubject());
        assertEquals(results.get(2).getObject(), results.get(3).getSubject());
        // same label, different solutions: different nodes
        assertNotEquals(results.get(0).getObject(), results.get(2).getObject());
        assertNotEquals(label, results.get(0).getObject());
        assertTrue(results.get(0).getObject() instanceof BNode);
    }

    @Test
    public void testGraphTarget() {
        TemplateInstantiator instantiator = new TemplateInstantiator(Arrays.asList(
                new TemplateTriple(var("x"), constant(knows), var("y"), constant(iri("graph"))),
                new TemplateTriple(var("x"), constant(knows), var("y"), var("g"))), vf);

        List<Statement> results = instantiator.instantiate(Collections.singletonList(
                solution("x", ARTHUR, "y", FORD)));

        assertEquals(1, results.size());
        assertEquals(iri("graph"), results.get(0).getContext());
    }

    @Test
    public void testDefaultGraphHasNoContext() {
        TemplateInstantiator instantiator = new TemplateInstantiator(Collections.singletonList(
                new TemplateTriple(var("x"), constant(knows), var("y"))), vf);

        List<Statement> results = instantiator.instantiate(Collections.singletonList(
                Solution.EMPTY.extend("x", ARTHUR).extend("y", FORD)));
        assertNull(results.get(0).getContext());
    }
}
