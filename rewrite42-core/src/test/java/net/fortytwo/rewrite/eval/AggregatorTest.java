package net.fortytwo.rewrite.eval;

import net.fortytwo.rewrite.RewriteTestBase;
import net.fortytwo.rewrite.algebra.AggregatePattern;
import net.fortytwo.rewrite.algebra.OrderPattern;
import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.expr.VarExpression;
import net.fortytwo.rewrite.model.Solution;
import org.junit.Test;
import org.openrdf.model.IRI;
import org.openrdf.model.Literal;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.XMLSchema;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class AggregatorTest extends RewriteTestBase {
    private final IRI g1 = iri("graph1"), g2 = iri("graph2");

    private Literal integer(final long n) {
        return vf.createLiteral(String.valueOf(n), XMLSchema.INTEGER);
    }

    private AggregatePattern.Aggregate count(final String as, final String variable, final boolean distinct) {
        return new AggregatePattern.Aggregate(as, AggregatePattern.Function.COUNT,
                null == variable ? null : new VarExpression(variable), distinct, null);
    }

    @Test
    public void testCountPerGroupSumsToTotal() {
        addTriples(g1, triple(ARTHUR, type, iri("Person")), triple(FORD, type, iri("Person")));
        addTriples(g2, triple(ZAPHOD, type, iri("Person")));

        Pattern p = new AggregatePattern(bgp(pattern("?s", type, "?t", "?g")),
                Collections.singletonList("g"),
                Collections.singletonList(count("n", "s", false)));

        List<Solution> results = evaluate(p);
        assertEquals(Arrays.asList(
                solution("g", g1, "n", integer(2)),
                solution("g", g2, "n", integer(1))), results);
    }

    @Test
    public void testCountOverEmptyInputIsZero() {
        Pattern p = new AggregatePattern(bgp(pattern("?s", type, "?t")),
                Collections.<String>emptyList(),
                Collections.singletonList(count("n", null, false)));

        assertEquals(Collections.singletonList(solution("n", integer(0))), evaluate(p));

        Pattern grouped = new AggregatePattern(bgp(pattern("?s", type, "?t")),
                Collections.singletonList("t"),
                Collections.singletonList(count("n", null, false)));
        assertEquals(0, evaluate(grouped).size());
    }

    @Test
    public void testCountIgnoresUnboundValues() {
        Aggregator aggregator = new Aggregator(matcher());
        List<Solution> input = Arrays.asList(
                solution("x", ARTHUR, "y", FORD),
                solution("x", ARTHUR),
                solution("x", ZAPHOD, "y", FORD));

        List<Solution> results = aggregator.aggregate(input, Collections.<String>emptyList(), Arrays.asList(
                count("all", null, false),
                count("ys", "y", false),
                count("distinctYs", "y", true)));

        assertEquals(Collections.singletonList(solution(
                "all", integer(3), "ys", integer(2), "distinctYs", integer(1))), results);
    }

    @Test
    public void testGroupsInFirstSeenOrder() {
        Aggregator aggregator = new Aggregator(matcher());
        List<Solution> input = Arrays.asList(
                solution("x", ZAPHOD),
                solution("x", ARTHUR),
                solution("x", ZAPHOD),
                solution("y", FORD));

        List<Solution> results = aggregator.aggregate(input, Collections.singletonList("x"),
                Collections.singletonList(count("n", null, false)));

        assertEquals(Arrays.asList(
                solution("x", ZAPHOD, "n", integer(2)),
                solution("x", ARTHUR, "n", integer(1)),
                solution("n", integer(1))), results);
    }

    @Test
    public void testOtherAggregates() {
        Aggregator aggregator = new Aggregator(matcher());
        List<Solution> input = Arrays.asList(
                solution("v", integer(10)),
                solution("v", integer(9)),
                solution("v", literal("x")),
                solution("w", literal("unused")));

        List<Solution> results = aggregator.aggregate(input, Collections.<String>emptyList(), Arrays.asList(
                new AggregatePattern.Aggregate("min", AggregatePattern.Function.MIN, new VarExpression("v"), false, null),
                new AggregatePattern.Aggregate("max", AggregatePattern.Function.MAX, new VarExpression("v"), false, null),
                new AggregatePattern.Aggregate("sample", AggregatePattern.Function.SAMPLE, new VarExpression("v"), false, null),
                new AggregatePattern.Aggregate("concat", AggregatePattern.Function.GROUP_CONCAT, new VarExpression("v"), false, ", "),
                new AggregatePattern.Aggregate("none", AggregatePattern.Function.MAX, new VarExpression("z"), false, null)));

        Solution s = results.get(0);
        assertEquals(integer(9), s.get("min"));
        assertEquals(literal("x"), s.get("max"));
        assertEquals(integer(10), s.get("sample"));
        assertEquals(literal("10, 9, x"), s.get("concat"));
        assertNull(s.get("none"));
    }

    @Test
    public void testOrderByCountDescending() {
        addTriples(
                triple(ARTHUR, knows, FORD),
                triple(ZAPHOD, knows, FORD),
                triple(ZAPHOD, knows, ARTHUR),
                triple(TRILLIAN, knows, FORD),
                triple(TRILLIAN, knows, ARTHUR),
                triple(TRILLIAN, knows, ZAPHOD));

        Pattern grouped = new AggregatePattern(bgp(pattern("?s", knows, "?o")),
                Collections.singletonList("s"),
                Collections.singletonList(count("n", "o", false)));
        Pattern ordered = new OrderPattern(grouped, Collections.singletonList(
                new OrderPattern.OrderCondition(new VarExpression("n"), false)));

        List<Value> counts = column(evaluate(ordered), "n");
        assertEquals(Arrays.<Value>asList(integer(3), integer(2), integer(1)), counts);
        assertEquals(Arrays.<Value>asList(TRILLIAN, ZAPHOD, ARTHUR), column(evaluate(ordered), "s"));
    }
}
