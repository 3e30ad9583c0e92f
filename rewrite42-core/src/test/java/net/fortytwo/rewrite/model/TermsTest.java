package net.fortytwo.rewrite.model;

import net.fortytwo.rewrite.RewriteTestBase;
import org.junit.Test;
import org.openrdf.model.BNode;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.XMLSchema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TermsTest extends RewriteTestBase {

    @Test
    public void testTypeTests() {
        BNode b = vf.createBNode();

        assertTrue(Terms.isIRI(ARTHUR));
        assertFalse(Terms.isIRI(b));
        assertTrue(Terms.isBlankNode(b));
        assertTrue(Terms.isLiteral(literal("arthur")));
        assertFalse(Terms.isLiteral(ARTHUR));
        assertTrue(Terms.isNumeric(vf.createLiteral("42", XMLSchema.INTEGER)));
        assertTrue(Terms.isNumeric(vf.createLiteral(3.5)));
        assertFalse(Terms.isNumeric(literal("42")));
    }

    @Test
    public void testNumericValue() {
        assertEquals(new BigDecimal("42"), Terms.numericValue(vf.createLiteral("42", XMLSchema.INTEGER)));
        assertNull(Terms.numericValue(vf.createLiteral("NaN", XMLSchema.DOUBLE)));
        assertNull(Terms.numericValue(literal("42")));
    }

    @Test
    public void testStringForm() {
        assertEquals(EX + "arthur", Terms.stringForm(ARTHUR));
        assertEquals("Arthur Dent", Terms.stringForm(vf.createLiteral("Arthur Dent", "en")));
        assertNull(Terms.stringForm(vf.createBNode()));
    }

    @Test
    public void testOrdering() {
        BNode b = vf.createBNode();
        Value two = vf.createLiteral("2", XMLSchema.INTEGER);
        Value ten = vf.createLiteral("10", XMLSchema.INTEGER);
        Value apple = literal("apple");

        List<Value> values = new ArrayList<>(Arrays.asList(apple, ten, ZAPHOD, null, two, b, ARTHUR));
        values.sort(Terms.ORDER);

        assertEquals(Arrays.asList(null, b, ARTHUR, ZAPHOD, two, ten, apple), values);
    }

    @Test
    public void testNumericComparisonIgnoresLexicalForm() {
        assertTrue(Terms.compare(vf.createLiteral("9", XMLSchema.INTEGER), vf.createLiteral("10", XMLSchema.INTEGER)) < 0);
        assertTrue(Terms.compare(vf.createLiteral("20.5", XMLSchema.DECIMAL), vf.createLiteral("3", XMLSchema.INTEGER)) > 0);
    }

    @Test
    public void testMixedLiteralOrderingIsTransitive() {
        Value ten = vf.createLiteral("10", XMLSchema.INTEGER);
        Value nine = vf.createLiteral("9", XMLSchema.INTEGER);
        Value five = literal("5");

        assertTrue(Terms.compare(nine, ten) < 0);
        assertTrue(Terms.compare(ten, five) < 0);
        assertTrue(Terms.compare(nine, five) < 0);
        assertTrue(Terms.compare(five, nine) > 0);
    }

    @Test
    public void testMixedLiteralOrderingIgnoresInputOrder() {
        Value ten = vf.createLiteral("10", XMLSchema.INTEGER);
        Value nine = vf.createLiteral("9", XMLSchema.INTEGER);
        Value half = vf.createLiteral("0.5", XMLSchema.DECIMAL);
        Value five = literal("5");
        Value apple = literal("apple");
        List<Value> expected = Arrays.asList(half, nine, ten, five, apple);

        List<List<Value>> inputs = Arrays.asList(
                Arrays.asList(ten, nine, five, apple, half),
                Arrays.asList(five, apple, half, ten, nine),
                Arrays.asList(apple, five, ten, half, nine));
        for (List<Value> input : inputs) {
            List<Value> sorted = new ArrayList<>(input);
            sorted.sort(Terms.ORDER);
            assertEquals(expected, sorted);
        }
    }
}
