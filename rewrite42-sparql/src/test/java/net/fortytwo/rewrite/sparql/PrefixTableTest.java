package net.fortytwo.rewrite.sparql;

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class PrefixTableTest {
    private PrefixTable prefixes;

    @Before
    public void setUp() {
        prefixes = PrefixTable.withDefaults()
                .add("ex", "http://example.org/")
                .add("animals", "http://example.org/animals/");
    }

    @Test
    public void testDefaults() {
        assertEquals("http://www.w3.org/2004/02/skos/core#", prefixes.getNamespace("skos"));
        assertEquals(PrefixTable.SKOSXL_NAMESPACE, prefixes.getNamespace("skosxl"));
        assertTrue(prefixes.contains("owl"));
        assertTrue(prefixes.contains("dcterms"));
        assertFalse(prefixes.contains("foo"));
    }

    @Test
    public void testExpand() throws Exception {
        assertEquals("http://www.w3.org/2004/02/skos/core#Concept", prefixes.expand("skos:Concept"));
        assertEquals("http://example.org/animals/Dog", prefixes.expand("animals:Dog"));
        assertEquals("http://example.org/x", prefixes.expand("<http://example.org/x>"));

        try {
            prefixes.expand("foo:bar");
            fail("expected an unknown prefix");
        } catch (QueryEngine.UnknownPrefixException e) {
            assertEquals("foo", e.getPrefix());
        }

        assertEquals("foo:bar", prefixes.expandOrSelf("foo:bar"));
    }

    @Test
    public void testCompressUsesLongestNamespace() throws Exception {
        assertEquals("animals:Dog", prefixes.compress("http://example.org/animals/Dog"));
        assertEquals("ex:plants/Fern", prefixes.compress("http://example.org/plants/Fern"));
        assertEquals("http://example.com/x", prefixes.compressOrSelf("http://example.com/x"));
    }

    @Test(expected = QueryEngine.UnknownPrefixException.class)
    public void testCompressWithoutMatchingNamespace() throws Exception {
        prefixes.compress("http://example.com/x");
    }

    @Test
    public void testPrologue() {
        PrefixTable table = new PrefixTable()
                .add("ex", "http://example.org/")
                .add("skos", "http://www.w3.org/2004/02/skos/core#");

        assertEquals("PREFIX ex: <http://example.org/>\n"
                + "PREFIX skos: <http://www.w3.org/2004/02/skos/core#>\n", table.toPrologue());
        assertEquals("PREFIX skos: <http://www.w3.org/2004/02/skos/core#>\n",
                table.toPrologue(Collections.singleton("ex")));
        assertEquals(Arrays.asList("ex", "skos"), Arrays.asList(table.getPrefixes().toArray()));
    }
}
