package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.PrefixTable;
import net.fortytwo.rewrite.sparql.QueryEngine;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriMappingTest {
    private static final String
            EX = "http://example.org/animals/",
            LOCAL = "http://example.org/local/";

    private IriMapping mapping;

    @Before
    public void setUp() {
        mapping = new IriMapping(PrefixTable.withDefaults().add("ex", EX).add("local", LOCAL));
    }

    @Test
    public void testKeysAndValuesAreExpanded() throws Exception {
        mapping.put("ex:Dog", "local:01000001");
        mapping.put(EX + "Cat", LOCAL + "01000002");

        assertEquals(LOCAL + "01000001", mapping.get(EX + "Dog"));
        assertEquals(LOCAL + "01000001", mapping.get("ex:Dog"));
        assertEquals(LOCAL + "01000002", mapping.get("ex:Cat"));
        assertTrue(mapping.containsKey("ex:Cat"));
        assertTrue(mapping.keySet().contains(EX + "Dog"));
        assertTrue(mapping.values().contains(LOCAL + "01000002"));
        assertEquals(2, mapping.size());
    }

    @Test
    public void testMissingKey() {
        assertNull(mapping.get("ex:Dog"));
        assertFalse(mapping.containsKey("ex:Dog"));
    }

    @Test
    public void testFullIrisOutsideTheTableAreKept() throws Exception {
        mapping.put("http://example.com/Dog", "urn:animal:dog");
        assertEquals("urn:animal:dog", mapping.get("http://example.com/Dog"));
    }

    @Test
    public void testIdenticalRecordIsIgnored() throws Exception {
        mapping.put("ex:Dog", "local:01000001");
        mapping.put(EX + "Dog", LOCAL + "01000001");
        assertEquals(1, mapping.size());
    }

    @Test
    public void testConflictingRecord() throws Exception {
        mapping.put("ex:Dog", "local:01000001");
        try {
            mapping.put("ex:Dog", "local:01000002");
            fail("expected a conflicting record");
        } catch (IriMapping.RecordExistsException e) {
            assertEquals(EX + "Dog", e.getKey());
        }
        assertEquals(LOCAL + "01000001", mapping.get("ex:Dog"));
    }

    @Test(expected = QueryEngine.UnknownPrefixException.class)
    public void testUnknownPrefix() throws Exception {
        mapping.put("foo:Dog", "local:01000001");
    }
}
