package net.fortytwo.rewrite.sparql;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class QueryScannerTest {

    private Set<String> used(final String query) {
        return QueryScanner.usedPrefixes(QueryScanner.strip(query));
    }

    private Set<String> setOf(final String... items) {
        return new LinkedHashSet<>(Arrays.asList(items));
    }

    @Test
    public void testStripPreservesLength() {
        String query = "SELECT ?x WHERE { ?x <http://example.org/a:b> \"c:d\" } # e:f";
        String stripped = QueryScanner.strip(query);
        assertEquals(query.length(), stripped.length());
        assertEquals("SELECT ?x WHERE { ?x", stripped.substring(0, 20));
        assertEquals(-1, stripped.indexOf(':'));
    }

    @Test
    public void testUsedPrefixes() {
        assertEquals(setOf("skos", "ex"), used("SELECT ?x WHERE { ?x a skos:Concept ; skos:broader ex:Animal }"));
        assertEquals(setOf("xsd"), used("SELECT ?x WHERE { ?x ?p \"5\"^^xsd:integer }"));
        assertEquals(setOf("rdfs"), used("SELECT ?x WHERE { ?x rdfs:subClassOf+/rdfs:subClassOf ?y }"));
        assertEquals(setOf("rdfs"), used("SELECT ?x WHERE { ?x ^rdfs:subClassOf ?y }"));
    }

    @Test
    public void testNonPrefixColonsAreIgnored() {
        assertEquals(Collections.<String>emptySet(),
                used("SELECT ?x WHERE { ?x <urn:isbn:123> 'a:b' . FILTER(?x < 5) }"));
        assertEquals(Collections.<String>emptySet(), used("SELECT ?x WHERE { ?x ?p \"\"\"long: \"text\" \"\"\" }"));
        assertEquals(setOf("ex"), used("INSERT { _:b ex:p ?o } WHERE { ?s ?p ?o }"));
        assertEquals(setOf("ex"), used("SELECT ?x WHERE { ?x ex:p ?y } # see skos:Concept"));
    }

    @Test
    public void testEmptyPrefix() {
        assertEquals(setOf(""), used("SELECT ?x WHERE { ?x :p ?y }"));
    }

    @Test
    public void testDeclaredPrefixes() {
        String query = "PREFIX ex: <http://example.org/>\nprefix : <http://example.org/default/>\nSELECT * { ?x ex:p ?y }";
        assertEquals(setOf("ex", ""), QueryScanner.declaredPrefixes(QueryScanner.strip(query)));
    }

    @Test
    public void testQueryKeyword() {
        assertEquals("SELECT", QueryScanner.queryKeyword(QueryScanner.strip("select ?x { ?x ?p ?o }")));
        assertEquals("INSERT", QueryScanner.queryKeyword(QueryScanner.strip(
                "# a comment\nPREFIX ex: <http://example.org/>\nBASE <http://example.org/>\ninsert { ?x a ex:C } WHERE {}")));
        assertEquals("WITH", QueryScanner.queryKeyword(QueryScanner.strip(
                "WITH <http://example.org/g> DELETE { ?x ?p ?o } WHERE { ?x ?p ?o }")));
        assertEquals("", QueryScanner.queryKeyword(""));
    }
}
