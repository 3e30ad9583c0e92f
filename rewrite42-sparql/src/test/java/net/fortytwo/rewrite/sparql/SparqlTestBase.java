package net.fortytwo.rewrite.sparql;

import info.aduna.iteration.CloseableIteration;
import net.fortytwo.rewrite.store.Dataset;
import org.junit.After;
import org.junit.Before;
import org.openrdf.model.IRI;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;
import org.openrdf.query.BindingSet;
import org.openrdf.query.QueryEvaluationException;
import org.openrdf.query.impl.DatasetImpl;
import org.openrdf.query.impl.EmptyBindingSet;
import org.openrdf.query.parser.ParsedQuery;
import org.openrdf.query.parser.QueryParser;
import org.openrdf.query.parser.sparql.SPARQLParser;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.RDFParserRegistry;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.StatementCollector;
import org.openrdf.sail.Sail;
import org.openrdf.sail.SailConnection;
import org.openrdf.sail.memory.MemoryStore;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.assertEquals;

/**
 * A base class for query engine tests, with fixture loading and comparison against a reference store
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public abstract class SparqlTestBase {
    protected static final String BASE_IRI = EngineConfiguration.DEFAULT_BASE_IRI;
    protected static final String
            EX = "http://example.org/animals/",
            GRAPHS = "http://example.org/graphs/";

    private final QueryParser queryParser = new SPARQLParser();

    protected final ValueFactory vf = SimpleValueFactory.getInstance();
    protected PrefixTable prefixes;
    protected QueryEngine engine;
    protected Dataset dataset;

    @Before
    public void setUp() throws Exception {
        prefixes = PrefixTable.withDefaults().add("ex", EX);
        engine = new QueryEngine(new EngineConfiguration());
        dataset = new Dataset();
    }

    @After
    public void tearDown() throws Exception {
        engine.shutDown();
    }

    protected IRI ex(final String localName) {
        return vf.createIRI(EX + localName);
    }

    protected IRI graph(final String localName) {
        return vf.createIRI(GRAPHS + localName);
    }

    protected String loadQuery(final String fileName) throws Exception {
        StringBuilder sb = new StringBuilder();
        try (InputStream in = QueryEngine.class.getResourceAsStream(fileName)) {
            if (null == in) {
                throw new IllegalStateException("no such resource: " + fileName);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while (null != (line = reader.readLine())) {
                sb.append(line).append("\n");
            }
        }
        return sb.toString();
    }

    protected List<Statement> loadData(final String fileName) throws Exception {
        Optional<RDFFormat> format = RDFParserRegistry.getInstance().getFileFormatForFileName(fileName);

        if (!format.isPresent()) {
            throw new IllegalStateException("unsupported file extension");
        }

        RDFParser p = Rio.createParser(format.get());

        List<Statement> c = new LinkedList<>();
        p.setRDFHandler(new StatementCollector(c));

        try (InputStream in = QueryEngine.class.getResourceAsStream(fileName)) {
            p.parse(in, BASE_IRI);
        }

        return c;
    }

    protected void loadDataset(final String fileName) throws Exception {
        dataset.addAll(loadData(fileName));
    }

    protected Set<Map<String, Value>> toSet(final SelectResult result) {
        Set<Map<String, Value>> answers = new HashSet<>();
        for (BindingSet bs : result.getRows()) {
            answers.add(toMap(bs));
        }
        return answers;
    }

    protected Map<String, Value> toMap(final BindingSet bs) {
        Map<String, Value> map = new HashMap<>();
        for (String name : bs.getBindingNames()) {
            Value v = bs.getValue(name);
            if (null != v) {
                map.put(name, v);
            }
        }
        return map;
    }

    /**
     * Evaluates a query against Sesame's in-memory store, for use as a reference.
     * Data is added to the default graph only.
     */
    protected Set<Map<String, Value>> referenceAnswers(final List<Statement> data,
                                                       final String query) throws Exception {
        Set<String> declared = QueryScanner.declaredPrefixes(QueryScanner.strip(query));
        ParsedQuery pq = queryParser.parseQuery(prefixes.toPrologue(declared) + query, BASE_IRI);
        Set<Map<String, Value>> results = new HashSet<>();

        Sail sail = new MemoryStore();
        sail.initialize();
        try {
            SailConnection sc = sail.getConnection();
            try {
                sc.begin();

                for (Statement s : data) {
                    sc.addStatement(s.getSubject(), s.getPredicate(), s.getObject());
                }

                try (CloseableIteration<? extends BindingSet, QueryEvaluationException> iter
                             = sc.evaluate(pq.getTupleExpr(), new DatasetImpl(), new EmptyBindingSet(), false)) {
                    while (iter.hasNext()) {
                        results.add(toMap(iter.next()));
                    }
                }
            } finally {
                sc.rollback();
                sc.close();
            }
        } finally {
            sail.shutDown();
        }

        return results;
    }

    /**
     * Checks that a SELECT query gives the same distinct answers as the reference store
     *
     * @return the answers of the query engine
     */
    protected SelectResult compareAnswers(final String dataFile, final String queryFile) throws Exception {
        List<Statement> data = loadData(dataFile);
        String query = loadQuery(queryFile);

        Dataset d = new Dataset();
        d.addAll(data);
        SelectResult result = engine.select(query, prefixes, d);

        assertEquals(referenceAnswers(data, query), toSet(result));
        return result;
    }
}
