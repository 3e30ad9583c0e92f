package net.fortytwo.rewrite.sparql;

import net.fortytwo.rewrite.eval.EvaluationContext;
import net.fortytwo.rewrite.eval.PatternMatcher;
import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.store.Dataset;
import net.fortytwo.rewrite.store.MutationReport;
import net.fortytwo.rewrite.template.ConstructExecutor;
import net.fortytwo.rewrite.template.UpdateExecutor;
import org.openrdf.model.IRI;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;
import org.openrdf.query.BindingSet;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.algebra.Modify;
import org.openrdf.query.algebra.UpdateExpr;
import org.openrdf.query.impl.MapBindingSet;
import org.openrdf.query.parser.ParsedBooleanQuery;
import org.openrdf.query.parser.ParsedDescribeQuery;
import org.openrdf.query.parser.ParsedGraphQuery;
import org.openrdf.query.parser.ParsedQuery;
import org.openrdf.query.parser.ParsedTupleQuery;
import org.openrdf.query.parser.ParsedUpdate;
import org.openrdf.query.parser.sparql.SPARQLParser;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;

/**
 * Binds SPARQL queries and updates to a prefix table, translates them into patterns and templates,
 * and executes them against a dataset
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class QueryEngine {
    private static final Logger logger = Logger.getLogger(QueryEngine.class.getName());

    private static final Set<String> UPDATE_KEYWORDS = new HashSet<>(Arrays.asList(
            "INSERT", "DELETE", "WITH", "LOAD", "CLEAR", "CREATE", "DROP", "COPY", "MOVE", "ADD"));

    private final EngineConfiguration configuration;
    private final ValueFactory valueFactory = SimpleValueFactory.getInstance();
    private final IRI graphControlPredicate;
    private final ForkJoinPool pool;

    public QueryEngine() {
        this(EngineConfiguration.load());
    }

    public QueryEngine(final EngineConfiguration configuration) {
        this.configuration = configuration;

        String gcp = configuration.getGraphControlPredicate();
        this.graphControlPredicate = null == gcp ? null : valueFactory.createIRI(gcp);

        this.pool = configuration.getParallelism() > 1
                ? new ForkJoinPool(configuration.getParallelism())
                : null;
    }

    public EngineConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Releases the threads of this engine, if it evaluates in parallel
     */
    public void shutDown() {
        if (null != pool) {
            pool.shutdown();
        }
    }

    /**
     * Binds a query to a prefix table, then parses and translates it
     *
     * @param query    the text of a SELECT, ASK or CONSTRUCT query, or of a DELETE/INSERT update
     * @param prefixes prefixes available to the query in addition to those it declares
     * @return the prepared query
     * @throws UnknownPrefixException     if the query uses a prefix which is neither declared nor in the table
     * @throws InvalidQueryException      if the query is syntactically invalid
     * @throws IncompatibleQueryException if the query uses an unsupported feature
     */
    public SparqlQuery prepare(final String query, final PrefixTable prefixes)
            throws InvalidQueryException, IncompatibleQueryException {
        String stripped = QueryScanner.strip(query);
        Set<String> declared = QueryScanner.declaredPrefixes(stripped);
        for (String prefix : QueryScanner.usedPrefixes(stripped)) {
            if (!declared.contains(prefix) && !prefixes.contains(prefix)) {
                throw new UnknownPrefixException(prefix);
            }
        }

        String text = prefixes.toPrologue(declared) + query;
        SPARQLParser parser = new SPARQLParser();

        SparqlQuery prepared;
        try {
            if (UPDATE_KEYWORDS.contains(QueryScanner.queryKeyword(stripped))) {
                prepared = prepareUpdate(parser.parseUpdate(text, configuration.getBaseIri()));
            } else {
                prepared = prepareQuery(parser.parseQuery(text, configuration.getBaseIri()));
            }
        } catch (MalformedQueryException e) {
            throw new InvalidQueryException(e);
        }

        logger.fine("prepared query: " + prepared);
        return prepared;
    }

    private SparqlQuery prepareQuery(final ParsedQuery parsed) throws IncompatibleQueryException {
        SparqlTranslator translator = new SparqlTranslator(valueFactory,
                null == parsed.getDataset()
                        ? null
                        : SparqlTranslator.singleGraph(parsed.getDataset().getDefaultGraphs()));

        if (parsed instanceof ParsedTupleQuery) {
            return translator.translateSelect(parsed.getTupleExpr());
        } else if (parsed instanceof ParsedBooleanQuery) {
            return translator.translateAsk(parsed.getTupleExpr());
        } else if (parsed instanceof ParsedDescribeQuery) {
            throw new IncompatibleQueryException("DESCRIBE query form is not supported");
        } else if (parsed instanceof ParsedGraphQuery) {
            return translator.translateConstruct(parsed.getTupleExpr());
        } else {
            throw new IncompatibleQueryException("unexpected query type: " + parsed.getClass().getSimpleName());
        }
    }

    private SparqlQuery prepareUpdate(final ParsedUpdate parsed) throws IncompatibleQueryException {
        List<UpdateExpr> exprs = parsed.getUpdateExprs();
        if (1 != exprs.size()) {
            throw new IncompatibleQueryException("expected exactly one update operation; found " + exprs.size());
        }

        UpdateExpr expr = exprs.get(0);
        if (!(expr instanceof Modify)) {
            throw new IncompatibleQueryException("unsupported update operation: " + expr.getClass().getSimpleName());
        }

        return SparqlTranslator.translateModify((Modify) expr, parsed.getDatasetMapping().get(expr), valueFactory);
    }

    public SelectResult select(final String query, final PrefixTable prefixes, final Dataset dataset)
            throws InvalidQueryException, IncompatibleQueryException {
        return select(checkForm(prepare(query, prefixes), SparqlQuery.QueryForm.SELECT), dataset);
    }

    public boolean ask(final String query, final PrefixTable prefixes, final Dataset dataset)
            throws InvalidQueryException, IncompatibleQueryException {
        return ask(checkForm(prepare(query, prefixes), SparqlQuery.QueryForm.ASK), dataset);
    }

    public Set<Statement> construct(final String query, final PrefixTable prefixes, final Dataset dataset)
            throws InvalidQueryException, IncompatibleQueryException {
        return construct(checkForm(prepare(query, prefixes), SparqlQuery.QueryForm.CONSTRUCT), dataset);
    }

    public MutationReport update(final String query, final PrefixTable prefixes, final Dataset dataset)
            throws InvalidQueryException, IncompatibleQueryException {
        return update(checkForm(prepare(query, prefixes), SparqlQuery.QueryForm.UPDATE), dataset);
    }

    public SelectResult select(final SparqlQuery query, final Dataset dataset) {
        List<BindingSet> rows = new LinkedList<>();
        for (Solution s : createMatcher(dataset).evaluate(query.getPattern())) {
            MapBindingSet bs = new MapBindingSet();
            for (String name : query.getBindingNames()) {
                Value v = s.get(name);
                if (null != v) {
                    bs.addBinding(name, v);
                }
            }
            rows.add(bs);
        }
        return new SelectResult(query.getBindingNames(), rows);
    }

    public boolean ask(final SparqlQuery query, final Dataset dataset) {
        return !createMatcher(dataset).evaluate(query.getPattern()).isEmpty();
    }

    public Set<Statement> construct(final SparqlQuery query, final Dataset dataset) {
        return new ConstructExecutor(createMatcher(dataset)).construct(query.getPattern(), query.getInsertTemplate());
    }

    public MutationReport update(final SparqlQuery query, final Dataset dataset) {
        return new UpdateExecutor(createMatcher(dataset))
                .execute(query.getPattern(), query.getDeleteTemplate(), query.getInsertTemplate());
    }

    private SparqlQuery checkForm(final SparqlQuery query, final SparqlQuery.QueryForm expected)
            throws IncompatibleQueryException {
        if (query.getQueryForm() != expected) {
            throw new IncompatibleQueryException("expected a " + expected + " query; found " + query.getQueryForm());
        }
        return query;
    }

    private PatternMatcher createMatcher(final Dataset dataset) {
        EvaluationContext context = new EvaluationContext(dataset, configuration.createBudget());
        context.setValueFactory(valueFactory);
        context.setBaseIri(configuration.getBaseIri());
        context.setGraphControlPredicate(graphControlPredicate);
        context.setPool(pool);
        return new PatternMatcher(context);
    }

    /**
     * An exception thrown when a query cannot be parsed or bound
     */
    public static class InvalidQueryException extends Exception {
        public InvalidQueryException(final String message) {
            super(message);
        }

        public InvalidQueryException(final Throwable cause) {
            super(cause);
        }
    }

    /**
     * An exception thrown when a query uses a prefix which has not been declared
     */
    public static class UnknownPrefixException extends InvalidQueryException {
        private final String prefix;

        public UnknownPrefixException(final String prefix) {
            super("unknown prefix: " + prefix);
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }
    }

    /**
     * An exception thrown when a valid query uses a feature which this engine does not support
     */
    public static class IncompatibleQueryException extends Exception {
        public IncompatibleQueryException(final String message) {
            super(message);
        }
    }
}
