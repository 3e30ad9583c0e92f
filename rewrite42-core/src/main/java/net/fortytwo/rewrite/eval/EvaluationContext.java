package net.fortytwo.rewrite.eval;

import net.fortytwo.rewrite.store.Dataset;
import org.openrdf.model.IRI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;

import java.util.concurrent.ForkJoinPool;

/**
 * Everything a single evaluation needs: the dataset, a budget, and evaluation options
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class EvaluationContext {
    /**
     * The default predicate by which patterns query the external graph control source.
     * A matching triple has a graph IRI as its subject and a tag literal as its object.
     */
    public static final String DEFAULT_GRAPH_CONTROL_PREDICATE = "http://fortytwo.net/2016/rewrite42#hasTag";

    private final Dataset dataset;
    private final EvaluationBudget budget;

    private ValueFactory valueFactory = SimpleValueFactory.getInstance();
    private String baseIri;
    private IRI graphControlPredicate;
    private ForkJoinPool pool;

    public EvaluationContext(final Dataset dataset, final EvaluationBudget budget) {
        if (null == dataset || null == budget) {
            throw new IllegalArgumentException("dataset and budget are required");
        }

        this.dataset = dataset;
        this.budget = budget;
        this.graphControlPredicate = valueFactory.createIRI(DEFAULT_GRAPH_CONTROL_PREDICATE);
    }

    public Dataset getDataset() {
        return dataset;
    }

    public EvaluationBudget getBudget() {
        return budget;
    }

    public ValueFactory getValueFactory() {
        return valueFactory;
    }

    public void setValueFactory(final ValueFactory valueFactory) {
        this.valueFactory = valueFactory;
    }

    public String getBaseIri() {
        return baseIri;
    }

    public void setBaseIri(final String baseIri) {
        this.baseIri = baseIri;
    }

    /**
     * @return the graph control predicate, or null if graph control patterns are disabled
     */
    public IRI getGraphControlPredicate() {
        return graphControlPredicate;
    }

    public void setGraphControlPredicate(final IRI graphControlPredicate) {
        this.graphControlPredicate = graphControlPredicate;
    }

    /**
     * @return a pool for evaluating independent sub-patterns in parallel, or null for sequential evaluation
     */
    public ForkJoinPool getPool() {
        return pool;
    }

    public void setPool(final ForkJoinPool pool) {
        this.pool = pool;
    }
}
