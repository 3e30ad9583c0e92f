package net.fortytwo.rewrite.eval;

import net.fortytwo.rewrite.algebra.AggregatePattern;
import net.fortytwo.rewrite.algebra.BasicGraphPattern;
import net.fortytwo.rewrite.algebra.BindPattern;
import net.fortytwo.rewrite.algebra.DistinctPattern;
import net.fortytwo.rewrite.algebra.EmptyPattern;
import net.fortytwo.rewrite.algebra.FilterPattern;
import net.fortytwo.rewrite.algebra.GraphScope;
import net.fortytwo.rewrite.algebra.JoinPattern;
import net.fortytwo.rewrite.algebra.OptionalPattern;
import net.fortytwo.rewrite.algebra.OrderPattern;
import net.fortytwo.rewrite.algebra.PathPattern;
import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.algebra.ProjectionPattern;
import net.fortytwo.rewrite.algebra.SingletonPattern;
import net.fortytwo.rewrite.algebra.SlicePattern;
import net.fortytwo.rewrite.algebra.TriplePattern;
import net.fortytwo.rewrite.algebra.UnionPattern;
import net.fortytwo.rewrite.algebra.ValuesPattern;
import net.fortytwo.rewrite.expr.Expression;
import net.fortytwo.rewrite.expr.ExpressionContext;
import net.fortytwo.rewrite.expr.ExpressionException;
import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import net.fortytwo.rewrite.model.VariableOrConstant;
import net.fortytwo.rewrite.path.PathEvaluator;
import net.fortytwo.rewrite.store.Dataset;
import net.fortytwo.rewrite.store.GraphTag;
import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Evaluates graph patterns against a dataset.
 * Each evaluation takes a solution whose bindings constrain the pattern,
 * and produces the sequence of solutions which extend it.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class PatternMatcher implements ExpressionContext {
    private static final Logger logger = Logger.getLogger(PatternMatcher.class.getName());

    private final EvaluationContext context;
    private final Dataset dataset;
    private final PathEvaluator pathEvaluator;
    private final Aggregator aggregator;

    public PatternMatcher(final EvaluationContext context) {
        this.context = context;
        this.dataset = context.getDataset();
        this.pathEvaluator = new PathEvaluator(dataset, context.getBudget());
        this.aggregator = new Aggregator(this);
    }

    public EvaluationContext getContext() {
        return context;
    }

    public List<Solution> evaluate(final Pattern pattern) {
        return evaluate(pattern, Solution.EMPTY);
    }

    /**
     * @param pattern  the pattern to evaluate
     * @param bindings bindings which constrain the pattern
     * @return all solutions of the pattern compatible with, and extending, the given bindings
     * @throws ResourceExceededException if the evaluation budget is exhausted
     */
    public List<Solution> evaluate(final Pattern pattern, final Solution bindings) {
        if (pattern instanceof BasicGraphPattern) {
            return evaluateBasicGraphPattern((BasicGraphPattern) pattern, bindings);
        } else if (pattern instanceof TriplePattern) {
            return evaluateTriplePattern((TriplePattern) pattern, bindings);
        } else if (pattern instanceof PathPattern) {
            return evaluatePathPattern((PathPattern) pattern, bindings);
        } else if (pattern instanceof JoinPattern) {
            return evaluateJoin((JoinPattern) pattern, bindings);
        } else if (pattern instanceof UnionPattern) {
            UnionPattern u = (UnionPattern) pattern;
            return evaluateAll(Arrays.asList(u.getLeft(), u.getRight()), p -> evaluate(p, bindings));
        } else if (pattern instanceof OptionalPattern) {
            return evaluateOptional((OptionalPattern) pattern, bindings);
        } else if (pattern instanceof FilterPattern) {
            return evaluateFilter((FilterPattern) pattern, bindings);
        } else if (pattern instanceof BindPattern) {
            return evaluateBind((BindPattern) pattern, bindings);
        } else if (pattern instanceof ValuesPattern) {
            return evaluateValues((ValuesPattern) pattern, bindings);
        } else if (pattern instanceof AggregatePattern) {
            return evaluateAggregate((AggregatePattern) pattern, bindings);
        } else if (pattern instanceof OrderPattern) {
            return evaluateOrder((OrderPattern) pattern, bindings);
        } else if (pattern instanceof ProjectionPattern) {
            return evaluateProjection((ProjectionPattern) pattern, bindings);
        } else if (pattern instanceof DistinctPattern) {
            return new ArrayList<>(new LinkedHashSet<>(evaluate(((DistinctPattern) pattern).getInner(), bindings)));
        } else if (pattern instanceof SlicePattern) {
            return evaluateSlice((SlicePattern) pattern, bindings);
        } else if (pattern instanceof SingletonPattern) {
            return Collections.singletonList(bindings);
        } else if (pattern instanceof EmptyPattern) {
            return Collections.emptyList();
        } else {
            throw new IllegalArgumentException("unsupported pattern: " + pattern);
        }
    }

    @Override
    public boolean exists(final Pattern pattern, final Solution solution) {
        context.getBudget().step();
        return !evaluate(pattern, solution).isEmpty();
    }

    @Override
    public ValueFactory getValueFactory() {
        return context.getValueFactory();
    }

    @Override
    public String getBaseIri() {
        return context.getBaseIri();
    }

    private List<Solution> evaluateBasicGraphPattern(final BasicGraphPattern bgp, final Solution bindings) {
        List<Solution> current = Collections.singletonList(bindings);
        for (Pattern p : bgp.getPatterns()) {
            List<Solution> next = new ArrayList<>();
            for (Solution s : current) {
                next.addAll(evaluate(p, s));
            }
            current = next;
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    private List<Solution> evaluateTriplePattern(final TriplePattern tp, final Solution bindings) {
        Value s = valueOf(tp.getSubject(), bindings);
        Value p = valueOf(tp.getPredicate(), bindings);
        Value o = valueOf(tp.getObject(), bindings);
        if ((null != s && !(s instanceof Resource)) || (null != p && !(p instanceof IRI))) {
            return Collections.emptyList();
        }

        IRI graphControlPredicate = context.getGraphControlPredicate();
        if (null != graphControlPredicate && graphControlPredicate.equals(p)) {
            return evaluateGraphControlPattern(tp, s, o, bindings);
        }

        return evaluateAll(graphsInScope(tp.getScope(), bindings), graph -> {
            List<Solution> results = new ArrayList<>();
            for (Statement st : dataset.match(graph, (Resource) s, (IRI) p, o)) {
                Solution r = bind(bindings, tp.getSubject(), st.getSubject());
                r = bind(r, tp.getPredicate(), st.getPredicate());
                r = bind(r, tp.getObject(), st.getObject());
                r = bindGraph(r, tp.getScope(), graph);
                if (null != r) {
                    results.add(r);
                }
            }
            return results;
        });
    }

    private List<Solution> evaluateGraphControlPattern(final TriplePattern tp,
                                                       final Value subject,
                                                       final Value object,
                                                       final Solution bindings) {
        List<Solution> results = new ArrayList<>();
        for (GraphTag gt : dataset.getGraphTags()) {
            Value tag = context.getValueFactory().createLiteral(gt.getTag());
            if ((null == subject || subject.equals(gt.getGraph())) && (null == object || object.equals(tag))) {
                Solution r = bind(bindings, tp.getSubject(), gt.getGraph());
                r = bind(r, tp.getObject(), tag);
                if (null != r) {
                    results.add(r);
                }
            }
        }
        return results;
    }

    private List<Solution> evaluatePathPattern(final PathPattern pp, final Solution bindings) {
        Value s = valueOf(pp.getSubject(), bindings);
        Value o = valueOf(pp.getObject(), bindings);
        boolean sameVariable = null == s
                && pp.getSubject().isVariable()
                && pp.getSubject().equals(pp.getObject());

        return evaluateAll(graphsInScope(pp.getScope(), bindings), graph -> {
            List<Solution> results = new ArrayList<>();
            for (Value[] pair : pathEvaluator.evaluate(graph, pp.getPath(), s, o)) {
                if (sameVariable && !pair[0].equals(pair[1])) {
                    continue;
                }
                Solution r = bind(bindings, pp.getSubject(), pair[0]);
                r = bind(r, pp.getObject(), pair[1]);
                r = bindGraph(r, pp.getScope(), graph);
                if (null != r) {
                    results.add(r);
                }
            }
            return results;
        });
    }

    // the graphs to match against, in IRI order; null stands for the default graph
    private List<IRI> graphsInScope(final GraphScope scope, final Solution bindings) {
        if (scope.isDefault()) {
            return Collections.singletonList(null);
        }

        Value g = valueOf(scope.getGraph(), bindings);
        if (null == g) {
            return dataset.listGraphs();
        } else if (g instanceof IRI) {
            return Collections.singletonList((IRI) g);
        } else {
            return Collections.emptyList();
        }
    }

    private Solution bindGraph(final Solution solution, final GraphScope scope, final IRI graph) {
        return null == solution || scope.isDefault() ? solution : bind(solution, scope.getGraph(), graph);
    }

    private List<Solution> evaluateJoin(final JoinPattern join, final Solution bindings) {
        List<Solution> left = evaluate(join.getLeft(), bindings);
        if (left.isEmpty()) {
            return left;
        }

        // triple and path patterns are substituted directly with each left solution
        if (join.getRight() instanceof BasicGraphPattern) {
            List<Solution> results = new ArrayList<>();
            for (Solution l : left) {
                results.addAll(evaluate(join.getRight(), l));
            }
            return results;
        }

        List<Solution> right = evaluate(join.getRight(), bindings);
        if (right.isEmpty()) {
            return right;
        }

        Set<String> keys = boundInAll(left);
        keys.retainAll(boundInAll(right));
        List<String> keyList = new ArrayList<>(keys);

        Map<List<Value>, List<Solution>> index = new HashMap<>();
        for (Solution r : right) {
            index.computeIfAbsent(keyOf(r, keyList), k -> new ArrayList<>()).add(r);
        }

        List<Solution> results = new ArrayList<>();
        for (Solution l : left) {
            List<Solution> matches = index.get(keyOf(l, keyList));
            if (null != matches) {
                for (Solution r : matches) {
                    if (l.isCompatibleWith(r)) {
                        results.add(l.merge(r));
                    }
                }
            }
        }
        return results;
    }

    private List<Solution> evaluateOptional(final OptionalPattern optional, final Solution bindings) {
        List<Solution> results = new ArrayList<>();
        for (Solution l : evaluate(optional.getLeft(), bindings)) {
            boolean extended = false;
            for (Solution r : evaluate(optional.getRight(), l)) {
                if (null == optional.getCondition() || test(optional.getCondition(), r)) {
                    results.add(r);
                    extended = true;
                }
            }
            if (!extended) {
                results.add(l);
            }
        }
        return results;
    }

    private List<Solution> evaluateFilter(final FilterPattern filter, final Solution bindings) {
        List<Solution> results = new ArrayList<>();
        for (Solution s : evaluate(filter.getInner(), bindings)) {
            if (test(filter.getCondition(), s)) {
                results.add(s);
            }
        }
        return results;
    }

    private List<Solution> evaluateBind(final BindPattern bind, final Solution bindings) {
        List<Solution> results = new ArrayList<>();
        for (Solution s : evaluate(bind.getInner(), bindings)) {
            Solution r = s;
            for (BindPattern.Assignment a : bind.getAssignments()) {
                Value v;
                try {
                    v = a.getExpression().evaluate(r, this);
                } catch (ExpressionException e) {
                    logger.fine("leaving ?" + a.getVariable() + " unbound: " + e.getMessage());
                    continue;
                }

                Value existing = r.get(a.getVariable());
                if (null == existing) {
                    r = r.extend(a.getVariable(), v);
                } else if (!existing.equals(v)) {
                    r = null;
                    break;
                }
            }
            if (null != r) {
                results.add(r);
            }
        }
        return results;
    }

    private List<Solution> evaluateValues(final ValuesPattern values, final Solution bindings) {
        List<Solution> results = new ArrayList<>();
        for (Solution row : values.getRows()) {
            if (bindings.isCompatibleWith(row)) {
                results.add(bindings.merge(row));
            }
        }
        return results;
    }

    private List<Solution> evaluateAggregate(final AggregatePattern aggregate, final Solution bindings) {
        List<Solution> input = evaluate(aggregate.getInner(), bindings.project(aggregate.getGroupBy()));
        return mergeAll(bindings, aggregator.aggregate(input, aggregate.getGroupBy(), aggregate.getAggregates()));
    }

    private List<Solution> evaluateOrder(final OrderPattern order, final Solution bindings) {
        List<Solution> input = evaluate(order.getInner(), bindings);
        List<OrderPattern.OrderCondition> conditions = order.getConditions();

        final Map<Solution, Value[]> keys = new HashMap<>();
        for (Solution s : input) {
            Value[] key = new Value[conditions.size()];
            for (int i = 0; i < key.length; i++) {
                try {
                    key[i] = conditions.get(i).getExpression().evaluate(s, this);
                } catch (ExpressionException e) {
                    // unbound and erroneous keys sort first
                    key[i] = null;
                }
            }
            keys.put(s, key);
        }

        List<Solution> sorted = new ArrayList<>(input);
        sorted.sort((a, b) -> {
            Value[] ka = keys.get(a);
            Value[] kb = keys.get(b);
            for (int i = 0; i < ka.length; i++) {
                int cmp = Terms.compare(ka[i], kb[i]);
                if (0 != cmp) {
                    return conditions.get(i).isAscending() ? cmp : -cmp;
                }
            }
            return 0;
        });
        return sorted;
    }

    private List<Solution> evaluateProjection(final ProjectionPattern projection, final Solution bindings) {
        Map<String, Value> innerBindings = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : projection.getTargetToSource().entrySet()) {
            Value v = bindings.get(e.getKey());
            if (null != v) {
                innerBindings.put(e.getValue(), v);
            }
        }

        List<Solution> projected = new ArrayList<>();
        for (Solution s : evaluate(projection.getInner(), Solution.of(innerBindings))) {
            Map<String, Value> row = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : projection.getTargetToSource().entrySet()) {
                row.put(e.getKey(), s.get(e.getValue()));
            }
            projected.add(Solution.of(row));
        }

        return mergeAll(bindings, projected);
    }

    private List<Solution> evaluateSlice(final SlicePattern slice, final Solution bindings) {
        List<Solution> input = evaluate(slice.getInner(), bindings);
        long from = Math.min(slice.getOffset(), input.size());
        long to = slice.getLimit() < 0 ? input.size() : Math.min(input.size(), from + slice.getLimit());
        return new ArrayList<>(input.subList((int) from, (int) to));
    }

    private boolean test(final Expression condition, final Solution solution) {
        try {
            return condition.test(solution, this);
        } catch (ExpressionException e) {
            logger.fine("condition " + condition + " failed for " + solution + ": " + e.getMessage());
            return false;
        }
    }

    // evaluates independent parts, in parallel if a pool is available, concatenating results in order
    private <T> List<Solution> evaluateAll(final List<T> parts, final Function<T, List<Solution>> evaluator) {
        ForkJoinPool pool = context.getPool();
        List<Solution> results = new ArrayList<>();

        if (null == pool || parts.size() < 2) {
            for (T part : parts) {
                results.addAll(evaluator.apply(part));
            }
            return results;
        }

        List<ForkJoinTask<List<Solution>>> tasks = new ArrayList<>(parts.size());
        for (T part : parts) {
            Callable<List<Solution>> task = () -> evaluator.apply(part);
            tasks.add(pool.submit(task));
        }
        try {
            for (ForkJoinTask<List<Solution>> task : tasks) {
                results.addAll(task.join());
            }
        } catch (RuntimeException e) {
            for (ForkJoinTask<List<Solution>> task : tasks) {
                task.cancel(true);
            }
            throw e;
        }
        return results;
    }

    private static List<Solution> mergeAll(final Solution bindings, final List<Solution> solutions) {
        if (bindings.isEmpty()) {
            return solutions;
        }

        List<Solution> results = new ArrayList<>(solutions.size());
        for (Solution s : solutions) {
            if (bindings.isCompatibleWith(s)) {
                results.add(bindings.merge(s));
            }
        }
        return results;
    }

    private static Set<String> boundInAll(final List<Solution> solutions) {
        Set<String> names = new LinkedHashSet<>(solutions.get(0).getBindingNames());
        for (Solution s : solutions) {
            names.retainAll(s.getBindingNames());
        }
        return names;
    }

    private static List<Value> keyOf(final Solution solution, final List<String> variables) {
        Value[] key = new Value[variables.size()];
        for (int i = 0; i < key.length; i++) {
            key[i] = solution.get(variables.get(i));
        }
        return Arrays.asList(key);
    }

    private static Value valueOf(final VariableOrConstant<String, Value> term, final Solution bindings) {
        return term.isVariable() ? bindings.get(term.getVariable()) : term.getConstant();
    }

    // returns null if the variable is already bound to a different value
    private static Solution bind(final Solution solution,
                                 final VariableOrConstant<String, Value> term,
                                 final Value value) {
        if (null == solution || !term.isVariable()) {
            return solution;
        }

        Value existing = solution.get(term.getVariable());
        if (null == existing) {
            return solution.extend(term.getVariable(), value);
        } else {
            return existing.equals(value) ? solution : null;
        }
    }
}
