package net.fortytwo.rewrite.eval;

import net.fortytwo.rewrite.algebra.AggregatePattern;
import net.fortytwo.rewrite.expr.ExpressionContext;
import net.fortytwo.rewrite.expr.ExpressionException;
import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.Terms;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.XMLSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Groups solutions by key and computes aggregate values.
 * Groups appear in the order in which their first member was seen.
 * Without grouping keys, all solutions form a single group, even if there are none.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class Aggregator {
    private static final Logger logger = Logger.getLogger(Aggregator.class.getName());

    private final ExpressionContext context;

    public Aggregator(final ExpressionContext context) {
        this.context = context;
    }

    public List<Solution> aggregate(final List<Solution> input,
                                    final List<String> groupBy,
                                    final List<AggregatePattern.Aggregate> aggregates) {
        Map<List<Value>, List<Solution>> groups = new LinkedHashMap<>();
        if (groupBy.isEmpty()) {
            groups.put(new ArrayList<Value>(), input);
        } else {
            for (Solution s : input) {
                Value[] key = new Value[groupBy.size()];
                for (int i = 0; i < key.length; i++) {
                    key[i] = s.get(groupBy.get(i));
                }
                groups.computeIfAbsent(Arrays.asList(key), k -> new ArrayList<>()).add(s);
            }
        }

        List<Solution> results = new ArrayList<>(groups.size());
        for (Map.Entry<List<Value>, List<Solution>> e : groups.entrySet()) {
            Map<String, Value> row = new LinkedHashMap<>();
            for (int i = 0; i < groupBy.size(); i++) {
                row.put(groupBy.get(i), e.getKey().get(i));
            }
            for (AggregatePattern.Aggregate a : aggregates) {
                row.put(a.getVariable(), compute(a, e.getValue()));
            }
            results.add(Solution.of(row));
        }

        logger.fine("aggregated " + input.size() + " solutions into " + results.size() + " groups");
        return results;
    }

    // returns null if the aggregate has no value for this group
    private Value compute(final AggregatePattern.Aggregate aggregate, final List<Solution> group) {
        ValueFactory vf = context.getValueFactory();

        if (aggregate.getFunction() == AggregatePattern.Function.COUNT && null == aggregate.getExpression()) {
            long count = aggregate.isDistinct() ? new LinkedHashSet<>(group).size() : group.size();
            return integer(count, vf);
        }

        Collection<Value> values = aggregate.isDistinct() ? new LinkedHashSet<Value>() : new ArrayList<Value>();
        for (Solution s : group) {
            try {
                values.add(aggregate.getExpression().evaluate(s, context));
            } catch (ExpressionException e) {
                // unbound or erroneous values are not aggregated
            }
        }

        switch (aggregate.getFunction()) {
            case COUNT:
                return integer(values.size(), vf);
            case SAMPLE:
                return values.isEmpty() ? null : values.iterator().next();
            case MIN:
            case MAX:
                Value best = null;
                for (Value v : values) {
                    if (null == best) {
                        best = v;
                    } else {
                        int cmp = Terms.compare(v, best);
                        if (aggregate.getFunction() == AggregatePattern.Function.MIN ? cmp < 0 : cmp > 0) {
                            best = v;
                        }
                    }
                }
                return best;
            case GROUP_CONCAT:
                StringBuilder sb = new StringBuilder();
                boolean first = true;
                for (Value v : values) {
                    String s = Terms.stringForm(v);
                    if (null == s) {
                        logger.fine("no string form for group_concat member " + v);
                        return null;
                    }
                    if (first) {
                        first = false;
                    } else {
                        sb.append(aggregate.getSeparator());
                    }
                    sb.append(s);
                }
                return vf.createLiteral(sb.toString());
            default:
                throw new IllegalStateException("unexpected aggregate: " + aggregate.getFunction());
        }
    }

    private static Value integer(final long n, final ValueFactory vf) {
        return vf.createLiteral(String.valueOf(n), XMLSchema.INTEGER);
    }
}
