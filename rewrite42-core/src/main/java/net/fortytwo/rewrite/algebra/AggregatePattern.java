package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Groups the solutions of an inner pattern by zero or more key variables
 * and computes aggregate values for each group
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class AggregatePattern extends Pattern {

    public enum Function {COUNT, SAMPLE, MIN, MAX, GROUP_CONCAT}

    public static class Aggregate {
        private final String variable;
        private final Function function;
        private final Expression expression;
        private final boolean distinct;
        private final String separator;

        /**
         * @param variable   the variable to which the aggregate value is bound
         * @param function   the aggregate function
         * @param expression the aggregated expression, or null for COUNT(*)
         * @param distinct   whether duplicate values are eliminated before aggregation
         * @param separator  the GROUP_CONCAT separator, or null for a single space
         */
        public Aggregate(final String variable,
                         final Function function,
                         final Expression expression,
                         final boolean distinct,
                         final String separator) {
            if (null == expression && function != Function.COUNT) {
                throw new IllegalArgumentException(function + " requires an argument");
            }

            this.variable = variable;
            this.function = function;
            this.expression = expression;
            this.distinct = distinct;
            this.separator = null == separator ? " " : separator;
        }

        public String getVariable() {
            return variable;
        }

        public Function getFunction() {
            return function;
        }

        public Expression getExpression() {
            return expression;
        }

        public boolean isDistinct() {
            return distinct;
        }

        public String getSeparator() {
            return separator;
        }

        @Override
        public String toString() {
            return function + "(" + (distinct ? "distinct " : "")
                    + (null == expression ? "*" : expression) + ") AS ?" + variable;
        }
    }

    private final Pattern inner;
    private final List<String> groupBy;
    private final List<Aggregate> aggregates;

    public AggregatePattern(final Pattern inner, final List<String> groupBy, final List<Aggregate> aggregates) {
        this.inner = inner;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(groupBy));
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(aggregates));
    }

    public Pattern getInner() {
        return inner;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public List<Aggregate> getAggregates() {
        return aggregates;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        variables.addAll(groupBy);
        for (Aggregate a : aggregates) {
            variables.add(a.getVariable());
        }
    }

    @Override
    public String toString() {
        return "group(" + groupBy + ", " + aggregates + ", " + inner + ")";
    }
}
