package net.fortytwo.rewrite.path;

import org.openrdf.model.IRI;

import java.util.Set;

/**
 * A property path expression: a composition of predicates
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public abstract class Path {

    /**
     * Adds the predicates of all atomic steps of this path to a set
     *
     * @param predicates the set to which to add predicates
     */
    public abstract void collectPredicates(Set<IRI> predicates);

    /**
     * @return whether this path can match a zero-length path, connecting a node to itself
     */
    public abstract boolean isNullable();

    public static Path atomic(final IRI predicate) {
        return new Atomic(predicate);
    }

    public static Path sequence(final Path first, final Path second) {
        return new Sequence(first, second);
    }

    public static Path alternation(final Path first, final Path second) {
        return new Alternation(first, second);
    }

    public static Path inverse(final Path path) {
        return new Inverse(path);
    }

    public static Path zeroOrMore(final Path path) {
        return new ZeroOrMore(path);
    }

    public static Path oneOrMore(final Path path) {
        return new OneOrMore(path);
    }

    public static Path zeroOrOne(final Path path) {
        return new ZeroOrOne(path);
    }

    public static Path identity() {
        return Identity.INSTANCE;
    }

    private abstract static class Unary extends Path {
        protected final Path operand;

        Unary(final Path operand) {
            if (null == operand) {
                throw new IllegalArgumentException("null path");
            }
            this.operand = operand;
        }

        public Path getOperand() {
            return operand;
        }

        @Override
        public void collectPredicates(final Set<IRI> predicates) {
            operand.collectPredicates(predicates);
        }

        @Override
        public boolean equals(final Object other) {
            return null != other
                    && other.getClass().equals(getClass())
                    && operand.equals(((Unary) other).operand);
        }

        @Override
        public int hashCode() {
            return getClass().hashCode() + 7 * operand.hashCode();
        }
    }

    private abstract static class Binary extends Path {
        protected final Path first;
        protected final Path second;

        Binary(final Path first, final Path second) {
            if (null == first || null == second) {
                throw new IllegalArgumentException("null path");
            }
            this.first = first;
            this.second = second;
        }

        public Path getFirst() {
            return first;
        }

        public Path getSecond() {
            return second;
        }

        @Override
        public void collectPredicates(final Set<IRI> predicates) {
            first.collectPredicates(predicates);
            second.collectPredicates(predicates);
        }

        @Override
        public boolean equals(final Object other) {
            return null != other
                    && other.getClass().equals(getClass())
                    && first.equals(((Binary) other).first)
                    && second.equals(((Binary) other).second);
        }

        @Override
        public int hashCode() {
            return getClass().hashCode() + 7 * first.hashCode() + 13 * second.hashCode();
        }
    }

    public static final class Atomic extends Path {
        private final IRI predicate;

        private Atomic(final IRI predicate) {
            if (null == predicate) {
                throw new IllegalArgumentException("null predicate");
            }
            this.predicate = predicate;
        }

        public IRI getPredicate() {
            return predicate;
        }

        @Override
        public void collectPredicates(final Set<IRI> predicates) {
            predicates.add(predicate);
        }

        @Override
        public boolean isNullable() {
            return false;
        }

        @Override
        public boolean equals(final Object other) {
            return other instanceof Atomic && predicate.equals(((Atomic) other).predicate);
        }

        @Override
        public int hashCode() {
            return predicate.hashCode();
        }

        @Override
        public String toString() {
            return "<" + predicate.stringValue() + ">";
        }
    }

    public static final class Sequence extends Binary {
        private Sequence(final Path first, final Path second) {
            super(first, second);
        }

        @Override
        public boolean isNullable() {
            return first.isNullable() && second.isNullable();
        }

        @Override
        public String toString() {
            return "(" + first + "/" + second + ")";
        }
    }

    public static final class Alternation extends Binary {
        private Alternation(final Path first, final Path second) {
            super(first, second);
        }

        @Override
        public boolean isNullable() {
            return first.isNullable() || second.isNullable();
        }

        @Override
        public String toString() {
            return "(" + first + "|" + second + ")";
        }
    }

    public static final class Inverse extends Unary {
        private Inverse(final Path operand) {
            super(operand);
        }

        @Override
        public boolean isNullable() {
            return operand.isNullable();
        }

        @Override
        public String toString() {
            return "^" + operand;
        }
    }

    public static final class ZeroOrMore extends Unary {
        private ZeroOrMore(final Path operand) {
            super(operand);
        }

        @Override
        public boolean isNullable() {
            return true;
        }

        @Override
        public String toString() {
            return operand + "*";
        }
    }

    public static final class OneOrMore extends Unary {
        private OneOrMore(final Path operand) {
            super(operand);
        }

        @Override
        public boolean isNullable() {
            return operand.isNullable();
        }

        @Override
        public String toString() {
            return operand + "+";
        }
    }

    public static final class ZeroOrOne extends Unary {
        private ZeroOrOne(final Path operand) {
            super(operand);
        }

        @Override
        public boolean isNullable() {
            return true;
        }

        @Override
        public String toString() {
            return operand + "?";
        }
    }

    /**
     * The zero-length path, which connects each node only to itself
     */
    public static final class Identity extends Path {
        private static final Identity INSTANCE = new Identity();

        private Identity() {
        }

        @Override
        public void collectPredicates(final Set<IRI> predicates) {
        }

        @Override
        public boolean isNullable() {
            return true;
        }

        @Override
        public String toString() {
            return "()";
        }
    }
}
