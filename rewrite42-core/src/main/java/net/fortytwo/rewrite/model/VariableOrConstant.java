package net.fortytwo.rewrite.model;

import java.util.Objects;

/**
 * A variable or constant, e.g. a query variable or an RDF term in the sense of SPARQL
 *
 * @param <K> the variable type, e.g. String
 * @param <V> the constant type, e.g. an RDF value class
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class VariableOrConstant<K, V> {
    private final K variable;
    private final V constant;

    public VariableOrConstant(K variable, V constant) {
        this.variable = variable;
        this.constant = constant;

        if (null == constant && null == variable) {
            throw new IllegalArgumentException("both variable and constant are null");
        }
        if (null != constant && null != variable) {
            throw new IllegalArgumentException("both variable and constant are non-null");
        }
    }

    public static <K, V> VariableOrConstant<K, V> variable(final K variable) {
        return new VariableOrConstant<>(variable, null);
    }

    public static <K, V> VariableOrConstant<K, V> constant(final V constant) {
        return new VariableOrConstant<>(null, constant);
    }

    public K getVariable() {
        return variable;
    }

    public V getConstant() {
        return constant;
    }

    public boolean isVariable() {
        return null != variable;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VariableOrConstant)) {
            return false;
        }

        VariableOrConstant<?, ?> o = (VariableOrConstant<?, ?>) other;
        return Objects.equals(variable, o.variable) && Objects.equals(constant, o.constant);
    }

    @Override
    public int hashCode() {
        return null == variable ? constant.hashCode() : 31 * variable.hashCode();
    }

    @Override
    public String toString() {
        return null == variable ? String.valueOf(constant) : "?" + variable;
    }
}
