package net.fortytwo.rewrite.expr;

import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.ValueFactory;

/**
 * Services available to expressions during evaluation
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public interface ExpressionContext {

    ValueFactory getValueFactory();

    /**
     * @return the IRI against which relative IRIs are resolved, or null if there is none
     */
    String getBaseIri();

    /**
     * @param pattern  a graph pattern
     * @param solution the bindings in scope
     * @return whether the pattern has at least one solution compatible with the given bindings
     */
    boolean exists(Pattern pattern, Solution solution);
}
