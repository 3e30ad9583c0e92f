package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.eval.PatternMatcher;
import net.fortytwo.rewrite.model.Solution;
import org.openrdf.model.Statement;
import org.openrdf.model.ValueFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Derives a new set of triples from a pattern and a template, leaving the dataset unchanged
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class ConstructExecutor {
    private static final Logger logger = Logger.getLogger(ConstructExecutor.class.getName());

    private final PatternMatcher matcher;

    public ConstructExecutor(final PatternMatcher matcher) {
        this.matcher = matcher;
    }

    /**
     * @return the distinct triples, without context, in order of first derivation
     */
    public Set<Statement> construct(final Pattern where, final List<TemplateTriple> template) {
        ValueFactory vf = matcher.getValueFactory();
        List<Solution> solutions = matcher.evaluate(where);

        Set<Statement> results = new LinkedHashSet<>();
        for (Statement st : new TemplateInstantiator(template, vf).instantiate(solutions)) {
            results.add(null == st.getContext()
                    ? st
                    : vf.createStatement(st.getSubject(), st.getPredicate(), st.getObject()));
        }

        logger.fine("constructed " + results.size() + " triples from " + solutions.size() + " solutions");
        return results;
    }
}
