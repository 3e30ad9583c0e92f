package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.eval.PatternMatcher;
import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.store.ChangeSet;
import net.fortytwo.rewrite.store.MutationReport;
import org.openrdf.model.IRI;
import org.openrdf.model.Statement;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Executes DELETE/INSERT operations.
 * All solutions are computed, and all triples instantiated, before the dataset is touched;
 * the changes are then committed as a single batch.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class UpdateExecutor {
    private static final Logger logger = Logger.getLogger(UpdateExecutor.class.getName());

    private final PatternMatcher matcher;

    public UpdateExecutor(final PatternMatcher matcher) {
        this.matcher = matcher;
    }

    public MutationReport insert(final Pattern where, final List<TemplateTriple> insertTemplate) {
        return execute(where, Collections.<TemplateTriple>emptyList(), insertTemplate);
    }

    /**
     * @param where          the pattern whose solutions instantiate both templates
     * @param deleteTemplate triples to remove from their target graphs
     * @param insertTemplate triples to add to their target graphs
     * @return the number of triples actually removed and added
     */
    public MutationReport execute(final Pattern where,
                                  final List<TemplateTriple> deleteTemplate,
                                  final List<TemplateTriple> insertTemplate) {
        List<Solution> solutions = matcher.evaluate(where);

        ChangeSet changes = new ChangeSet();
        for (Statement st : new TemplateInstantiator(deleteTemplate, matcher.getValueFactory()).instantiate(solutions)) {
            changes.remove((IRI) st.getContext(), st);
        }
        for (Statement st : new TemplateInstantiator(insertTemplate, matcher.getValueFactory()).instantiate(solutions)) {
            changes.add((IRI) st.getContext(), st);
        }

        MutationReport report = matcher.getContext().getDataset().apply(changes);
        logger.info("update over " + solutions.size() + " solutions: " + report);
        return report;
    }
}
