package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.VariableOrConstant;
import org.openrdf.model.BNode;
import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Instantiates a template against a sequence of solutions.
 * A template triple is dropped for any solution which leaves one of its variables unbound
 * or which puts a term in a position it cannot occupy, such as a literal subject.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TemplateInstantiator {
    private static final Logger logger = Logger.getLogger(TemplateInstantiator.class.getName());

    private final List<TemplateTriple> template;
    private final ValueFactory valueFactory;

    public TemplateInstantiator(final List<TemplateTriple> template, final ValueFactory valueFactory) {
        this.template = Collections.unmodifiableList(new ArrayList<>(template));
        this.valueFactory = valueFactory;
    }

    public List<TemplateTriple> getTemplate() {
        return template;
    }

    /**
     * @return the instantiated statements, in order. Each statement's context is its target graph,
     * or null for the default graph
     */
    public List<Statement> instantiate(final List<Solution> solutions) {
        BlankNodeArena arena = new BlankNodeArena(valueFactory);
        List<Statement> results = new ArrayList<>();
        for (int i = 0; i < solutions.size(); i++) {
            instantiate(solutions.get(i), i, arena, results);
        }
        return results;
    }

    private void instantiate(final Solution solution,
                             final int index,
                             final BlankNodeArena arena,
                             final List<Statement> results) {
        for (TemplateTriple t : template) {
            Value s = resolve(t.getSubject(), solution, index, arena);
            Value p = resolve(t.getPredicate(), solution, index, arena);
            Value o = resolve(t.getObject(), solution, index, arena);
            Value g = null == t.getGraph() ? null : resolve(t.getGraph(), solution, index, arena);

            if (null == s || null == p || null == o || (null != t.getGraph() && null == g)) {
                logger.fine("dropping " + t + ": unbound variable in " + solution);
            } else if (!(s instanceof Resource) || !(p instanceof IRI) || (null != g && !(g instanceof IRI))) {
                logger.fine("dropping " + t + ": ill-typed term in " + solution);
            } else {
                results.add(null == g
                        ? valueFactory.createStatement((Resource) s, (IRI) p, o)
                        : valueFactory.createStatement((Resource) s, (IRI) p, o, (IRI) g));
            }
        }
    }

    private static Value resolve(final VariableOrConstant<String, Value> term,
                                 final Solution solution,
                                 final int index,
                                 final BlankNodeArena arena) {
        if (term.isVariable()) {
            return solution.get(term.getVariable());
        }

        Value c = term.getConstant();
        return c instanceof BNode ? arena.get(index, ((BNode) c).getID()) : c;
    }
}
