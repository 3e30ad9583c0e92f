package net.fortytwo.rewrite.template;

import net.fortytwo.rewrite.model.VariableOrConstant;
import org.openrdf.model.Value;

/**
 * A triple pattern to be instantiated once per solution.
 * A blank node constant in a template stands for a label: each solution gets its own fresh blank node for it.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TemplateTriple {
    private final VariableOrConstant<String, Value> subject;
    private final VariableOrConstant<String, Value> predicate;
    private final VariableOrConstant<String, Value> object;
    private final VariableOrConstant<String, Value> graph;

    /**
     * @param graph the target graph, or null for the default graph
     */
    public TemplateTriple(final VariableOrConstant<String, Value> subject,
                          final VariableOrConstant<String, Value> predicate,
                          final VariableOrConstant<String, Value> object,
                          final VariableOrConstant<String, Value> graph) {
        if (null == subject || null == predicate || null == object) {
            throw new IllegalArgumentException("incomplete template triple");
        }

        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
        this.graph = graph;
    }

    public TemplateTriple(final VariableOrConstant<String, Value> subject,
                          final VariableOrConstant<String, Value> predicate,
                          final VariableOrConstant<String, Value> object) {
        this(subject, predicate, object, null);
    }

    public VariableOrConstant<String, Value> getSubject() {
        return subject;
    }

    public VariableOrConstant<String, Value> getPredicate() {
        return predicate;
    }

    public VariableOrConstant<String, Value> getObject() {
        return object;
    }

    public VariableOrConstant<String, Value> getGraph() {
        return graph;
    }

    @Override
    public String toString() {
        return (null == graph ? "" : "GRAPH " + graph + " ") + "(" + subject + " " + predicate + " " + object + ")";
    }
}
