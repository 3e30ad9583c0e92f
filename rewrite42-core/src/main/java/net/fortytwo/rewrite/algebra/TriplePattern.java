package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.model.VariableOrConstant;
import org.openrdf.model.Value;

import java.util.Set;

/**
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class TriplePattern extends Pattern {
    private final VariableOrConstant<String, Value> subject;
    private final VariableOrConstant<String, Value> predicate;
    private final VariableOrConstant<String, Value> object;
    private final GraphScope scope;

    public TriplePattern(final VariableOrConstant<String, Value> subject,
                         final VariableOrConstant<String, Value> predicate,
                         final VariableOrConstant<String, Value> object,
                         final GraphScope scope) {
        if (null == subject || null == predicate || null == object || null == scope) {
            throw new IllegalArgumentException("incomplete triple pattern");
        }

        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
        this.scope = scope;
    }

    public TriplePattern(final VariableOrConstant<String, Value> subject,
                         final VariableOrConstant<String, Value> predicate,
                         final VariableOrConstant<String, Value> object) {
        this(subject, predicate, object, GraphScope.DEFAULT);
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

    public GraphScope getScope() {
        return scope;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        addVariable(subject, variables);
        addVariable(predicate, variables);
        addVariable(object, variables);
        if (!scope.isDefault()) {
            addVariable(scope.getGraph(), variables);
        }
    }

    static void addVariable(final VariableOrConstant<String, Value> term, final Set<String> variables) {
        if (term.isVariable()) {
            variables.add(term.getVariable());
        }
    }

    @Override
    public String toString() {
        return scope + "(" + subject + " " + predicate + " " + object + ")";
    }
}
