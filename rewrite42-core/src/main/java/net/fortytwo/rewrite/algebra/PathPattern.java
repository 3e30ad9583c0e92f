package net.fortytwo.rewrite.algebra;

import net.fortytwo.rewrite.model.VariableOrConstant;
import net.fortytwo.rewrite.path.Path;
import org.openrdf.model.Value;

import java.util.Set;

/**
 * A pattern connecting a subject and an object by a property path
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class PathPattern extends Pattern {
    private final VariableOrConstant<String, Value> subject;
    private final Path path;
    private final VariableOrConstant<String, Value> object;
    private final GraphScope scope;

    public PathPattern(final VariableOrConstant<String, Value> subject,
                       final Path path,
                       final VariableOrConstant<String, Value> object,
                       final GraphScope scope) {
        if (null == subject || null == path || null == object || null == scope) {
            throw new IllegalArgumentException("incomplete path pattern");
        }

        this.subject = subject;
        this.path = path;
        this.object = object;
        this.scope = scope;
    }

    public VariableOrConstant<String, Value> getSubject() {
        return subject;
    }

    public Path getPath() {
        return path;
    }

    public VariableOrConstant<String, Value> getObject() {
        return object;
    }

    public GraphScope getScope() {
        return scope;
    }

    @Override
    public void collectVariables(final Set<String> variables) {
        TriplePattern.addVariable(subject, variables);
        TriplePattern.addVariable(object, variables);
        if (!scope.isDefault()) {
            TriplePattern.addVariable(scope.getGraph(), variables);
        }
    }

    @Override
    public String toString() {
        return scope + "(" + subject + " " + path + " " + object + ")";
    }
}
