package net.fortytwo.rewrite.sparql;

import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.template.TemplateTriple;

import java.util.Collections;
import java.util.List;

/**
 * A SPARQL query or update which has been bound to a prefix table, parsed,
 * and translated into a pattern and zero or more templates.
 * A prepared query holds no dataset state, and may be executed any number of times.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class SparqlQuery {

    public enum QueryForm {ASK, CONSTRUCT, SELECT, UPDATE}

    private final QueryForm queryForm;
    private final Pattern pattern;
    private final List<String> bindingNames;
    private final List<TemplateTriple> deleteTemplate;
    private final List<TemplateTriple> insertTemplate;

    private SparqlQuery(final QueryForm queryForm,
                        final Pattern pattern,
                        final List<String> bindingNames,
                        final List<TemplateTriple> deleteTemplate,
                        final List<TemplateTriple> insertTemplate) {
        this.queryForm = queryForm;
        this.pattern = pattern;
        this.bindingNames = Collections.unmodifiableList(bindingNames);
        this.deleteTemplate = Collections.unmodifiableList(deleteTemplate);
        this.insertTemplate = Collections.unmodifiableList(insertTemplate);
    }

    public static SparqlQuery select(final Pattern pattern, final List<String> bindingNames) {
        return new SparqlQuery(QueryForm.SELECT, pattern, bindingNames,
                Collections.<TemplateTriple>emptyList(), Collections.<TemplateTriple>emptyList());
    }

    public static SparqlQuery ask(final Pattern pattern) {
        return new SparqlQuery(QueryForm.ASK, pattern, Collections.<String>emptyList(),
                Collections.<TemplateTriple>emptyList(), Collections.<TemplateTriple>emptyList());
    }

    public static SparqlQuery construct(final Pattern pattern, final List<TemplateTriple> template) {
        return new SparqlQuery(QueryForm.CONSTRUCT, pattern, Collections.<String>emptyList(),
                Collections.<TemplateTriple>emptyList(), template);
    }

    public static SparqlQuery update(final Pattern pattern,
                                     final List<TemplateTriple> deleteTemplate,
                                     final List<TemplateTriple> insertTemplate) {
        return new SparqlQuery(QueryForm.UPDATE, pattern, Collections.<String>emptyList(),
                deleteTemplate, insertTemplate);
    }

    public QueryForm getQueryForm() {
        return queryForm;
    }

    /**
     * @return the pattern of the WHERE clause
     */
    public Pattern getPattern() {
        return pattern;
    }

    /**
     * @return the projected variables of a SELECT query, in order
     */
    public List<String> getBindingNames() {
        return bindingNames;
    }

    public List<TemplateTriple> getDeleteTemplate() {
        return deleteTemplate;
    }

    /**
     * @return the template of a CONSTRUCT query, or the insert template of an update
     */
    public List<TemplateTriple> getInsertTemplate() {
        return insertTemplate;
    }

    @Override
    public String toString() {
        return queryForm + " " + pattern;
    }
}
