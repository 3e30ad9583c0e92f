package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.QueryEngine;
import net.fortytwo.rewrite.store.ChangeSet;
import net.fortytwo.rewrite.store.Dataset;
import org.openrdf.model.IRI;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.SimpleValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SKOS;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

import static net.fortytwo.rewrite.sparql.PrefixTable.SKOSXL_NAMESPACE;

/**
 * Replaces the public IRIs of concepts in a graph with local IRIs.
 * A concept is any resource of type skos:Concept, or of a type declared a subclass of skos:Concept.
 * Occurrences of each public IRI as a subject or object are replaced, as is the public IRI within
 * the IRI of each of its SKOS-XL labels; each local IRI is linked to the public IRI it replaces.
 * Predicates and literals are left unchanged.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriRemapper {
    private static final Logger logger = Logger.getLogger(IriRemapper.class.getName());

    private static final String SOURCED_FROM = "property/sourced_from";

    private final IriMinter minter;
    private final IRI sourcedFrom;
    private final ValueFactory valueFactory = SimpleValueFactory.getInstance();
    private final IRI skosxlLabel = valueFactory.createIRI(SKOSXL_NAMESPACE + "Label");

    public IriRemapper(final IriMinter minter) {
        this.minter = minter;
        this.sourcedFrom = valueFactory.createIRI(minter.getNamespace() + SOURCED_FROM);
    }

    public IriRemapper(final IriMinter minter, final IRI sourcedFrom) {
        this.minter = minter;
        this.sourcedFrom = sourcedFrom;
    }

    public IRI getSourcedFrom() {
        return sourcedFrom;
    }

    /**
     * Rewrites a graph, committing all changes at once
     *
     * @param dataset the dataset containing the graph
     * @param graph   the graph to rewrite, or null for the default graph
     * @return a report of the replacements made
     * @throws IriMapping.RecordExistsException   if a minted IRI conflicts with an existing record
     * @throws QueryEngine.UnknownPrefixException if a public IRI cannot be recorded
     */
    public RemapReport remap(final Dataset dataset, final IRI graph)
            throws IriMapping.RecordExistsException, QueryEngine.UnknownPrefixException {
        // new records are committed only once the graph has been rewritten
        Map<String, String> pending = new LinkedHashMap<>();
        Map<Value, Value> replacements = new HashMap<>();
        Map<IRI, IRI> iris = new LinkedHashMap<>();
        for (IRI publicIri : findPublicConcepts(dataset, graph)) {
            IRI local = valueFactory.createIRI(minter.mint(publicIri.stringValue(), pending));
            replacements.put(publicIri, local);
            iris.put(publicIri, local);
        }
        int minted = pending.size();

        // labels take the local IRI of the concept whose IRI they contain
        Set<Value> labels = new HashSet<>();
        for (Statement st : dataset.match(graph, null, RDF.TYPE, skosxlLabel)) {
            labels.add(st.getSubject());
        }
        for (Map.Entry<IRI, IRI> e : iris.entrySet()) {
            for (Statement st : dataset.match(graph, e.getKey(), null, null)) {
                Value o = st.getObject();
                if (labels.contains(o) && o instanceof IRI && !replacements.containsKey(o)) {
                    String s = o.stringValue();
                    if (s.contains(e.getKey().stringValue())) {
                        replacements.put(o, valueFactory.createIRI(
                                s.replace(e.getKey().stringValue(), e.getValue().stringValue())));
                    }
                }
            }
        }

        ChangeSet changes = new ChangeSet();
        long replaced = 0;
        for (Statement st : dataset.match(graph, null, null, null)) {
            Value s = replacements.get(st.getSubject());
            Value o = replacements.get(st.getObject());
            if (null == s && null == o) {
                continue;
            }

            changes.remove(graph, st);
            changes.add(graph, valueFactory.createStatement(
                    null == s ? st.getSubject() : (Resource) s,
                    st.getPredicate(),
                    null == o ? st.getObject() : o));
            replaced++;
        }

        long added = 0;
        for (Map.Entry<IRI, IRI> e : iris.entrySet()) {
            String source = minter.getMapping().getPrefixes().compressOrSelf(e.getKey().stringValue());
            changes.add(graph, valueFactory.createStatement(e.getValue(), sourcedFrom, valueFactory.createLiteral(source)));
            added++;
        }

        dataset.apply(changes);
        minter.commit(pending);

        RemapReport report = new RemapReport(iris, minted, replaced, added);
        logger.info(report.toString());
        return report;
    }

    private Set<IRI> findPublicConcepts(final Dataset dataset, final IRI graph) {
        Set<Value> conceptClasses = new LinkedHashSet<>();
        conceptClasses.add(SKOS.CONCEPT);
        for (Statement st : dataset.match(graph, null, RDFS.SUBCLASSOF, SKOS.CONCEPT)) {
            conceptClasses.add(st.getSubject());
        }

        // sorted, so that minted ids follow the order of the public IRIs
        Set<IRI> concepts = new TreeSet<>((a, b) -> a.stringValue().compareTo(b.stringValue()));
        for (Value c : conceptClasses) {
            for (Statement st : dataset.match(graph, null, RDF.TYPE, c)) {
                if (st.getSubject() instanceof IRI && !minter.isLocal(st.getSubject().stringValue())) {
                    concepts.add((IRI) st.getSubject());
                }
            }
        }
        return concepts;
    }
}
