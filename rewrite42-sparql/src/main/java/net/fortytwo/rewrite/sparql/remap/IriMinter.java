package net.fortytwo.rewrite.sparql.remap;

import net.fortytwo.rewrite.sparql.QueryEngine;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Mints local IRIs of the form namespace + domain code + six-digit id, and records them in a mapping.
 * Ids already taken by existing records are skipped.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class IriMinter {
    private static final Logger logger = Logger.getLogger(IriMinter.class.getName());

    public static final int DEFAULT_MAX_ID = 900000;

    private final IriMapping mapping;
    private final String namespace;
    private final String domainCode;
    private final int maxId;
    private final Set<String> used;

    private int nextId = 1;

    public IriMinter(final IriMapping mapping, final String namespace, final String domainCode) {
        this(mapping, namespace, domainCode, DEFAULT_MAX_ID);
    }

    public IriMinter(final IriMapping mapping, final String namespace, final String domainCode, final int maxId) {
        this.mapping = mapping;
        this.namespace = namespace;
        this.domainCode = DomainCodes.formatCode(domainCode);
        this.maxId = maxId;
        this.used = new HashSet<>(mapping.values());
    }

    public String getNamespace() {
        return namespace;
    }

    public String getDomainCode() {
        return domainCode;
    }

    public IriMapping getMapping() {
        return mapping;
    }

    /**
     * @param publicIri a public IRI, or a CURIE for one
     * @return the local IRI recorded for the public IRI, minting and recording a new one if there is none
     */
    public String getOrMint(final String publicIri)
            throws IriMapping.RecordExistsException, QueryEngine.UnknownPrefixException {
        String existing = mapping.get(publicIri);
        if (null != existing) {
            return existing;
        }

        String minted = format(nextFreeId(Collections.<String>emptySet()));
        mapping.put(publicIri, minted);
        used.add(minted);
        logger.fine("minted " + minted + " for " + publicIri);
        return minted;
    }

    /**
     * Finds or mints a local IRI without recording it.
     * Newly minted IRIs are added to the pending records, and are not reused within them.
     *
     * @param publicIri a full public IRI
     * @param pending   records minted but not yet committed, keyed by public IRI
     * @return the local IRI recorded or pending for the public IRI, or a newly minted one
     */
    public String mint(final String publicIri, final Map<String, String> pending) {
        String existing = mapping.get(publicIri);
        if (null == existing) {
            existing = pending.get(publicIri);
        }
        if (null != existing) {
            return existing;
        }

        String minted = format(nextFreeId(pending.values()));
        pending.put(publicIri, minted);
        return minted;
    }

    /**
     * Records previously minted IRIs in the mapping
     *
     * @param pending records obtained from {@link #mint}
     */
    public void commit(final Map<String, String> pending)
            throws IriMapping.RecordExistsException, QueryEngine.UnknownPrefixException {
        for (Map.Entry<String, String> e : pending.entrySet()) {
            mapping.put(e.getKey(), e.getValue());
            used.add(e.getValue());
            logger.fine("minted " + e.getValue() + " for " + e.getKey());
        }
    }

    /**
     * @return whether the IRI is in the local namespace
     */
    public boolean isLocal(final String iri) {
        return iri.startsWith(namespace);
    }

    private int nextFreeId(final Collection<String> reserved) {
        while (used.contains(format(nextId))) {
            nextId++;
        }
        int id = nextId;
        while (reserved.contains(format(id))) {
            id++;
        }
        if (id >= maxId) {
            throw new IllegalStateException("no ids left below " + maxId + " for domain code " + domainCode);
        }
        return id;
    }

    private String format(final int id) {
        return namespace + domainCode + String.format("%06d", id);
    }
}
