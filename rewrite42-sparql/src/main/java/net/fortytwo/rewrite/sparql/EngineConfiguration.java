package net.fortytwo.rewrite.sparql;

import net.fortytwo.rewrite.eval.EvaluationBudget;
import net.fortytwo.rewrite.eval.EvaluationContext;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Settings of a query engine, with defaults which may be overridden by properties
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class EngineConfiguration {
    private static final Logger logger = Logger.getLogger(EngineConfiguration.class.getName());

    public static final String PROPERTIES_RESOURCE = "/rewrite42.properties";

    public static final String
            BASE_IRI = "rewrite42.baseIri",
            MAX_STEPS = "rewrite42.maxSteps",
            TIMEOUT = "rewrite42.timeout",
            PARALLELISM = "rewrite42.parallelism",
            GRAPH_CONTROL_PREDICATE = "rewrite42.graphControlPredicate";

    public static final String DEFAULT_BASE_IRI = "http://example.org/base/";
    public static final long DEFAULT_MAX_STEPS = 10000000L;

    private String baseIri = DEFAULT_BASE_IRI;
    private long maxSteps = DEFAULT_MAX_STEPS;
    private long timeout = EvaluationBudget.UNLIMITED;
    private int parallelism = 1;
    private String graphControlPredicate = EvaluationContext.DEFAULT_GRAPH_CONTROL_PREDICATE;

    /**
     * @return a configuration from the properties resource on the classpath,
     * or the default configuration if there is no such resource
     */
    public static EngineConfiguration load() {
        Properties props = new Properties();
        try (InputStream in = EngineConfiguration.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (null == in) {
                return new EngineConfiguration();
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + PROPERTIES_RESOURCE, e);
        }

        logger.fine("loaded configuration from " + PROPERTIES_RESOURCE);
        return fromProperties(props);
    }

    public static EngineConfiguration fromProperties(final Properties props) {
        EngineConfiguration conf = new EngineConfiguration();

        String s = props.getProperty(BASE_IRI);
        if (null != s) {
            conf.setBaseIri(s.trim());
        }
        s = props.getProperty(MAX_STEPS);
        if (null != s) {
            conf.setMaxSteps(parseLong(MAX_STEPS, s));
        }
        s = props.getProperty(TIMEOUT);
        if (null != s) {
            conf.setTimeout(parseLong(TIMEOUT, s));
        }
        s = props.getProperty(PARALLELISM);
        if (null != s) {
            conf.setParallelism((int) parseLong(PARALLELISM, s));
        }
        s = props.getProperty(GRAPH_CONTROL_PREDICATE);
        if (null != s) {
            s = s.trim();
            conf.setGraphControlPredicate(s.isEmpty() ? null : s);
        }

        return conf;
    }

    private static long parseLong(final String key, final String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad value for " + key + ": " + value, e);
        }
    }

    public String getBaseIri() {
        return baseIri;
    }

    public void setBaseIri(final String baseIri) {
        this.baseIri = baseIri;
    }

    /**
     * @return the maximum number of traversal and EXISTS steps per query, or -1 for no limit
     */
    public long getMaxSteps() {
        return maxSteps;
    }

    public void setMaxSteps(final long maxSteps) {
        this.maxSteps = maxSteps;
    }

    /**
     * @return the time allowed for a query, in milliseconds, or -1 for no limit
     */
    public long getTimeout() {
        return timeout;
    }

    public void setTimeout(final long timeout) {
        this.timeout = timeout;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(final int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.parallelism = parallelism;
    }

    /**
     * @return the IRI of the graph control predicate, or null if graph control patterns are disabled
     */
    public String getGraphControlPredicate() {
        return graphControlPredicate;
    }

    public void setGraphControlPredicate(final String graphControlPredicate) {
        this.graphControlPredicate = graphControlPredicate;
    }

    public EvaluationBudget createBudget() {
        return new EvaluationBudget(maxSteps, timeout);
    }
}
