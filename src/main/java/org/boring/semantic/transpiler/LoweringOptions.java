package org.boring.semantic.transpiler;

import org.boring.semantic.SemanticException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Options threaded through one lowering call.
 *
 * @param projectionPushdown             Whether table scans are restricted to the columns used
 * @param allowUndeclaredJoinCardinality Whether aggregating across an undeclared join keeps the
 *                                       raw join (with a warning) instead of failing
 * @param dialect                        The SQL dialect queries are rendered in
 */
public record LoweringOptions(
        boolean projectionPushdown,
        boolean allowUndeclaredJoinCardinality,
        SQLDialect dialect) {

    public static final String PROJECTION_PUSHDOWN = "semantic.rewrites.projectionPushdown";
    public static final String ALLOW_UNDECLARED_CARDINALITY = "semantic.joins.allowUndeclaredCardinality";
    public static final String RESOURCE = "semantic.properties";

    public LoweringOptions {
        Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    public static LoweringOptions defaults() {
        return new LoweringOptions(true, false, DuckDBDialect.INSTANCE);
    }

    /**
     * Reads options from properties; missing keys keep their defaults.
     */
    public static LoweringOptions fromProperties(Properties properties) {
        LoweringOptions defaults = defaults();
        return new LoweringOptions(
                Boolean.parseBoolean(properties.getProperty(PROJECTION_PUSHDOWN,
                        String.valueOf(defaults.projectionPushdown()))),
                Boolean.parseBoolean(properties.getProperty(ALLOW_UNDECLARED_CARDINALITY,
                        String.valueOf(defaults.allowUndeclaredJoinCardinality()))),
                defaults.dialect());
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, or returns the defaults when it is absent.
     */
    public static LoweringOptions load() {
        try (InputStream in = LoweringOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new SemanticException("Failed to read " + RESOURCE, e);
        }
    }

    public LoweringOptions withProjectionPushdown(boolean enabled) {
        return new LoweringOptions(enabled, allowUndeclaredJoinCardinality, dialect);
    }

    public LoweringOptions withAllowUndeclaredJoinCardinality(boolean allowed) {
        return new LoweringOptions(projectionPushdown, allowed, dialect);
    }

    public LoweringOptions withDialect(SQLDialect newDialect) {
        return new LoweringOptions(projectionPushdown, allowUndeclaredJoinCardinality, newDialect);
    }
}
