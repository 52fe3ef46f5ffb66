package org.boring.semantic.transpiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class LoweringOptionsTest {

    @Test
    @DisplayName("Defaults prune scans and reject undeclared cardinality")
    void testDefaults() {
        LoweringOptions options = LoweringOptions.defaults();

        assertTrue(options.projectionPushdown());
        assertFalse(options.allowUndeclaredJoinCardinality());
        assertSame(DuckDBDialect.INSTANCE, options.dialect());
    }

    @Test
    @DisplayName("Properties override only the keys they set")
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(LoweringOptions.ALLOW_UNDECLARED_CARDINALITY, "true");

        LoweringOptions options = LoweringOptions.fromProperties(properties);

        assertTrue(options.projectionPushdown());
        assertTrue(options.allowUndeclaredJoinCardinality());
    }

    @Test
    @DisplayName("Loads the classpath resource")
    void testLoad() {
        // src/test/resources/semantic.properties disables pushdown
        LoweringOptions options = LoweringOptions.load();

        assertFalse(options.projectionPushdown());
        assertFalse(options.allowUndeclaredJoinCardinality());
    }

    @Test
    @DisplayName("Withers change one option")
    void testWithers() {
        LoweringOptions options = LoweringOptions.defaults()
                .withProjectionPushdown(false)
                .withAllowUndeclaredJoinCardinality(true);

        assertFalse(options.projectionPushdown());
        assertTrue(options.allowUndeclaredJoinCardinality());
        assertThrows(NullPointerException.class, () -> options.withDialect(null));
    }
}
