package org.opgraph;

import org.jboss.logging.Logger;
import org.opgraph.lowering.ComplexityGuard;

/**
 * Settings fixed at decomposer construction.
 *
 * @param maxOperations   most operations one expression may produce; zero or
 *                        negative selects the default of 100
 * @param maxNestingDepth deepest nesting of parentheses and prefix operators;
 *                        zero or negative selects the default of 256
 */
public record DecomposerConfig(int maxOperations, int maxNestingDepth) {

    public static final String MAX_OPERATIONS_PROPERTY = "opgraph.decomposer.maxOperations";
    public static final String MAX_NESTING_DEPTH_PROPERTY = "opgraph.decomposer.maxNestingDepth";

    private static final Logger LOG = Logger.getLogger(DecomposerConfig.class);

    public DecomposerConfig {
        if (maxOperations <= 0) {
            maxOperations = ComplexityGuard.DEFAULT_MAX_OPERATIONS;
        }
        if (maxNestingDepth <= 0) {
            maxNestingDepth = ComplexityGuard.DEFAULT_MAX_NESTING_DEPTH;
        }
    }

    public DecomposerConfig(int maxOperations) {
        this(maxOperations, ComplexityGuard.DEFAULT_MAX_NESTING_DEPTH);
    }

    public static DecomposerConfig defaults() {
        return new DecomposerConfig(ComplexityGuard.DEFAULT_MAX_OPERATIONS, ComplexityGuard.DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * Reads {@value #MAX_OPERATIONS_PROPERTY} and {@value #MAX_NESTING_DEPTH_PROPERTY};
     * unset, malformed or non-positive values fall back to the defaults.
     */
    public static DecomposerConfig fromSystemProperties() {
        return new DecomposerConfig(
                readPositive(MAX_OPERATIONS_PROPERTY, ComplexityGuard.DEFAULT_MAX_OPERATIONS),
                readPositive(MAX_NESTING_DEPTH_PROPERTY, ComplexityGuard.DEFAULT_MAX_NESTING_DEPTH));
    }

    private static int readPositive(String property, int defaultValue) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warnf("Ignoring %s=%s: not an integer, using %d", property, value, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            LOG.warnf("Ignoring %s=%d: must be positive, using %d", property, parsed, defaultValue);
            return defaultValue;
        }
        return parsed;
    }
}
