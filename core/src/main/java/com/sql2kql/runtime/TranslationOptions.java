package com.sql2kql.runtime;

import com.sql2kql.generator.AliasGenerator;
import com.sql2kql.generator.DefaultAliasGenerator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for one translator instance.
 *
 * <p>Options are immutable; the {@code with...} methods return modified copies.
 *
 * <p>Two settings can be supplied as system properties:
 * <ul>
 *   <li>{@code sql2kql.maxNestingDepth}: maximum subquery / join / union and parenthesis nesting (default 64)</li>
 *   <li>{@code sql2kql.inlineWarnings}: whether warning markers appear in the output text (default true)</li>
 * </ul>
 * Unparseable property values fall back to the defaults.
 */
public final class TranslationOptions {

    private static final Logger logger = LoggerFactory.getLogger(TranslationOptions.class);

    /** Default maximum query nesting depth */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    /** System property for max nesting depth */
    public static final String PROP_MAX_NESTING_DEPTH = "sql2kql.maxNestingDepth";

    /** System property for inline warning markers */
    public static final String PROP_INLINE_WARNINGS = "sql2kql.inlineWarnings";

    private static final TranslationOptions DEFAULTS = new TranslationOptions(
        DEFAULT_MAX_NESTING_DEPTH, true, true, false, new DefaultAliasGenerator());

    private final int maxNestingDepth;
    private final boolean inlineWarnings;
    private final boolean normalizeDoubleQuotes;
    private final boolean wholeWordTableSubstitution;
    private final AliasGenerator aliasGenerator;

    private TranslationOptions(int maxNestingDepth, boolean inlineWarnings, boolean normalizeDoubleQuotes,
                               boolean wholeWordTableSubstitution, AliasGenerator aliasGenerator) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
        this.inlineWarnings = inlineWarnings;
        this.normalizeDoubleQuotes = normalizeDoubleQuotes;
        this.wholeWordTableSubstitution = wholeWordTableSubstitution;
        this.aliasGenerator = Objects.requireNonNull(aliasGenerator, "aliasGenerator must not be null");
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     *
     * @return the default options
     */
    public static TranslationOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Returns the defaults overlaid with any configured system properties.
     *
     * @return the configured options
     */
    public static TranslationOptions fromSystemProperties() {
        return DEFAULTS
            .withMaxNestingDepth(getConfiguredMaxNestingDepth())
            .withInlineWarnings(getConfiguredInlineWarnings());
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * Returns whether soft warnings are also written into the output text as
     * {@code // WARNING} comments. Structured diagnostics are recorded either way.
     *
     * @return true if markers are inlined
     */
    public boolean inlineWarnings() {
        return inlineWarnings;
    }

    /**
     * Returns whether unescaped double quotes in the input are turned into single quotes
     * before parsing.
     *
     * @return true if double quotes are normalized
     */
    public boolean normalizeDoubleQuotes() {
        return normalizeDoubleQuotes;
    }

    /**
     * Returns whether table-name substitution only replaces whole words.
     * When false, substitution is a plain substring replacement.
     *
     * @return true for whole-word substitution
     */
    public boolean wholeWordTableSubstitution() {
        return wholeWordTableSubstitution;
    }

    public AliasGenerator aliasGenerator() {
        return aliasGenerator;
    }

    public TranslationOptions withMaxNestingDepth(int value) {
        return new TranslationOptions(value, inlineWarnings, normalizeDoubleQuotes,
            wholeWordTableSubstitution, aliasGenerator);
    }

    public TranslationOptions withInlineWarnings(boolean value) {
        return new TranslationOptions(maxNestingDepth, value, normalizeDoubleQuotes,
            wholeWordTableSubstitution, aliasGenerator);
    }

    public TranslationOptions withNormalizeDoubleQuotes(boolean value) {
        return new TranslationOptions(maxNestingDepth, inlineWarnings, value,
            wholeWordTableSubstitution, aliasGenerator);
    }

    public TranslationOptions withWholeWordTableSubstitution(boolean value) {
        return new TranslationOptions(maxNestingDepth, inlineWarnings, normalizeDoubleQuotes,
            value, aliasGenerator);
    }

    public TranslationOptions withAliasGenerator(AliasGenerator value) {
        return new TranslationOptions(maxNestingDepth, inlineWarnings, normalizeDoubleQuotes,
            wholeWordTableSubstitution, value);
    }

    private static int getConfiguredMaxNestingDepth() {
        String value = System.getProperty(PROP_MAX_NESTING_DEPTH);
        if (value != null) {
            try {
                int depth = Integer.parseInt(value.trim());
                if (depth > 0) {
                    return depth;
                }
                logger.warn("Ignoring non-positive {}={}", PROP_MAX_NESTING_DEPTH, value);
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid {}={}: {}", PROP_MAX_NESTING_DEPTH, value, e.getMessage());
            }
        }
        return DEFAULT_MAX_NESTING_DEPTH;
    }

    private static boolean getConfiguredInlineWarnings() {
        String value = System.getProperty(PROP_INLINE_WARNINGS);
        if (value == null) {
            return true;
        }
        String normalized = value.trim().toLowerCase();
        if (normalized.equals("true") || normalized.equals("false")) {
            return Boolean.parseBoolean(normalized);
        }
        logger.warn("Ignoring invalid {}={}", PROP_INLINE_WARNINGS, value);
        return true;
    }

    @Override
    public String toString() {
        return String.format(
            "TranslationOptions[maxNestingDepth=%d, inlineWarnings=%s, normalizeDoubleQuotes=%s, " +
            "wholeWordTableSubstitution=%s, aliasGenerator=%s]",
            maxNestingDepth, inlineWarnings, normalizeDoubleQuotes,
            wholeWordTableSubstitution, aliasGenerator.getClass().getSimpleName());
    }
}
