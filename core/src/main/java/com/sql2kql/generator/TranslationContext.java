package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationDiagnostic;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.runtime.TranslationOptions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-call state of one translation: the options in force, the diagnostics recorded so
 * far, the current query nesting depth and the inline warning markers not yet written.
 *
 * <p>Inline markers are {@code //} comments, which run to the end of the line. They are
 * therefore held back while nested pipelines are rendered and only attached to the end
 * of a top-level stage.
 *
 * <p>A context is created for every top-level translation and is never shared between
 * threads, so the mapping tables remain the only shared state.
 */
public final class TranslationContext {

    private static final Logger logger = LoggerFactory.getLogger(TranslationContext.class);

    private final TranslationOptions options;
    private final List<TranslationDiagnostic> diagnostics = new ArrayList<>();
    private final Set<String> pendingMarkers = new LinkedHashSet<>();
    private int depth;

    public TranslationContext(TranslationOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public TranslationOptions options() {
        return options;
    }

    /**
     * Records a soft warning and logs it.
     *
     * @param kind the warning kind
     * @param message the warning text
     * @param construct the offending construct (may be null)
     */
    public void warn(DiagnosticKind kind, String message, String construct) {
        if (kind.isError()) {
            throw new IllegalArgumentException(kind + " is an error kind, not a warning");
        }
        TranslationDiagnostic diagnostic = new TranslationDiagnostic(kind, message, construct);
        diagnostics.add(diagnostic);
        logger.warn("{}", diagnostic);
    }

    /**
     * Queues an inline warning marker for the next top-level stage. Does nothing when
     * inline warnings are disabled.
     *
     * @param marker the comment text, starting with {@code //}
     */
    public void markInline(String marker) {
        if (options.inlineWarnings()) {
            pendingMarkers.add(marker);
        }
    }

    /**
     * Appends the queued markers to a stage of the top-level pipeline. Inside a nested
     * query the stage is returned unchanged and the markers stay queued.
     *
     * @param stage the stage text
     * @return the stage, followed by the queued markers if any were written
     */
    public String attachMarkers(String stage) {
        if (depth > 1 || stage == null || stage.isBlank()) {
            return stage;
        }
        String markers = drainMarkers();
        return markers.isEmpty() ? stage : stage + " " + markers;
    }

    /**
     * Removes and returns every queued marker.
     *
     * @return the markers separated by spaces, or an empty string
     */
    public String drainMarkers() {
        String markers = String.join(" ", pendingMarkers);
        pendingMarkers.clear();
        return markers;
    }

    /**
     * Returns the diagnostics recorded so far, in the order they were raised.
     *
     * @return an unmodifiable view of the diagnostics
     */
    public List<TranslationDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Enters one level of query nesting.
     *
     * @param construct the query being entered, for the error message
     * @throws TranslationException if the maximum nesting depth is exceeded
     */
    public void enter(String construct) {
        depth++;
        if (depth > options.maxNestingDepth()) {
            throw new TranslationException(
                DiagnosticKind.NESTING_TOO_DEEP,
                "Query nesting exceeds the maximum depth of " + options.maxNestingDepth(),
                construct);
        }
    }

    /**
     * Leaves one level of query nesting.
     */
    public void exit() {
        if (depth == 0) {
            throw new IllegalStateException("exit() without matching enter()");
        }
        depth--;
    }

    public int depth() {
        return depth;
    }
}
