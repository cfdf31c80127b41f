package com.sql2kql.runtime;

import com.sql2kql.exception.TranslationDiagnostic;
import com.sql2kql.generator.Pipeline;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The outcome of translating one query: the KQL text, its stages and every
 * diagnostic raised along the way.
 *
 * <p>Warnings never prevent a result; errors are thrown as
 * {@link com.sql2kql.exception.TranslationException} instead.
 */
public final class TranslationResult {

    private final List<String> stages;
    private final String kql;
    private final List<TranslationDiagnostic> diagnostics;

    public TranslationResult(Pipeline pipeline, List<TranslationDiagnostic> diagnostics) {
        Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.stages = List.copyOf(pipeline.stages());
        this.kql = pipeline.render();
        this.diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics must not be null"));
    }

    /**
     * Returns the translated query, one stage per line.
     *
     * @return the KQL text
     */
    public String kql() {
        return kql;
    }

    /**
     * Returns the pipeline stages without their leading pipe, source first.
     *
     * @return an unmodifiable list of stages
     */
    public List<String> stages() {
        return stages;
    }

    public List<TranslationDiagnostic> diagnostics() {
        return diagnostics;
    }

    /**
     * Returns only the warning diagnostics.
     *
     * @return an unmodifiable list of warnings
     */
    public List<TranslationDiagnostic> warnings() {
        return diagnostics.stream()
            .filter(TranslationDiagnostic::isWarning)
            .collect(Collectors.toUnmodifiableList());
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(TranslationDiagnostic::isWarning);
    }

    @Override
    public String toString() {
        return kql;
    }
}
