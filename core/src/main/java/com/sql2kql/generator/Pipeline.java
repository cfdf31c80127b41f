package com.sql2kql.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of KQL pipeline stages.
 *
 * <p>Stage 0 is the source (a table name, or the first stage of an absorbed subquery);
 * every later stage is one pipe operation written without its leading {@code |}.
 * Blank stages are never stored.
 *
 * <p>Example:
 * <pre>
 *   Pipeline p = new Pipeline();
 *   p.add("SecurityEvent");
 *   p.add("where EventID == 4624");
 *   p.add("project Account");
 *   p.render();
 *   // SecurityEvent
 *   // | where EventID == 4624
 *   // | project Account
 * </pre>
 */
public final class Pipeline {

    private static final String STAGE_SEPARATOR = "| ";

    private final List<String> stages = new ArrayList<>();

    /**
     * Appends a stage. Null or blank stages are ignored.
     *
     * @param stage the stage text
     * @return this pipeline
     */
    public Pipeline add(String stage) {
        if (stage != null && !stage.isBlank()) {
            stages.add(stage);
        }
        return this;
    }

    /**
     * Appends every stage of another pipeline, in order.
     *
     * @param other the pipeline to absorb
     * @return this pipeline
     */
    public Pipeline addAll(Pipeline other) {
        for (String stage : other.stages) {
            add(stage);
        }
        return this;
    }

    /**
     * Appends text to the end of the last stage.
     *
     * @param suffix the text to append
     * @return this pipeline
     * @throws IllegalStateException if the pipeline is empty
     */
    public Pipeline appendToLastStage(String suffix) {
        if (stages.isEmpty()) {
            throw new IllegalStateException("Cannot append to an empty pipeline");
        }
        int last = stages.size() - 1;
        stages.set(last, stages.get(last) + suffix);
        return this;
    }

    public List<String> stages() {
        return Collections.unmodifiableList(stages);
    }

    public boolean isEmpty() {
        return stages.isEmpty();
    }

    /**
     * Returns the first whitespace-delimited token of the source stage. For a plain
     * table source this is the table name.
     *
     * @return the leading token, or an empty string for an empty pipeline
     */
    public String leadingToken() {
        if (stages.isEmpty()) {
            return "";
        }
        String[] tokens = stages.get(0).trim().split("\\s+", 2);
        return tokens[0];
    }

    /**
     * Renders the pipeline at top level: one stage per line, non-source lines
     * prefixed with {@code | }.
     *
     * @return the query text
     */
    public String render() {
        return renderNested("");
    }

    /**
     * Renders the pipeline for embedding inside another stage, such as the right side
     * of a {@code join} or {@code union}. Continuation lines are indented.
     *
     * @param indent the indentation placed before each continuation line
     * @return the query text
     */
    public String renderNested(String indent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < stages.size(); i++) {
            if (i > 0) {
                sb.append('\n').append(indent).append(STAGE_SEPARATOR);
            }
            sb.append(stages.get(i));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
