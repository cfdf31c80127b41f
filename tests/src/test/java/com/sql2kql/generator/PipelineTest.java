package com.sql2kql.generator;

import com.sql2kql.runtime.TranslationOptions;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Pipeline}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Pipeline Tests")
public class PipelineTest extends TestBase {

    @Test
    @DisplayName("Stages render one per line with pipes after the source")
    void testRender() {
        Pipeline pipeline = new Pipeline()
            .add("SecurityEvent")
            .add("where EventID == 4624")
            .add("project Account");

        assertThat(pipeline.render())
            .isEqualTo("SecurityEvent\n| where EventID == 4624\n| project Account");
        assertThat(pipeline.toString()).isEqualTo(pipeline.render());
    }

    @Test
    @DisplayName("Blank stages are suppressed")
    void testBlankStagesSkipped() {
        Pipeline pipeline = new Pipeline().add("t").add("").add("   ").add(null).add("limit 5");

        assertThat(pipeline.stages()).containsExactly("t", "limit 5");
    }

    @Test
    @DisplayName("Nested rendering indents continuation lines")
    void testRenderNested() {
        Pipeline pipeline = new Pipeline().add("t2").add("project b");

        assertThat(pipeline.renderNested("  ")).isEqualTo("t2\n  | project b");
    }

    @Test
    @DisplayName("addAll appends the other pipeline's stages")
    void testAddAll() {
        Pipeline inner = new Pipeline().add("t").add("where a > 1");
        Pipeline outer = new Pipeline().addAll(inner).add("project a");

        assertThat(outer.stages()).containsExactly("t", "where a > 1", "project a");
        assertThat(inner.stages()).hasSize(2);
    }

    @Test
    @DisplayName("Leading token is the first word of the source")
    void testLeadingToken() {
        assertThat(new Pipeline().add("events").add("take 5").leadingToken()).isEqualTo("events");
        assertThat(new Pipeline().add("  db.events  | x").leadingToken()).isEqualTo("db.events");
        assertThat(new Pipeline().leadingToken()).isEmpty();
        assertThat(new Pipeline().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Text can be appended to the last stage")
    void testAppendToLastStage() {
        Pipeline pipeline = new Pipeline().add("t").add("project a").appendToLastStage(" // note");

        assertThat(pipeline.render()).isEqualTo("t\n| project a // note");
        assertThatThrownBy(() -> new Pipeline().appendToLastStage("x"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Queued markers are held back inside nested queries")
    void testMarkersHeldInNestedQuery() {
        TranslationContext context = new TranslationContext(TranslationOptions.defaults());
        context.enter("outer");
        context.enter("inner");
        context.markInline("// WARNING one");
        context.markInline("// WARNING one");

        assertThat(context.attachMarkers("where x")).isEqualTo("where x");

        context.exit();
        context.markInline("// WARNING two");
        assertThat(context.attachMarkers("project x")).isEqualTo("project x // WARNING one // WARNING two");
        assertThat(context.drainMarkers()).isEmpty();
    }
}
