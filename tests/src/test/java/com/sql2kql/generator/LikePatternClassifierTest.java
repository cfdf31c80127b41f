package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.Literal;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link LikePatternClassifier}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("LIKE Pattern Classifier Tests")
public class LikePatternClassifierTest extends TestBase {

    @Nested
    @DisplayName("Classification")
    class ClassificationTests {

        @ParameterizedTest(name = "''{0}'' -> {1} ''{2}''")
        @CsvSource(delimiter = '|', value = {
            "abc%   | startswith    | abc",
            "%abc   | endswith      | abc",
            "%abc%  | contains      | abc",
            "abc_   | startswith    | abc",
            "_abc   | endswith      | abc",
            "a%b    | matches regex | a.*b",
            "a_b    | matches regex | a.b",
            "%a%b%  | matches regex | .*a.*b.*",
            "abc    | matches regex | abc",
            "%      | matches regex | .*"
        })
        @DisplayName("Wildcard position decides the operator")
        void testClassify(String pattern, String operator, String rewritten) {
            LikePatternClassifier.LikeMatch match = LikePatternClassifier.classify(pattern);

            assertThat(match.operator()).isEqualTo(operator);
            assertThat(match.pattern()).isEqualTo(rewritten);
        }

        @Test
        @DisplayName("Regex metacharacters in the pattern are escaped")
        void testRegexEscaping() {
            LikePatternClassifier.LikeMatch match = LikePatternClassifier.classify("10.0.%.1");

            assertThat(match.isRegex()).isTrue();
            assertThat(match.pattern()).isEqualTo("10\\.0\\..*\\.1");
        }
    }

    @Nested
    @DisplayName("Rendering")
    class RenderingTests {

        @Test
        @DisplayName("Positive matches render operator and quoted pattern")
        void testPositive() {
            assertThat(LikePatternClassifier.translate("name", Literal.of("abc%"), false, "like"))
                .isEqualTo("name startswith 'abc'");
            assertThat(LikePatternClassifier.translate("name", Literal.of("a%b"), false, "like"))
                .isEqualTo("name matches regex 'a.*b'");
        }

        @Test
        @DisplayName("Quotes inside the pattern are escaped")
        void testQuotedPatternEscaped() {
            assertThat(LikePatternClassifier.translate("name", Literal.of("'abc'%"), false, "like"))
                .isEqualTo("name startswith '\\'abc\\''");
        }

        @Test
        @DisplayName("NOT LIKE negates string operators with a bang")
        void testNegatedStringOperators() {
            assertThat(LikePatternClassifier.translate("name", Literal.of("abc%"), true, "like"))
                .isEqualTo("name !startswith 'abc'");
            assertThat(LikePatternClassifier.translate("name", Literal.of("%abc"), true, "like"))
                .isEqualTo("name !endswith 'abc'");
            assertThat(LikePatternClassifier.translate("name", Literal.of("%abc%"), true, "like"))
                .isEqualTo("name !contains 'abc'");
        }

        @Test
        @DisplayName("NOT LIKE wraps a regex match in not()")
        void testNegatedRegex() {
            assertThat(LikePatternClassifier.translate("name", Literal.of("a_c"), true, "like"))
                .isEqualTo("not (name matches regex 'a.c')");
        }

        @Test
        @DisplayName("A non-literal pattern is a hard error naming the operand")
        void testNonLiteralPattern() {
            TranslationException e = catchThrowableOfType(
                () -> LikePatternClassifier.translate("name", new ColumnReference("pat"), false,
                    "(name LIKE pat)"),
                TranslationException.class);

            assertThat(e.kind()).isEqualTo(DiagnosticKind.NON_LITERAL_LIKE_PATTERN);
            assertThat(e.getMessage()).contains("pat").contains("(name LIKE pat)");
        }

        @Test
        @DisplayName("A numeric pattern is rejected too")
        void testNumericPattern() {
            TranslationException e = catchThrowableOfType(
                () -> LikePatternClassifier.translate("name", Literal.of(5), false, "like"),
                TranslationException.class);

            assertThat(e.kind()).isEqualTo(DiagnosticKind.NON_LITERAL_LIKE_PATTERN);
        }
    }
}
