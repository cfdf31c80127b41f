package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link JoinKeywords}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Join Keyword Tests")
public class JoinKeywordsTest extends TestBase {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "join, inner",
        "INNER JOIN, inner",
        "left join, leftouter",
        "LEFT   OUTER JOIN, leftouter",
        "right join, rightouter",
        "right outer join, rightouter",
        "full join, fullouter",
        "FULL OUTER JOIN, fullouter"
    })
    @DisplayName("Join keyword variants resolve to KQL join kinds")
    void testResolve(String keyword, String kqlKind) {
        JoinKeywords.JoinKind kind = JoinKeywords.resolve(keyword);

        assertThat(kind.isSupported()).isTrue();
        assertThat(kind.kqlName()).isEqualTo(kqlKind);
        assertThat(JoinKeywords.isJoinKeyword(keyword)).isTrue();
    }

    @Test
    @DisplayName("CROSS JOIN is recognized but has no KQL kind")
    void testCrossJoin() {
        JoinKeywords.JoinKind kind = JoinKeywords.resolve("cross join");

        assertThat(kind).isEqualTo(JoinKeywords.JoinKind.CROSS);
        assertThat(kind.isSupported()).isFalse();
        assertThatThrownBy(kind::kqlName).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Unknown keywords are a hard error")
    void testUnknownKeyword() {
        TranslationException e = catchThrowableOfType(
            () -> JoinKeywords.resolve("natural join"), TranslationException.class);

        assertThat(e.kind()).isEqualTo(DiagnosticKind.UNKNOWN_JOIN_KEYWORD);
        assertThat(e.getMessage()).contains("natural join");
        assertThat(JoinKeywords.isJoinKeyword("natural join")).isFalse();
        assertThat(JoinKeywords.isJoinKeyword(null)).isFalse();
    }

    @Test
    @DisplayName("The keyword table cannot be modified")
    void testImmutable() {
        assertThat(JoinKeywords.keywords()).hasSize(9);
        assertThatThrownBy(() -> JoinKeywords.keywords().remove("join"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
