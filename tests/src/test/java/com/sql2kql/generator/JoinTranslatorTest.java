package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationDiagnostic;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.expression.BinaryExpression;
import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.ConjunctionExpression;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.Literal;
import com.sql2kql.logical.FromClause;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.SelectClause;
import com.sql2kql.logical.SelectItem;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.TableRelation;
import com.sql2kql.runtime.TranslationOptions;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link JoinTranslator}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Join Translator Tests")
public class JoinTranslatorTest extends TestBase {

    private KQLGenerator generator;
    private TranslationContext context;
    private ExpressionTranslator expressions;

    @BeforeEach
    void setUp() {
        generator = new KQLGenerator();
        context = new TranslationContext(TranslationOptions.defaults());
        expressions = new ExpressionTranslator(generator, context);
    }

    private String translate(JoinClause join) {
        return JoinTranslator.translate(join, generator, expressions, context);
    }

    private static Expression eq(String leftQualifier, String leftColumn, String rightQualifier, String rightColumn) {
        return BinaryExpression.equal(
            new ColumnReference(leftColumn, leftQualifier),
            new ColumnReference(rightColumn, rightQualifier));
    }

    @Nested
    @DisplayName("Join kinds")
    class KindTests {

        @Test
        @DisplayName("Plain JOIN is an inner join with left and right markers")
        void testInnerJoin() {
            logStep("Given: t1 JOIN t2 ON t1.x = t2.y");
            JoinClause join = new JoinClause("join", new TableRelation("t2"), eq("t1", "x", "t2", "y"));

            logStep("When: translating the join");
            String kql = translate(join);
            logData("KQL", kql);

            logStep("Then: qualifiers become $left / $right");
            assertThat(kql).isEqualTo("join kind=inner (t2) on $left.x == $right.y");
            assertThat(context.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("Outer joins map to KQL outer kinds")
        void testOuterJoins() {
            assertThat(translate(new JoinClause("left outer join", new TableRelation("t2"), eq("t1", "x", "t2", "x"))))
                .startsWith("join kind=leftouter (t2)");
            assertThat(translate(new JoinClause("right join", new TableRelation("t2"), eq("t1", "x", "t2", "x"))))
                .startsWith("join kind=rightouter (t2)");
            assertThat(translate(new JoinClause("full outer join", new TableRelation("t2"), eq("t1", "x", "t2", "x"))))
                .startsWith("join kind=fullouter (t2)");
        }

        @Test
        @DisplayName("CROSS JOIN renders an unsupported marker and a warning")
        void testCrossJoin() {
            String kql = translate(new JoinClause("cross join", new TableRelation("t2"), null));

            assertThat(kql).isEqualTo("join kind=" + JoinTranslator.UNSUPPORTED_CROSS_JOIN + " (t2)");
            assertThat(context.drainMarkers()).isEqualTo(JoinTranslator.CROSS_JOIN_MARKER);
            assertThat(context.diagnostics())
                .extracting(TranslationDiagnostic::kind)
                .containsExactly(DiagnosticKind.UNSUPPORTED_CROSS_JOIN);
        }

        @Test
        @DisplayName("Unknown join keywords are a hard error")
        void testUnknownKeyword() {
            TranslationException e = catchThrowableOfType(
                () -> translate(new JoinClause("natural join", new TableRelation("t2"), null)),
                TranslationException.class);

            assertThat(e.kind()).isEqualTo(DiagnosticKind.UNKNOWN_JOIN_KEYWORD);
        }
    }

    @Nested
    @DisplayName("Table reference rewriting")
    class RewriteTests {

        @Test
        @DisplayName("The right side is found by its alias, ignoring case")
        void testRightAlias() {
            JoinClause join = new JoinClause("inner join",
                new TableRelation("SecurityEvent", "e"),
                eq("a", "Account", "E", "TargetAccount"));

            assertThat(translate(join))
                .isEqualTo("join kind=inner (SecurityEvent) on $left.Account == $right.TargetAccount");
            assertThat(context.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("Non-column operands are left untouched")
        void testLiteralOperand() {
            Expression condition = ConjunctionExpression.and(
                eq("t1", "id", "t2", "id"),
                BinaryExpression.greaterThan(new ColumnReference("level", "t2"), Literal.of(3)));

            String kql = translate(new JoinClause("join", new TableRelation("t2"), condition));

            assertThat(kql).endsWith("on ($left.id == $right.id) and ($right.level > 3)");
        }

        @Test
        @DisplayName("USING columns become a column list")
        void testUsing() {
            JoinClause join = new JoinClause("join", new TableRelation("t2"), null, List.of("id", "host"));

            assertThat(translate(join)).isEqualTo("join kind=inner (t2) on id, host");
        }

        @Test
        @DisplayName("A subquery on the right side is nested and indented")
        void testSubqueryRight() {
            SelectQuery subquery = new SelectQuery(
                new SelectClause(false, List.of(new SelectItem(new ColumnReference("b")))),
                new FromClause(new TableRelation("t2")),
                BinaryExpression.greaterThan(new ColumnReference("c"), Literal.of(1)));
            JoinClause join = new JoinClause("join", new SubqueryRelation(subquery, "s"), eq("t1", "b", "s", "b"));

            assertThat(translate(join))
                .isEqualTo("join kind=inner (t2\n  | where c > 1\n  | project b) on $left.b == $right.b");
        }

        @Test
        @DisplayName("A right table that needs quoting is matched by its SQL name")
        void testQuotedRightTable() {
            JoinClause join = new JoinClause("join", new TableRelation("my-t2"), eq("t1", "x", "my-t2", "y"));

            String kql = translate(join);

            assertThat(kql).isEqualTo("join kind=inner (['my-t2']) on $left.x == $right.y");
            assertThat(context.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("A dotted right table is matched by its full or last name")
        void testDottedRightTable() {
            Expression condition = ConjunctionExpression.and(
                eq("t1", "a", "db.t2", "a"),
                eq("t1", "b", "T2", "b"));

            String kql = translate(new JoinClause("join", new TableRelation("db.t2"), condition));

            assertThat(kql).isEqualTo("join kind=inner (db.t2) on ($left.a == $right.a) and ($left.b == $right.b)");
            assertThat(context.diagnostics()).isEmpty();
        }

        @Test
        @DisplayName("More than one left qualifier is flagged as ambiguous")
        void testThreeTables() {
            Expression condition = ConjunctionExpression.and(
                eq("t1", "a", "t3", "a"),
                eq("t2", "b", "t3", "b"));

            String kql = translate(new JoinClause("join", new TableRelation("t3"), condition));

            assertThat(kql).endsWith("on ($left.a == $right.a) and ($left.b == $right.b)");
            assertThat(context.diagnostics())
                .extracting(TranslationDiagnostic::kind)
                .containsExactly(DiagnosticKind.JOIN_PREFIX_AMBIGUOUS);
        }

        @Test
        @DisplayName("A condition that never names the right side is flagged")
        void testRightSideMissing() {
            translate(new JoinClause("join", new TableRelation("t2"), eq("t1", "a", "t1", "b")));

            assertThat(context.diagnostics())
                .extracting(TranslationDiagnostic::kind)
                .containsExactly(DiagnosticKind.JOIN_PREFIX_AMBIGUOUS);
        }

        @Test
        @DisplayName("Side markers are recognized")
        void testIsSideMarker() {
            assertThat(JoinTranslator.isSideMarker("$left")).isTrue();
            assertThat(JoinTranslator.isSideMarker("$right")).isTrue();
            assertThat(JoinTranslator.isSideMarker("t1")).isFalse();
            assertThat(JoinTranslator.isSideMarker(null)).isFalse();
        }
    }
}
