package com.sql2kql.validation;

import com.sql2kql.exception.ValidationException;
import com.sql2kql.expression.BinaryExpression;
import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.StarExpression;
import com.sql2kql.logical.FromClause;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.logical.SelectClause;
import com.sql2kql.logical.SelectItem;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.TableRelation;
import com.sql2kql.logical.UnionQuery;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import java.util.List;
import java.util.OptionalLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link QueryValidator}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Query Validator Tests")
public class QueryValidatorTest extends TestBase {

    private static SelectClause selectStar() {
        return new SelectClause(false, List.of(new SelectItem(new StarExpression())));
    }

    private static SelectQuery selectFrom(String table) {
        return new SelectQuery(selectStar(), new FromClause(new TableRelation(table)), null);
    }

    private static SelectQuery selectWithJoin(JoinClause join) {
        return new SelectQuery(selectStar(),
            new FromClause(new TableRelation("t1"), List.of(join)), null);
    }

    @Nested
    @DisplayName("SELECT validation")
    class SelectValidation {

        @Test
        @DisplayName("A plain query is valid")
        void testValid() {
            assertThatCode(() -> QueryValidator.validate(selectFrom("t"))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("An empty select list is rejected")
        void testEmptySelectList() {
            SelectQuery query = new SelectQuery(new SelectClause(false, List.of()),
                new FromClause(new TableRelation("t")), null);

            ValidationException e = catchThrowableOfType(
                () -> QueryValidator.validate(query), ValidationException.class);

            assertThat(e.getMessage()).isEqualTo("SELECT list cannot be empty");
            assertThat(e.getPhase()).isEqualTo("select validation");
            assertThat(e.getUserMessage()).endsWith("Select at least one column or use SELECT *");
        }

        @Test
        @DisplayName("A null query is rejected")
        void testNullQuery() {
            assertThatThrownBy(() -> QueryValidator.validate(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("Query cannot be null");
        }
    }

    @Nested
    @DisplayName("JOIN validation")
    class JoinValidation {

        @Test
        @DisplayName("A join needs ON or USING")
        void testMissingCondition() {
            SelectQuery query = selectWithJoin(new JoinClause("left join", new TableRelation("t2"), null));

            ValidationException e = catchThrowableOfType(
                () -> QueryValidator.validate(query), ValidationException.class);

            assertThat(e.getMessage()).isEqualTo("JOIN condition cannot be null for left join");
            assertThat(e.getPhase()).isEqualTo("join validation");
            assertThat(e.getSuggestion()).contains("CROSS JOIN");
        }

        @Test
        @DisplayName("ON and USING both satisfy the join")
        void testCriteriaPresent() {
            JoinClause on = new JoinClause("inner join", new TableRelation("t2"),
                BinaryExpression.equal(new ColumnReference("x", "t1"), new ColumnReference("x", "t2")));
            JoinClause using = new JoinClause("join", new TableRelation("t2"), null, List.of("x"));

            assertThatCode(() -> QueryValidator.validate(selectWithJoin(on))).doesNotThrowAnyException();
            assertThatCode(() -> QueryValidator.validate(selectWithJoin(using))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("A cross join needs no condition")
        void testCrossJoin() {
            SelectQuery query = selectWithJoin(new JoinClause("cross join", new TableRelation("t2"), null));

            assertThatCode(() -> QueryValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Unknown join keywords are left to the generator")
        void testUnknownKeyword() {
            SelectQuery query = selectWithJoin(new JoinClause("semi join", new TableRelation("t2"), null));

            assertThatCode(() -> QueryValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Join sources are validated recursively")
        void testJoinSubquery() {
            SelectQuery bad = new SelectQuery(new SelectClause(false, List.of()),
                new FromClause(new TableRelation("t2")), null);
            JoinClause join = new JoinClause("join", new SubqueryRelation(bad, "s"), null, List.of("x"));

            assertThatThrownBy(() -> QueryValidator.validate(selectWithJoin(join)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("SELECT list cannot be empty");
        }
    }

    @Nested
    @DisplayName("Nested queries and LIMIT")
    class NestedValidation {

        @Test
        @DisplayName("A negative limit is rejected")
        void testNegativeLimit() {
            SelectQuery query = new SelectQuery(selectStar(), new FromClause(new TableRelation("t")), null,
                List.of(), List.of(), OptionalLong.of(-1));

            ValidationException e = catchThrowableOfType(
                () -> QueryValidator.validate(query), ValidationException.class);

            assertThat(e.getMessage()).isEqualTo("LIMIT must not be negative, got -1");
            assertThat(e.getPhase()).isEqualTo("limit validation");
        }

        @Test
        @DisplayName("A zero limit is valid")
        void testZeroLimit() {
            SelectQuery query = new SelectQuery(selectStar(), new FromClause(new TableRelation("t")), null,
                List.of(), List.of(), OptionalLong.of(0));

            assertThatCode(() -> QueryValidator.validate(query)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Both union branches are validated")
        void testUnionBranches() {
            SelectQuery bad = selectWithJoin(new JoinClause("full join", new TableRelation("t2"), null));
            QueryNode union = new UnionQuery(selectFrom("t"), bad, true);

            assertThatThrownBy(() -> QueryValidator.validate(union))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("full join");
        }

        @Test
        @DisplayName("FROM subqueries are validated")
        void testFromSubquery() {
            SelectQuery inner = new SelectQuery(selectStar(), new FromClause(new TableRelation("t")), null,
                List.of(), List.of(), OptionalLong.of(-5));
            SelectQuery outer = new SelectQuery(selectStar(),
                new FromClause(new SubqueryRelation(inner, "s")), null);

            assertThatThrownBy(() -> QueryValidator.validate(outer))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("-5");
        }
    }
}
