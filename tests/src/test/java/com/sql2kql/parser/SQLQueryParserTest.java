package com.sql2kql.parser;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import com.sql2kql.expression.BetweenExpression;
import com.sql2kql.expression.BinaryExpression;
import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.ConjunctionExpression;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.FunctionCall;
import com.sql2kql.expression.InExpression;
import com.sql2kql.expression.InSubquery;
import com.sql2kql.expression.LikeExpression;
import com.sql2kql.expression.Literal;
import com.sql2kql.expression.NotExpression;
import com.sql2kql.expression.StarExpression;
import com.sql2kql.expression.UnresolvedExpression;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.logical.SelectItem;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SortOrder;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.TableRelation;
import com.sql2kql.logical.UnionQuery;
import com.sql2kql.test.TestBase;
import com.sql2kql.test.TestCategories;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link SQLQueryParser} and the tree built by {@link SQLAstBuilder}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQL Query Parser Tests")
public class SQLQueryParserTest extends TestBase {

    private final SQLQueryParser parser = SQLQueryParser.getInstance();

    private SelectQuery parseSelect(String sql) {
        logStep("Given: " + sql);
        QueryNode query = parser.parse(sql);
        logData("Parsed", query.toSQL());
        assertThat(query).isInstanceOf(SelectQuery.class);
        return (SelectQuery) query;
    }

    private Expression whereOf(String sql) {
        return parseSelect(sql).where();
    }

    @Nested
    @DisplayName("Query structure")
    class StructureTests {

        @Test
        @DisplayName("Simple select with filter")
        void testSimpleSelect() {
            SelectQuery query = parseSelect("SELECT a, b AS c FROM t WHERE a = 'x'");

            assertThat(query.select().items()).containsExactly(
                new SelectItem(new ColumnReference("a")),
                new SelectItem(new ColumnReference("b"), "c"));
            assertThat(query.from().source()).isEqualTo(new TableRelation("t"));
            assertThat(query.where()).isEqualTo(
                BinaryExpression.equal(new ColumnReference("a"), Literal.of("x")));
            assertThat(query.hasGroupBy()).isFalse();
            assertThat(query.limit()).isEmpty();
        }

        @Test
        @DisplayName("Keywords are case-insensitive and a trailing semicolon is allowed")
        void testCaseInsensitiveKeywords() {
            SelectQuery query = parseSelect("select Host from Events where Level > 3;");

            assertThat(query.select().items()).containsExactly(new SelectItem(new ColumnReference("Host")));
            assertThat(query.from().source()).isEqualTo(new TableRelation("Events"));
        }

        @Test
        @DisplayName("Star, qualified star and dotted table names")
        void testStars() {
            SelectQuery query = parseSelect("SELECT *, e.* FROM db.events e");

            assertThat(query.select().items()).extracting(SelectItem::expression)
                .containsExactly(new StarExpression(), new StarExpression("e"));
            assertThat(query.from().source()).isEqualTo(new TableRelation("db.events", "e"));
        }

        @Test
        @DisplayName("DISTINCT, GROUP BY, ORDER BY and LIMIT")
        void testClauses() {
            SelectQuery query = parseSelect(
                "SELECT DISTINCT c, count(*) AS n FROM t GROUP BY c ORDER BY n DESC NULLS LAST, c LIMIT 10");

            assertThat(query.select().isDistinct()).isTrue();
            assertThat(query.groupBy()).containsExactly(new ColumnReference("c"));
            assertThat(query.orderBy()).containsExactly(
                new SortOrder(new ColumnReference("n"), SortOrder.SortDirection.DESCENDING,
                    SortOrder.NullOrdering.NULLS_LAST),
                new SortOrder(new ColumnReference("c"), SortOrder.SortDirection.ASCENDING));
            assertThat(query.limit()).hasValue(10);
            assertThat(query.select().items().get(1).expression())
                .isEqualTo(FunctionCall.of("count", new StarExpression()));
        }

        @Test
        @DisplayName("Quoted aliases and backquoted identifiers are unquoted")
        void testQuotedNames() {
            SelectQuery query = parseSelect("SELECT `event id` 'Event Id' FROM `my``table`");

            SelectItem item = query.select().items().get(0);
            assertThat(item.expression()).isEqualTo(new ColumnReference("event id"));
            assertThat(item.alias()).isEqualTo("Event Id");
            assertThat(query.from().source()).isEqualTo(new TableRelation("my`table"));
        }

        @Test
        @DisplayName("Non-reserved keywords can name columns")
        void testNonReservedIdentifiers() {
            SelectQuery query = parseSelect("SELECT first, last FROM t");

            assertThat(query.select().items()).extracting(SelectItem::expression)
                .containsExactly(new ColumnReference("first"), new ColumnReference("last"));
        }

        @Test
        @DisplayName("UNION and UNION ALL")
        void testUnion() {
            QueryNode query = parser.parse("SELECT a FROM t1 UNION ALL SELECT a FROM t2 UNION SELECT a FROM t3");

            assertThat(query).isInstanceOf(UnionQuery.class);
            UnionQuery outer = (UnionQuery) query;
            assertThat(outer.isAll()).isFalse();
            assertThat(outer.left()).isInstanceOf(UnionQuery.class);
            assertThat(((UnionQuery) outer.left()).isAll()).isTrue();
        }

        @Test
        @DisplayName("ORDER BY after a union belongs to the union")
        void testUnionOrganization() {
            QueryNode query = parser.parse("SELECT a FROM t1 UNION ALL SELECT a FROM t2 ORDER BY a LIMIT 3");

            assertThat(query).isInstanceOf(UnionQuery.class);
            assertThat(query.orderBy()).hasSize(1);
            assertThat(query.limit()).hasValue(3);
            assertThat(((UnionQuery) query).right().limit()).isEmpty();
        }

        @Test
        @DisplayName("FROM subquery keeps its alias")
        void testFromSubquery() {
            SelectQuery query = parseSelect("SELECT s.a FROM (SELECT a FROM t WHERE a > 1) s");

            assertThat(query.from().source()).isInstanceOf(SubqueryRelation.class);
            SubqueryRelation subquery = (SubqueryRelation) query.from().source();
            assertThat(subquery.alias()).isEqualTo("s");
            assertThat(subquery.query()).isInstanceOf(SelectQuery.class);
        }
    }

    @Nested
    @DisplayName("Joins")
    class JoinTests {

        @Test
        @DisplayName("Join keywords are spelled in lower case")
        void testJoinKeywords() {
            SelectQuery query = parseSelect(
                "SELECT * FROM a JOIN b ON a.x = b.x LEFT OUTER JOIN c ON a.y = c.y RIGHT JOIN d USING (z)");

            List<JoinClause> joins = query.from().joins();
            assertThat(joins).extracting(JoinClause::keyword)
                .containsExactly("join", "left outer join", "right join");
            assertThat(joins.get(0).condition()).isEqualTo(BinaryExpression.equal(
                new ColumnReference("x", "a"), new ColumnReference("x", "b")));
            assertThat(joins.get(2).usingColumns()).containsExactly("z");
            assertThat(joins.get(2).condition()).isNull();
        }

        @Test
        @DisplayName("A comma-separated FROM list is a cross join")
        void testCommaJoin() {
            SelectQuery query = parseSelect("SELECT * FROM a, b");

            assertThat(query.from().joins()).hasSize(1);
            JoinClause join = query.from().joins().get(0);
            assertThat(join.keyword()).isEqualTo("cross join");
            assertThat(join.right()).isEqualTo(new TableRelation("b"));
            assertThat(join.hasCriteria()).isFalse();
        }

        @Test
        @DisplayName("A join without criteria is kept for the validator")
        void testJoinWithoutCriteria() {
            SelectQuery query = parseSelect("SELECT * FROM a INNER JOIN b");

            assertThat(query.from().joins().get(0).keyword()).isEqualTo("inner join");
            assertThat(query.from().joins().get(0).hasCriteria()).isFalse();
        }
    }

    @Nested
    @DisplayName("Expressions")
    class ExpressionTests {

        @Test
        @DisplayName("AND / OR build conjunctions")
        void testConjunction() {
            Expression where = whereOf("SELECT * FROM t WHERE a = 1 AND b = 2 AND c = 3");

            assertThat(where).isInstanceOf(ConjunctionExpression.class);
            ConjunctionExpression and = (ConjunctionExpression) where;
            assertThat(and.connective()).isEqualTo(ConjunctionExpression.Connective.AND);
            assertThat(and.operands()).hasSize(3);
        }

        @Test
        @DisplayName("Predicates")
        void testPredicates() {
            ColumnReference a = new ColumnReference("a");

            assertThat(whereOf("SELECT * FROM t WHERE a NOT BETWEEN 1 AND 5"))
                .isEqualTo(new BetweenExpression(a, Literal.of(1), Literal.of(5), true));
            assertThat(whereOf("SELECT * FROM t WHERE a IN ('x', 'y')"))
                .isEqualTo(new InExpression(a, List.of(Literal.of("x"), Literal.of("y")), false));
            assertThat(whereOf("SELECT * FROM t WHERE a NOT LIKE 'x%'"))
                .isEqualTo(new LikeExpression(a, Literal.of("x%"), true));
            assertThat(whereOf("SELECT * FROM t WHERE a IS NULL"))
                .isEqualTo(FunctionCall.of("isnull", a));
            assertThat(whereOf("SELECT * FROM t WHERE a IS NOT NULL"))
                .isEqualTo(FunctionCall.of("isnotnull", a));
        }

        @Test
        @DisplayName("IN with a subquery")
        void testInSubquery() {
            Expression where = whereOf("SELECT * FROM t WHERE a NOT IN (SELECT b FROM t2)");

            assertThat(where).isInstanceOf(InSubquery.class);
            InSubquery in = (InSubquery) where;
            assertThat(in.isNegated()).isTrue();
            assertThat(in.subquery()).isInstanceOf(SelectQuery.class);
        }

        @Test
        @DisplayName("SIMILAR TO is a binary operation")
        void testSimilarTo() {
            ColumnReference a = new ColumnReference("a");

            assertThat(whereOf("SELECT * FROM t WHERE a SIMILAR TO 'x.*'"))
                .isEqualTo(new BinaryExpression(a, "similar to", Literal.of("x.*")));
            assertThat(whereOf("SELECT * FROM t WHERE a NOT SIMILAR TO 'x.*'"))
                .isEqualTo(new NotExpression(new BinaryExpression(a, "similar to", Literal.of("x.*"))));
        }

        @Test
        @DisplayName("Unary minus folds into numbers")
        void testUnaryMinus() {
            assertThat(whereOf("SELECT * FROM t WHERE a > -2.5"))
                .isEqualTo(BinaryExpression.greaterThan(new ColumnReference("a"),
                    Literal.of(new BigDecimal("-2.5"))));
            assertThat(whereOf("SELECT * FROM t WHERE -a > 0"))
                .isEqualTo(BinaryExpression.greaterThan(
                    BinaryExpression.multiply(Literal.of(-1), new ColumnReference("a")), Literal.of(0)));
        }

        @Test
        @DisplayName("|| becomes concat")
        void testConcatPipe() {
            SelectQuery query = parseSelect("SELECT a || '-' || b AS ab FROM t");

            assertThat(query.select().items().get(0).expression()).isEqualTo(
                FunctionCall.of("concat",
                    FunctionCall.of("concat", new ColumnReference("a"), Literal.of("-")),
                    new ColumnReference("b")));
        }

        @Test
        @DisplayName("String escapes and adjacent literals")
        void testStringLiterals() {
            assertThat(whereOf("SELECT * FROM t WHERE a = 'it''s'"))
                .isEqualTo(BinaryExpression.equal(new ColumnReference("a"), Literal.of("it's")));
            assertThat(whereOf("SELECT * FROM t WHERE a = 'ab' 'cd'"))
                .isEqualTo(BinaryExpression.equal(new ColumnReference("a"), Literal.of("abcd")));
        }

        @Test
        @DisplayName("Literals of every kind")
        void testLiterals() {
            SelectQuery query = parseSelect("SELECT NULL, TRUE, 42, 0.5 FROM t");

            assertThat(query.select().items()).extracting(SelectItem::expression).containsExactly(
                Literal.nullValue(), Literal.of(true), Literal.of(42), Literal.of(new BigDecimal("0.5")));
        }

        @Test
        @DisplayName("COUNT(DISTINCT x) keeps the quantifier")
        void testDistinctAggregate() {
            SelectQuery query = parseSelect("SELECT count(DISTINCT host) FROM t");

            FunctionCall call = (FunctionCall) query.select().items().get(0).expression();
            assertThat(call.distinct()).isTrue();
            assertThat(call.arguments()).containsExactly(new ColumnReference("host"));
        }

        @Test
        @DisplayName("LEFT and RIGHT can be called as functions")
        void testLeftRightFunctions() {
            SelectQuery query = parseSelect("SELECT left(name, 3) FROM t");

            assertThat(query.select().items().get(0).expression())
                .isEqualTo(FunctionCall.of("left", new ColumnReference("name"), Literal.of(3)));
        }

        @Test
        @DisplayName("CASE, CAST and EXISTS stay unresolved")
        void testUnresolvedConstructs() {
            SelectQuery query = parseSelect(
                "SELECT CASE WHEN a > 1 THEN 'x' ELSE 'y' END, CAST(a AS bigint) FROM t "
                    + "WHERE EXISTS (SELECT b FROM t2)");

            assertThat(query.select().items().get(0).expression())
                .isEqualTo(new UnresolvedExpression("CASE WHEN a > 1 THEN 'x' ELSE 'y' END", "CASE"));
            assertThat(query.select().items().get(1).expression())
                .isEqualTo(new UnresolvedExpression("CAST(a AS bigint)", "CAST"));
            assertThat(query.where()).isInstanceOf(UnresolvedExpression.class);
            assertThat(((UnresolvedExpression) query.where()).construct()).isEqualTo("EXISTS");
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class ErrorTests {

        @Test
        @DisplayName("HAVING is rejected with a precise message")
        void testHaving() {
            assertThatThrownBy(() -> parser.parse("SELECT c, count(*) FROM t GROUP BY c HAVING count(*) > 1"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("HAVING");
        }

        @Test
        @DisplayName("OFFSET is rejected with a precise message")
        void testOffset() {
            assertThatThrownBy(() -> parser.parse("SELECT a FROM t LIMIT 10 OFFSET 5"))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("OFFSET");
        }

        @Test
        @DisplayName("Syntax errors carry the position")
        void testSyntaxError() {
            SQLParseException e = catchThrowableOfType(
                () -> parser.parse("SELECT a\nFROM t WHERE"), SQLParseException.class);

            assertThat(e).isNotNull();
            assertThat(e.getLine()).isEqualTo(2);
            assertThat(e.getOffendingText()).isEqualTo("<EOF>");
            assertThat(e.getMessage()).startsWith("Syntax error at line 2:");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "SELECT", "SELECT a", "DELETE FROM t", "SELECT a FROM t WHERE a = 1 1"})
        @DisplayName("Invalid input is a parse error")
        void testInvalidInput(String sql) {
            assertThatThrownBy(() -> parser.parse(sql)).isInstanceOf(SQLParseException.class);
        }

        @Test
        @DisplayName("The parser is reusable after a failure")
        void testReuseAfterFailure() {
            assertThatThrownBy(() -> parser.parse("SELECT FROM")).isInstanceOf(SQLParseException.class);

            assertThat(parseSelect("SELECT a FROM t").select().items()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Nesting limit")
    class NestingTests {

        private String nestedParentheses(int depth) {
            return "SELECT a FROM t WHERE " + "(".repeat(depth) + "a = 1" + ")".repeat(depth);
        }

        private String nestedSubqueries(int depth) {
            return "SELECT * FROM (".repeat(depth) + "SELECT a FROM t" + ")".repeat(depth);
        }

        @Test
        @DisplayName("Thousands of nested parentheses are refused before parsing")
        void testDeepParentheses() {
            TranslationException e = catchThrowableOfType(
                () -> parser.parse(nestedParentheses(3000)), TranslationException.class);

            assertThat(e).isNotNull();
            assertThat(e.kind()).isEqualTo(DiagnosticKind.NESTING_TOO_DEEP);
            assertThat(e.getMessage()).contains("maximum depth of 64");
        }

        @Test
        @DisplayName("Thousands of nested subqueries are refused before parsing")
        void testDeepSubqueries() {
            TranslationException e = catchThrowableOfType(
                () -> parser.parse(nestedSubqueries(2000)), TranslationException.class);

            assertThat(e).isNotNull();
            assertThat(e.kind()).isEqualTo(DiagnosticKind.NESTING_TOO_DEEP);
        }

        @Test
        @DisplayName("Nesting up to the limit parses")
        void testAtLimit() {
            assertThat(parser.parse(nestedParentheses(8), 8)).isInstanceOf(SelectQuery.class);
            assertThatThrownBy(() -> parser.parse(nestedParentheses(9), 8))
                .isInstanceOf(TranslationException.class);
        }

        @Test
        @DisplayName("Parentheses that close in between do not add up")
        void testSiblingGroups() {
            String sql = "SELECT a FROM t WHERE " + "((a = 1)) AND ".repeat(50) + "((a = 2))";

            assertThat(parser.parse(sql, 2)).isInstanceOf(SelectQuery.class);
        }

        @Test
        @DisplayName("The parser is reusable after a refusal")
        void testReuseAfterRefusal() {
            assertThatThrownBy(() -> parser.parse(nestedParentheses(100)))
                .isInstanceOf(TranslationException.class);

            assertThat(parseSelect("SELECT a FROM t").select().items()).hasSize(1);
        }
    }
}
