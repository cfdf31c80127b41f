package com.sql2kql.parser;

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
import com.sql2kql.logical.FromClause;
import com.sql2kql.logical.JoinClause;
import com.sql2kql.logical.QueryNode;
import com.sql2kql.logical.Relation;
import com.sql2kql.logical.SelectClause;
import com.sql2kql.logical.SelectItem;
import com.sql2kql.logical.SelectQuery;
import com.sql2kql.logical.SortOrder;
import com.sql2kql.logical.SubqueryRelation;
import com.sql2kql.logical.TableRelation;
import com.sql2kql.logical.UnionQuery;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link QueryNode} and {@link Expression} trees from the ANTLR parse tree.
 *
 * <p>A few source constructs are normalized here:
 * <ul>
 *   <li>{@code x IS [NOT] NULL} becomes {@code isnull(x)} / {@code isnotnull(x)}</li>
 *   <li>{@code a || b} becomes {@code concat(a, b)}</li>
 *   <li>{@code x SIMILAR TO p} becomes a binary {@code similar to} operation</li>
 *   <li>comma-separated FROM sources become cross joins</li>
 * </ul>
 * CASE, CAST and EXISTS are kept as {@link UnresolvedExpression}s. HAVING and OFFSET
 * are rejected with {@link UnsupportedOperationException}.
 */
public class SQLAstBuilder extends RestrictedSqlParserBaseVisitor<Object> {

    private static final Logger logger = LoggerFactory.getLogger(SQLAstBuilder.class);

    // ==================== Entry Points ====================

    @Override
    public QueryNode visitSingleStatement(RestrictedSqlParser.SingleStatementContext ctx) {
        return visitQuery(ctx.query());
    }

    // ==================== Query ====================

    @Override
    public QueryNode visitQuery(RestrictedSqlParser.QueryContext ctx) {
        QueryNode query = (QueryNode) visit(ctx.queryTerm());
        return applyQueryOrganization(query, ctx.queryOrganization());
    }

    private QueryNode applyQueryOrganization(QueryNode query,
                                             RestrictedSqlParser.QueryOrganizationContext ctx) {
        if (ctx == null) return query;

        if (ctx.offset != null) {
            throw new UnsupportedOperationException("OFFSET is not supported: KQL has no row offset");
        }

        List<SortOrder> orderBy = new ArrayList<>();
        for (RestrictedSqlParser.SortItemContext item : ctx.sortItem()) {
            orderBy.add(buildSortOrder(item));
        }
        OptionalLong limit = ctx.limit != null
            ? OptionalLong.of(Long.parseLong(ctx.limit.getText()))
            : OptionalLong.empty();

        if (orderBy.isEmpty() && limit.isEmpty()) {
            return query;
        }

        if (query instanceof UnionQuery union && union.orderBy().isEmpty() && union.limit().isEmpty()) {
            return union.withOrganization(orderBy, limit);
        }
        if (query instanceof SelectQuery select && select.orderBy().isEmpty() && select.limit().isEmpty()) {
            return new SelectQuery(select.select(), select.from(), select.where(),
                select.groupBy(), orderBy, limit);
        }

        // A parenthesized query with its own ORDER BY / LIMIT: wrap it as a subquery
        SelectClause all = new SelectClause(false, List.of(new SelectItem(new StarExpression())));
        FromClause from = new FromClause(new SubqueryRelation(query, null));
        return new SelectQuery(all, from, null, List.of(), orderBy, limit);
    }

    private SortOrder buildSortOrder(RestrictedSqlParser.SortItemContext item) {
        Expression expr = visitExpr(item.expression());
        SortOrder.SortDirection direction = SortOrder.SortDirection.ASCENDING;
        if (item.ordering != null && item.ordering.getType() == RestrictedSqlLexer.DESC) {
            direction = SortOrder.SortDirection.DESCENDING;
        }
        SortOrder.NullOrdering nullOrdering = SortOrder.NullOrdering.UNSPECIFIED;
        if (item.nullOrder != null) {
            nullOrdering = item.nullOrder.getType() == RestrictedSqlLexer.FIRST
                ? SortOrder.NullOrdering.NULLS_FIRST
                : SortOrder.NullOrdering.NULLS_LAST;
        }
        return new SortOrder(expr, direction, nullOrdering);
    }

    // ==================== Query Term (UNION) ====================

    @Override
    public QueryNode visitQueryTermDefault(RestrictedSqlParser.QueryTermDefaultContext ctx) {
        return (QueryNode) visit(ctx.queryPrimary());
    }

    @Override
    public QueryNode visitSetOperation(RestrictedSqlParser.SetOperationContext ctx) {
        QueryNode left = (QueryNode) visit(ctx.left);
        QueryNode right = (QueryNode) visit(ctx.right);
        boolean isAll = ctx.setQuantifier() != null && ctx.setQuantifier().ALL() != null;
        return new UnionQuery(left, right, isAll);
    }

    // ==================== Query Primary ====================

    @Override
    public QueryNode visitQueryPrimaryDefault(RestrictedSqlParser.QueryPrimaryDefaultContext ctx) {
        return visitQuerySpecification(ctx.querySpecification());
    }

    @Override
    public QueryNode visitParenthesizedQuery(RestrictedSqlParser.ParenthesizedQueryContext ctx) {
        return visitQuery(ctx.query());
    }

    // ==================== SELECT Statement ====================

    @Override
    public QueryNode visitQuerySpecification(RestrictedSqlParser.QuerySpecificationContext ctx) {
        if (ctx.havingClause() != null) {
            throw new UnsupportedOperationException(
                "HAVING is not supported: filter the summarized result with a WHERE in an outer query");
        }

        boolean distinct = ctx.setQuantifier() != null && ctx.setQuantifier().DISTINCT() != null;
        List<SelectItem> items = new ArrayList<>();
        for (RestrictedSqlParser.SelectItemContext item : ctx.selectItem()) {
            items.add((SelectItem) visit(item));
        }

        FromClause from = buildFromClause(ctx.fromClause());

        Expression where = null;
        if (ctx.whereClause() != null) {
            where = visitExpr(ctx.whereClause().booleanExpression());
        }

        List<Expression> groupBy = new ArrayList<>();
        if (ctx.groupByClause() != null) {
            for (RestrictedSqlParser.ExpressionContext key : ctx.groupByClause().expression()) {
                groupBy.add(visitExpr(key));
            }
        }

        return new SelectQuery(new SelectClause(distinct, items), from, where,
            groupBy, List.of(), OptionalLong.empty());
    }

    @Override
    public SelectItem visitSelectAll(RestrictedSqlParser.SelectAllContext ctx) {
        return new SelectItem(new StarExpression());
    }

    @Override
    public SelectItem visitSelectQualifiedAll(RestrictedSqlParser.SelectQualifiedAllContext ctx) {
        return new SelectItem(new StarExpression(getIdentifierText(ctx.qualifier)));
    }

    @Override
    public SelectItem visitSelectExpression(RestrictedSqlParser.SelectExpressionContext ctx) {
        Expression expr = visitExpr(ctx.expression());
        String alias = null;
        if (ctx.alias != null) {
            alias = getIdentifierText(ctx.alias);
        } else if (ctx.aliasString != null) {
            alias = unquoteString(ctx.aliasString.getText());
        }
        return new SelectItem(expr, alias);
    }

    // ==================== FROM / JOIN ====================

    private FromClause buildFromClause(RestrictedSqlParser.FromClauseContext ctx) {
        List<RestrictedSqlParser.RelationContext> relations = ctx.relation();
        RestrictedSqlParser.RelationContext first = relations.get(0);
        Relation source = buildRelationPrimary(first.relationPrimary());

        List<JoinClause> joins = new ArrayList<>(buildJoins(first));
        for (int i = 1; i < relations.size(); i++) {
            // FROM a, b is a cross join of a and b
            RestrictedSqlParser.RelationContext extra = relations.get(i);
            joins.add(new JoinClause("cross join", buildRelationPrimary(extra.relationPrimary()), null));
            joins.addAll(buildJoins(extra));
        }
        return new FromClause(source, joins);
    }

    private List<JoinClause> buildJoins(RestrictedSqlParser.RelationContext ctx) {
        List<JoinClause> joins = new ArrayList<>();
        for (RestrictedSqlParser.JoinRelationContext join : ctx.joinRelation()) {
            String keyword = joinKeyword(join.joinType());
            Relation right = buildRelationPrimary(join.right);

            RestrictedSqlParser.JoinCriteriaContext criteria = join.joinCriteria();
            if (criteria == null) {
                joins.add(new JoinClause(keyword, right, null));
            } else if (criteria.ON() != null) {
                joins.add(new JoinClause(keyword, right, visitExpr(criteria.booleanExpression())));
            } else {
                List<String> columns = new ArrayList<>();
                for (RestrictedSqlParser.IdentifierContext id : criteria.identifier()) {
                    columns.add(getIdentifierText(id));
                }
                joins.add(new JoinClause(keyword, right, null, columns));
            }
        }
        return joins;
    }

    /**
     * Spells the join type the way the join keyword table keys it,
     * e.g. {@code "left outer join"}.
     */
    private String joinKeyword(RestrictedSqlParser.JoinTypeContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            sb.append(ctx.getChild(i).getText().toLowerCase()).append(' ');
        }
        return sb.append("join").toString();
    }

    private Relation buildRelationPrimary(RestrictedSqlParser.RelationPrimaryContext ctx) {
        if (ctx instanceof RestrictedSqlParser.TableNameRelationContext table) {
            return new TableRelation(
                getQualifiedNameText(table.qualifiedName()),
                table.tableAlias() != null ? getIdentifierText(table.tableAlias().identifier()) : null);
        }
        if (ctx instanceof RestrictedSqlParser.AliasedQueryContext aliased) {
            return new SubqueryRelation(
                visitQuery(aliased.query()),
                aliased.tableAlias() != null ? getIdentifierText(aliased.tableAlias().identifier()) : null);
        }
        throw new UnsupportedOperationException("Unsupported relation: " + getOriginalText(ctx));
    }

    // ==================== Boolean Expressions ====================

    private Expression visitExpr(ParseTree ctx) {
        return (Expression) visit(ctx);
    }

    @Override
    public Expression visitExpression(RestrictedSqlParser.ExpressionContext ctx) {
        return visitExpr(ctx.booleanExpression());
    }

    @Override
    public Expression visitLogicalNot(RestrictedSqlParser.LogicalNotContext ctx) {
        return new NotExpression(visitExpr(ctx.booleanExpression()));
    }

    @Override
    public Expression visitExists(RestrictedSqlParser.ExistsContext ctx) {
        return new UnresolvedExpression(getOriginalText(ctx), "EXISTS");
    }

    @Override
    public Expression visitLogicalBinary(RestrictedSqlParser.LogicalBinaryContext ctx) {
        Expression left = visitExpr(ctx.left);
        Expression right = visitExpr(ctx.right);
        if (ctx.operator.getType() == RestrictedSqlLexer.AND) {
            return ConjunctionExpression.and(left, right);
        }
        return ConjunctionExpression.or(left, right);
    }

    @Override
    public Expression visitPredicated(RestrictedSqlParser.PredicatedContext ctx) {
        Expression value = visitExpr(ctx.valueExpression());
        if (ctx.predicate() == null) {
            return value;
        }
        return buildPredicate(value, ctx.predicate());
    }

    private Expression buildPredicate(Expression value, RestrictedSqlParser.PredicateContext ctx) {
        boolean negated = ctx.NOT() != null;
        switch (ctx.kind.getType()) {
            case RestrictedSqlLexer.BETWEEN:
                return new BetweenExpression(value, visitExpr(ctx.lower), visitExpr(ctx.upper), negated);

            case RestrictedSqlLexer.IN:
                if (ctx.query() != null) {
                    return new InSubquery(value, visitQuery(ctx.query()), negated);
                }
                List<Expression> values = new ArrayList<>();
                for (RestrictedSqlParser.ExpressionContext item : ctx.expression()) {
                    values.add(visitExpr(item));
                }
                return new InExpression(value, values, negated);

            case RestrictedSqlLexer.LIKE:
                return new LikeExpression(value, visitExpr(ctx.pattern), negated);

            case RestrictedSqlLexer.SIMILAR: {
                Expression match = new BinaryExpression(value, "similar to", visitExpr(ctx.pattern));
                return negated ? new NotExpression(match) : match;
            }

            case RestrictedSqlLexer.NULL:
                return new FunctionCall(negated ? "isnotnull" : "isnull", List.of(value));

            default:
                throw new UnsupportedOperationException("Unsupported predicate: " + getOriginalText(ctx));
        }
    }

    // ==================== Value Expressions ====================

    @Override
    public Expression visitValueExpressionDefault(RestrictedSqlParser.ValueExpressionDefaultContext ctx) {
        return visitExpr(ctx.primaryExpression());
    }

    @Override
    public Expression visitArithmeticUnary(RestrictedSqlParser.ArithmeticUnaryContext ctx) {
        Expression operand = visitExpr(ctx.valueExpression());
        if (ctx.operator.getType() == RestrictedSqlLexer.PLUS) {
            return operand;
        }
        if (operand instanceof Literal literal && literal.kind() == Literal.Kind.NUMBER) {
            return Literal.of(((BigDecimal) literal.value()).negate());
        }
        return new BinaryExpression(Literal.of(-1), "*", operand);
    }

    @Override
    public Expression visitArithmeticBinary(RestrictedSqlParser.ArithmeticBinaryContext ctx) {
        Expression left = visitExpr(ctx.left);
        Expression right = visitExpr(ctx.right);
        if (ctx.operator.getType() == RestrictedSqlLexer.CONCAT_PIPE) {
            return new FunctionCall("concat", List.of(left, right));
        }
        return new BinaryExpression(left, ctx.operator.getText(), right);
    }

    @Override
    public Expression visitComparison(RestrictedSqlParser.ComparisonContext ctx) {
        return new BinaryExpression(visitExpr(ctx.left), ctx.comparisonOperator().getText(), visitExpr(ctx.right));
    }

    // ==================== Primary Expressions ====================

    @Override
    public Expression visitSearchedCase(RestrictedSqlParser.SearchedCaseContext ctx) {
        return new UnresolvedExpression(getOriginalText(ctx), "CASE");
    }

    @Override
    public Expression visitSimpleCase(RestrictedSqlParser.SimpleCaseContext ctx) {
        return new UnresolvedExpression(getOriginalText(ctx), "CASE");
    }

    @Override
    public Expression visitCast(RestrictedSqlParser.CastContext ctx) {
        return new UnresolvedExpression(getOriginalText(ctx), "CAST");
    }

    @Override
    public Expression visitConstantDefault(RestrictedSqlParser.ConstantDefaultContext ctx) {
        return visitExpr(ctx.constant());
    }

    @Override
    public Expression visitFunctionCall(RestrictedSqlParser.FunctionCallContext ctx) {
        String name = ctx.functionName().getText();
        if (ctx.functionName().identifier() != null) {
            name = getIdentifierText(ctx.functionName().identifier());
        }
        boolean distinct = ctx.setQuantifier() != null && ctx.setQuantifier().DISTINCT() != null;

        List<Expression> args = new ArrayList<>();
        for (RestrictedSqlParser.FunctionArgumentContext arg : ctx.functionArgument()) {
            if (arg.ASTERISK() != null) {
                args.add(new StarExpression());
            } else {
                args.add(visitExpr(arg.expression()));
            }
        }
        logger.trace("Function call {} with {} argument(s)", name, args.size());
        return new FunctionCall(name, args, distinct);
    }

    @Override
    public Expression visitDereference(RestrictedSqlParser.DereferenceContext ctx) {
        return new ColumnReference(getIdentifierText(ctx.name), getIdentifierText(ctx.qualifier));
    }

    @Override
    public Expression visitColumnReference(RestrictedSqlParser.ColumnReferenceContext ctx) {
        return new ColumnReference(getIdentifierText(ctx.identifier()));
    }

    @Override
    public Expression visitParenthesizedExpression(RestrictedSqlParser.ParenthesizedExpressionContext ctx) {
        return visitExpr(ctx.expression());
    }

    // ==================== Literals ====================

    @Override
    public Expression visitNullLiteral(RestrictedSqlParser.NullLiteralContext ctx) {
        return Literal.nullValue();
    }

    @Override
    public Expression visitNumericLiteral(RestrictedSqlParser.NumericLiteralContext ctx) {
        return Literal.of(new BigDecimal(ctx.number().getText()));
    }

    @Override
    public Expression visitBooleanLiteral(RestrictedSqlParser.BooleanLiteralContext ctx) {
        return Literal.of(ctx.booleanValue().TRUE() != null);
    }

    @Override
    public Expression visitStringLiteral(RestrictedSqlParser.StringLiteralContext ctx) {
        // Adjacent literals concatenate: 'a' 'b' is 'ab'
        StringBuilder sb = new StringBuilder();
        for (TerminalNode part : ctx.STRING_LITERAL()) {
            sb.append(unquoteString(part.getText()));
        }
        return Literal.of(sb.toString());
    }

    // ==================== Utility Methods ====================

    private String getQualifiedNameText(RestrictedSqlParser.QualifiedNameContext ctx) {
        List<String> parts = new ArrayList<>();
        for (RestrictedSqlParser.IdentifierContext id : ctx.identifier()) {
            parts.add(getIdentifierText(id));
        }
        return String.join(".", parts);
    }

    private String getIdentifierText(RestrictedSqlParser.IdentifierContext ctx) {
        if (ctx.BACKQUOTED_IDENTIFIER() != null) {
            String text = ctx.BACKQUOTED_IDENTIFIER().getText();
            // Remove surrounding backticks
            return text.substring(1, text.length() - 1).replace("``", "`");
        }
        return ctx.getText();
    }

    private static String unquoteString(String text) {
        // Remove surrounding quotes and unescape
        return text.substring(1, text.length() - 1).replace("''", "'");
    }

    /**
     * Gets the original SQL text for a parse tree node.
     */
    private String getOriginalText(ParseTree ctx) {
        if (ctx instanceof ParserRuleContext prc) {
            if (prc.start != null && prc.stop != null) {
                return prc.start.getInputStream().getText(
                    new Interval(prc.start.getStartIndex(), prc.stop.getStopIndex()));
            }
        }
        return ctx.getText();
    }
}
