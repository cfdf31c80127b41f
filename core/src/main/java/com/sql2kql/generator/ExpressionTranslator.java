package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
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
import com.sql2kql.functions.FunctionTranslator;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Translates expression trees into KQL expression text.
 *
 * <p>Dispatch order, first match wins: literal, AND/OR, NOT, BETWEEN, IN, binary
 * operator, LIKE, function call. Column references and stars are leaves. Any other
 * shape renders as an {@code EXPRESSION ... not resolved} placeholder and records a
 * warning instead of failing.
 *
 * <p>Operand grouping from the source is kept: nested conjunctions and nested binary
 * operations are parenthesized.
 */
public final class ExpressionTranslator {

    private final KQLGenerator generator;
    private final TranslationContext context;

    /**
     * Creates an expression translator bound to one translation.
     *
     * @param generator the generator used for IN subqueries
     * @param context the translation context
     */
    public ExpressionTranslator(KQLGenerator generator, TranslationContext context) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    /**
     * Translates an expression.
     *
     * @param expr the expression
     * @return the KQL text
     * @throws com.sql2kql.exception.TranslationException for unknown operators,
     *         non-literal LIKE patterns and malformed function templates
     */
    public String translate(Expression expr) {
        Objects.requireNonNull(expr, "expr must not be null");

        if (expr instanceof ColumnReference col) {
            return translateColumn(col);
        }
        if (expr instanceof StarExpression) {
            return "*";
        }
        if (expr instanceof Literal literal) {
            return KQLQuoting.renderLiteral(literal);
        }
        if (expr instanceof ConjunctionExpression conj) {
            return translateConjunction(conj);
        }
        if (expr instanceof NotExpression not) {
            return "not (" + translate(not.operand()) + ")";
        }
        if (expr instanceof BetweenExpression between) {
            return translateBetween(between);
        }
        if (expr instanceof InExpression in) {
            return translateIn(in);
        }
        if (expr instanceof InSubquery in) {
            return translateInSubquery(in);
        }
        if (expr instanceof BinaryExpression bin) {
            return translateBinary(bin);
        }
        if (expr instanceof LikeExpression like) {
            return LikePatternClassifier.translate(
                translate(like.value()), like.pattern(), like.isNegated(), like.toSQL());
        }
        if (expr instanceof FunctionCall func) {
            return FunctionTranslator.translate(func, this::translate, context);
        }

        context.warn(DiagnosticKind.UNRESOLVED_EXPRESSION,
            "Expression has no KQL translation", expr.toSQL());
        return "EXPRESSION " + expr.toSQL() + " not resolved";
    }

    private String translateColumn(ColumnReference col) {
        String name = KQLQuoting.quoteIdentifier(col.columnName());
        if (!col.isQualified()) {
            return name;
        }
        String qualifier = col.qualifier();
        if (JoinTranslator.isSideMarker(qualifier)) {
            return qualifier + "." + name;
        }
        return KQLQuoting.quoteIdentifier(qualifier) + "." + name;
    }

    private String translateConjunction(ConjunctionExpression conj) {
        String keyword = conj.connective() == ConjunctionExpression.Connective.AND ? " and " : " or ";
        return conj.operands().stream()
            .map(this::translateGrouped)
            .collect(Collectors.joining(keyword));
    }

    private String translateBetween(BetweenExpression between) {
        String range = translate(between.lower()) + " .. " + translate(between.upper());
        String keyword = between.isNegated() ? " not between (" : " between (";
        return translate(between.value()) + keyword + range + ")";
    }

    private String translateIn(InExpression in) {
        String values = in.values().stream()
            .map(this::translate)
            .collect(Collectors.joining(", "));
        return translate(in.testExpr()) + (in.isNegated() ? " !in (" : " in (") + values + ")";
    }

    private String translateInSubquery(InSubquery in) {
        Pipeline subquery = generator.translateQuery(in.subquery(), context);
        return translate(in.testExpr()) + (in.isNegated() ? " !in (" : " in (")
            + subquery.renderNested("  ") + ")";
    }

    private String translateBinary(BinaryExpression bin) {
        String operator = OperatorTable.translate(bin.operator());
        return translateGrouped(bin.left()) + " " + operator + " " + translateGrouped(bin.right());
    }

    /**
     * Translates an operand, wrapping compound operands in parentheses.
     */
    private String translateGrouped(Expression operand) {
        String text = translate(operand);
        if (operand instanceof BinaryExpression || operand instanceof ConjunctionExpression) {
            return "(" + text + ")";
        }
        return text;
    }
}
