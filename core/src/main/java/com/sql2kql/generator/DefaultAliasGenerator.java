package com.sql2kql.generator;

import com.sql2kql.expression.ColumnReference;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.FunctionCall;

/**
 * Default naming for computed select items.
 *
 * <ul>
 *   <li>a function whose first argument is a bare column takes that column's name:
 *       {@code tolower(Host)} becomes {@code Host}</li>
 *   <li>any other function call is named {@code <function>_<position>}</li>
 *   <li>anything else is named {@code expr_<position>}</li>
 * </ul>
 */
public class DefaultAliasGenerator implements AliasGenerator {

    @Override
    public String aliasFor(Expression expression, int position) {
        if (expression instanceof ColumnReference col) {
            return col.columnName();
        }
        if (expression instanceof FunctionCall func) {
            if (!func.arguments().isEmpty() && func.arguments().get(0) instanceof ColumnReference col) {
                return col.columnName();
            }
            return func.functionName().toLowerCase() + "_" + position;
        }
        return "expr_" + position;
    }
}
