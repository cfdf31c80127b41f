package com.sql2kql.functions;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.expression.Expression;
import com.sql2kql.expression.FunctionCall;
import com.sql2kql.expression.StarExpression;
import com.sql2kql.generator.TranslationContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Renders function calls using the {@link FunctionRegistry}.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@code count(DISTINCT x)} becomes {@code dcount(x)}</li>
 *   <li>an unmapped name is passed through as {@code name(args)} with a warning; the
 *       {@code // WARNING unmapped function} marker is queued on the context and ends
 *       the enclosing top-level stage</li>
 *   <li>a mapped name renders through its {@link FunctionMapping}</li>
 * </ol>
 *
 * <p>Star arguments are dropped, so {@code count(*)} becomes {@code count()}.
 */
public final class FunctionTranslator {

    /** Inline marker for stages that contain a passthrough call */
    public static final String UNMAPPED_MARKER = "// WARNING unmapped function";

    private FunctionTranslator() {}

    /**
     * Translates a function call.
     *
     * @param call the function call
     * @param argumentTranslator translates each argument expression
     * @param context the translation context receiving warnings
     * @return the KQL text
     */
    public static String translate(FunctionCall call, Function<Expression, String> argumentTranslator,
                                   TranslationContext context) {
        String name = call.functionName().trim().toLowerCase();
        List<String> args = translateArguments(call, argumentTranslator);

        if (name.equals("count") && call.distinct()) {
            if (args.isEmpty()) {
                return "dcount()";
            }
            return "dcount(" + args.get(0) + ")";
        }

        Optional<FunctionMapping> mapping = FunctionRegistry.lookup(name);
        if (mapping.isEmpty()) {
            context.warn(DiagnosticKind.UNMAPPED_FUNCTION,
                "Function '" + name + "' has no KQL mapping and was passed through unchanged",
                call.toSQL());
            context.markInline(UNMAPPED_MARKER);
            return name + "(" + String.join(", ", args) + ")";
        }

        if (call.distinct()) {
            context.warn(DiagnosticKind.DISTINCT_QUANTIFIER_DROPPED,
                "DISTINCT is only supported inside count(); it was dropped from " + name + "()",
                call.toSQL());
        }
        return mapping.get().apply(name, args);
    }

    private static List<String> translateArguments(FunctionCall call,
                                                   Function<Expression, String> argumentTranslator) {
        List<String> args = new ArrayList<>();
        for (Expression arg : call.arguments()) {
            if (arg instanceof StarExpression) {
                continue;
            }
            args.add(argumentTranslator.apply(arg));
        }
        return args;
    }
}
