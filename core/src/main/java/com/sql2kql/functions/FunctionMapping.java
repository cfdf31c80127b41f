package com.sql2kql.functions;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How one source function renders in the target language.
 *
 * <p>A mapping takes one of three forms:
 * <ul>
 *   <li><b>direct</b>: {@code target(arg0, arg1, ...)}</li>
 *   <li><b>reorder</b>: {@code target(<template>)}, where the template places
 *       arguments by index, e.g. {@code "{p1}, {p0}"}</li>
 *   <li><b>override</b>: the template is the whole output and the target name
 *       is ignored, e.g. {@code "iif(isnull({p0}), {p1}, {p0})"}</li>
 * </ul>
 *
 * <p>Reorder mappings may carry arity-specific templates, used in place of the general
 * template when the call has exactly that many arguments.
 *
 * <p>Instances are immutable.
 */
public final class FunctionMapping {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{p(\\d+)\\}");

    private final String target;
    private final String argTemplate;
    private final String overrideTemplate;
    private final Map<Integer, String> arityTemplates;

    private FunctionMapping(String target, String argTemplate, String overrideTemplate,
                            Map<Integer, String> arityTemplates) {
        this.target = target;
        this.argTemplate = argTemplate;
        this.overrideTemplate = overrideTemplate;
        this.arityTemplates = Collections.unmodifiableMap(new HashMap<>(arityTemplates));
    }

    /**
     * Creates a direct mapping.
     *
     * @param target the target function name
     * @return the mapping
     */
    public static FunctionMapping direct(String target) {
        Objects.requireNonNull(target, "target must not be null");
        return new FunctionMapping(target, null, null, Map.of());
    }

    /**
     * Creates a reorder mapping.
     *
     * @param target the target function name
     * @param argTemplate the argument template, e.g. {@code "{p1}, {p0}"}
     * @return the mapping
     */
    public static FunctionMapping reorder(String target, String argTemplate) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(argTemplate, "argTemplate must not be null");
        return new FunctionMapping(target, argTemplate, null, Map.of());
    }

    /**
     * Creates an override mapping.
     *
     * @param overrideTemplate the full output template
     * @return the mapping
     */
    public static FunctionMapping override(String overrideTemplate) {
        Objects.requireNonNull(overrideTemplate, "overrideTemplate must not be null");
        return new FunctionMapping(null, null, overrideTemplate, Map.of());
    }

    /**
     * Returns a copy of this mapping with an extra template for calls of one arity.
     *
     * @param arity the argument count the template applies to
     * @param template the argument template for that arity
     * @return the new mapping
     */
    public FunctionMapping withArityTemplate(int arity, String template) {
        if (target == null) {
            throw new IllegalStateException("arity templates need a target function name");
        }
        Map<Integer, String> templates = new HashMap<>(arityTemplates);
        templates.put(arity, Objects.requireNonNull(template, "template must not be null"));
        return new FunctionMapping(target, argTemplate, overrideTemplate, templates);
    }

    /**
     * Returns the target function name.
     *
     * @return the target name, or null for override mappings
     */
    public String target() {
        return target;
    }

    public String argTemplate() {
        return argTemplate;
    }

    public String overrideTemplate() {
        return overrideTemplate;
    }

    public Map<Integer, String> arityTemplates() {
        return arityTemplates;
    }

    public boolean isOverride() {
        return overrideTemplate != null;
    }

    /**
     * Renders a call with already-translated arguments.
     *
     * @param sourceName the source function name, used in error messages
     * @param args the translated arguments
     * @return the rendered call
     * @throws TranslationException if a template refers to a missing argument
     */
    public String apply(String sourceName, List<String> args) {
        if (overrideTemplate != null) {
            return substitute(overrideTemplate, sourceName, args);
        }
        String template = arityTemplates.getOrDefault(args.size(), argTemplate);
        if (template != null) {
            return target + "(" + substitute(template, sourceName, args) + ")";
        }
        return target + "(" + String.join(", ", args) + ")";
    }

    private static String substitute(String template, String sourceName, List<String> args) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            if (index >= args.size()) {
                throw new TranslationException(
                    DiagnosticKind.MALFORMED_TEMPLATE,
                    String.format("Template '%s' refers to argument %d but %s was called with %d argument(s)",
                        template, index, sourceName, args.size()),
                    sourceName + "(" + String.join(", ", args) + ")");
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(args.get(index)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        if (overrideTemplate != null) {
            return "override[" + overrideTemplate + "]";
        }
        if (argTemplate != null || !arityTemplates.isEmpty()) {
            return target + "(" + (argTemplate != null ? argTemplate : "...") + ")";
        }
        return target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionMapping)) return false;
        FunctionMapping that = (FunctionMapping) obj;
        return Objects.equals(target, that.target) &&
               Objects.equals(argTemplate, that.argTemplate) &&
               Objects.equals(overrideTemplate, that.overrideTemplate) &&
               arityTemplates.equals(that.arityTemplates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, argTemplate, overrideTemplate, arityTemplates);
    }
}
