package com.sql2kql.logical;

import com.sql2kql.expression.Expression;
import java.util.List;
import java.util.Objects;

/**
 * A JOIN attached to a FROM clause.
 *
 * <p>The join is held as written: the keyword variant ({@code "left outer join"},
 * {@code "join"}, {@code "cross join"}...) is resolved to a join kind only during
 * translation, through {@link com.sql2kql.generator.JoinKeywords}. The criteria are
 * either an ON condition or a USING column list; cross joins carry neither.
 */
public final class JoinClause {

    private final String keyword;
    private final Relation right;
    private final Expression condition;
    private final List<String> usingColumns;

    /**
     * Creates a join clause.
     *
     * @param keyword the join keyword variant, lower-cased
     * @param right the right-side source
     * @param condition the ON condition (may be null)
     * @param usingColumns the USING columns (empty when ON or no criteria)
     */
    public JoinClause(String keyword, Relation right, Expression condition, List<String> usingColumns) {
        Objects.requireNonNull(keyword, "keyword must not be null");
        this.keyword = keyword.trim().replaceAll("\\s+", " ").toLowerCase();
        this.right = Objects.requireNonNull(right, "right must not be null");
        this.condition = condition;
        this.usingColumns = List.copyOf(Objects.requireNonNull(usingColumns, "usingColumns must not be null"));
        if (condition != null && !this.usingColumns.isEmpty()) {
            throw new IllegalArgumentException("join cannot have both ON and USING criteria");
        }
    }

    public JoinClause(String keyword, Relation right, Expression condition) {
        this(keyword, right, condition, List.of());
    }

    public String keyword() {
        return keyword;
    }

    public Relation right() {
        return right;
    }

    /**
     * Returns the ON condition.
     *
     * @return the condition, or null for USING joins and joins without criteria
     */
    public Expression condition() {
        return condition;
    }

    public List<String> usingColumns() {
        return usingColumns;
    }

    public boolean hasCriteria() {
        return condition != null || !usingColumns.isEmpty();
    }

    public String toSQL() {
        StringBuilder sb = new StringBuilder(keyword.toUpperCase());
        sb.append(' ').append(right.toSQL());
        if (condition != null) {
            sb.append(" ON ").append(condition.toSQL());
        } else if (!usingColumns.isEmpty()) {
            sb.append(" USING (").append(String.join(", ", usingColumns)).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSQL();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JoinClause)) return false;
        JoinClause that = (JoinClause) obj;
        return keyword.equals(that.keyword) &&
               right.equals(that.right) &&
               Objects.equals(condition, that.condition) &&
               usingColumns.equals(that.usingColumns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, right, condition, usingColumns);
    }
}
