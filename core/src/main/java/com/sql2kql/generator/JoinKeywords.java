package com.sql2kql.generator;

import com.sql2kql.exception.DiagnosticKind;
import com.sql2kql.exception.TranslationException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Mapping from SQL join keyword variants to KQL join kinds.
 *
 * <p>{@code cross join} is recognized but maps to {@link JoinKind#CROSS}, which has no
 * KQL rendering; the join translator emits an explicit unsupported marker for it.
 */
public final class JoinKeywords {

    /**
     * KQL join kinds.
     */
    public enum JoinKind {
        INNER("inner"),
        LEFT("leftouter"),
        RIGHT("rightouter"),
        OUTER("fullouter"),
        CROSS(null);

        private final String kqlName;

        JoinKind(String kqlName) {
            this.kqlName = kqlName;
        }

        /**
         * Returns the value written after {@code kind=}.
         *
         * @return the KQL kind name
         * @throws UnsupportedOperationException for {@link #CROSS}
         */
        public String kqlName() {
            if (kqlName == null) {
                throw new UnsupportedOperationException("CROSS join has no KQL join kind");
            }
            return kqlName;
        }

        public boolean isSupported() {
            return kqlName != null;
        }
    }

    private static final Map<String, JoinKind> KEYWORDS;

    static {
        Map<String, JoinKind> keywords = new HashMap<>();
        keywords.put("join", JoinKind.INNER);
        keywords.put("inner join", JoinKind.INNER);
        keywords.put("left join", JoinKind.LEFT);
        keywords.put("left outer join", JoinKind.LEFT);
        keywords.put("right join", JoinKind.RIGHT);
        keywords.put("right outer join", JoinKind.RIGHT);
        keywords.put("full join", JoinKind.OUTER);
        keywords.put("full outer join", JoinKind.OUTER);
        keywords.put("cross join", JoinKind.CROSS);
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private JoinKeywords() {}

    /**
     * Resolves a join keyword variant.
     *
     * @param keyword the keyword as written, e.g. {@code "LEFT OUTER JOIN"}
     * @return the join kind
     * @throws TranslationException if the keyword is not a known join variant
     */
    public static JoinKind resolve(String keyword) {
        JoinKind kind = keyword == null ? null : KEYWORDS.get(normalize(keyword));
        if (kind == null) {
            throw new TranslationException(
                DiagnosticKind.UNKNOWN_JOIN_KEYWORD,
                "Unknown join keyword '" + keyword + "'",
                keyword);
        }
        return kind;
    }

    public static boolean isJoinKeyword(String keyword) {
        return keyword != null && KEYWORDS.containsKey(normalize(keyword));
    }

    public static Map<String, JoinKind> keywords() {
        return KEYWORDS;
    }

    private static String normalize(String keyword) {
        return keyword.trim().replaceAll("\\s+", " ").toLowerCase();
    }
}
