package com.example.umarell.data;

import com.example.umarell.security.InputSanitizer;
import com.example.umarell.security.SanitizeContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the Room lookups. Every caller value goes through {@link InputSanitizer}
 * before it is placed inside a quoted literal.
 */
public final class CypherQueryBuilder {

    public static final String ROOM_LABEL = "Room";

    private CypherQueryBuilder() {
    }

    public static TopologyQuery select(TopologyFilter filter, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }

        List<String> clauses = new ArrayList<>();
        if (filter.category() != null) {
            String c = literal(filter.category().toLowerCase(Locale.ROOT));
            clauses.add("(toLower(coalesce(r.category_it, '')) CONTAINS " + c +
                    " OR toLower(coalesce(r.category_en, '')) CONTAINS " + c + ")");
        }
        if (filter.floor() != null) {
            clauses.add("toString(r.storey) = " + literal(filter.floor()));
        }
        if (filter.nameContains() != null) {
            clauses.add("toLower(coalesce(r.name, '')) CONTAINS " +
                    literal(filter.nameContains().toLowerCase(Locale.ROOT)));
        }

        StringBuilder cypher = new StringBuilder("MATCH (r:" + ROOM_LABEL + ")\n");
        if (!clauses.isEmpty()) {
            cypher.append("WHERE ")
                    .append(String.join(filter.anyOf() ? "\n   OR " : "\n  AND ", clauses))
                    .append('\n');
        }
        cypher.append("RETURN r\n").append("LIMIT ").append(limit);

        return new TopologyQuery(cypher.toString(), filter, limit);
    }

    private static String literal(String raw) {
        return "'" + InputSanitizer.sanitize(raw, SanitizeContext.GRAPH_LITERAL) + "'";
    }
}
