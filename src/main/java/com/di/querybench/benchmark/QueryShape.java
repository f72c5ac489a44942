package com.di.querybench.benchmark;

import com.di.querybench.schema.SchemaVariant;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SQL shapes under comparison. Both return the WAITING distribution groups that have a
 * resolvable matching, ordered by id and paginated with {@code LIMIT ? OFFSET ?}. Table names
 * carry a {@code {s}} placeholder that {@link #render(SchemaVariant, String)} replaces with the
 * variant's suffix; nothing else differs between variants.
 *
 * <p>Numeric ids are cast to the text type named by {@code {t}} before they are compared with
 * {@code distribution_group_matching.pointer}. PostgreSQL uses {@code TEXT}; stores without
 * that type name pass their own (H2: {@code VARCHAR}).
 */
public enum QueryShape {

    /** One query, discriminated LEFT JOINs on the matching type, GROUP BY to deduplicate. */
    OUTER_JOIN_AND_GROUP("outer-join-and-group", """
            SELECT dg.id, dg.state
            FROM distribution_group{s} dg
            JOIN distribution_group_matching{s} dgm ON dgm.distribution_group_id = dg.id
            LEFT JOIN skill{s} s ON dgm.type = 'SKILL_CODE' AND dgm.pointer = s.code
            LEFT JOIN account{s} a ON dgm.type = 'ACCOUNT_ID' AND dgm.pointer = CAST(a.id AS {t})
            LEFT JOIN account_group{s} ag ON dgm.type = 'ACCOUNT_GROUP_ID' AND dgm.pointer = CAST(ag.id AS {t})
            WHERE dg.state = 'WAITING'
              AND (s.id IS NOT NULL OR a.id IS NOT NULL OR ag.id IS NOT NULL)
            GROUP BY dg.id, dg.state
            ORDER BY dg.id
            LIMIT ? OFFSET ?
            """),

    /** Three inner joins, one per matching type, combined with UNION ALL and paginated after the union. */
    UNION_OF_INNER_JOINS("union-of-inner-joins", """
            SELECT dg.id, dg.state FROM distribution_group{s} dg
            JOIN distribution_group_matching{s} dgm ON dgm.distribution_group_id = dg.id
            JOIN skill{s} s ON dgm.type = 'SKILL_CODE' AND dgm.pointer = s.code
            WHERE dg.state = 'WAITING'

            UNION ALL

            SELECT dg.id, dg.state FROM distribution_group{s} dg
            JOIN distribution_group_matching{s} dgm ON dgm.distribution_group_id = dg.id
            JOIN account{s} a ON dgm.type = 'ACCOUNT_ID' AND dgm.pointer = CAST(a.id AS {t})
            WHERE dg.state = 'WAITING'

            UNION ALL

            SELECT dg.id, dg.state FROM distribution_group{s} dg
            JOIN distribution_group_matching{s} dgm ON dgm.distribution_group_id = dg.id
            JOIN account_group{s} ag ON dgm.type = 'ACCOUNT_GROUP_ID' AND dgm.pointer = CAST(ag.id AS {t})
            WHERE dg.state = 'WAITING'

            ORDER BY id
            LIMIT ? OFFSET ?
            """);

    public static final String DEFAULT_ID_CAST_TYPE = "TEXT";

    private static final String  SUFFIX_PLACEHOLDER    = "{s}";
    private static final String  CAST_TYPE_PLACEHOLDER = "{t}";
    private static final Pattern CAST_TYPE             = Pattern.compile("[A-Za-z]+( [A-Za-z]+)*");

    private final String id;
    private final String template;

    QueryShape(String id, String template) {
        this.id = id;
        this.template = template;
    }

    public String getId() {
        return id;
    }

    public String getTemplate() {
        return template;
    }

    public String render(SchemaVariant variant) {
        return render(variant, DEFAULT_ID_CAST_TYPE);
    }

    /**
     * @throws IllegalArgumentException when {@code idCastType} is not a plain type name
     */
    public String render(SchemaVariant variant, String idCastType) {
        if (idCastType == null || !CAST_TYPE.matcher(idCastType.trim()).matches()) {
            throw new IllegalArgumentException("Invalid id cast type: " + idCastType);
        }
        return template.replace(SUFFIX_PLACEHOLDER, variant.getTableSuffix())
                       .replace(CAST_TYPE_PLACEHOLDER, idCastType.trim().toUpperCase(Locale.ROOT));
    }

    public static QueryShape fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Query shape is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QueryShape s : values()) {
            if (s.id.equals(normalized) || s.name().equalsIgnoreCase(normalized)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown query shape: " + value);
    }
}
