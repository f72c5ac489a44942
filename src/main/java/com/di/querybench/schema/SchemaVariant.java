package com.di.querybench.schema;

import java.util.Locale;

/**
 * Physical copy of the dataset a statement targets.
 *
 * <p>{@link #BASE} holds the plain tables; {@link #INDEXED} is the structurally identical
 * shadow copy (tables suffixed {@code _2}) that carries the supplementary indexes. Both are
 * loaded with the same generated content so a benchmark can separate query-shape effects
 * from indexing effects.
 */
public enum SchemaVariant {

    BASE("base", ""),
    INDEXED("indexed", "_2");

    private final String id;
    private final String tableSuffix;

    SchemaVariant(String id, String tableSuffix) {
        this.id = id;
        this.tableSuffix = tableSuffix;
    }

    public String getId() {
        return id;
    }

    public String getTableSuffix() {
        return tableSuffix;
    }

    /** Physical name of {@code baseName} in this variant, e.g. {@code skill} → {@code skill_2}. */
    public String table(String baseName) {
        return baseName + tableSuffix;
    }

    /**
     * Resolves a variant from its id ({@code base}, {@code indexed}) or its enum name.
     *
     * @throws IllegalArgumentException for blank or unknown values
     */
    public static SchemaVariant fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Schema variant is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SchemaVariant v : values()) {
            if (v.id.equals(normalized) || v.name().equalsIgnoreCase(normalized)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown schema variant: " + value);
    }
}
