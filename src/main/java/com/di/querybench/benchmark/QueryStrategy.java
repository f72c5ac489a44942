package com.di.querybench.benchmark;

import com.di.querybench.schema.SchemaVariant;
import lombok.Value;

/**
 * A query shape bound to the schema variant it runs against, named
 * {@code <shape>@<variant>}, e.g. {@code union-of-inner-joins@indexed}.
 */
@Value
public class QueryStrategy {

    QueryShape    shape;
    SchemaVariant variant;

    public static QueryStrategy of(QueryShape shape, SchemaVariant variant) {
        return new QueryStrategy(shape, variant);
    }

    /**
     * Parses {@code <shape>@<variant>}; a missing variant means {@link SchemaVariant#BASE}.
     *
     * @throws IllegalArgumentException for unknown shapes or variants
     */
    public static QueryStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Query strategy is required");
        }
        String[] parts = value.trim().split("@", -1);
        if (parts.length > 2) {
            throw new IllegalArgumentException("Invalid query strategy: " + value);
        }
        SchemaVariant variant = parts.length == 2 ? SchemaVariant.fromId(parts[1]) : SchemaVariant.BASE;
        return new QueryStrategy(QueryShape.fromId(parts[0]), variant);
    }

    public String getName() {
        return shape.getId() + "@" + variant.getId();
    }

    /** SQL with two positional parameters: page size, offset. Ids are cast to {@code TEXT}. */
    public String sql() {
        return shape.render(variant);
    }

    public String sql(String idCastType) {
        return shape.render(variant, idCastType);
    }
}
