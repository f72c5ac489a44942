package com.di.querybench.benchmark;

import com.di.querybench.schema.SchemaVariant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryStrategy Tests")
class QueryStrategyTest {

    @Test
    @DisplayName("Should parse shape and variant from the strategy name")
    void testParse() {
        QueryStrategy strategy = QueryStrategy.parse("union-of-inner-joins@indexed");

        assertEquals(QueryShape.UNION_OF_INNER_JOINS, strategy.getShape());
        assertEquals(SchemaVariant.INDEXED, strategy.getVariant());
        assertEquals("union-of-inner-joins@indexed", strategy.getName());
    }

    @Test
    @DisplayName("Should default to the base variant and accept enum names")
    void testParse_Defaults() {
        assertEquals(QueryStrategy.of(QueryShape.OUTER_JOIN_AND_GROUP, SchemaVariant.BASE),
                QueryStrategy.parse("OUTER_JOIN_AND_GROUP"));
        assertEquals(QueryStrategy.of(QueryShape.OUTER_JOIN_AND_GROUP, SchemaVariant.INDEXED),
                QueryStrategy.parse(" outer-join-and-group@INDEXED "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "left-join@base", "union-of-inner-joins@other", "a@b@c"})
    @DisplayName("Should reject unknown or malformed strategies")
    void testParse_Invalid(String value) {
        assertThrows(IllegalArgumentException.class, () -> QueryStrategy.parse(value));
    }

    @Test
    @DisplayName("Should render table names for the variant only")
    void testSql_Rendering() {
        String base    = QueryStrategy.parse("union-of-inner-joins@base").sql();
        String indexed = QueryStrategy.parse("union-of-inner-joins@indexed").sql();

        assertFalse(base.contains("{s}"));
        assertFalse(base.contains("_2 "));
        assertTrue(indexed.contains("FROM distribution_group_2 dg"));
        assertTrue(indexed.contains("JOIN skill_2 s"));
        assertEquals(base, indexed.replace("_2 ", " "));
    }

    @Test
    @DisplayName("Should combine three inner joins or group three outer joins")
    void testSql_Shapes() {
        String union = QueryShape.UNION_OF_INNER_JOINS.render(SchemaVariant.BASE);
        String outer = QueryShape.OUTER_JOIN_AND_GROUP.render(SchemaVariant.BASE);

        assertEquals(2, union.split("UNION ALL", -1).length - 1);
        assertFalse(union.contains("LEFT JOIN"));
        assertEquals(3, outer.split("LEFT JOIN", -1).length - 1);
        assertTrue(outer.contains("GROUP BY dg.id, dg.state"));
        assertTrue(union.trim().endsWith("LIMIT ? OFFSET ?"));
        assertTrue(outer.trim().endsWith("LIMIT ? OFFSET ?"));
    }

    @Test
    @DisplayName("Should cast ids to TEXT unless another type name is configured")
    void testSql_IdCastType() {
        QueryStrategy strategy = QueryStrategy.parse("outer-join-and-group@base");

        assertTrue(strategy.sql().contains("CAST(a.id AS TEXT)"));
        assertTrue(strategy.sql().contains("CAST(ag.id AS TEXT)"));
        assertFalse(strategy.sql().contains("{t}"));

        String h2 = strategy.sql("varchar");
        assertTrue(h2.contains("CAST(a.id AS VARCHAR)"));
        assertEquals(strategy.sql(), h2.replace("AS VARCHAR)", "AS TEXT)"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "TEXT); DROP TABLE skill; --", "VARCHAR(10)"})
    @DisplayName("Should reject cast types that are not plain type names")
    void testSql_InvalidIdCastType(String idCastType) {
        QueryStrategy strategy = QueryStrategy.parse("union-of-inner-joins@base");
        assertThrows(IllegalArgumentException.class, () -> strategy.sql(idCastType));
    }
}
