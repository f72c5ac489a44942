package com.di.querybench.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tables of the benchmark dataset, declared in foreign-key dependency order
 * (every table appears after the tables it references).
 */
public enum DatasetTable {

    ACCOUNT("account"),
    ACCOUNT_GROUP("account_group"),
    ACCOUNT_TO_ACCOUNT_GROUP("account_to_account_group"),
    SKILL("skill"),
    ACCOUNT_SKILL("account_skill"),
    TASK("task"),
    DISTRIBUTION_GROUP("distribution_group"),
    DISTRIBUTION_GROUP_TASK("distribution_group_task"),
    DISTRIBUTION_GROUP_MATCHING("distribution_group_matching");

    private final String baseName;

    DatasetTable(String baseName) {
        this.baseName = baseName;
    }

    public String getBaseName() {
        return baseName;
    }

    public String qualifiedName(SchemaVariant variant) {
        return variant.table(baseName);
    }

    /** Dependents first, so truncation never hits a table that is still referenced. */
    public static List<DatasetTable> reverseDependencyOrder() {
        List<DatasetTable> tables = new ArrayList<>(Arrays.asList(values()));
        Collections.reverse(tables);
        return tables;
    }
}
