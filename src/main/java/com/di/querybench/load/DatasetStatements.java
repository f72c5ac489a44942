package com.di.querybench.load;

import com.di.querybench.model.Account;
import com.di.querybench.model.AccountGroup;
import com.di.querybench.model.AccountGroupLink;
import com.di.querybench.model.AccountSkillLink;
import com.di.querybench.model.DistributionGroup;
import com.di.querybench.model.DistributionGroupMatching;
import com.di.querybench.model.DistributionGroupTaskLink;
import com.di.querybench.model.Skill;
import com.di.querybench.model.Task;
import com.di.querybench.schema.DatasetTable;
import com.di.querybench.schema.SchemaVariant;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * INSERT and TRUNCATE statements of the dataset tables for one schema variant.
 * Enum-valued columns are written by name.
 */
public final class DatasetStatements {

    private final SchemaVariant variant;

    public DatasetStatements(SchemaVariant variant) {
        this.variant = variant;
    }

    public SchemaVariant getVariant() {
        return variant;
    }

    public String table(DatasetTable table) {
        return table.qualifiedName(variant);
    }

    public InsertStatement<Account> account() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.ACCOUNT) + " (id, name) VALUES (?, ?)",
                (ps, a) -> {
                    ps.setLong(1, a.getId());
                    ps.setString(2, a.getName());
                });
    }

    public InsertStatement<AccountGroup> accountGroup() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.ACCOUNT_GROUP) + " (id, name) VALUES (?, ?)",
                (ps, g) -> {
                    ps.setLong(1, g.getId());
                    ps.setString(2, g.getName());
                });
    }

    public InsertStatement<AccountGroupLink> accountGroupLink() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.ACCOUNT_TO_ACCOUNT_GROUP)
                        + " (account_id, account_group_id) VALUES (?, ?)",
                (ps, l) -> {
                    ps.setLong(1, l.getAccountId());
                    ps.setLong(2, l.getAccountGroupId());
                });
    }

    public InsertStatement<Skill> skill() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.SKILL)
                        + " (id, code, translation_type, source_language, target_language) VALUES (?, ?, ?, ?, ?)",
                (ps, s) -> {
                    ps.setLong(1, s.getId());
                    ps.setString(2, s.getCode());
                    ps.setString(3, s.getTranslationType().name());
                    ps.setString(4, s.getSourceLanguage());
                    ps.setString(5, s.getTargetLanguage());
                });
    }

    public InsertStatement<AccountSkillLink> accountSkillLink() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.ACCOUNT_SKILL)
                        + " (account_id, skill_id, skill_code) VALUES (?, ?, ?)",
                (ps, l) -> {
                    ps.setLong(1, l.getAccountId());
                    ps.setLong(2, l.getSkillId());
                    ps.setString(3, l.getSkillCode());
                });
    }

    public InsertStatement<Task> task() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.TASK) + " (id) VALUES (?)",
                (ps, t) -> ps.setLong(1, t.getId()));
    }

    public InsertStatement<DistributionGroup> distributionGroup() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.DISTRIBUTION_GROUP) + " (id, state) VALUES (?, ?)",
                (ps, dg) -> {
                    ps.setLong(1, dg.getId());
                    ps.setString(2, dg.getState().name());
                });
    }

    public InsertStatement<DistributionGroupTaskLink> distributionGroupTask() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.DISTRIBUTION_GROUP_TASK)
                        + " (id, distribution_group_id, task_id) VALUES (?, ?, ?)",
                (ps, l) -> {
                    ps.setLong(1, l.getId());
                    ps.setLong(2, l.getDistributionGroupId());
                    ps.setLong(3, l.getTaskId());
                });
    }

    public InsertStatement<DistributionGroupMatching> distributionGroupMatching() {
        return new InsertStatement<>(
                "INSERT INTO " + table(DatasetTable.DISTRIBUTION_GROUP_MATCHING)
                        + " (id, distribution_group_id, pointer, type) VALUES (?, ?, ?, ?)",
                (ps, m) -> {
                    ps.setLong(1, m.getId());
                    ps.setLong(2, m.getDistributionGroupId());
                    ps.setString(3, m.getPointer().toStoreValue());
                    ps.setString(4, m.getType().name());
                });
    }

    /** Truncation statements for all tables of the given variants, dependents first. */
    public static List<String> truncateStatements(List<SchemaVariant> variants, TruncateMode mode) {
        List<String> tables = new ArrayList<>();
        for (SchemaVariant v : variants) {
            for (DatasetTable t : DatasetTable.reverseDependencyOrder()) {
                tables.add(t.qualifiedName(v));
            }
        }
        if (mode == TruncateMode.CASCADE) {
            return List.of("TRUNCATE TABLE " + String.join(", ", tables) + " RESTART IDENTITY CASCADE");
        }
        return tables.stream()
                .map(t -> "TRUNCATE TABLE " + t + " RESTART IDENTITY")
                .collect(Collectors.toList());
    }
}
