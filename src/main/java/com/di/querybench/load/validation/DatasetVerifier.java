package com.di.querybench.load.validation;

import com.di.querybench.exception.IncompleteDatasetException;
import com.di.querybench.load.LoadConfig;
import com.di.querybench.load.generator.AccountGroupMembershipGenerator;
import com.di.querybench.load.generator.AccountSkillMembershipGenerator;
import com.di.querybench.model.DistributionGroupState;
import com.di.querybench.model.MatchingType;
import com.di.querybench.schema.DatasetTable;
import com.di.querybench.schema.SchemaVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Row-count reconciliation between a load configuration and the stored dataset.
 *
 * <p>Checks exact counts of the entity tables and the 1:1 link tables, the membership
 * bounds of the account link tables, the all-WAITING state, and the three-way split of
 * matching types. A reload that failed half way, or a dataset loaded with another
 * configuration, fails at least one check.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DatasetVerifier {

    private final JdbcTemplate jdbc;

    public VerificationResult verify(LoadConfig config, SchemaVariant variant) {
        long accounts = config.getAccountCount();
        long dgs      = config.getDistributionGroupCount();
        List<TableCheck> checks = new ArrayList<>();

        checks.add(exact(variant, DatasetTable.ACCOUNT, accounts));
        checks.add(exact(variant, DatasetTable.ACCOUNT_GROUP, config.getAccountGroupCount()));
        checks.add(exact(variant, DatasetTable.SKILL, config.getSkillCount()));
        checks.add(range(variant, DatasetTable.ACCOUNT_TO_ACCOUNT_GROUP, accounts,
                accounts * Math.min(AccountGroupMembershipGenerator.MAX_GROUPS_PER_ACCOUNT, config.getAccountGroupCount())));
        checks.add(range(variant, DatasetTable.ACCOUNT_SKILL, accounts,
                accounts * Math.min(AccountSkillMembershipGenerator.MAX_SKILLS_PER_ACCOUNT, config.getSkillCount())));
        checks.add(exact(variant, DatasetTable.TASK, config.getTaskCount()));
        checks.add(exact(variant, DatasetTable.DISTRIBUTION_GROUP, dgs));
        checks.add(exact(variant, DatasetTable.DISTRIBUTION_GROUP_TASK, dgs));
        checks.add(exact(variant, DatasetTable.DISTRIBUTION_GROUP_MATCHING, dgs));

        checks.add(TableCheck.builder()
                .name(DatasetTable.DISTRIBUTION_GROUP.qualifiedName(variant) + "[state=WAITING]")
                .expectedMin(dgs).expectedMax(dgs)
                .actual(count("SELECT COUNT(*) FROM " + DatasetTable.DISTRIBUTION_GROUP.qualifiedName(variant)
                        + " WHERE state = ?", DistributionGroupState.WAITING.name()))
                .build());

        long lowShare  = dgs / MatchingType.values().length;
        long highShare = lowShare + (dgs % MatchingType.values().length == 0 ? 0 : 1);
        for (MatchingType type : MatchingType.values()) {
            checks.add(TableCheck.builder()
                    .name(DatasetTable.DISTRIBUTION_GROUP_MATCHING.qualifiedName(variant) + "[type=" + type + "]")
                    .expectedMin(lowShare).expectedMax(highShare)
                    .actual(count("SELECT COUNT(*) FROM " + DatasetTable.DISTRIBUTION_GROUP_MATCHING.qualifiedName(variant)
                            + " WHERE type = ?", type.name()))
                    .build());
        }

        VerificationResult result = VerificationResult.builder().variant(variant).checks(checks).build();
        for (TableCheck c : checks) {
            if (c.isPassed()) {
                log.debug("[VERIFY] {}", c.describe());
            } else {
                log.warn("[VERIFY] {}", c.describe());
            }
        }
        log.info("[VERIFY] variant={} {}", variant.getId(), result.isPassed() ? "complete" : "INCOMPLETE");
        return result;
    }

    /**
     * @throws IncompleteDatasetException when any check fails
     */
    public VerificationResult requireComplete(LoadConfig config, SchemaVariant variant) {
        VerificationResult result = verify(config, variant);
        if (!result.isPassed()) {
            throw new IncompleteDatasetException(result);
        }
        return result;
    }

    private TableCheck exact(SchemaVariant variant, DatasetTable table, long expected) {
        return range(variant, table, expected, expected);
    }

    private TableCheck range(SchemaVariant variant, DatasetTable table, long min, long max) {
        String name = table.qualifiedName(variant);
        return TableCheck.builder()
                .name(name)
                .expectedMin(min)
                .expectedMax(max)
                .actual(count("SELECT COUNT(*) FROM " + name))
                .build();
    }

    private long count(String sql, Object... args) {
        Long cnt = jdbc.queryForObject(sql, Long.class, args);
        return cnt == null ? 0L : cnt;
    }
}
