package com.di.querybench.load;

import com.di.querybench.exception.DatasetLoadException;
import com.di.querybench.load.generator.AccountGenerator;
import com.di.querybench.load.generator.AccountGroupGenerator;
import com.di.querybench.load.generator.AccountGroupMembershipGenerator;
import com.di.querybench.load.generator.AccountSkillMembershipGenerator;
import com.di.querybench.load.generator.DistributionGroupGenerator;
import com.di.querybench.load.generator.DistributionGroupMatchingGenerator;
import com.di.querybench.load.generator.DistributionGroupTaskLinkGenerator;
import com.di.querybench.load.generator.MembershipGenerator;
import com.di.querybench.load.generator.RowGenerator;
import com.di.querybench.load.generator.SkillGenerator;
import com.di.querybench.load.generator.TaskGenerator;
import com.di.querybench.schema.DatasetTable;
import com.di.querybench.schema.SchemaVariant;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * Truncates and regenerates the whole benchmark dataset.
 *
 * <pre>
 *  validate config            (nothing written on failure)
 *  ── one transaction ──────────────────────────────────────────────
 *  TRUNCATE all tables of all variants, dependents first
 *  per variant:
 *    account, account_group, skill, task, distribution_group
 *    account_to_account_group, account_skill          (seeded random)
 *    distribution_group_task, distribution_group_matching
 *  ─────────────────────────────────────────────────────────────────
 * </pre>
 *
 * <p>Each variant gets a fresh {@link ReferenceIndex} and a fresh {@link Random} seeded with
 * {@link LoadConfig#getSeed()}, so the indexed shadow copy receives exactly the rows of the
 * base copy. Any failure rolls the transaction back and propagates.
 */
@Service
@Slf4j
public class DatasetLoader {

    private final JdbcTemplate        jdbc;
    private final TransactionTemplate tx;
    private final DatasetGuard        guard;

    public DatasetLoader(JdbcTemplate jdbc, TransactionTemplate tx, DatasetGuard guard) {
        this.jdbc  = jdbc;
        this.tx    = tx;
        this.guard = guard;
    }

    /**
     * Reloads the dataset for every configured schema variant.
     *
     * @throws com.di.querybench.exception.DatasetConfigurationException before any write
     * @throws DatasetLoadException when the store rejects a statement
     */
    public LoadReport reload(LoadConfig config) {
        config.validate();

        String runId = UUID.randomUUID().toString();
        Lock lock = guard.reloadLock();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("runId", runId)) {
            lock.lock();
            try {
                return loadAll(config, runId);
            } catch (RuntimeException ex) {
                log.error("[LOAD] runId={} FAILED, transaction rolled back: {}", runId, ex.getMessage());
                throw ex;
            } finally {
                lock.unlock();
            }
        }
    }

    /* ==================================================================== */
    /* Phases                                                                */
    /* ==================================================================== */

    private LoadReport loadAll(LoadConfig config, String runId) {
        long startMs = System.currentTimeMillis();
        List<SchemaVariant> variants = config.effectiveVariants();
        log.info("[LOAD] runId={} variants={} accounts={} groups={} skills={} distributionGroups={} batchSize={} seed={}",
                 runId, variants, config.getAccountCount(), config.getAccountGroupCount(),
                 config.getSkillCount(), config.getDistributionGroupCount(),
                 config.getBatchSize(), config.getSeed());

        Map<String, Long> written = tx.execute(status -> {
            truncate(variants, config.getTruncateMode());
            Map<String, Long> counts = new LinkedHashMap<>();
            for (SchemaVariant variant : variants) {
                counts.putAll(loadVariant(config, variant));
            }
            return counts;
        });

        long elapsedMs = System.currentTimeMillis() - startMs;
        log.info("[LOAD] runId={} completed in {} s", runId, String.format("%.1f", elapsedMs / 1000.0));
        return LoadReport.builder()
                .runId(runId)
                .seed(config.getSeed())
                .variants(variants)
                .rowsWritten(written)
                .elapsedMs(elapsedMs)
                .build();
    }

    private void truncate(List<SchemaVariant> variants, TruncateMode mode) {
        log.info("[LOAD] clearing existing data ({})", mode);
        for (String sql : DatasetStatements.truncateStatements(variants, mode)) {
            try {
                jdbc.execute(sql);
            } catch (DataAccessException ex) {
                throw new DatasetLoadException("Truncate failed: " + sql, ex);
            }
        }
    }

    private Map<String, Long> loadVariant(LoadConfig config, SchemaVariant variant) {
        DatasetStatements sql    = new DatasetStatements(variant);
        RowBatchWriter    writer = new RowBatchWriter(jdbc, config.getProgressEveryBatches());
        ReferenceIndex    refs   = new ReferenceIndex();
        Random            random = new Random(config.getSeed());
        int               batch  = config.getBatchSize();
        Map<String, Long> counts = new LinkedHashMap<>();

        log.info("[LOAD] variant={} started", variant.getId());

        // ── independent entities ───────────────────────────────────────
        AccountGenerator accounts = new AccountGenerator(config.getAccountCount());
        counts.put(sql.table(DatasetTable.ACCOUNT),
                writer.writeBatches(sql.table(DatasetTable.ACCOUNT), accounts.count(), batch, rows(accounts), sql.account()));
        refs.register(EntityType.ACCOUNT, refsOf(accounts, a -> EntityRef.of(a.getId())));

        AccountGroupGenerator groups = new AccountGroupGenerator(config.getAccountGroupCount());
        counts.put(sql.table(DatasetTable.ACCOUNT_GROUP),
                writer.writeBatches(sql.table(DatasetTable.ACCOUNT_GROUP), groups.count(), batch, rows(groups), sql.accountGroup()));
        refs.register(EntityType.ACCOUNT_GROUP, refsOf(groups, g -> EntityRef.of(g.getId())));

        SkillGenerator skills = new SkillGenerator(config.getSkillCount());
        counts.put(sql.table(DatasetTable.SKILL),
                writer.writeBatches(sql.table(DatasetTable.SKILL), skills.count(), batch, rows(skills), sql.skill()));
        refs.register(EntityType.SKILL, refsOf(skills, s -> new EntityRef(s.getId(), s.getCode())));

        TaskGenerator tasks = new TaskGenerator(config.getTaskCount());
        counts.put(sql.table(DatasetTable.TASK),
                writer.writeBatches(sql.table(DatasetTable.TASK), tasks.count(), batch, rows(tasks), sql.task()));
        refs.registerCount(EntityType.TASK, tasks.count());

        DistributionGroupGenerator dgs = new DistributionGroupGenerator(config.getDistributionGroupCount());
        counts.put(sql.table(DatasetTable.DISTRIBUTION_GROUP),
                writer.writeBatches(sql.table(DatasetTable.DISTRIBUTION_GROUP), dgs.count(), batch, rows(dgs), sql.distributionGroup()));
        refs.registerCount(EntityType.DISTRIBUTION_GROUP, dgs.count());

        // ── link / junction tables ─────────────────────────────────────
        AccountGroupMembershipGenerator groupLinks = new AccountGroupMembershipGenerator(refs);
        counts.put(sql.table(DatasetTable.ACCOUNT_TO_ACCOUNT_GROUP),
                writer.writeBatches(sql.table(DatasetTable.ACCOUNT_TO_ACCOUNT_GROUP), groupLinks.accountCount(), batch,
                        memberships(groupLinks, random), sql.accountGroupLink()));

        AccountSkillMembershipGenerator skillLinks = new AccountSkillMembershipGenerator(refs);
        counts.put(sql.table(DatasetTable.ACCOUNT_SKILL),
                writer.writeBatches(sql.table(DatasetTable.ACCOUNT_SKILL), skillLinks.accountCount(), batch,
                        memberships(skillLinks, random), sql.accountSkillLink()));

        DistributionGroupTaskLinkGenerator taskLinks = new DistributionGroupTaskLinkGenerator(refs);
        counts.put(sql.table(DatasetTable.DISTRIBUTION_GROUP_TASK),
                writer.writeBatches(sql.table(DatasetTable.DISTRIBUTION_GROUP_TASK), taskLinks.count(), batch,
                        rows(taskLinks), sql.distributionGroupTask()));

        DistributionGroupMatchingGenerator matchings = new DistributionGroupMatchingGenerator(refs);
        counts.put(sql.table(DatasetTable.DISTRIBUTION_GROUP_MATCHING),
                writer.writeBatches(sql.table(DatasetTable.DISTRIBUTION_GROUP_MATCHING), matchings.count(), batch,
                        rows(matchings), sql.distributionGroupMatching()));

        log.info("[LOAD] variant={} finished: {}", variant.getId(), counts);
        return counts;
    }

    /* ==================================================================== */
    /* Helpers                                                               */
    /* ==================================================================== */

    private static <T> BatchProducer<T> rows(RowGenerator<T> generator) {
        return (from, size) -> LongStream.range(from, from + size)
                .mapToObj(generator::generate)
                .collect(Collectors.toList());
    }

    /** Batches are produced in index order, so the shared random is consumed deterministically. */
    private static <T> BatchProducer<T> memberships(MembershipGenerator<T> generator, Random random) {
        return (from, size) -> {
            List<T> out = new ArrayList<>();
            for (long i = from; i < from + size; i++) {
                out.addAll(generator.generate(i, random));
            }
            return out;
        };
    }

    private static <T> List<EntityRef> refsOf(RowGenerator<T> generator, Function<T, EntityRef> toRef) {
        List<EntityRef> refs = new ArrayList<>((int) generator.count());
        for (long i = 0; i < generator.count(); i++) {
            refs.add(toRef.apply(generator.generate(i)));
        }
        return refs;
    }
}
