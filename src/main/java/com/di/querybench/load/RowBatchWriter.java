package com.di.querybench.load;

import com.di.querybench.exception.DatasetLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Writes an entity in fixed-size JDBC batches.
 *
 * <p>Only one batch of payloads is materialized at a time. A failing batch is fatal to the
 * whole load: the error is rethrown as {@link DatasetLoadException} and nothing is retried,
 * because a retried bulk write could leave duplicate or partial rows behind.
 */
@Slf4j
public class RowBatchWriter {

    private final JdbcTemplate jdbc;
    private final int          progressEveryBatches;

    public RowBatchWriter(JdbcTemplate jdbc, int progressEveryBatches) {
        if (progressEveryBatches < 1) {
            throw new IllegalArgumentException("progressEveryBatches must be >= 1");
        }
        this.jdbc                 = jdbc;
        this.progressEveryBatches = progressEveryBatches;
    }

    /**
     * Writes logical indexes {@code [0, totalCount)} of an entity.
     *
     * @param entityLabel table name used in progress lines and errors
     * @param totalCount  number of logical indexes to produce
     * @param batchSize   logical indexes per batch
     * @param rowProducer materializes the rows of one batch
     * @param statement   INSERT and binder for the payload type
     * @return number of rows written (may exceed {@code totalCount} for memberships)
     * @throws DatasetLoadException when any batch insert fails
     */
    public <T> long writeBatches(String            entityLabel,
                                 long              totalCount,
                                 int               batchSize,
                                 BatchProducer<T>  rowProducer,
                                 InsertStatement<T> statement) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (totalCount < 0) {
            throw new IllegalArgumentException("totalCount must be >= 0");
        }

        long startMs     = System.currentTimeMillis();
        long written     = 0;
        long batchNumber = 0;

        for (long from = 0; from < totalCount; from += batchSize) {
            int size = (int) Math.min(batchSize, totalCount - from);
            batchNumber++;
            List<T> rows = rowProducer.produce(from, size);
            try {
                jdbc.batchUpdate(statement.getSql(), rows, rows.size(), statement.getBinder());
            } catch (DataAccessException ex) {
                log.error("[BATCH] {} batch {} (indexes {}..{}) failed: {}",
                          entityLabel, batchNumber, from, from + size - 1, ex.getMessage());
                throw new DatasetLoadException(entityLabel, batchNumber, ex);
            }
            written += rows.size();

            if (batchNumber % progressEveryBatches == 0) {
                log.info("[BATCH] {}: {} / {} indexes, {} rows written",
                         entityLabel, from + size, totalCount, written);
            }
        }

        log.info("[BATCH] {} done: {} rows in {} batches ({} ms)",
                 entityLabel, written, batchNumber, System.currentTimeMillis() - startMs);
        return written;
    }
}
