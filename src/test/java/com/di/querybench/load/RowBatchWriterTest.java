package com.di.querybench.load;

import com.di.querybench.exception.DatasetLoadException;
import com.di.querybench.load.generator.AccountGenerator;
import com.di.querybench.model.Account;
import com.di.querybench.schema.SchemaVariant;
import com.di.querybench.support.H2TestDatabase;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RowBatchWriter Tests")
class RowBatchWriterTest {

    private static H2TestDatabase db;

    private final InsertStatement<Account> insert = new DatasetStatements(SchemaVariant.BASE).account();

    @BeforeAll
    static void startDatabase() {
        db = new H2TestDatabase();
    }

    @AfterAll
    static void stopDatabase() {
        db.close();
    }

    @BeforeEach
    void clear() {
        db.jdbc().execute("TRUNCATE TABLE account RESTART IDENTITY");
    }

    private static BatchProducer<Account> accounts(AccountGenerator generator, List<Long> batchStarts) {
        return (from, size) -> {
            batchStarts.add(from);
            return LongStream.range(from, from + size).mapToObj(generator::generate).collect(Collectors.toList());
        };
    }

    @Test
    @DisplayName("Should write all rows in batches of at most batchSize")
    void testWriteBatches_AllRows() {
        List<Long> starts = new ArrayList<>();
        RowBatchWriter writer = new RowBatchWriter(db.jdbc(), 2);

        long written = writer.writeBatches("account", 25, 10, accounts(new AccountGenerator(25), starts), insert);

        assertEquals(25L, written);
        assertEquals(25L, db.count("account"));
        assertEquals(List.of(0L, 10L, 20L), starts);
        assertEquals("Account_25", db.jdbc().queryForObject("SELECT name FROM account WHERE id = 25", String.class));
    }

    @Test
    @DisplayName("Should write nothing for a zero count")
    void testWriteBatches_Empty() {
        List<Long> starts = new ArrayList<>();
        long written = new RowBatchWriter(db.jdbc(), 1)
                .writeBatches("account", 0, 10, accounts(new AccountGenerator(0), starts), insert);

        assertEquals(0L, written);
        assertTrue(starts.isEmpty());
    }

    @Test
    @DisplayName("Should wrap a failing batch with entity label and batch number")
    void testWriteBatches_FailingBatch() {
        // third batch repeats ids 1..10
        BatchProducer<Account> producer = (from, size) -> LongStream.range(from, from + size)
                .map(i -> from >= 20 ? i - 20 : i)
                .mapToObj(i -> new Account(i + 1, "Account_" + (i + 1)))
                .collect(Collectors.toList());

        DatasetLoadException ex = assertThrows(DatasetLoadException.class,
                () -> new RowBatchWriter(db.jdbc(), 10).writeBatches("account", 30, 10, producer, insert));

        assertEquals("account", ex.getEntityLabel());
        assertEquals(3L, ex.getBatchNumber());
        assertInstanceOf(DataAccessException.class, ex.getCause());
        assertEquals(20L, db.count("account"));
    }

    @Test
    @DisplayName("Should reject invalid batch settings")
    void testWriteBatches_InvalidArguments() {
        RowBatchWriter writer = new RowBatchWriter(db.jdbc(), 1);
        List<Long> starts = new ArrayList<>();
        assertThrows(IllegalArgumentException.class,
                () -> writer.writeBatches("account", 5, 0, accounts(new AccountGenerator(5), starts), insert));
        assertThrows(IllegalArgumentException.class, () -> new RowBatchWriter(db.jdbc(), 0));
    }
}
