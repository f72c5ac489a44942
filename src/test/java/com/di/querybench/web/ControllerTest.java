package com.di.querybench.web;

import com.di.querybench.benchmark.BenchmarkRunner;
import com.di.querybench.config.QueryBenchProperties;
import com.di.querybench.exception.GlobalExceptionHandler;
import com.di.querybench.load.DatasetGuard;
import com.di.querybench.load.DatasetLoader;
import com.di.querybench.load.TruncateMode;
import com.di.querybench.load.validation.DatasetVerifier;
import com.di.querybench.report.ComparativeReport;
import com.di.querybench.session.BenchmarkSession;
import com.di.querybench.support.H2TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface against H2, with the controller advice in place.
 */
@DisplayName("Controller Tests")
class ControllerTest {

    private H2TestDatabase db;
    private MockMvc        mvc;
    private DatasetGuard   guard;

    @BeforeEach
    void setUp() {
        db = new H2TestDatabase();
        QueryBenchProperties properties = new QueryBenchProperties();
        properties.getLoad().setAccountCount(5);
        properties.getLoad().setAccountGroupCount(2);
        properties.getLoad().setSkillCount(3);
        properties.getLoad().setDistributionGroupCount(60);
        properties.getLoad().setTruncateMode(TruncateMode.PER_TABLE);
        properties.getBenchmark().setIterationsPerStrategy(2);

        guard  = new DatasetGuard();
        DatasetLoader   loader = new DatasetLoader(db.jdbc(), db.tx(), guard);
        BenchmarkRunner runner = new BenchmarkRunner(db.jdbc(), H2TestDatabase.ID_CAST_TYPE);
        BenchmarkSession session = new BenchmarkSession(properties, loader, new DatasetVerifier(db.jdbc()),
                runner, new ComparativeReport(), guard, db.dataSource());

        mvc = MockMvcBuilders
                .standaloneSetup(new DistributionGroupController(runner, properties, db.jdbc(), guard),
                                 new BenchmarkController(loader, session, properties))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    @DisplayName("Should report a healthy database")
    void testHealth() throws Exception {
        mvc.perform(get("/api/distribution-groups/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.dbCheck").value(true));
    }

    @Test
    @DisplayName("Should serve pages through the slow and fast strategies after a reload")
    void testSlowAndFast() throws Exception {
        mvc.perform(post("/api/benchmark/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowsWritten.distribution_group").value(60));

        mvc.perform(get("/api/distribution-groups/slow").param("limit", "10").param("offset", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(10))
                .andExpect(jsonPath("$.data[0].id").value(6));

        mvc.perform(get("/api/distribution-groups/fast"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(60));
    }

    @Test
    @DisplayName("Should map an invalid page size to 400")
    void testInvalidLimit() throws Exception {
        mvc.perform(get("/api/distribution-groups/fast").param("limit", "-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should map a benchmark on an empty dataset to 409")
    void testRunOnEmptyDataset() throws Exception {
        mvc.perform(post("/api/benchmark/run").param("reload", "false"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCategory").value("INCOMPLETE_DATASET"))
                .andExpect(jsonPath("$.details.variant").value("base"));
    }

    @Test
    @DisplayName("Should run a full session and return the summary")
    void testRunWithReload() throws Exception {
        mvc.perform(post("/api/benchmark/run").param("reload", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats['union-of-inner-joins@indexed'].samples").value(2))
                .andExpect(jsonPath("$.ratios.length()").value(6));
    }

    @Test
    @DisplayName("Should hold a page query until the running reload releases the dataset")
    void testFastWaitsForReload() throws Exception {
        mvc.perform(post("/api/benchmark/reload")).andExpect(status().isOk());

        Lock reload = guard.reloadLock();
        reload.lock();
        CompletableFuture<MvcResult> request;
        try {
            request = CompletableFuture.supplyAsync(() -> {
                try {
                    return mvc.perform(get("/api/distribution-groups/fast").param("limit", "5")).andReturn();
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            });
            Thread.sleep(300);
            assertFalse(request.isDone());
        } finally {
            reload.unlock();
        }

        MvcResult result = request.get(10, TimeUnit.SECONDS);
        assertEquals(200, result.getResponse().getStatus());
        assertTrue(result.getResponse().getContentAsString().contains("\"count\":5"));
    }
}
