package com.di.querybench.config;

import com.di.querybench.benchmark.QueryShape;
import com.di.querybench.benchmark.QueryStrategy;
import com.di.querybench.load.LoadConfig;
import com.di.querybench.load.TruncateMode;
import com.di.querybench.schema.SchemaVariant;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Settings bound from {@code querybench.*} in application.yml.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "querybench")
public class QueryBenchProperties {

    @Valid
    private Load      load      = new Load();
    @Valid
    private Benchmark benchmark = new Benchmark();
    private Session   session   = new Session();

    @Data
    public static class Load {
        @Min(1)
        private int          accountCount           = 100;
        @Min(1)
        private int          accountGroupCount      = 20;
        @Min(1)
        private int          skillCount             = 50;
        /** Also the task count. */
        @Min(1)
        private long         distributionGroupCount = 1_000_000L;
        @Min(1)
        private int          batchSize              = LoadConfig.DEFAULT_BATCH_SIZE;
        @Min(1)
        private int          progressEveryBatches   = 10;
        private long         seed                   = 42L;
        @NotNull
        private TruncateMode truncateMode           = TruncateMode.CASCADE;
        private List<String> schemaVariants         = new ArrayList<>(List.of("base", "indexed"));
    }

    @Data
    public static class Benchmark {
        @Min(1)
        private int          iterationsPerStrategy = 20;
        @PositiveOrZero
        private int          pageSize              = 100;
        @PositiveOrZero
        private int          offset                = 0;
        private List<String> strategies            = new ArrayList<>(List.of(
                "outer-join-and-group@base",
                "union-of-inner-joins@base",
                "union-of-inner-joins@indexed"));
        /** Strategy served by GET /api/distribution-groups/slow. */
        private String       slowStrategy          = "union-of-inner-joins@base";
        /** Strategy served by GET /api/distribution-groups/fast. */
        private String       fastStrategy          = "outer-join-and-group@indexed";
        /** Optional path the JSON summary is written to; blank disables the file. */
        private String       summaryFile;
        /** Text type ids are cast to before matching; H2 needs VARCHAR. */
        @Pattern(regexp = "[A-Za-z]+( [A-Za-z]+)*")
        private String       idCastType            = QueryShape.DEFAULT_ID_CAST_TYPE;
    }

    @Data
    public static class Session {
        private boolean runOnStartup          = false;
        private boolean reloadBeforeBenchmark = true;
    }

    public LoadConfig toLoadConfig() {
        return LoadConfig.builder()
                .accountCount(load.accountCount)
                .accountGroupCount(load.accountGroupCount)
                .skillCount(load.skillCount)
                .distributionGroupCount(load.distributionGroupCount)
                .batchSize(load.batchSize)
                .progressEveryBatches(load.progressEveryBatches)
                .seed(load.seed)
                .truncateMode(load.truncateMode)
                .schemaVariants(load.schemaVariants.stream().map(SchemaVariant::fromId).collect(Collectors.toList()))
                .build();
    }

    public List<QueryStrategy> benchmarkStrategies() {
        return benchmark.strategies.stream().map(QueryStrategy::parse).collect(Collectors.toList());
    }
}
