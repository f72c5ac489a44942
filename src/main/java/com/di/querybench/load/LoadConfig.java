package com.di.querybench.load;

import com.di.querybench.exception.DatasetConfigurationException;
import com.di.querybench.load.generator.SkillGenerator;
import com.di.querybench.schema.SchemaVariant;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Cardinalities and write settings of one dataset reload.
 *
 * <p>{@code distributionGroupCount} is also the task count; the two tables are kept equal
 * by the 1:1 task link.
 */
@Value
@Builder(toBuilder = true)
public class LoadConfig {

    public static final int DEFAULT_BATCH_SIZE = 10_000;

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    @Min(1)
    @Builder.Default int          accountCount           = 100;
    /** Every account needs a group. */
    @Min(1)
    @Builder.Default int          accountGroupCount      = 20;
    /** Every account needs a skill. */
    @Min(1)
    @Builder.Default int          skillCount             = 50;
    @Min(1)
    @Builder.Default long         distributionGroupCount = 1_000_000L;
    @Min(1)
    @Builder.Default int          batchSize              = DEFAULT_BATCH_SIZE;
    /** A progress line is logged every this many batches. */
    @Min(1)
    @Builder.Default int          progressEveryBatches   = 10;
    /** Seeds the membership randomness; the same seed reproduces the same dataset. */
    @Builder.Default long         seed                   = 42L;
    @NotNull
    @Builder.Default TruncateMode truncateMode           = TruncateMode.CASCADE;
    @Singular        List<SchemaVariant> schemaVariants;

    public long getTaskCount() {
        return distributionGroupCount;
    }

    /** Configured variants, or {@link SchemaVariant#BASE} alone when none were given. */
    public List<SchemaVariant> effectiveVariants() {
        return schemaVariants.isEmpty() ? List.of(SchemaVariant.BASE) : schemaVariants;
    }

    /**
     * Checks every cardinality before anything touches the store. Field bounds come from the
     * constraint annotations; the skill ceiling and variant uniqueness are checked here.
     *
     * @throws DatasetConfigurationException listing every violated rule
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        VALIDATOR.validate(this).stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(LoadConfig::describe)
                .forEach(errors::add);
        if (skillCount > SkillGenerator.maxSkillCount()) {
            errors.add("skillCount " + skillCount + " exceeds the " + SkillGenerator.maxSkillCount()
                    + " codes derivable from " + SkillGenerator.LANGUAGES.size() + " languages");
        }
        if (schemaVariants.stream().distinct().count() != schemaVariants.size()) {
            errors.add("schemaVariants contains duplicates: " + schemaVariants);
        }
        if (!errors.isEmpty()) {
            throw new DatasetConfigurationException("Invalid load configuration: " + String.join("; ", errors));
        }
    }

    private static String describe(ConstraintViolation<LoadConfig> violation) {
        return violation.getPropertyPath() + " " + violation.getMessage() + " (was " + violation.getInvalidValue() + ")";
    }
}
