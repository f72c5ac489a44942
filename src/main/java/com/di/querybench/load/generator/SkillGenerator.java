package com.di.querybench.load.generator;

import com.di.querybench.model.Skill;
import com.di.querybench.model.TranslationType;

import java.util.List;

/**
 * Skills are the ordered language pairs of {@link #LANGUAGES} without self pairs,
 * enumerated source-major: {@code SKILL_EN_KO, SKILL_EN_JA, ..., SKILL_RU_IT}.
 */
public class SkillGenerator implements RowGenerator<Skill> {

    public static final List<String> LANGUAGES =
            List.of("EN", "KO", "JA", "ZH", "ES", "FR", "DE", "PT", "IT", "RU");

    private final long count;

    public SkillGenerator(long count) {
        if (count > maxSkillCount()) {
            throw new IllegalArgumentException("at most " + maxSkillCount() + " skills can be derived, requested " + count);
        }
        this.count = count;
    }

    /** Number of distinct codes the language set yields. */
    public static int maxSkillCount() {
        return LANGUAGES.size() * (LANGUAGES.size() - 1);
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public Skill generate(long index) {
        checkIndex(index);
        int others = LANGUAGES.size() - 1;
        int sourcePos = (int) (index / others);
        int targetPos = (int) (index % others);
        // skip the diagonal
        if (targetPos >= sourcePos) {
            targetPos++;
        }
        String source = LANGUAGES.get(sourcePos);
        String target = LANGUAGES.get(targetPos);
        return new Skill(index + 1, "SKILL_" + source + "_" + target, TranslationType.SUBTITLE, source, target);
    }
}
