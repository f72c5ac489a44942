package com.di.querybench.load.generator;

import com.di.querybench.exception.MissingReferenceException;
import com.di.querybench.load.EntityRef;
import com.di.querybench.load.EntityType;
import com.di.querybench.load.ReferenceIndex;
import com.di.querybench.model.AccountGroupLink;
import com.di.querybench.model.AccountSkillLink;
import com.di.querybench.model.Skill;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Membership Generator Tests")
class MembershipGeneratorTest {

    private static ReferenceIndex index(int accounts, int groups, int skills) {
        ReferenceIndex index = new ReferenceIndex();
        index.register(EntityType.ACCOUNT, refs(accounts));
        index.register(EntityType.ACCOUNT_GROUP, refs(groups));
        SkillGenerator generator = new SkillGenerator(skills);
        List<EntityRef> skillRefs = new ArrayList<>();
        for (long i = 0; i < generator.count(); i++) {
            Skill s = generator.generate(i);
            skillRefs.add(new EntityRef(s.getId(), s.getCode()));
        }
        index.register(EntityType.SKILL, skillRefs);
        return index;
    }

    private static List<EntityRef> refs(int n) {
        List<EntityRef> out = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            out.add(EntityRef.of(i));
        }
        return out;
    }

    // ============================================================================
    // Account -> group
    // ============================================================================

    @Test
    @DisplayName("Should give every account 1..3 distinct existing groups")
    void testGroupMemberships_Bounds() {
        AccountGroupMembershipGenerator generator = new AccountGroupMembershipGenerator(index(200, 20, 10));
        Random random = new Random(42);
        Set<Integer> sizes = new HashSet<>();
        for (long i = 0; i < generator.accountCount(); i++) {
            List<AccountGroupLink> links = generator.generate(i, random);
            sizes.add(links.size());
            assertTrue(links.size() >= 1 && links.size() <= 3, "size " + links.size());
            Set<Long> groups = links.stream().map(AccountGroupLink::getAccountGroupId).collect(Collectors.toSet());
            assertEquals(links.size(), groups.size(), "duplicate group for account " + (i + 1));
            for (AccountGroupLink l : links) {
                assertEquals(i + 1, l.getAccountId());
                assertTrue(l.getAccountGroupId() >= 1 && l.getAccountGroupId() <= 20);
            }
        }
        assertEquals(Set.of(1, 2, 3), sizes);
    }

    @Test
    @DisplayName("Should cap memberships at the number of groups")
    void testGroupMemberships_SingleGroup() {
        AccountGroupMembershipGenerator generator = new AccountGroupMembershipGenerator(index(50, 1, 1));
        Random random = new Random(7);
        for (long i = 0; i < generator.accountCount(); i++) {
            List<AccountGroupLink> links = generator.generate(i, random);
            assertEquals(1, links.size());
            assertEquals(1L, links.get(0).getAccountGroupId());
        }
    }

    @Test
    @DisplayName("Should reproduce the same memberships for the same seed")
    void testGroupMemberships_Reproducible() {
        ReferenceIndex index = index(30, 10, 10);
        assertEquals(allGroupLinks(index, 99), allGroupLinks(index, 99));
        assertNotEquals(allGroupLinks(index, 99), allGroupLinks(index, 100));
    }

    private static List<AccountGroupLink> allGroupLinks(ReferenceIndex index, long seed) {
        AccountGroupMembershipGenerator generator = new AccountGroupMembershipGenerator(index);
        Random random = new Random(seed);
        List<AccountGroupLink> out = new ArrayList<>();
        for (long i = 0; i < generator.accountCount(); i++) {
            out.addAll(generator.generate(i, random));
        }
        return out;
    }

    // ============================================================================
    // Account -> skill
    // ============================================================================

    @Test
    @DisplayName("Should give every account 1..5 distinct skills with the skill's own code")
    void testSkillMemberships_BoundsAndCode() {
        ReferenceIndex index = index(200, 5, 50);
        Map<Long, String> codeById = new HashMap<>();
        index.resolve(EntityType.SKILL).forEach(r -> codeById.put(r.getId(), r.getCode()));

        AccountSkillMembershipGenerator generator = new AccountSkillMembershipGenerator(index);
        Random random = new Random(42);
        for (long i = 0; i < generator.accountCount(); i++) {
            List<AccountSkillLink> links = generator.generate(i, random);
            assertTrue(links.size() >= 1 && links.size() <= 5, "size " + links.size());
            assertEquals(links.size(), links.stream().map(AccountSkillLink::getSkillId).distinct().count());
            for (AccountSkillLink l : links) {
                assertEquals(codeById.get(l.getSkillId()), l.getSkillCode());
            }
        }
    }

    @Test
    @DisplayName("Should fail with a dependency error when skills are not loaded")
    void testSkillMemberships_MissingSkills() {
        ReferenceIndex index = new ReferenceIndex();
        index.register(EntityType.ACCOUNT, refs(3));

        MissingReferenceException ex = assertThrows(MissingReferenceException.class,
                () -> new AccountSkillMembershipGenerator(index));
        assertEquals(EntityType.SKILL, ex.getEntityType());
    }

    @Test
    @DisplayName("Should reject account indexes outside the loaded range")
    void testSkillMemberships_IndexOutOfRange() {
        AccountSkillMembershipGenerator generator = new AccountSkillMembershipGenerator(index(3, 1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> generator.generate(3, new Random()));
    }

    // ============================================================================
    // Sampler
    // ============================================================================

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 3, 10})
    @DisplayName("Should draw k distinct positions within the population")
    void testSample_Distinct(int k) {
        int[] drawn = DistinctSampler.sample(10, k, new Random(1));
        assertEquals(k, drawn.length);
        Set<Integer> seen = new HashSet<>();
        for (int v : drawn) {
            assertTrue(v >= 0 && v < 10);
            assertTrue(seen.add(v));
        }
    }

    @Test
    @DisplayName("Should reject drawing more than the population")
    void testSample_TooMany() {
        assertThrows(IllegalArgumentException.class, () -> DistinctSampler.sample(2, 3, new Random()));
    }
}
