package com.di.querybench.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Tagged target of a distribution-group matching: an account id, an account-group id or a
 * skill code. The store keeps every variant as text; {@link #toStoreValue()} is the only
 * place that conversion happens.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class MatchingPointer {

    @Getter
    private final MatchingType type;
    private final long id;
    private final String code;

    public static MatchingPointer account(long accountId) {
        requirePositive(accountId, "accountId");
        return new MatchingPointer(MatchingType.ACCOUNT_ID, accountId, null);
    }

    public static MatchingPointer accountGroup(long accountGroupId) {
        requirePositive(accountGroupId, "accountGroupId");
        return new MatchingPointer(MatchingType.ACCOUNT_GROUP_ID, accountGroupId, null);
    }

    public static MatchingPointer skillCode(String skillCode) {
        if (skillCode == null || skillCode.isBlank()) {
            throw new IllegalArgumentException("skillCode is required");
        }
        return new MatchingPointer(MatchingType.SKILL_CODE, 0L, skillCode);
    }

    /**
     * Numeric target id.
     *
     * @throws IllegalStateException for {@link MatchingType#SKILL_CODE} pointers
     */
    public long getId() {
        if (type == MatchingType.SKILL_CODE) {
            throw new IllegalStateException("SKILL_CODE pointer has no numeric id");
        }
        return id;
    }

    /**
     * Skill code target.
     *
     * @throws IllegalStateException for id-based pointers
     */
    public String getCode() {
        if (type != MatchingType.SKILL_CODE) {
            throw new IllegalStateException(type + " pointer has no skill code");
        }
        return code;
    }

    /** Text form written to {@code distribution_group_matching.pointer}. */
    public String toStoreValue() {
        return type == MatchingType.SKILL_CODE ? code : Long.toString(id);
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    @Override
    public String toString() {
        return type + "(" + toStoreValue() + ")";
    }
}
