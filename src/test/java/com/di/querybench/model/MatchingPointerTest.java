package com.di.querybench.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MatchingPointer Tests")
class MatchingPointerTest {

    @Test
    @DisplayName("Should store id pointers as decimal text")
    void testToStoreValue_Ids() {
        assertEquals("17", MatchingPointer.account(17).toStoreValue());
        assertEquals("3", MatchingPointer.accountGroup(3).toStoreValue());
        assertEquals(MatchingType.ACCOUNT_GROUP_ID, MatchingPointer.accountGroup(3).getType());
    }

    @Test
    @DisplayName("Should store skill pointers as the code")
    void testToStoreValue_SkillCode() {
        MatchingPointer pointer = MatchingPointer.skillCode("SKILL_EN_KO");
        assertEquals("SKILL_EN_KO", pointer.toStoreValue());
        assertEquals("SKILL_EN_KO", pointer.getCode());
        assertThrows(IllegalStateException.class, pointer::getId);
    }

    @Test
    @DisplayName("Should not expose a code on id pointers")
    void testGetCode_IdPointer() {
        assertThrows(IllegalStateException.class, () -> MatchingPointer.account(1).getCode());
    }

    @Test
    @DisplayName("Should reject non-positive ids and blank codes")
    void testFactories_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> MatchingPointer.account(0));
        assertThrows(IllegalArgumentException.class, () -> MatchingPointer.accountGroup(-2));
        assertThrows(IllegalArgumentException.class, () -> MatchingPointer.skillCode(" "));
    }

    @Test
    @DisplayName("Should compare by type and target")
    void testEquals() {
        assertEquals(MatchingPointer.account(5), MatchingPointer.account(5));
        assertNotEquals(MatchingPointer.account(5), MatchingPointer.accountGroup(5));
        assertEquals(MatchingPointer.skillCode("SKILL_KO_EN").hashCode(), MatchingPointer.skillCode("SKILL_KO_EN").hashCode());
        assertEquals("ACCOUNT_ID(5)", MatchingPointer.account(5).toString());
    }

    @Test
    @DisplayName("Should deduplicate equal pointers in hashed collections")
    void testHashCode_SetMembership() {
        Set<MatchingPointer> pointers = Set.of(
                MatchingPointer.account(5),
                MatchingPointer.accountGroup(5),
                MatchingPointer.skillCode("SKILL_EN_ES"));

        assertTrue(pointers.contains(MatchingPointer.account(5)));
        assertTrue(pointers.contains(MatchingPointer.skillCode("SKILL_EN_ES")));
        assertFalse(pointers.contains(MatchingPointer.account(6)));
        assertFalse(pointers.contains(MatchingPointer.skillCode("SKILL_ES_EN")));
    }
}
