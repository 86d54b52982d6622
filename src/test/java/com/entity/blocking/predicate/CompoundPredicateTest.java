package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;
import com.entity.blocking.index.TfidfIndexType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompoundPredicateTest {

    private final Instance record = Instance.of(Map.of(
            "name", "Acme Corp",
            "city", "Paris",
            "tags", List.of("a", "b")));

    @Test
    void singleMemberPassesKeysThrough() {
        CompoundPredicate compound = CompoundPredicate.of(new WholeFieldPredicate("name"));

        assertEquals(Set.of("acme corp"), compound.apply(record));
        assertEquals("WholeFieldPredicate(name)", compound.describe());
    }

    @Test
    void conjunctionCombinesEveryMemberKey() {
        CompoundPredicate compound = CompoundPredicate.of(
                new FirstTokenPredicate("name"), new CommonSetElementPredicate("tags"));

        assertEquals(Set.of("acme:a", "acme:b"), compound.apply(record));
    }

    @Test
    void anyEmptyMemberYieldsNoKeys() {
        CompoundPredicate compound = CompoundPredicate.of(
                new FirstTokenPredicate("name"), new WholeFieldPredicate("zip"));

        assertTrue(compound.apply(record).isEmpty());
    }

    @Test
    void memberKeysContainingColonsAreEscaped() {
        Instance left = Instance.of(Map.of("x", "a:b", "y", "c"));
        Instance right = Instance.of(Map.of("x", "a", "y", "b:c"));
        CompoundPredicate compound = CompoundPredicate.of(
                new WholeFieldPredicate("x"), new WholeFieldPredicate("y"));

        assertNotEquals(compound.apply(left), compound.apply(right));
    }

    @Test
    void requiresIndexWhenAnyMemberDoes() {
        CompoundPredicate simple = CompoundPredicate.of(new WholeFieldPredicate("name"));
        CompoundPredicate indexed = CompoundPredicate.of(new WholeFieldPredicate("name"),
                new CanopyPredicate(TfidfIndexType.TEXT, "name", 0.5));

        assertFalse(simple.requiresIndex());
        assertTrue(indexed.requiresIndex());
    }

    @Test
    void describeListsMembers() {
        CompoundPredicate compound = CompoundPredicate.of(
                new FirstTokenPredicate("name"), new WholeFieldPredicate("city"));

        assertEquals("(FirstTokenPredicate(name), WholeFieldPredicate(city))", compound.describe());
    }

    @Test
    void emptyCompoundRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CompoundPredicate(List.of()));
    }
}
