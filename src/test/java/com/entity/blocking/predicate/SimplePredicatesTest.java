package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimplePredicatesTest {

    private static Instance instance(String field, Object value) {
        return Instance.of(Map.of(field, value));
    }

    @Nested
    @DisplayName("String field predicates")
    class StringPredicates {

        @Test
        void wholeFieldIsCaseAndWhitespaceInsensitive() {
            WholeFieldPredicate predicate = new WholeFieldPredicate("name");

            assertEquals(Set.of("acme corp"), predicate.apply(instance("name", "  ACME Corp ")));
        }

        @Test
        void firstToken() {
            FirstTokenPredicate predicate = new FirstTokenPredicate("name");

            assertEquals(Set.of("acme"), predicate.apply(instance("name", "Acme   Corporation")));
        }

        @Test
        void emptyOrMissingValueYieldsNoKeys() {
            WholeFieldPredicate predicate = new WholeFieldPredicate("name");

            assertTrue(predicate.apply(instance("name", "  ")).isEmpty());
            assertTrue(predicate.apply(instance("city", "Paris")).isEmpty());
        }

        @Test
        void simplePredicatesDoNotRequireAnIndex() {
            assertFalse(new WholeFieldPredicate("name").requiresIndex());
        }

        @Test
        void targetDoesNotChangeSimplePredicateKeys() {
            FirstTokenPredicate predicate = new FirstTokenPredicate("name");
            Instance acme = instance("name", "acme corp");

            assertEquals(predicate.apply(acme, false), predicate.apply(acme, true));
        }
    }

    @Nested
    @DisplayName("Set field predicates")
    class SetFieldPredicates {

        private final Instance tags = instance("tags", List.of("red", "green", "", "blue"));

        @Test
        void wholeSetIgnoresOrder() {
            WholeSetPredicate predicate = new WholeSetPredicate("tags");

            assertEquals(predicate.apply(tags),
                    predicate.apply(instance("tags", List.of("blue", "red", "green"))));
            assertEquals(Set.of("blue|green|red"), predicate.apply(tags));
        }

        @Test
        void commonElementEmitsOneKeyPerNonEmptyElement() {
            assertEquals(Set.of("red", "green", "blue"), new CommonSetElementPredicate("tags").apply(tags));
        }

        @Test
        void firstAndLastElement() {
            assertEquals(Set.of("red"), new FirstSetElementPredicate("tags").apply(tags));
            assertEquals(Set.of("blue"), new LastSetElementPredicate("tags").apply(tags));
        }

        @Test
        void magnitudeOfCardinality() {
            MagnitudeOfCardinalityPredicate predicate = new MagnitudeOfCardinalityPredicate("tags");

            assertEquals(Set.of("0"), predicate.apply(tags));
            assertEquals(Set.of("1"), predicate.apply(instance("tags",
                    List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j"))));
        }

        @Test
        void setOfOnlyEmptyElementsYieldsNoKeys() {
            Instance blank = instance("tags", List.of("", ""));

            assertTrue(new CommonSetElementPredicate("tags").apply(blank).isEmpty());
            assertTrue(new WholeSetPredicate("tags").apply(blank).isEmpty());
            assertTrue(new MagnitudeOfCardinalityPredicate("tags").apply(blank).isEmpty());
        }

        @Test
        @DisplayName("Separators inside elements do not make different sets collide")
        void wholeSetKeyIsUniquePerSet() {
            WholeSetPredicate predicate = new WholeSetPredicate("tags");

            Set<String> joined = predicate.apply(instance("tags", List.of("a|b")));
            Set<String> split = predicate.apply(instance("tags", List.of("a", "b")));

            assertNotEquals(split, joined);
            assertEquals(Set.of("a\\|b"), joined);
            assertEquals(Set.of("a|b"), split);
        }

        @Test
        void commonTwoElementsEmitsEverySortedPair() {
            assertEquals(Set.of("blue|green", "blue|red", "green|red"),
                    new CommonTwoElementsPredicate("tags").apply(tags));
        }

        @Test
        void commonThreeElementsEmitsEverySortedTriple() {
            Instance four = instance("tags", List.of("d", "b", "a", "c", "a"));

            assertEquals(Set.of("a|b|c", "a|b|d", "a|c|d", "b|c|d"),
                    new CommonThreeElementsPredicate("tags").apply(four));
            assertEquals(Set.of("blue|green|red"), new CommonThreeElementsPredicate("tags").apply(tags));
        }

        @Test
        void tooFewElementsForCombinationYieldsNoKeys() {
            Instance single = instance("tags", List.of("red", "red", ""));

            assertTrue(new CommonTwoElementsPredicate("tags").apply(single).isEmpty());
            assertTrue(new CommonThreeElementsPredicate("tags").apply(instance("tags", List.of("a", "b"))).isEmpty());
        }
    }
}
