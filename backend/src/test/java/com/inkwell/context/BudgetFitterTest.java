package com.inkwell.context;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BudgetFitterTest {

    private final BudgetFitter fitter = new BudgetFitter(String::length);

    @Test
    void shouldSelectEverythingWhenBudgetIsLarge() {
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CUSTOM, "a", "aaaa", 200),
                item(ContextItemType.CHAPTER_CONTENT, "b", "bb", 1000));

        BuiltContext result = fitter.fit(candidates, 1_000);

        assertEquals(2, result.getItems().size());
        assertEquals("b", result.getItems().get(0).getId());
        assertEquals("a", result.getItems().get(1).getId());
        assertEquals(6, result.getTotalTokens());
        assertFalse(result.isTruncated());
    }

    @Test
    void shouldSkipOversizedHighPriorityItemAndKeepSmallerOnes() {
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CHAPTER_CONTENT, "big", repeat('x', 50), 1000),
                item(ContextItemType.CHARACTER, "c1", repeat('y', 10), 800),
                item(ContextItemType.FORESHADOWING, "f1", repeat('z', 15), 600));

        BuiltContext result = fitter.fit(candidates, 30);

        assertEquals(2, result.getItems().size());
        assertEquals("c1", result.getItems().get(0).getId());
        assertEquals("f1", result.getItems().get(1).getId());
        assertEquals(25, result.getTotalTokens());
        assertTrue(result.isTruncated());
    }

    @Test
    void shouldNeverBacktrackOnceAnItemIsSelected() {
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CHAPTER_CONTENT, "first", repeat('a', 6), 1000),
                item(ContextItemType.CHARACTER, "second", repeat('b', 5), 800),
                item(ContextItemType.HOOK, "third", repeat('c', 4), 600));

        BuiltContext result = fitter.fit(candidates, 10);

        // second does not fit after first; third still does
        assertEquals(Arrays.asList("first", "third"), ids(result));
        assertEquals(10, result.getTotalTokens());
        assertTrue(result.isTruncated());
    }

    @Test
    void shouldKeepInsertionOrderForEqualPriorities() {
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CHARACTER, "c1", "x", 800),
                item(ContextItemType.LOCATION, "l1", "x", 800),
                item(ContextItemType.CHAPTER_OUTLINE, "o1", "x", 1000),
                item(ContextItemType.ARC, "a1", "x", 800));

        BuiltContext result = fitter.fit(candidates, 100);

        assertEquals(Arrays.asList("o1", "c1", "l1", "a1"), ids(result));
    }

    @Test
    void shouldStayWithinBudgetAndFlagTruncationOnlyWhenSomethingWasDropped() {
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CHAPTER_CONTENT, "1", repeat('a', 7), 1000),
                item(ContextItemType.CHARACTER, "2", repeat('b', 3), 800),
                item(ContextItemType.CUSTOM, "3", repeat('c', 9), 200));

        for (int budget = 0; budget <= 25; budget++) {
            BuiltContext result = fitter.fit(candidates, budget);
            assertTrue(result.getTotalTokens() <= budget, "budget " + budget);
            assertEquals(result.getItems().size() < candidates.size(), result.isTruncated(), "budget " + budget);
        }
    }

    @Test
    void shouldRejectHugeEstimateInsteadOfOverflowingTotal() {
        BudgetFitter saturating = new BudgetFitter(text -> "huge".equals(text) ? Integer.MAX_VALUE : 10);
        List<ContextItem> candidates = Arrays.asList(
                item(ContextItemType.CHAPTER_CONTENT, "small", "small", 1000),
                item(ContextItemType.CHARACTER, "big", "huge", 800));

        BuiltContext result = saturating.fit(candidates, 994_000);

        assertEquals(Collections.singletonList("small"), ids(result));
        assertEquals(10, result.getTotalTokens());
        assertTrue(result.isTruncated());
    }

    @Test
    void shouldReturnEmptyResultForNoCandidates() {
        BuiltContext result = fitter.fit(Collections.emptyList(), 10);

        assertTrue(result.getItems().isEmpty());
        assertEquals(0, result.getTotalTokens());
        assertFalse(result.isTruncated());
    }

    private static List<String> ids(BuiltContext context) {
        return context.getItems().stream().map(ContextItem::getId).collect(java.util.stream.Collectors.toList());
    }

    private static ContextItem item(ContextItemType type, String id, String content, int priority) {
        return ContextItem.builder().type(type).id(id).content(content).priority(priority).build();
    }

    private static String repeat(char c, int n) {
        return String.valueOf(c).repeat(n);
    }
}
