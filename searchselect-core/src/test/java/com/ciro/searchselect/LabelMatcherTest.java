package com.ciro.searchselect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LabelMatcherTest {

    @Test
    void emptyQueryMatchesEverything() {
        assertTrue(LabelMatcher.matches("anything", ""));
        assertTrue(LabelMatcher.matches("", null));
    }

    @Test
    void matchIsPlainCaseInsensitiveSubstring() {
        assertTrue(LabelMatcher.matches("Avocado", "VOC"));
        assertTrue(LabelMatcher.matches("avocado", "Ado"));
        assertFalse(LabelMatcher.matches("Apple", "av"));
        // sin fuzzy: las letras tienen que ir seguidas
        assertFalse(LabelMatcher.matches("Avocado", "acd"));
    }

    @Test
    void filterKeepsCatalogOrderNotRelevance() {
        Item<String> zebra = Item.of("Zebra bar", "z");
        Item<String> bar = Item.of("bar", "b");
        Item<String> foo = Item.of("foo", "f");

        List<Item<String>> out = LabelMatcher.filter(List.of(zebra, foo, bar), "bar");

        assertEquals(List.of(zebra, bar), out);
    }

    @Test
    void filterWithEmptyQueryReturnsTheSameList() {
        List<Item<String>> items = List.of(Item.of("a", "1"), Item.of("b", "2"));
        assertSame(items, LabelMatcher.filter(items, ""));
    }
}
