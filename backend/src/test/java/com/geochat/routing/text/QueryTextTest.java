package com.geochat.routing.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryTextTest {

    @Test
    @DisplayName("Should lower-case tokens and keep their spans in the original text")
    void of_shouldTokenizeWithSpans() {
        QueryText text = QueryText.of("Compare NIKE, Adidas!");

        assertEquals(List.of("compare", "nike", "adidas"), QueryText.tokenize("Compare NIKE, Adidas!"));
        assertEquals(3, text.size());
        assertEquals("NIKE", text.span(1, 1));
        assertEquals("NIKE, Adidas", text.span(1, 2));
    }

    @Test
    @DisplayName("Should keep apostrophes inside words and split on hyphens")
    void tokenize_shouldHandlePunctuation() {
        assertEquals(List.of("monster's", "share"), QueryText.tokenize("Monster's share"));
        assertEquals(List.of("5", "hour", "energy"), QueryText.tokenize("5-Hour Energy"));
    }

    @Test
    @DisplayName("Should match phrases on whole tokens only")
    void occurrences_shouldMatchWholeTokens() {
        QueryText text = QueryText.of("market share and shares of the market share");

        assertEquals(List.of(0, 6), text.occurrences(List.of("market", "share")));
        assertFalse(text.containsPhrase(List.of("share", "of")));
        assertFalse(QueryText.of("comparison").contains("compare"));
    }

    @Test
    @DisplayName("Should find scattered tokens without requiring adjacency")
    void containsAll_shouldIgnoreOrder() {
        QueryText text = QueryText.of("share of the market");

        assertTrue(text.containsAll(List.of("market", "share")));
        assertFalse(text.containsPhrase(List.of("market", "share")));
    }

    @Test
    @DisplayName("Should append context as extra tokens without touching the original")
    void with_shouldAppend() {
        QueryText text = QueryText.of("what about there");
        QueryText combined = text.with("demographics for Toronto");

        assertEquals(3, text.size());
        assertEquals(6, combined.size());
        assertSame(text, text.with("  "));
    }

    @Test
    @DisplayName("Should treat null and punctuation-only input as empty")
    void of_shouldHandleEmptyInput() {
        assertTrue(QueryText.of(null).isEmpty());
        assertTrue(QueryText.of("?!? ...").isEmpty());
    }
}
