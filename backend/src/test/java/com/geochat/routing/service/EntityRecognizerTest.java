package com.geochat.routing.service;

import com.geochat.routing.TestFixtures;
import com.geochat.routing.model.DomainConfig;
import com.geochat.routing.model.EntityType;
import com.geochat.routing.model.RecognizedEntity;
import com.geochat.routing.text.QueryText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRecognizerTest {

    private final EntityRecognizer recognizer = new EntityRecognizer();
    private DomainConfig config;

    @BeforeEach
    void setUp() {
        config = TestFixtures.domainConfig();
    }

    @ParameterizedTest
    @ValueSource(strings = {"NIKE sales", "nike sales", "Nike Inc sales", "the swoosh sales"})
    @DisplayName("Should resolve case variants and aliases to the same canonical id")
    void recognize_shouldResolveAliases(String query) {
        List<RecognizedEntity> entities = recognizer.recognize(QueryText.of(query), config);

        assertEquals(1, entities.size());
        assertEquals("nike", entities.get(0).getCanonicalId());
        assertEquals(EntityType.BRAND, entities.get(0).getType());
    }

    @Test
    @DisplayName("Should prefer the longest alias and never overlap matches")
    void recognize_shouldMatchLongestFirst() {
        List<RecognizedEntity> entities = recognizer.recognize(QueryText.of("Nike Inc versus Adidas Group"), config);

        assertEquals(2, entities.size());
        assertEquals("Nike Inc", entities.get(0).getSurface());
        assertEquals("Adidas Group", entities.get(1).getSurface());
    }

    @Test
    @DisplayName("Should report original-text spans and place codes")
    void recognize_shouldKeepSpans() {
        String raw = "demographics for Toronto";
        RecognizedEntity toronto = recognizer.recognize(QueryText.of(raw), config).get(0);

        assertEquals("toronto", toronto.getCanonicalId());
        assertEquals("M5V", toronto.getCode());
        assertEquals("Toronto", raw.substring(toronto.getStart(), toronto.getEnd()));
    }

    @Test
    @DisplayName("Should not match aliases inside longer words")
    void recognize_shouldMatchWholeTokens() {
        assertTrue(recognizer.recognize(QueryText.of("pumas and nikes"), config).isEmpty());
    }

    @Test
    @DisplayName("Should keep the first occurrence per entity when asked for distinct entities")
    void distinct_shouldDeduplicate() {
        List<RecognizedEntity> entities = recognizer.recognize(QueryText.of("Nike vs Puma vs nike"), config);

        assertEquals(3, entities.size());
        List<RecognizedEntity> distinct = recognizer.distinct(entities);
        assertEquals(2, distinct.size());
        assertEquals("Nike", distinct.get(0).getSurface());
        assertEquals("puma", distinct.get(1).getCanonicalId());
    }
}
