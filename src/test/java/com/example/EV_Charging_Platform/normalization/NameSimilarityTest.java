package com.example.EV_Charging_Platform.normalization;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NameSimilarityTest {

    @Test
    void testScore_BrandWordsIgnored() {
        assertEquals(1.0, NameSimilarity.score("ChargePoint Station - Downtown", "Downtown EVgo"), 1e-9);
    }

    @Test
    void testScore_PartialOverlap() {
        // {civic, center, garage} vs {civic, center}
        assertEquals(2.0 / 3.0, NameSimilarity.score("Civic Center Garage", "Civic Center"), 1e-9);
    }

    @Test
    void testScore_Unrelated() {
        assertEquals(0.0, NameSimilarity.score("Union Square Garage", "Mission Bay Plaza"), 1e-9);
    }

    @Test
    void testScore_OnlyNoiseWordsComparesFullText() {
        assertEquals(1.0, NameSimilarity.score("EVgo Fast Charging", "evgo fast-charging"), 1e-9);
        assertEquals(0.0, NameSimilarity.score("EVgo", "ChargePoint"), 1e-9);
    }

    @Test
    void testScore_NullName() {
        assertEquals(0.0, NameSimilarity.score(null, "Downtown"), 1e-9);
    }

    @Test
    void testTokens_LowercasedAlphanumeric() {
        assertEquals(Set.of("mall", "2nd", "floor"), NameSimilarity.tokens("EVgo @ Mall, 2nd Floor"));
    }
}
