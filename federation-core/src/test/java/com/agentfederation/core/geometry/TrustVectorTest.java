package com.agentfederation.core.geometry;

import com.agentfederation.core.exception.DimensionMismatchException;
import com.agentfederation.core.exception.InvalidTrustVectorException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrustVectorTest {

    @Test
    @DisplayName("dense array must have exactly 20 scores")
    void dimensionEnforced() {
        assertThrows(DimensionMismatchException.class, () -> TrustVector.of(new double[21]));
        assertThrows(DimensionMismatchException.class, () -> TrustVector.of(0.1, 0.2));
    }

    @Test
    @DisplayName("scores outside [0,1] or NaN are rejected")
    void rangeEnforced() {
        assertThrows(InvalidTrustVectorException.class, () -> TrustVector.uniform(1.2));
        assertThrows(InvalidTrustVectorException.class, () -> TrustVector.uniform(-0.1));
        assertThrows(InvalidTrustVectorException.class, () -> TrustVector.uniform(Double.NaN));
        assertThrows(InvalidTrustVectorException.class,
            () -> TrustVector.zero().with(TrustCategory.SECURITY, Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("named keys accept snake, kebab and any case")
    void namedKeys() {
        TrustVector v = TrustVector.fromNamedScores(Map.of(
            "code_quality", 0.7,
            "Data-Integrity", 0.6,
            "ETHICAL_ALIGNMENT", 0.5));

        assertEquals(0.7, v.score(TrustCategory.CODE_QUALITY));
        assertEquals(0.6, v.score(TrustCategory.DATA_INTEGRITY));
        assertEquals(0.5, v.score(TrustCategory.ETHICAL_ALIGNMENT));
        assertEquals(0.0, v.score(TrustCategory.SECURITY));
    }

    @Test
    @DisplayName("unknown category key is rejected")
    void unknownKey() {
        InvalidTrustVectorException ex = assertThrows(InvalidTrustVectorException.class,
            () -> TrustVector.fromNamedScores(Map.of("charisma", 0.9)));
        assertTrue(ex.getMessage().contains("charisma"));
    }

    @Test
    @DisplayName("null score in a sparse map counts as 0")
    void nullScore() {
        Map<TrustCategory, Double> scores = new HashMap<>();
        scores.put(TrustCategory.SECURITY, null);
        scores.put(TrustCategory.TESTING, 0.4);

        TrustVector v = TrustVector.fromScores(scores);

        assertEquals(0.0, v.score(TrustCategory.SECURITY));
        assertEquals(0.4, v.score(TrustCategory.TESTING));
    }

    @Test
    @DisplayName("sparse and dense forms are equal; -0.0 is canonicalised")
    void equality() {
        double[] dense = new double[20];
        dense[TrustCategory.TESTING.ordinal()] = 0.4;
        dense[TrustCategory.SECURITY.ordinal()] = -0.0;

        TrustVector fromArray = TrustVector.of(dense);
        TrustVector fromMap = TrustVector.fromScores(Map.of(TrustCategory.TESTING, 0.4));

        assertEquals(fromMap, fromArray);
        assertEquals(fromMap.hashCode(), fromArray.hashCode());
        assertEquals(TensorOverlap.geometryHash(fromMap), TensorOverlap.geometryHash(fromArray));
    }

    @Test
    @DisplayName("toArray returns a defensive copy")
    void immutability() {
        TrustVector v = TrustVector.uniform(0.5);
        double[] copy = v.toArray();
        copy[0] = 0.9;

        assertEquals(0.5, v.score(TrustCategory.SECURITY));
        assertTrue(TrustVector.zero().isZero());
        assertFalse(v.isZero());
    }
}
