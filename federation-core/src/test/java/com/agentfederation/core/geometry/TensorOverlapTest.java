package com.agentfederation.core.geometry;

import com.agentfederation.core.exception.DimensionMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link TensorOverlap}.
 */
class TensorOverlapTest {

    private static final double EPS = 1e-9;

    private static TrustVector halves(double first, double second) {
        double[] scores = new double[20];
        for (int i = 0; i < 20; i++) {
            scores[i] = i < 10 ? first : second;
        }
        return TrustVector.of(scores);
    }

    // ── computeOverlap() ──────────────────────────────────────────────────

    @Nested
    @DisplayName("computeOverlap()")
    class ComputeOverlapTests {

        @Test
        @DisplayName("identical vectors → overlap 1.0, all aligned")
        void identical() {
            TrustVector v = TrustVector.uniform(0.8);
            OverlapResult result = TensorOverlap.computeOverlap(v, v);

            assertEquals(1.0, result.overlap(), EPS);
            assertEquals(20, result.aligned().size());
            assertTrue(result.divergent().isEmpty());
        }

        @Test
        @DisplayName("parallel vectors of different magnitude → overlap 1.0")
        void parallel() {
            OverlapResult result = TensorOverlap.computeOverlap(TrustVector.uniform(0.8), TrustVector.uniform(0.82));

            assertEquals(1.0, result.overlap(), 1e-4);
            assertEquals(20, result.aligned().size());
            assertTrue(result.divergent().isEmpty());
        }

        @Test
        @DisplayName("orthogonal halves → overlap 0, nothing aligned, all divergent")
        void orthogonal() {
            OverlapResult result = TensorOverlap.computeOverlap(halves(1.0, 0.0), halves(0.0, 1.0));

            assertEquals(0.0, result.overlap(), EPS);
            assertTrue(result.aligned().isEmpty());
            assertEquals(20, result.divergent().size());
        }

        @Test
        @DisplayName("zero vs zero → overlap 0 with every category aligned")
        void bothZero() {
            OverlapResult result = TensorOverlap.computeOverlap(TrustVector.zero(), TrustVector.zero());

            assertEquals(0.0, result.overlap());
            assertEquals(EnumSet.allOf(TrustCategory.class), result.aligned());
            assertTrue(result.divergent().isEmpty());
        }

        @Test
        @DisplayName("zero vs non-zero → overlap 0")
        void oneZero() {
            assertEquals(0.0, TensorOverlap.computeOverlap(TrustVector.zero(), TrustVector.uniform(0.5)).overlap());
        }

        @Test
        @DisplayName("half profile vs uniform → 1/√2")
        void halfProfile() {
            OverlapResult result = TensorOverlap.computeOverlap(TrustVector.uniform(0.8), halves(1.0, 0.0));
            assertEquals(Math.sqrt(0.5), result.overlap(), EPS);
        }

        @Test
        @DisplayName("difference of exactly 0.2 is aligned")
        void alignmentBoundary() {
            OverlapResult result = TensorOverlap.computeOverlap(TrustVector.uniform(0.5), TrustVector.uniform(0.7));

            assertEquals(20, result.aligned().size());
            assertTrue(result.divergent().isEmpty());
        }

        @Test
        @DisplayName("difference just above 0.4 is divergent")
        void divergenceBoundary() {
            OverlapResult result = TensorOverlap.computeOverlap(TrustVector.uniform(0.5), TrustVector.uniform(0.91));

            assertEquals(20, result.divergent().size());
            assertTrue(result.aligned().isEmpty());
        }

        @Test
        @DisplayName("difference in (0.2, 0.4] is neither aligned nor divergent")
        void neutralBand() {
            TrustVector a = TrustVector.uniform(0.5);
            TrustVector b = a.with(TrustCategory.TESTING, 0.8).with(TrustCategory.SECURITY, 1.0);

            OverlapResult result = TensorOverlap.computeOverlap(a, b);

            assertFalse(result.aligned().contains(TrustCategory.TESTING));
            assertFalse(result.divergent().contains(TrustCategory.TESTING));
            assertTrue(result.divergent().contains(TrustCategory.SECURITY));
            assertEquals(EnumSet.of(TrustCategory.TESTING), result.neutral());
            assertEquals(18, result.aligned().size());
        }

        @Test
        @DisplayName("overlap is symmetric and within [0,1]")
        void symmetric() {
            TrustVector a = TrustVector.uniform(0.3).with(TrustCategory.SECURITY, 0.95).with(TrustCategory.INNOVATION, 0.0);
            TrustVector b = halves(0.9, 0.1).with(TrustCategory.USER_FOCUS, 0.6);

            double ab = TensorOverlap.computeOverlap(a, b).overlap();
            double ba = TensorOverlap.computeOverlap(b, a).overlap();

            assertEquals(ab, ba, EPS);
            assertTrue(ab >= 0.0 && ab <= 1.0, "overlap out of range: " + ab);
        }

        @Test
        @DisplayName("sparse map input: missing categories score 0")
        void sparseInput() {
            Map<TrustCategory, Double> sparse = new EnumMap<>(TrustCategory.class);
            sparse.put(TrustCategory.SECURITY, 0.9);
            sparse.put(TrustCategory.RELIABILITY, 0.8);
            sparse.put(TrustCategory.CODE_QUALITY, 0.7);

            OverlapResult result = TensorOverlap.computeOverlap(sparse, TrustVector.uniform(0.5).toMap());

            assertTrue(result.overlap() > 0.0 && result.overlap() < 1.0);
            assertTrue(result.aligned().size() < 20);
        }

        @Test
        @DisplayName("array input of 20 elements accepted")
        void arrayInput() {
            double[] a = new double[20];
            double[] b = new double[20];
            java.util.Arrays.fill(a, 0.7);
            java.util.Arrays.fill(b, 0.8);

            OverlapResult result = TensorOverlap.computeOverlap(a, b);

            assertEquals(1.0, result.overlap(), 1e-4);
            assertEquals(20, result.aligned().size());
        }

        @Test
        @DisplayName("array input of wrong length → DimensionMismatchException")
        void wrongDimension() {
            DimensionMismatchException ex = assertThrows(DimensionMismatchException.class,
                () -> TensorOverlap.computeOverlap(new double[19], new double[20]));
            assertEquals(20, ex.getExpected());
            assertEquals(19, ex.getActual());
        }
    }

    // ── isCompatible() ────────────────────────────────────────────────────

    @Nested
    @DisplayName("isCompatible()")
    class IsCompatibleTests {

        @Test
        @DisplayName("similar vectors compatible at default 0.8")
        void compatibleDefault() {
            assertTrue(TensorOverlap.isCompatible(TrustVector.uniform(0.8), TrustVector.uniform(0.85)));
        }

        @Test
        @DisplayName("orthogonal vectors not compatible")
        void orthogonalIncompatible() {
            assertFalse(TensorOverlap.isCompatible(halves(1.0, 0.0), halves(0.0, 1.0)));
        }

        @Test
        @DisplayName("custom threshold brackets the actual overlap")
        void customThreshold() {
            double[] a = new double[20];
            double[] b = new double[20];
            for (int i = 0; i < 20; i++) {
                a[i] = i < 15 ? 0.8 : 0.3;
                b[i] = i < 15 ? 0.85 : 0.7;
            }
            TrustVector va = TrustVector.of(a);
            TrustVector vb = TrustVector.of(b);
            double actual = TensorOverlap.computeOverlap(va, vb).overlap();

            assertFalse(TensorOverlap.isCompatible(va, vb, actual + 0.01));
            assertTrue(TensorOverlap.isCompatible(va, vb, actual - 0.01));
            assertTrue(TensorOverlap.isCompatible(va, vb, actual));
        }
    }

    // ── geometryHash() ────────────────────────────────────────────────────

    @Nested
    @DisplayName("geometryHash()")
    class GeometryHashTests {

        @Test
        @DisplayName("stable 64-char hex for the same vector")
        void stable() {
            String first = TensorOverlap.geometryHash(TrustVector.uniform(0.8));
            String second = TensorOverlap.geometryHash(TrustVector.uniform(0.8));

            assertEquals(first, second);
            assertEquals(64, first.length());
            assertTrue(first.matches("[0-9a-f]{64}"));
        }

        @Test
        @DisplayName("sparse map and equivalent dense array hash identically")
        void sparseEqualsDense() {
            Map<TrustCategory, Double> sparse = new EnumMap<>(TrustCategory.class);
            sparse.put(TrustCategory.SECURITY, 0.9);
            sparse.put(TrustCategory.ETHICAL_ALIGNMENT, 0.4);

            double[] dense = new double[20];
            dense[0] = 0.9;
            dense[19] = 0.4;

            assertEquals(TensorOverlap.geometryHash(sparse), TensorOverlap.geometryHash(dense));
        }

        @Test
        @DisplayName("explicit zero and omitted category hash identically")
        void explicitZero() {
            Map<TrustCategory, Double> withZero = new EnumMap<>(TrustCategory.class);
            withZero.put(TrustCategory.SECURITY, 0.9);
            withZero.put(TrustCategory.TESTING, 0.0);

            Map<TrustCategory, Double> without = new EnumMap<>(TrustCategory.class);
            without.put(TrustCategory.SECURITY, 0.9);

            assertEquals(TensorOverlap.geometryHash(withZero), TensorOverlap.geometryHash(without));
        }

        @Test
        @DisplayName("changing one defaulted category changes the hash")
        void differentVectors() {
            TrustVector base = TrustVector.fromScores(Map.of(TrustCategory.SECURITY, 0.9));
            TrustVector changed = base.with(TrustCategory.COMPLIANCE, 0.1);

            assertNotEquals(TensorOverlap.geometryHash(base), TensorOverlap.geometryHash(changed));
        }
    }
}
