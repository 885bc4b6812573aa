package com.agentfederation.core.geometry;

import com.agentfederation.core.exception.FederationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Map;

/**
 * Geometric similarity between two trust vectors.
 *
 * <p>Overlap is the magnitude of the cosine between the two dense vectors:
 * <pre>
 *   overlap = |A · B| / (‖A‖ · ‖B‖)      (0 when either norm is 0)
 * </pre>
 * Each category is additionally classified by the absolute score difference:
 * aligned at {@value #ALIGNMENT_THRESHOLD} or below, divergent above
 * {@value #DIVERGENCE_THRESHOLD}, neither in between.
 *
 * <p>Stateless, pure, and thread-safe. No Spring dependencies.
 */
public final class TensorOverlap {

    /** Maximum per-category difference for a category to count as aligned. */
    public static final double ALIGNMENT_THRESHOLD = 0.2;

    /** Per-category difference above which a category counts as divergent. */
    public static final double DIVERGENCE_THRESHOLD = 0.4;

    /** Minimum overlap for two peers to be compatible (handshake acceptance). */
    public static final double TRUST_THRESHOLD = 0.8;

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper();

    private TensorOverlap() { /* utility class */ }

    /**
     * Computes overlap and the per-category partition.
     *
     * @return the result; never null
     */
    public static OverlapResult computeOverlap(TrustVector a, TrustVector b) {
        double[] va = a.toArray();
        double[] vb = b.toArray();

        double dot = 0, normA = 0, normB = 0;
        EnumSet<TrustCategory> aligned   = EnumSet.noneOf(TrustCategory.class);
        EnumSet<TrustCategory> divergent = EnumSet.noneOf(TrustCategory.class);

        for (TrustCategory category : TrustCategory.values()) {
            int i = category.ordinal();
            dot   += va[i] * vb[i];
            normA += va[i] * va[i];
            normB += vb[i] * vb[i];

            double diff = Math.abs(va[i] - vb[i]);
            if (diff <= ALIGNMENT_THRESHOLD) {
                aligned.add(category);
            } else if (diff > DIVERGENCE_THRESHOLD) {
                divergent.add(category);
            }
        }

        double overlap = 0.0;
        if (normA > 0 && normB > 0) {
            overlap = Math.abs(dot) / (Math.sqrt(normA) * Math.sqrt(normB));
            // rounding can push parallel vectors a hair above 1
            overlap = Math.min(1.0, overlap);
        }
        return new OverlapResult(overlap, aligned, divergent);
    }

    /**
     * Dense-array form of {@link #computeOverlap(TrustVector, TrustVector)}.
     *
     * @throws com.agentfederation.core.exception.DimensionMismatchException if either
     *         array does not have exactly 20 elements
     */
    public static OverlapResult computeOverlap(double[] a, double[] b) {
        return computeOverlap(TrustVector.of(a), TrustVector.of(b));
    }

    /** Sparse-map form; categories absent from a map score 0. */
    public static OverlapResult computeOverlap(Map<TrustCategory, Double> a, Map<TrustCategory, Double> b) {
        return computeOverlap(TrustVector.fromScores(a), TrustVector.fromScores(b));
    }

    public static boolean isCompatible(TrustVector a, TrustVector b) {
        return isCompatible(a, b, TRUST_THRESHOLD);
    }

    public static boolean isCompatible(TrustVector a, TrustVector b, double threshold) {
        return computeOverlap(a, b).overlap() >= threshold;
    }

    /**
     * SHA-256 over the canonical dense JSON form of the vector, as 64 lowercase hex chars.
     * Sparse and dense representations of the same vector hash identically.
     */
    public static String geometryHash(TrustVector vector) {
        try {
            byte[] canonical = CANONICAL_MAPPER.writeValueAsBytes(vector.toArray());
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new FederationException("Geometry", "Unable to hash trust vector", e);
        }
    }

    public static String geometryHash(double[] vector) {
        return geometryHash(TrustVector.of(vector));
    }

    public static String geometryHash(Map<TrustCategory, Double> vector) {
        return geometryHash(TrustVector.fromScores(vector));
    }
}
