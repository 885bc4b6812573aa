package com.agentfederation.core.geometry;

import com.agentfederation.core.exception.DimensionMismatchException;
import com.agentfederation.core.exception.InvalidTrustVectorException;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable 20-dimensional trust profile: one score in {@code [0,1]} per
 * {@link TrustCategory}, stored densely in canonical category order.
 *
 * <p>Sparse inputs are accepted; any category they omit (or map to {@code null})
 * scores 0. Two vectors are equal iff their canonical dense forms are equal, so a
 * sparse map and the equivalent array produce equal vectors.
 */
public final class TrustVector {

    private static final TrustVector ZERO = new TrustVector(new double[TrustCategory.DIMENSIONS]);

    private final double[] scores;

    private TrustVector(double[] scores) {
        this.scores = scores;
    }

    /**
     * Builds a vector from a dense array in category order.
     *
     * @throws DimensionMismatchException if {@code scores.length != 20}
     * @throws InvalidTrustVectorException if a score is not a finite value in [0,1]
     */
    public static TrustVector of(double... scores) {
        Objects.requireNonNull(scores, "scores");
        if (scores.length != TrustCategory.DIMENSIONS) {
            throw new DimensionMismatchException(TrustCategory.DIMENSIONS, scores.length);
        }
        double[] copy = new double[TrustCategory.DIMENSIONS];
        for (int i = 0; i < scores.length; i++) {
            copy[i] = checkScore(TrustCategory.values()[i].key(), scores[i]);
        }
        return new TrustVector(copy);
    }

    /**
     * Builds a vector from a sparse category map. Missing categories score 0.
     */
    public static TrustVector fromScores(Map<TrustCategory, Double> scores) {
        Objects.requireNonNull(scores, "scores");
        double[] dense = new double[TrustCategory.DIMENSIONS];
        for (Map.Entry<TrustCategory, Double> entry : scores.entrySet()) {
            if (entry.getKey() == null) {
                throw new InvalidTrustVectorException("Null category in trust vector");
            }
            Double value = entry.getValue();
            dense[entry.getKey().ordinal()] = value == null ? 0.0 : checkScore(entry.getKey().key(), value);
        }
        return new TrustVector(dense);
    }

    /**
     * Builds a vector from a sparse map keyed by category wire key
     * (e.g. {@code "code_quality"}). Missing categories score 0.
     *
     * @throws InvalidTrustVectorException if a key names no category
     */
    public static TrustVector fromNamedScores(Map<String, Double> scores) {
        Objects.requireNonNull(scores, "scores");
        Map<TrustCategory, Double> byCategory = new EnumMap<>(TrustCategory.class);
        scores.forEach((key, value) -> {
            TrustCategory category = TrustCategory.fromKey(key)
                .orElseThrow(() -> new InvalidTrustVectorException("Unknown trust category '" + key + "'"));
            byCategory.put(category, value);
        });
        return fromScores(byCategory);
    }

    /** Every category set to the same score. */
    public static TrustVector uniform(double score) {
        double[] dense = new double[TrustCategory.DIMENSIONS];
        Arrays.fill(dense, checkScore("uniform", score));
        return new TrustVector(dense);
    }

    public static TrustVector zero() {
        return ZERO;
    }

    public double score(TrustCategory category) {
        return scores[category.ordinal()];
    }

    /** Returns a copy of this vector with one category replaced. */
    public TrustVector with(TrustCategory category, double score) {
        double[] copy = scores.clone();
        copy[category.ordinal()] = checkScore(category.key(), score);
        return new TrustVector(copy);
    }

    /** Canonical dense form, in category order. Returns a defensive copy. */
    public double[] toArray() {
        return scores.clone();
    }

    public Map<TrustCategory, Double> toMap() {
        Map<TrustCategory, Double> map = new EnumMap<>(TrustCategory.class);
        for (TrustCategory category : TrustCategory.values()) {
            map.put(category, scores[category.ordinal()]);
        }
        return map;
    }

    public boolean isZero() {
        for (double score : scores) {
            if (score != 0.0) return false;
        }
        return true;
    }

    private static double checkScore(String category, double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new InvalidTrustVectorException(
                "Score for '" + category + "' must be within [0,1], got " + score);
        }
        // -0.0 and 0.0 must hash identically
        return score + 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrustVector other)) return false;
        return Arrays.equals(scores, other.scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return "TrustVector" + Arrays.toString(scores);
    }
}
