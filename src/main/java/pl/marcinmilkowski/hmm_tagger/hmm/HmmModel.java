package pl.marcinmilkowski.hmm_tagger.hmm;

import pl.marcinmilkowski.hmm_tagger.hmm.smoothing.Smoothing;

import java.util.Collection;
import java.util.Set;

/**
 * A trained first-order HMM: tag set, training vocabulary and the three log2
 * probability tables.
 *
 * Models are immutable once built and can be shared by any number of concurrent
 * decoders. Cell accessors are O(1) array reads; table accessors return copies.
 */
public final class HmmModel {

    private final Vocabulary vocabulary;
    private final double[] initial;
    private final double[][] transition;
    private final EmissionTable emission;
    private final Smoothing smoothing;
    private final TransitionBoundaries transitionBoundaries;

    HmmModel(Vocabulary vocabulary, double[] initial, double[][] transition, EmissionTable emission,
             Smoothing smoothing, TransitionBoundaries transitionBoundaries) {
        this.vocabulary = vocabulary;
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
        this.smoothing = smoothing;
        this.transitionBoundaries = transitionBoundaries;
    }

    /**
     * Assemble a model from previously estimated tables, e.g. when reading a stored
     * model. Arrays are copied.
     *
     * @param emissionResiduals per-tag residual log-probabilities, or null when unsmoothed
     * @throws IllegalArgumentException if a table does not match the vocabulary's dimensions
     */
    public static HmmModel fromTables(Vocabulary vocabulary, double[] initial, double[][] transition,
                                      double[][] emission, double[] emissionResiduals,
                                      Smoothing smoothing, TransitionBoundaries transitionBoundaries) {
        int n = vocabulary.tagCount();
        int v = vocabulary.size();
        if (initial.length != n) {
            throw new IllegalArgumentException("Initial table has " + initial.length + " entries, expected " + n);
        }
        checkMatrix("Transition", transition, n, n);
        checkMatrix("Emission", emission, n, v);
        if ((smoothing == Smoothing.LAPLACE) != (emissionResiduals != null)) {
            throw new IllegalArgumentException("Residuals must be present exactly for Laplace-smoothed models");
        }
        return new HmmModel(
            vocabulary,
            initial.clone(),
            copy(transition),
            new EmissionTable(copy(emission), emissionResiduals != null ? emissionResiduals.clone() : null),
            smoothing,
            transitionBoundaries
        );
    }

    private static void checkMatrix(String name, double[][] matrix, int rows, int columns) {
        if (matrix.length != rows) {
            throw new IllegalArgumentException(name + " table has " + matrix.length + " rows, expected " + rows);
        }
        for (double[] row : matrix) {
            if (row.length != columns) {
                throw new IllegalArgumentException(name + " table row has " + row.length
                    + " columns, expected " + columns);
            }
        }
    }

    private static double[][] copy(double[][] matrix) {
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public Smoothing smoothing() {
        return smoothing;
    }

    public TransitionBoundaries transitionBoundaries() {
        return transitionBoundaries;
    }

    public int tagCount() {
        return vocabulary.tagCount();
    }

    public double initialLogProb(int tag) {
        return initial[tag];
    }

    public double transitionLogProb(int from, int to) {
        return transition[from][to];
    }

    public double emissionLogProb(int tag, int token) {
        return emission.logProb(tag, token);
    }

    public boolean hasResidual() {
        return emission.hasResidual();
    }

    /**
     * Log-probability reserved under the tag for tokens it never emitted in training.
     *
     * @throws IllegalStateException for unsmoothed models
     */
    public double residualLogProb(int tag) {
        return emission.residualLogProb(tag);
    }

    public double initialLogProb(String tag) {
        return initial[requireTag(tag)];
    }

    public double transitionLogProb(String from, String to) {
        return transition[requireTag(from)][requireTag(to)];
    }

    /**
     * Base-table emission lookup by name. Tokens outside the training vocabulary have
     * no entry and yield negative infinity; unknown-token handling happens at decode
     * time.
     */
    public double emissionLogProb(String tag, String token) {
        int tagIndex = requireTag(tag);
        int tokenIndex = vocabulary.tokenIndex(token);
        return tokenIndex < 0 ? LogProb.ZERO : emission.logProb(tagIndex, tokenIndex);
    }

    public double[] initialTable() {
        return initial.clone();
    }

    public double[][] transitionTable() {
        return copy(transition);
    }

    public double[][] emissionTable() {
        return copy(emission.rows());
    }

    /**
     * @return residual log-probabilities per tag, or null for unsmoothed models
     */
    public double[] residualTable() {
        double[] residuals = emission.residuals();
        return residuals != null ? residuals.clone() : null;
    }

    /**
     * Tokens of a decode-time vocabulary that never occurred in training.
     */
    public Set<String> unknownTokens(Collection<String> decodeVocabulary) {
        return vocabulary.unknownTokens(decodeVocabulary);
    }

    private int requireTag(String tag) {
        int index = vocabulary.tagIndex(tag);
        if (index < 0) {
            throw new IllegalArgumentException("Tag not in model: " + tag);
        }
        return index;
    }

    @Override
    public String toString() {
        return "HmmModel{tags=" + vocabulary.tagCount()
            + ", vocabulary=" + vocabulary.size()
            + ", smoothing=" + smoothing.configName()
            + ", transitions=" + transitionBoundaries.configName() + "}";
    }
}
