package com.quill.resolver;

/**
 * Scores one keyword against the columns of a prepared snapshot.
 */
public interface ColumnScorer {

    /**
     * @param keyword lower-case keyword
     * @return one score in [0, 100] per column entry, in entry order
     */
    double[] score(String keyword);
}
