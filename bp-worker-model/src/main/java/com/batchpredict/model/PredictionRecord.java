package com.batchpredict.model;

import java.util.Objects;

/**
 * One row of raw prediction output. Has no identifier: {@code position} is its zero-based line index
 * in the output file, which matches the line index of the submitted input row.
 */
public record PredictionRecord(int position, String score) {

    public PredictionRecord {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0: " + position);
        }
        Objects.requireNonNull(score, "score");
    }
}
