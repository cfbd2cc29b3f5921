package com.batchpredict.model;

import java.util.Objects;

/** A candidate joined with the prediction at the same position; always marked as predicted. */
public final class ReconciledRecord {

    private final CandidateRecord candidate;
    private final PredictionRecord prediction;

    public ReconciledRecord(CandidateRecord candidate, PredictionRecord prediction) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.prediction = Objects.requireNonNull(prediction, "prediction");
    }

    public CandidateRecord getCandidate() {
        return candidate;
    }

    public PredictionRecord getPrediction() {
        return prediction;
    }

    public String getPredictedValue() {
        return prediction.score();
    }

    public boolean isPredicted() {
        return true;
    }
}
