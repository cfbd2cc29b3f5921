package com.batchpredict.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A row needing prediction: fixed identifier plus the remaining columns as ordered named values.
 * Immutable snapshot; the relational row is only touched again by the DB writer.
 */
public final class CandidateRecord {

    private final String id;
    private final List<FeatureValue> features;

    public CandidateRecord(String id, List<FeatureValue> features) {
        this.id = Objects.requireNonNull(id, "id");
        this.features = features != null
                ? Collections.unmodifiableList(new ArrayList<>(features))
                : List.of();
    }

    public String getId() {
        return id;
    }

    public List<FeatureValue> getFeatures() {
        return features;
    }

    /** Value of the named column, if this record carries it. */
    public Optional<String> valueOf(String columnName) {
        for (FeatureValue f : features) {
            if (f.name().equals(columnName)) {
                return Optional.of(f.value());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateRecord)) return false;
        CandidateRecord that = (CandidateRecord) o;
        return id.equals(that.id) && features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, features);
    }

    @Override
    public String toString() {
        return "CandidateRecord{id=" + id + ", features=" + features.size() + "}";
    }
}
