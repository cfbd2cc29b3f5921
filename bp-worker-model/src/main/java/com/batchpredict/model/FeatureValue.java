package com.batchpredict.model;

import java.util.Objects;

/** One named column value of a record, as text exactly as exported. */
public record FeatureValue(String name, String value) {

    public FeatureValue {
        Objects.requireNonNull(name, "name");
        value = value != null ? value : "";
    }
}
