package com.batchpredict.storage.db;

import com.batchpredict.model.RecordTable;

import java.math.BigDecimal;

/** Relational store holding the dataset. Faults surface as {@link com.batchpredict.storage.StorageException}. */
public interface CandidateRepository {

    /** Rows needing prediction, in the order the store returns them, with all table columns. */
    RecordTable findCandidates();

    /**
     * Sets the value of one row and marks it predicted, committed on its own.
     *
     * @return false when no row has this id
     */
    boolean updatePrediction(String id, BigDecimal value);
}
