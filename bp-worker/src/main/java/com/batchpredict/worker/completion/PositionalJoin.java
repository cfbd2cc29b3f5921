package com.batchpredict.worker.completion;

import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.PredictionRecord;
import com.batchpredict.model.ReconciledRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins submitted rows with prediction output by position: row {@code i} of the input pairs with line
 * {@code i} of the output. The prediction service receives no identifier column, so list order is the only
 * correlation key and both lists must be in file order, unfiltered.
 * <p>
 * More predictions than inputs: the first {@code n} are used and the rest dropped. Fewer: no position
 * mapping is safe and the join fails.
 */
public final class PositionalJoin {

    private static final Logger log = LoggerFactory.getLogger(PositionalJoin.class);

    private PositionalJoin() {
    }

    /**
     * @return one reconciled record per input, in input order
     * @throws ReconciliationException if there are fewer predictions than inputs
     */
    public static List<ReconciledRecord> join(List<CandidateRecord> inputs, List<PredictionRecord> predictions) {
        int n = inputs.size();
        int m = predictions.size();
        if (m < n) {
            throw new ReconciliationException("Prediction output has " + m + " rows for " + n
                    + " input rows; cannot match predictions to records by position");
        }
        if (m > n) {
            log.warn("Prediction output has {} rows for {} input rows; truncating to {}", m, n, n);
        }
        List<ReconciledRecord> joined = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            joined.add(new ReconciledRecord(inputs.get(i), predictions.get(i)));
        }
        return joined;
    }
}
