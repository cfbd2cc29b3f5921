package com.batchpredict.worker.dispatch;

import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.RecordTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows exported rows to the model's feature columns, in feature order, keeping row order. Job input is
 * split on physical lines: one row must stay one line, so cells holding a line break are rejected.
 */
public final class FeatureProjection {

    private FeatureProjection() {
    }

    /**
     * @throws DispatchException with {@link DispatchErrorCode#MISSING_COLUMNS} naming every absent column, or
     *         {@link DispatchErrorCode#INVALID_FEATURE_VALUE} naming the row and column of a multi-line cell
     */
    public static List<List<String>> project(RecordTable table, List<String> featureColumns) {
        List<String> missing = new ArrayList<>();
        for (String column : featureColumns) {
            if (!table.getColumns().contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new DispatchException(DispatchErrorCode.MISSING_COLUMNS,
                    "Missing required columns: " + missing + " (available: " + table.getColumns() + ")");
        }
        List<List<String>> rows = new ArrayList<>(table.size());
        for (CandidateRecord record : table.getRows()) {
            List<String> cells = new ArrayList<>(featureColumns.size());
            for (String column : featureColumns) {
                String value = table.cell(record, column);
                if (value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0)) {
                    throw new DispatchException(DispatchErrorCode.INVALID_FEATURE_VALUE,
                            "Line break in column '" + column + "' of record " + record.getId()
                                    + "; line-split job input cannot hold it");
                }
                cells.add(value);
            }
            rows.add(cells);
        }
        return rows;
    }
}
