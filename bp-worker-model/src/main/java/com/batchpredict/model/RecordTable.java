package com.batchpredict.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An exported record set: column order of the file (identifier column included) and its rows in file order.
 * Row order is the correlation key for the positional join, so it is never re-sorted or filtered.
 */
public final class RecordTable {

    private final List<String> columns;
    private final String idColumn;
    private final List<CandidateRecord> rows;

    public RecordTable(List<String> columns, String idColumn, List<CandidateRecord> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
        this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
        this.rows = rows != null ? Collections.unmodifiableList(new ArrayList<>(rows)) : List.of();
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public List<CandidateRecord> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Value of a column for a row; the identifier column resolves to {@link CandidateRecord#getId()}. */
    public String cell(CandidateRecord row, String column) {
        if (idColumn.equals(column)) {
            return row.getId();
        }
        return row.valueOf(column).orElse("");
    }
}
