package com.batchpredict.model;

/** Storage type of a dataset column, as inferred from its name. */
public enum ColumnType {
    BOOLEAN,
    DATE_TIME,
    FLOAT,
    TEXT
}
