package com.batchpredict.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Naming-convention type inference for dataset columns. Pure function; no database access.
 * <ul>
 *   <li>{@code *_at} or {@code timestamp} → {@link ColumnType#DATE_TIME}</li>
 *   <li>{@code is_*} or {@code has_*} → {@link ColumnType#BOOLEAN}</li>
 *   <li>name containing amount, price, value, pm25 or pm10 → {@link ColumnType#FLOAT}</li>
 *   <li>anything else → {@link ColumnType#TEXT}</li>
 * </ul>
 */
public final class ColumnTypes {

    private static final List<String> NUMERIC_MARKERS = List.of("amount", "price", "value", "pm25", "pm10");

    private ColumnTypes() {
    }

    public static ColumnType infer(String columnName) {
        if (columnName == null || columnName.isBlank()) {
            return ColumnType.TEXT;
        }
        String name = columnName.trim().toLowerCase(Locale.ROOT);
        if (name.endsWith("_at") || name.equals("timestamp")) {
            return ColumnType.DATE_TIME;
        }
        if (name.startsWith("is_") || name.startsWith("has_")) {
            return ColumnType.BOOLEAN;
        }
        for (String marker : NUMERIC_MARKERS) {
            if (name.contains(marker)) {
                return ColumnType.FLOAT;
            }
        }
        return ColumnType.TEXT;
    }

    /** First column (in the given order) whose inferred type is {@link ColumnType#DATE_TIME}. */
    public static Optional<String> firstTimeColumn(List<String> columnNames) {
        if (columnNames == null) {
            return Optional.empty();
        }
        return columnNames.stream()
                .filter(c -> infer(c) == ColumnType.DATE_TIME)
                .findFirst();
    }
}
