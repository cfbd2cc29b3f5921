package com.batchpredict.storage.db;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.ColumnTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * SQL for selecting candidate rows and applying a prediction. Candidates are rows whose value column holds
 * the sentinel and whose predicted flag is false, optionally narrowed to one parameter and to a recent
 * time window.
 */
public final class CandidateQuery {

    private static final Logger log = LoggerFactory.getLogger(CandidateQuery.class);

    private final String sql;
    private final List<Object> parameters;

    private CandidateQuery(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(parameters);
    }

    public String getSql() {
        return sql;
    }

    /** Positional bind values for {@link #getSql()}. */
    public List<Object> getParameters() {
        return parameters;
    }

    /** True when the time filter applies but no time column is configured, so table columns are needed. */
    public static boolean needsTableColumns(PredictConfig config) {
        return config.getLookbackHours() > 0 && isBlank(config.getTimeColumn());
    }

    /**
     * Builds the select for the configured table.
     *
     * @param tableColumns column names of the table in order; used only to detect a time column
     */
    public static CandidateQuery select(PredictConfig config, List<String> tableColumns) {
        String table = SqlIdentifiers.require(config.getTableName(), "table");
        String value = SqlIdentifiers.require(config.getValueColumn(), "value column");
        String flag = SqlIdentifiers.require(config.getPredictedFlagColumn(), "predicted flag column");

        StringBuilder sb = new StringBuilder("SELECT * FROM ").append(table)
                .append(" WHERE ").append(value).append(" = ?")
                .append(" AND ").append(flag).append(" = FALSE");
        List<Object> params = new ArrayList<>();
        params.add(config.getSentinelValue());

        if (!isBlank(config.getTargetParameter())) {
            String parameter = SqlIdentifiers.require(config.getParameterColumn(), "parameter column");
            sb.append(" AND ").append(parameter).append(" = ?");
            params.add(config.getTargetParameter());
        }

        if (config.getLookbackHours() > 0) {
            Optional<String> timeColumn = isBlank(config.getTimeColumn())
                    ? ColumnTypes.firstTimeColumn(tableColumns)
                    : Optional.of(config.getTimeColumn());
            if (timeColumn.isPresent()) {
                sb.append(" AND ").append(SqlIdentifiers.require(timeColumn.get(), "time column"))
                        .append(" >= NOW() - (? * INTERVAL '1 hour')");
                params.add(config.getLookbackHours());
            } else {
                log.warn("Lookback of {}h requested but table {} has no time column; filter not applied",
                        config.getLookbackHours(), table);
            }
        }
        return new CandidateQuery(sb.toString(), params);
    }

    /** Update of one row by id: sets the value and marks the row predicted. Binds value, then id. */
    public static String update(PredictConfig config) {
        return "UPDATE " + SqlIdentifiers.require(config.getTableName(), "table")
                + " SET " + SqlIdentifiers.require(config.getValueColumn(), "value column") + " = ?, "
                + SqlIdentifiers.require(config.getPredictedFlagColumn(), "predicted flag column") + " = TRUE"
                + " WHERE " + SqlIdentifiers.require(config.getIdColumn(), "id column") + " = ?";
    }

    /** Zero-row query used to read the table's column names. */
    public static String columnLookup(PredictConfig config) {
        return "SELECT * FROM " + SqlIdentifiers.require(config.getTableName(), "table") + " WHERE 1 = 0";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
