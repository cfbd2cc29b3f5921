package com.batchpredict.storage.db;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.FeatureValue;
import com.batchpredict.model.RecordTable;
import com.batchpredict.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** PostgreSQL {@link CandidateRepository}. Each call uses its own auto-commit connection. */
public final class JdbcCandidateRepository implements CandidateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCandidateRepository.class);

    private final PredictConfig config;
    private final JdbcConnectionProvider connectionProvider;
    private volatile Integer idSqlType;

    public JdbcCandidateRepository(PredictConfig config, JdbcConnectionProvider connectionProvider) {
        this.config = Objects.requireNonNull(config, "config");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    }

    @Override
    public RecordTable findCandidates() {
        try (Connection c = connectionProvider.getConnection()) {
            List<String> tableColumns = CandidateQuery.needsTableColumns(config) ? tableColumns(c) : List.of();
            CandidateQuery query = CandidateQuery.select(config, tableColumns);
            log.info("Querying candidates | table={} sql={}", config.getTableName(), query.getSql());
            try (PreparedStatement ps = c.prepareStatement(query.getSql())) {
                List<Object> params = query.getParameters();
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    return toTable(rs);
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Candidate query failed on " + config.getTableName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean updatePrediction(String id, BigDecimal value) {
        String sql = CandidateQuery.update(config);
        try (Connection c = connectionProvider.getConnection()) {
            int sqlType = idSqlType(c);
            Object idParameter = idParameter(id, sqlType);
            if (idParameter == null) {
                log.warn("Id '{}' cannot match {} column of JDBC type {}; skipped", id, config.getIdColumn(), sqlType);
                return false;
            }
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setBigDecimal(1, value);
                ps.setObject(2, idParameter);
                int updated = ps.executeUpdate();
                log.debug("Prediction applied | table={} id={} value={} rows={}", config.getTableName(), id, value, updated);
                return updated > 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Update failed for id " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Id as a bind value of the column's own type: integer and decimal columns get numbers, everything else
     * the text as read. Null when the text cannot be a value of a numeric column.
     */
    static Object idParameter(String id, int sqlType) {
        String trimmed = id.trim();
        try {
            switch (sqlType) {
                case Types.TINYINT:
                case Types.SMALLINT:
                case Types.INTEGER:
                case Types.BIGINT:
                    return Long.parseLong(trimmed);
                case Types.NUMERIC:
                case Types.DECIMAL:
                    return new BigDecimal(trimmed);
                default:
                    return trimmed;
            }
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private int idSqlType(Connection c) throws SQLException {
        Integer cached = idSqlType;
        if (cached != null) {
            return cached;
        }
        try (PreparedStatement ps = c.prepareStatement(CandidateQuery.columnLookup(config));
             ResultSet rs = ps.executeQuery()) {
            int type = columnType(rs.getMetaData(), config.getIdColumn());
            idSqlType = type;
            return type;
        }
    }

    private static int columnType(ResultSetMetaData md, String column) throws SQLException {
        for (int i = 1; i <= md.getColumnCount(); i++) {
            if (md.getColumnLabel(i).equals(column)) {
                return md.getColumnType(i);
            }
        }
        throw new SQLException("Identifier column '" + column + "' not in table columns");
    }

    private List<String> tableColumns(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(CandidateQuery.columnLookup(config));
             ResultSet rs = ps.executeQuery()) {
            return columnNames(rs.getMetaData());
        }
    }

    private RecordTable toTable(ResultSet rs) throws SQLException {
        List<String> columns = columnNames(rs.getMetaData());
        String idColumn = config.getIdColumn();
        int idIndex = columns.indexOf(idColumn);
        if (idIndex < 0) {
            throw new SQLException("Identifier column '" + idColumn + "' not in result columns " + columns);
        }
        idSqlType = rs.getMetaData().getColumnType(idIndex + 1);
        List<CandidateRecord> rows = new ArrayList<>();
        while (rs.next()) {
            List<FeatureValue> features = new ArrayList<>(columns.size() - 1);
            for (int i = 0; i < columns.size(); i++) {
                if (i == idIndex) continue;
                features.add(new FeatureValue(columns.get(i), rs.getString(i + 1)));
            }
            String id = rs.getString(idIndex + 1);
            rows.add(new CandidateRecord(id != null ? id : "", features));
        }
        return new RecordTable(columns, idColumn, rows);
    }

    private static List<String> columnNames(ResultSetMetaData md) throws SQLException {
        List<String> names = new ArrayList<>(md.getColumnCount());
        for (int i = 1; i <= md.getColumnCount(); i++) {
            names.add(md.getColumnLabel(i));
        }
        return names;
    }
}
