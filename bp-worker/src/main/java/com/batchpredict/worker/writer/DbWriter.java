package com.batchpredict.worker.writer;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.WriteResult;
import com.batchpredict.model.csv.CsvRecordCodec;
import com.batchpredict.storage.StorageException;
import com.batchpredict.storage.db.CandidateRepository;
import com.batchpredict.storage.object.ObjectStore;
import com.batchpredict.worker.metrics.PredictionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies the final predictions file to the dataset, one independently committed update per row.
 * A row that is malformed, not found or fails to update is logged and skipped; a file that cannot be read
 * fails the stage.
 */
public final class DbWriter {

    static final String PREDICTED_VALUE_COLUMN = "predicted_value";
    static final int SCALE = 2;

    private static final Logger log = LoggerFactory.getLogger(DbWriter.class);

    private final PredictConfig config;
    private final ObjectStore objects;
    private final CandidateRepository repository;

    public DbWriter(PredictConfig config, ObjectStore objects, CandidateRepository repository) {
        this.config = Objects.requireNonNull(config, "config");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /**
     * @param records expected row count; 0 returns {@code {0, 0}} without reading anything
     * @throws StorageException if the file cannot be read or holds no usable prediction
     */
    public WriteResult write(String fileKey, int records) {
        if (records == 0) {
            log.info("Nothing to update; no predictions found");
            return WriteResult.empty();
        }
        log.info("Processing file {} with {} records", fileKey, records);
        List<Map<String, String>> rows = CsvRecordCodec.readRows(objects.readObject(fileKey));

        String idColumn = config.getIdColumn();
        int total = 0;
        int updated = 0;
        for (Map<String, String> row : rows) {
            String id = row.get(idColumn);
            String raw = row.get(PREDICTED_VALUE_COLUMN);
            if (isBlank(id) || isBlank(raw)) {
                log.warn("Missing required fields in prediction row: {}", row);
                continue;
            }
            BigDecimal value;
            try {
                value = round(raw);
            } catch (NumberFormatException e) {
                log.warn("Non-numeric predicted value '{}' for id {}; skipped", raw, id);
                continue;
            }
            total++;
            try {
                if (repository.updatePrediction(id.trim(), value)) {
                    updated++;
                } else {
                    log.warn("No record found with id {}", id);
                }
            } catch (RuntimeException e) {
                log.error("Error updating prediction for id {}: {}", id, e.getMessage());
            }
        }
        if (total == 0) {
            throw new StorageException("No predictions found in " + fileKey);
        }
        log.info("Update complete. {} of {} records updated.", updated, total);
        PredictionMetrics.rowsWritten(total, updated);
        return new WriteResult(total, updated);
    }

    /** Two decimals, half-up on the exact decimal text: 12.345 becomes 12.35, 12.344 becomes 12.34. */
    static BigDecimal round(String raw) {
        return new BigDecimal(raw.trim()).setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
