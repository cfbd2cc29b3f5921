package com.batchpredict.worker.query;

import com.batchpredict.model.QueryResult;
import com.batchpredict.model.RecordTable;
import com.batchpredict.model.csv.CsvRecordCodec;
import com.batchpredict.storage.db.CandidateRepository;
import com.batchpredict.storage.object.ObjectStore;
import com.batchpredict.worker.FileKeys;
import com.batchpredict.worker.metrics.PredictionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Selects rows needing prediction and exports them, with a header, under {@code retrieved_from_db/}.
 * Never throws: an empty selection is 204 and any store or storage fault is 500 with the cause in the message.
 */
public final class QueryStage {

    private static final Logger log = LoggerFactory.getLogger(QueryStage.class);

    private final CandidateRepository repository;
    private final ObjectStore objects;
    private final Clock clock;

    public QueryStage(CandidateRepository repository, ObjectStore objects, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public QueryResult run(int durationHours) {
        QueryResult result;
        try {
            RecordTable table = repository.findCandidates();
            if (table.isEmpty()) {
                log.info("No candidate records found | durationHours={}", durationHours);
                result = QueryResult.noRecords(durationHours);
            } else {
                String key = FileKeys.queryResults(FileKeys.timestamp(clock.instant()));
                objects.writeObject(key, CsvRecordCodec.writeTable(table));
                log.info("Exported candidates | records={} key={}", table.size(), key);
                result = QueryResult.found(table.size(), key, durationHours);
            }
        } catch (RuntimeException e) {
            log.error("Query stage failed: {}", e.getMessage(), e);
            result = QueryResult.failed("Query failed: " + e.getMessage(), durationHours);
        }
        PredictionMetrics.queryCompleted(result.getStatusCode(), result.getRecords());
        return result;
    }
}
