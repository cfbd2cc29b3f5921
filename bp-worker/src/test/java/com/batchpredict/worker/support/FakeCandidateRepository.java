package com.batchpredict.worker.support;

import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.FeatureValue;
import com.batchpredict.model.RecordTable;
import com.batchpredict.storage.StorageException;
import com.batchpredict.storage.db.CandidateRepository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class FakeCandidateRepository implements CandidateRepository {

    public static final List<String> COLUMNS =
            List.of("id", "timestamp", "parameter", "device_id", "location_id", "deployment_date", "value", "predicted_label");

    private final List<CandidateRecord> candidates = new ArrayList<>();
    private final Map<String, BigDecimal> updates = new LinkedHashMap<>();
    private final Set<String> failingIds = ConcurrentHashMap.newKeySet();
    private final Set<String> knownIds = ConcurrentHashMap.newKeySet();
    private volatile boolean failQuery;

    /** Adds {@code count} sentinel rows with ids 1..count. */
    public static FakeCandidateRepository withRows(int count) {
        FakeCandidateRepository repo = new FakeCandidateRepository();
        for (int i = 1; i <= count; i++) {
            repo.add(String.valueOf(i));
        }
        return repo;
    }

    public void add(String id) {
        List<FeatureValue> features = List.of(
                new FeatureValue("timestamp", "2024-06-01 10:00:00"),
                new FeatureValue("parameter", "pm25"),
                new FeatureValue("device_id", "dev-" + id),
                new FeatureValue("location_id", "loc-7"),
                new FeatureValue("deployment_date", "2023-01-15"),
                new FeatureValue("value", "65535"),
                new FeatureValue("predicted_label", "false"));
        candidates.add(new CandidateRecord(id, features));
        knownIds.add(id);
    }

    @Override
    public RecordTable findCandidates() {
        if (failQuery) {
            throw new StorageException("connection refused");
        }
        return new RecordTable(COLUMNS, "id", candidates);
    }

    @Override
    public synchronized boolean updatePrediction(String id, BigDecimal value) {
        if (failingIds.contains(id)) {
            throw new StorageException("deadlock detected");
        }
        if (!knownIds.contains(id)) {
            return false;
        }
        updates.put(id, value);
        return true;
    }

    public void failQuery() {
        this.failQuery = true;
    }

    public void failUpdateFor(String id) {
        failingIds.add(id);
    }

    public void forget(String id) {
        knownIds.remove(id);
    }

    public synchronized Map<String, BigDecimal> updates() {
        return new LinkedHashMap<>(updates);
    }
}
