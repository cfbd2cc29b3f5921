package com.batchpredict.worker.dispatch;

import com.batchpredict.model.CandidateRecord;
import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.FeatureValue;
import com.batchpredict.model.RecordTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FeatureProjectionTest {

    private static RecordTable table(String note) {
        return new RecordTable(List.of("id", "device_id", "note"), "id", List.of(
                new CandidateRecord("1", List.of(new FeatureValue("device_id", "d1"), new FeatureValue("note", "ok"))),
                new CandidateRecord("2", List.of(new FeatureValue("device_id", "d2"), new FeatureValue("note", note)))));
    }

    @Test
    void project_keepsFeatureOrderAndRowOrder() {
        List<List<String>> rows = FeatureProjection.project(table("x"), List.of("note", "device_id"));

        assertEquals(List.of(List.of("ok", "d1"), List.of("x", "d2")), rows);
    }

    @Test
    void project_rejectsCarriageReturnInCell() {
        DispatchException e = assertThrows(DispatchException.class,
                () -> FeatureProjection.project(table("a\rb"), List.of("device_id", "note")));

        assertEquals(DispatchErrorCode.INVALID_FEATURE_VALUE, e.getErrorCode());
    }

    @Test
    void project_ignoresLineBreaksOutsideFeatureColumns() {
        List<List<String>> rows = FeatureProjection.project(table("a\nb"), List.of("device_id"));

        assertEquals(2, rows.size());
    }
}
