package com.batchpredict.worker.activity;

import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.WriteResult;
import io.temporal.activity.ActivityInterface;
import io.temporal.activity.ActivityMethod;

/** One activity per active stage of a prediction run. */
@ActivityInterface
public interface PredictionActivities {

    /** Selects and exports candidates. Reports faults as status 500 rather than failing the activity. */
    @ActivityMethod
    QueryResult queryCandidates(int durationHours);

    /**
     * Submits the batch job and completes asynchronously: the result is delivered later by the completion
     * handler through the activity's task token, or a failure of type {@code DispatchErrorCode.getType()}.
     */
    @ActivityMethod
    DispatchResult dispatchJob(QueryResult queryResult);

    /** Applies the final predictions file to the dataset. Fails the activity if the file cannot be read. */
    @ActivityMethod
    WriteResult writePredictions(String fileKey, int records);
}
