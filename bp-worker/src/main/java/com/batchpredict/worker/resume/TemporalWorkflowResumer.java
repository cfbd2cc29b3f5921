package com.batchpredict.worker.resume;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.worker.metrics.PredictionMetrics;
import io.temporal.client.ActivityCompletionClient;
import io.temporal.client.ActivityCompletionException;
import io.temporal.client.ActivityCompletionFailureException;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Completes the asynchronous dispatch activity by task token. Failures are non-retryable
 * {@link ApplicationFailure}s whose type is the {@link DispatchErrorCode#getType()}.
 * <p>
 * An activity that no longer exists or was canceled is a rejected delivery ({@code false}); any other
 * completion failure, such as an unreachable service, is thrown as {@link ResumptionUnavailableException}.
 */
public final class TemporalWorkflowResumer implements WorkflowResumer {

    private static final Logger log = LoggerFactory.getLogger(TemporalWorkflowResumer.class);

    private final ActivityCompletionClient completionClient;
    private final LongSupplier clock;

    public TemporalWorkflowResumer(ActivityCompletionClient completionClient) {
        this(completionClient, System::currentTimeMillis);
    }

    TemporalWorkflowResumer(ActivityCompletionClient completionClient, LongSupplier clock) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public boolean succeed(ResumptionHandle handle, DispatchResult result) {
        if (isExpired(handle)) {
            return false;
        }
        try {
            completionClient.complete(handle.taskToken(), result);
            log.info("Workflow resumed with success | {}", result);
            return true;
        } catch (ActivityCompletionException e) {
            if (!isRejection(e)) {
                throw new ResumptionUnavailableException("Success delivery failed: " + e.getMessage(), e);
            }
            log.warn("Success delivery rejected (already resumed or timed out): {}", e.getMessage());
            PredictionMetrics.resumptionRejected();
            return false;
        }
    }

    @Override
    public boolean fail(ResumptionHandle handle, DispatchErrorCode code, String cause) {
        if (isExpired(handle)) {
            return false;
        }
        try {
            completionClient.completeExceptionally(handle.taskToken(),
                    ApplicationFailure.newNonRetryableFailure(cause, code.getType()));
            log.info("Workflow resumed with failure | error={} cause={}", code.getType(), cause);
            return true;
        } catch (ActivityCompletionException e) {
            if (!isRejection(e)) {
                throw new ResumptionUnavailableException(
                        "Failure delivery (" + code.getType() + ") failed: " + e.getMessage(), e);
            }
            log.warn("Failure delivery rejected (already resumed or timed out) | error={}: {}",
                    code.getType(), e.getMessage());
            PredictionMetrics.resumptionRejected();
            return false;
        }
    }

    /** True when the activity is gone; false when the service could not complete the request. */
    static boolean isRejection(ActivityCompletionException e) {
        return !(e instanceof ActivityCompletionFailureException);
    }

    private boolean isExpired(ResumptionHandle handle) {
        if (handle.isExpired(clock.getAsLong())) {
            log.warn("Resumption handle expired at {}; outcome not delivered", handle.getExpiresAtMillis());
            PredictionMetrics.resumptionRejected();
            return true;
        }
        return false;
    }
}
