package com.batchpredict.worker.resume;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.ResumptionHandle;

/**
 * Delivers the outcome of a suspended dispatch to the workflow holding the handle. At most one delivery per
 * handle succeeds; a repeated or late delivery is logged and reported as {@code false}, never thrown.
 * <p>
 * Implementations throw {@link ResumptionUnavailableException} when the outcome could not be delivered for a
 * transient reason and a later attempt with the same handle may still succeed.
 */
public interface WorkflowResumer {

    boolean succeed(ResumptionHandle handle, DispatchResult result);

    boolean fail(ResumptionHandle handle, DispatchErrorCode code, String cause);
}
