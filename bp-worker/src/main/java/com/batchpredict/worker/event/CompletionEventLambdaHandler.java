package com.batchpredict.worker.event;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.JobCompletionEvent;
import com.batchpredict.worker.PredictWorkerComponents;
import com.batchpredict.worker.completion.CompletionHandler;
import com.batchpredict.worker.completion.CompletionResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lambda entry point for batch job state-change events. Accepts the event-bus shape and the
 * direct-invocation shape; see {@link JobCompletionEvent}.
 */
public class CompletionEventLambdaHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {

    private static final Logger log = LoggerFactory.getLogger(CompletionEventLambdaHandler.class);

    private static volatile CompletionHandler sharedHandler;

    private final CompletionHandler handler;

    /** Used by the Lambda runtime: components are built once per container from the environment. */
    public CompletionEventLambdaHandler() {
        this(null);
    }

    CompletionEventLambdaHandler(CompletionHandler handler) {
        this.handler = handler;
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> input, Context context) {
        JobCompletionEvent event = JobCompletionEvent.fromMap(input);
        log.info("Received job state change event | {}", event);
        CompletionResponse response = handler().handle(event);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("statusCode", response.getStatusCode());
        out.put("body", response.getMessage());
        out.put("resumed", response.isResumed());
        return out;
    }

    private CompletionHandler handler() {
        if (handler != null) {
            return handler;
        }
        CompletionHandler existing = sharedHandler;
        if (existing == null) {
            synchronized (CompletionEventLambdaHandler.class) {
                existing = sharedHandler;
                if (existing == null) {
                    existing = PredictWorkerComponents.create(PredictConfig.fromEnvironment()).completionHandler();
                    sharedHandler = existing;
                }
            }
        }
        return existing;
    }
}
