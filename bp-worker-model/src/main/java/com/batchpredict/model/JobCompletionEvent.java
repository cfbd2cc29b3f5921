package com.batchpredict.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Notification that an external batch job reached a terminal status. Accepts the service's event-bus shape
 * ({@code {"detail":{"TransformJobName":..,"TransformJobStatus":..}}}) and a direct-invocation shape
 * ({@code {"batch_job_name":..,"job_status":..}}).
 */
public final class JobCompletionEvent {

    private final String jobName;
    private final String rawStatus;

    public JobCompletionEvent(String jobName, String rawStatus) {
        this.jobName = jobName;
        this.rawStatus = rawStatus != null ? rawStatus : JobStatus.UNKNOWN.getExternalName();
    }

    /** Job name; may be null or blank when the event did not carry one. */
    public String getJobName() {
        return jobName;
    }

    /** Status text exactly as reported, used verbatim as the failure cause. */
    public String getRawStatus() {
        return rawStatus;
    }

    public JobStatus getStatus() {
        return JobStatus.fromExternal(rawStatus);
    }

    public static JobCompletionEvent fromJson(String json) {
        try {
            return fromNode(ModelJson.MAPPER.readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static JobCompletionEvent fromMap(Map<String, ?> event) {
        return fromNode(ModelJson.MAPPER.valueToTree(event != null ? event : Map.of()));
    }

    private static JobCompletionEvent fromNode(JsonNode root) {
        if (root == null || root.isNull()) {
            return new JobCompletionEvent(null, null);
        }
        JsonNode detail = root.get("detail");
        if (detail != null && detail.isObject()) {
            return new JobCompletionEvent(text(detail, "TransformJobName"), text(detail, "TransformJobStatus"));
        }
        return new JobCompletionEvent(text(root, "batch_job_name"), text(root, "job_status"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && !v.isNull() ? v.asText() : null;
    }

    @Override
    public String toString() {
        return "JobCompletionEvent{jobName=" + jobName + ", status=" + rawStatus + "}";
    }
}
