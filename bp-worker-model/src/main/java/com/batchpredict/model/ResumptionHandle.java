package com.batchpredict.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Base64;
import java.util.Objects;

/**
 * Opaque capability to resume one suspended workflow execution: the orchestrator's task token (Base64)
 * plus the instant after which the orchestrator has given up waiting. Single use: the substrate accepts
 * the first delivered outcome and rejects any later one.
 */
public final class ResumptionHandle {

    private final String token;
    private final long expiresAtMillis;

    @JsonCreator
    public ResumptionHandle(
            @JsonProperty("token") String token,
            @JsonProperty("expiresAtMillis") long expiresAtMillis) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
        this.token = token;
        this.expiresAtMillis = expiresAtMillis;
    }

    public static ResumptionHandle of(byte[] taskToken, long expiresAtMillis) {
        Objects.requireNonNull(taskToken, "taskToken");
        return new ResumptionHandle(Base64.getEncoder().encodeToString(taskToken), expiresAtMillis);
    }

    public String getToken() {
        return token;
    }

    /** Epoch millis after which delivery is pointless; 0 means no expiry. */
    public long getExpiresAtMillis() {
        return expiresAtMillis;
    }

    @JsonIgnore
    public byte[] taskToken() {
        return Base64.getDecoder().decode(token);
    }

    public boolean isExpired(long nowMillis) {
        return expiresAtMillis > 0 && nowMillis > expiresAtMillis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResumptionHandle)) return false;
        ResumptionHandle that = (ResumptionHandle) o;
        return expiresAtMillis == that.expiresAtMillis && token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, expiresAtMillis);
    }

    @Override
    public String toString() {
        return "ResumptionHandle{expiresAtMillis=" + expiresAtMillis + "}";
    }
}
