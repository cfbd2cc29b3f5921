package com.batchpredict.model;

/** Terminal status reported by the prediction service for a batch job. */
public enum JobStatus {
    COMPLETED("Completed"),
    FAILED("Failed"),
    STOPPED("Stopped"),
    UNKNOWN("Unknown");

    private final String externalName;

    JobStatus(String externalName) {
        this.externalName = externalName;
    }

    public String getExternalName() {
        return externalName;
    }

    /** Maps the service's status text; anything not recognized is {@link #UNKNOWN} and treated as failure. */
    public static JobStatus fromExternal(String status) {
        if (status == null) return UNKNOWN;
        for (JobStatus s : values()) {
            if (s.externalName.equalsIgnoreCase(status.trim())) {
                return s;
            }
        }
        return UNKNOWN;
    }
}
