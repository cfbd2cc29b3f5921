package com.batchpredict.worker.workflow;

/** Stages of one prediction run. Terminal stages end the run with success or failure. */
public enum WorkflowStage {
    QUERYING(false, false),
    NO_RECORDS(true, true),
    QUERY_FAILED(true, false),
    HAS_RECORDS(false, false),
    DISPATCHING(false, false),
    DISPATCH_FAILED(true, false),
    AWAITING_COMPLETION(false, false),
    COMPLETED(false, false),
    JOB_FAILED(true, false),
    WRITING(false, false),
    WRITE_FAILED(true, false),
    DONE(true, true);

    private final boolean terminal;
    private final boolean success;

    WorkflowStage(boolean terminal, boolean success) {
        this.terminal = terminal;
        this.success = success;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccess() {
        return success;
    }
}
