package dev.evalset.log;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Lifecycle state recorded in an eval log. */
public enum EvalStatus {
    /** written when execution begins. A log still in this state was abandoned or is running */
    @JsonProperty("started")
    STARTED,
    @JsonProperty("success")
    SUCCESS,
    @JsonProperty("error")
    ERROR;

    public boolean isCompleted() {
        return this != STARTED;
    }
}
