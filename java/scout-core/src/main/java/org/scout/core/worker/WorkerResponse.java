package org.scout.core.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.scout.core.model.InvocationOutcome;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply to a setup line (batch id {@link #SETUP_ACK}) or to a {@link WorkerRequest}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkerResponse {

    public static final int SETUP_ACK = -1;

    @JsonProperty("batchId")
    private int batchId;

    @JsonProperty("outcomes")
    private List<InvocationOutcome> outcomes = new ArrayList<>();

    // set when the worker could not handle the line at all
    @JsonProperty("error")
    private String error;

    public WorkerResponse() {}

    public WorkerResponse(int batchId, List<InvocationOutcome> outcomes, String error) {
        this.batchId = batchId;
        this.outcomes = outcomes;
        this.error = error;
    }

    public int getBatchId() {
        return batchId;
    }

    public void setBatchId(int batchId) {
        this.batchId = batchId;
    }

    public List<InvocationOutcome> getOutcomes() {
        return outcomes;
    }

    public void setOutcomes(List<InvocationOutcome> outcomes) {
        this.outcomes = outcomes;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
