package org.scout.core.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.scout.core.filter.TestFilter;
import org.scout.core.model.DiscoveredUnit;

import java.util.List;

public class WorkerRequest {
    @JsonProperty("batchId")
    private int batchId;

    @JsonProperty("suite")
    private String suite;

    @JsonProperty("filter")
    private TestFilter filter;

    @JsonProperty("units")
    private List<DiscoveredUnit> units;

    public WorkerRequest() {}

    public WorkerRequest(int batchId, String suite, TestFilter filter, List<DiscoveredUnit> units) {
        this.batchId = batchId;
        this.suite = suite;
        this.filter = filter;
        this.units = units;
    }

    public int getBatchId() {
        return batchId;
    }

    public void setBatchId(int batchId) {
        this.batchId = batchId;
    }

    public String getSuite() {
        return suite;
    }

    public void setSuite(String suite) {
        this.suite = suite;
    }

    public TestFilter getFilter() {
        return filter;
    }

    public void setFilter(TestFilter filter) {
        this.filter = filter;
    }

    public List<DiscoveredUnit> getUnits() {
        return units;
    }

    public void setUnits(List<DiscoveredUnit> units) {
        this.units = units;
    }
}
