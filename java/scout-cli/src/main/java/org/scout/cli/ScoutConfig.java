package org.scout.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.scout.core.scan.SourceScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of the optional {@code scout.json} at a project root.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScoutConfig {

    public static final String FILE_NAME = "scout.json";

    // prep units, relative to the project root, loaded before discovery
    @JsonProperty("preps")
    private List<String> preps = new ArrayList<>();

    // directory names skipped while scanning; replaces the defaults when present
    @JsonProperty("exclude")
    private List<String> exclude = new ArrayList<>(SourceScanner.DEFAULT_EXCLUDES);

    @JsonProperty("classpath")
    private List<String> classpath = new ArrayList<>();

    @JsonProperty("workerJvmArgs")
    private List<String> workerJvmArgs = new ArrayList<>();

    public List<String> getPreps() {
        return preps;
    }

    public void setPreps(List<String> preps) {
        this.preps = preps;
    }

    public List<String> getExclude() {
        return exclude;
    }

    public void setExclude(List<String> exclude) {
        this.exclude = exclude;
    }

    public List<String> getClasspath() {
        return classpath;
    }

    public void setClasspath(List<String> classpath) {
        this.classpath = classpath;
    }

    public List<String> getWorkerJvmArgs() {
        return workerJvmArgs;
    }

    public void setWorkerJvmArgs(List<String> workerJvmArgs) {
        this.workerJvmArgs = workerJvmArgs;
    }
}
