package org.scout.core.worker;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.scout.core.annotation.AnnotationIndex;

import java.util.ArrayList;
import java.util.List;

/**
 * First line a worker reads: everything it needs to build its own runner.
 */
public class WorkerSetup {
    @JsonProperty("projectRoot")
    private String projectRoot;

    @JsonProperty("prepUnits")
    private List<String> prepUnits = new ArrayList<>();

    @JsonProperty("classpath")
    private List<String> classpath = new ArrayList<>();

    @JsonProperty("sourcePath")
    private List<String> sourcePath = new ArrayList<>();

    @JsonProperty("annotations")
    private List<AnnotationIndex.Entry> annotations = new ArrayList<>();

    public WorkerSetup() {}

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public List<String> getPrepUnits() {
        return prepUnits;
    }

    public void setPrepUnits(List<String> prepUnits) {
        this.prepUnits = prepUnits;
    }

    public List<String> getClasspath() {
        return classpath;
    }

    public void setClasspath(List<String> classpath) {
        this.classpath = classpath;
    }

    public List<String> getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(List<String> sourcePath) {
        this.sourcePath = sourcePath;
    }

    public List<AnnotationIndex.Entry> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(List<AnnotationIndex.Entry> annotations) {
        this.annotations = annotations;
    }
}
