package org.scout.core;

import org.scout.core.annotation.AnnotationIndex;
import org.scout.core.exec.SchedulerSettings;
import org.scout.core.prep.PrepRegistry;
import org.scout.core.scan.SourceScanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Inputs of one {@link ScoutRunner} run.
 */
public class RunOptions {

    private Path projectRoot;

    private int maxWorkers = 1;

    private int batchSize = SchedulerSettings.DEFAULT_BATCH_SIZE;

    // null runs every suite
    private String suite;

    // dotted file[.class[.method]] expression, null selects everything
    private String filter;

    // project-relative prep unit paths
    private List<String> prepUnits = new ArrayList<>();

    private List<String> excludes = new ArrayList<>(SourceScanner.DEFAULT_EXCLUDES);

    private List<String> classpath = new ArrayList<>();

    private List<String> workerJvmArgs = new ArrayList<>();

    private AnnotationIndex annotationIndex = AnnotationIndex.empty();

    // in-process registrations; forked workers only see prep units
    private PrepRegistry prepRegistry;

    public Path getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(Path projectRoot) {
        this.projectRoot = projectRoot;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public void setMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getSuite() {
        return suite;
    }

    public void setSuite(String suite) {
        this.suite = suite;
    }

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public List<String> getPrepUnits() {
        return prepUnits;
    }

    public void setPrepUnits(List<String> prepUnits) {
        this.prepUnits = prepUnits;
    }

    public List<String> getExcludes() {
        return excludes;
    }

    public void setExcludes(List<String> excludes) {
        this.excludes = excludes;
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

    public AnnotationIndex getAnnotationIndex() {
        return annotationIndex;
    }

    public void setAnnotationIndex(AnnotationIndex annotationIndex) {
        this.annotationIndex = annotationIndex;
    }

    public PrepRegistry getPrepRegistry() {
        return prepRegistry;
    }

    public void setPrepRegistry(PrepRegistry prepRegistry) {
        this.prepRegistry = prepRegistry;
    }
}
