package org.scout.core.load;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compile and load settings for {@link CompilingUnitLoader}.
 */
public class CompilerSettings {

    // extra entries, searched after the engine's own classpath
    private List<String> classpath = new ArrayList<>();

    // roots used to resolve references from one unit to sibling sources
    private List<Path> sourcePath = new ArrayList<>();

    public List<String> getClasspath() {
        return classpath;
    }

    public void setClasspath(List<String> classpath) {
        this.classpath = classpath;
    }

    public List<Path> getSourcePath() {
        return sourcePath;
    }

    public void setSourcePath(List<Path> sourcePath) {
        this.sourcePath = sourcePath;
    }
}
