package org.scout.core.filter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.scout.core.model.DiscoveredUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Three-part selection filter over (unit, class, method).
 *
 * Each part is matched by exact equality; a missing, empty or {@code "*"} part matches everything.
 */
public final class TestFilter {

    private static final String WILDCARD = "*";
    private static final TestFilter ALL = new TestFilter(null, null, null);

    private final String filePattern;
    private final String classPattern;
    private final String methodPattern;

    @JsonCreator
    public TestFilter(@JsonProperty("file") String filePattern,
                      @JsonProperty("class") String classPattern,
                      @JsonProperty("method") String methodPattern) {
        this.filePattern = filePattern;
        this.classPattern = classPattern;
        this.methodPattern = methodPattern;
    }

    public static TestFilter all() {
        return ALL;
    }

    /**
     * Builds a filter from {@code file}, {@code file.class} or {@code file.class.method}.
     * A null expression selects everything.
     */
    public static TestFilter parse(String expression) {
        if (expression == null) {
            return ALL;
        }
        // keep trailing empty segments so "a.b." still counts as three parts
        String[] parts = expression.split("\\.", -1);
        if (parts.length < 1 || parts.length > 3) {
            throw new InvalidFilterFormatException(
                    "Invalid test filter format '" + expression + "' - Use file, file.class or file.class.method");
        }
        return new TestFilter(parts[0],
                parts.length > 1 ? parts[1] : null,
                parts.length > 2 ? parts[2] : null);
    }

    public boolean matches(String unitId, String className, String methodName) {
        return matchesFile(unitId) && matchesClass(className) && matchesMethod(methodName);
    }

    public boolean matchesFile(String unitId) {
        return matchesPart(filePattern, unitId);
    }

    public boolean matchesClass(String className) {
        return matchesPart(classPattern, className);
    }

    public boolean matchesMethod(String methodName) {
        return matchesPart(methodPattern, methodName);
    }

    /**
     * Classes and methods of a unit that pass the class and method patterns, in declaration
     * order. Classes left without methods are dropped; the file pattern is not consulted.
     */
    public Map<String, List<String>> narrow(DiscoveredUnit unit) {
        Map<String, List<String>> surviving = new LinkedHashMap<>();
        unit.classes().forEach((className, methods) -> {
            if (!matchesClass(className)) {
                return;
            }
            List<String> kept = new ArrayList<>();
            for (String method : methods) {
                if (matchesMethod(method)) {
                    kept.add(method);
                }
            }
            if (!kept.isEmpty()) {
                surviving.put(className, kept);
            }
        });
        return surviving;
    }

    private static boolean matchesPart(String pattern, String value) {
        if (pattern == null || pattern.isEmpty() || WILDCARD.equals(pattern)) {
            return true;
        }
        return pattern.equals(value);
    }

    @JsonProperty("file")
    public String getFilePattern() {
        return filePattern;
    }

    @JsonProperty("class")
    public String getClassPattern() {
        return classPattern;
    }

    @JsonProperty("method")
    public String getMethodPattern() {
        return methodPattern;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestFilter that)) return false;
        return Objects.equals(filePattern, that.filePattern)
                && Objects.equals(classPattern, that.classPattern)
                && Objects.equals(methodPattern, that.methodPattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filePattern, classPattern, methodPattern);
    }

    @Override
    public String toString() {
        return "TestFilter{file=" + filePattern + ", class=" + classPattern + ", method=" + methodPattern + "}";
    }
}
