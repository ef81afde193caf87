package org.scout.core.model;

/**
 * Stable identity of a test method across discovery, scheduling and reporting.
 */
public record MethodKey(String unitId, String className, String methodName) {

    @Override
    public String toString() {
        return unitId + "." + className + "." + methodName;
    }
}
