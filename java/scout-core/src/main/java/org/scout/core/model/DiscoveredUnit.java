package org.scout.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A source unit with its statically discovered test classes and methods.
 *
 * @param unitId      relative path without extension, {@code /}-separated
 * @param packageName declared package of the unit, empty for the default package
 * @param content     raw source text, compiled again at execution time
 * @param classes     test methods per test class, both in declaration order
 */
public record DiscoveredUnit(String unitId,
                             String packageName,
                             String content,
                             Map<String, List<String>> classes) {

    public DiscoveredUnit {
        // copy into an insertion-ordered map: ordering is part of the contract
        Map<String, List<String>> ordered = new LinkedHashMap<>();
        classes.forEach((cls, methods) -> ordered.put(cls, List.copyOf(methods)));
        classes = Collections.unmodifiableMap(ordered);
        packageName = packageName == null ? "" : packageName;
    }

    public String binaryName(String className) {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    public int methodCount() {
        return classes.values().stream().mapToInt(List::size).sum();
    }
}
