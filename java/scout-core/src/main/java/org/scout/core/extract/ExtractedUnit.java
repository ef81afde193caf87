package org.scout.core.extract;

import java.util.List;
import java.util.Map;

/**
 * Structural summary of one source unit, produced without compiling or running it.
 *
 * @param packageName  declared package, empty for the default package
 * @param testClasses  test class names in declaration order
 * @param testMethods  test method names per class, in declaration order
 * @param imports      top-level imports as written ({@code static} and {@code .*} included)
 */
public record ExtractedUnit(String packageName,
                            List<String> testClasses,
                            Map<String, List<String>> testMethods,
                            List<String> imports) {

    public boolean hasTests() {
        return !testClasses.isEmpty();
    }

    public int methodCount() {
        return testMethods.values().stream().mapToInt(List::size).sum();
    }
}
