package org.scout.core.load;

import org.scout.core.model.DiscoveredUnit;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The classes a unit defined when it was loaded, keyed by binary name.
 */
public class LoadedUnit {

    private final DiscoveredUnit unit;
    private final Map<String, Class<?>> classes;

    public LoadedUnit(DiscoveredUnit unit, Map<String, Class<?>> classes) {
        this.unit = unit;
        this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    public DiscoveredUnit getUnit() {
        return unit;
    }

    /**
     * Looks up a top-level class of this unit by its simple name.
     */
    public Optional<Class<?>> findClass(String simpleName) {
        return Optional.ofNullable(classes.get(unit.binaryName(simpleName)));
    }

    public Collection<Class<?>> getClasses() {
        return classes.values();
    }
}
