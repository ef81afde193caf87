package org.scout.core.load;

import org.scout.core.model.DiscoveredUnit;

/**
 * Materializes a discovered unit into a fresh, isolated namespace of classes.
 */
public interface UnitLoader {

    LoadedUnit load(DiscoveredUnit unit) throws UnitLoadException;
}
