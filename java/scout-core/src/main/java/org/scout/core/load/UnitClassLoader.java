package org.scout.core.load;

import java.util.Map;
import java.util.Set;

/**
 * Defines the classes compiled from a single unit. One instance per load, so static
 * state of one unit never leaks into another.
 */
class UnitClassLoader extends ClassLoader {

    static {
        registerAsParallelCapable();
    }

    private final Map<String, byte[]> compiled;

    UnitClassLoader(String unitId, Map<String, byte[]> compiled, ClassLoader parent) {
        super("unit:" + unitId, parent);
        this.compiled = compiled;
    }

    Set<String> compiledClassNames() {
        return compiled.keySet();
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        byte[] bytes = compiled.get(name);
        if (bytes == null) {
            throw new ClassNotFoundException(name);
        }
        return defineClass(name, bytes, 0, bytes.length);
    }
}
