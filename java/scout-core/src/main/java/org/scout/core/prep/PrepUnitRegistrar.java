package org.scout.core.prep;

import org.scout.core.ConfigurationException;
import org.scout.core.load.LoadedUnit;
import org.scout.core.load.UnitLoadException;
import org.scout.core.load.UnitLoader;
import org.scout.core.model.DiscoveredUnit;
import org.scout.core.scan.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads prep units and registers their {@link Prep} methods.
 */
public class PrepUnitRegistrar {
    private static final Logger logger = LoggerFactory.getLogger(PrepUnitRegistrar.class);

    private final UnitLoader unitLoader;
    private final PrepRegistry registry;

    public PrepUnitRegistrar(UnitLoader unitLoader, PrepRegistry registry) {
        this.unitLoader = unitLoader;
        this.registry = registry;
    }

    /**
     * @param projectRoot root the unit paths are relative to
     * @param prepUnits   relative paths of prep units, loaded in order
     * @return number of preps registered
     */
    public int registerAll(Path projectRoot, List<String> prepUnits) {
        int registered = 0;
        for (String relative : prepUnits) {
            registered += register(projectRoot, relative);
        }
        return registered;
    }

    private int register(Path projectRoot, String relative) {
        Path root = projectRoot.toAbsolutePath().normalize();
        Path file = root.resolve(relative).normalize();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Prep unit " + relative + " cannot be read: " + e.getMessage(), e);
        }

        String unitId = new SourceFile(root.relativize(file), content).unitId();
        LoadedUnit loaded;
        try {
            loaded = unitLoader.load(new DiscoveredUnit(unitId, "", content, Map.of()));
        } catch (UnitLoadException e) {
            throw new ConfigurationException("Prep unit " + relative + " failed to load: " + e.getMessage(), e);
        }

        int count = 0;
        for (Class<?> type : loaded.getClasses()) {
            for (Method method : type.getDeclaredMethods()) {
                Prep prep = method.getAnnotation(Prep.class);
                if (prep == null) {
                    continue;
                }
                if (!Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0) {
                    throw new ConfigurationException("@Prep method " + type.getName() + "." + method.getName()
                            + " must be static and take no arguments");
                }
                String name = prep.name().isBlank() ? method.getName() : prep.name();
                method.setAccessible(true);
                registry.register(prep.scope(), name, () -> invoke(method));
                count++;
            }
        }
        logger.info("Registered {} preps from {}", count, relative);
        return count;
    }

    private static Object invoke(Method method) throws Exception {
        try {
            return method.invoke(null);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
