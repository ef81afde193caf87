package org.scout.core.prep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Materializes prep values according to their scope.
 *
 * One context lives for a whole run inside one process and owns the session cache;
 * {@link #openClass(String)} creates the cache for one loaded test class and
 * {@link #openMethod(String)} the cache for one invocation of a test method.
 */
public class PrepContext {
    private static final Logger logger = LoggerFactory.getLogger(PrepContext.class);

    private final PrepRegistry registry;
    private final Map<String, Object> sessionValues = new HashMap<>();

    public PrepContext(PrepRegistry registry) {
        this.registry = registry;
    }

    public PrepRegistry getRegistry() {
        return registry;
    }

    public ClassPreps openClass(String classKey) {
        return new ClassPreps(classKey);
    }

    public MethodPreps openMethod(String invocationKey) {
        return new MethodPreps(invocationKey);
    }

    Object resolve(PrepScope scope, String name, ClassPreps classPreps, MethodPreps methodPreps) {
        PrepRegistration registration = registry.lookup(scope, name);
        switch (scope) {
            case SESSION:
                synchronized (sessionValues) {
                    return cached(sessionValues, registration, "session");
                }
            case CLASS:
                return cached(classPreps.values, registration, classPreps.classKey);
            default:
                // outside an invocation, e.g. in a constructor, nothing outlives the lookup
                if (methodPreps == null) {
                    return materialize(registration);
                }
                return cached(methodPreps.values, registration, methodPreps.invocationKey);
        }
    }

    private static Object cached(Map<String, Object> cache, PrepRegistration registration, String owner) {
        if (cache.containsKey(registration.name())) {
            return cache.get(registration.name());
        }
        Object value = materialize(registration);
        cache.put(registration.name(), value);
        logger.debug("Materialized {} prep '{}' for {}", registration.scope().label(), registration.name(), owner);
        return value;
    }

    private static Object materialize(PrepRegistration registration) {
        try {
            return registration.factory().create();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Prep " + registration.scope().label() + ":" + registration.name()
                    + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Class-scoped prep cache for one loaded test class.
     */
    public static final class ClassPreps {
        private final String classKey;
        private final Map<String, Object> values = new HashMap<>();

        private ClassPreps(String classKey) {
            this.classKey = classKey;
        }
    }

    /**
     * Method-scoped prep cache for a single invocation.
     */
    public static final class MethodPreps {
        private final String invocationKey;
        private final Map<String, Object> values = new HashMap<>();

        private MethodPreps(String invocationKey) {
            this.invocationKey = invocationKey;
        }
    }
}
