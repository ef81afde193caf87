package org.scout.core.prep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Table of prep factories keyed by (scope, name).
 *
 * Registering the same key twice keeps the later factory.
 */
public class PrepRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PrepRegistry.class);

    private final Map<Key, PrepRegistration> registrations = new ConcurrentHashMap<>();

    public void register(String scope, String name, PrepFactory factory) {
        register(PrepScope.of(scope), name, factory);
    }

    public void register(PrepScope scope, String name, PrepFactory factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Prep name must not be blank");
        }
        PrepRegistration previous = registrations.put(new Key(scope, name), new PrepRegistration(scope, name, factory));
        if (previous != null) {
            logger.warn("Prep {}:{} registered twice; the later registration wins", scope.label(), name);
        } else {
            logger.debug("Registered prep {}:{}", scope.label(), name);
        }
    }

    public PrepRegistration lookup(PrepScope scope, String name) {
        PrepRegistration registration = registrations.get(new Key(scope, name));
        if (registration == null) {
            throw new PrepNotFoundException(scope, name);
        }
        return registration;
    }

    public boolean contains(PrepScope scope, String name) {
        return registrations.containsKey(new Key(scope, name));
    }

    public int size() {
        return registrations.size();
    }

    public List<PrepRegistration> registrations() {
        return new ArrayList<>(registrations.values());
    }

    private record Key(PrepScope scope, String name) {
    }
}
