package org.scout.core.annotation;

import org.scout.core.model.MethodKey;
import org.scout.core.model.ParameterBinding;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Side table of method metadata, keyed by {@link MethodKey}.
 *
 * An entry registered here replaces whatever the method declares with annotations;
 * methods without an entry fall back to {@link AnnotationReader}. The index is
 * immutable once built.
 */
public class AnnotationIndex {

    private static final AnnotationIndex EMPTY = new AnnotationIndex(Map.of());

    private final Map<MethodKey, AnnotationSet> entries;

    private AnnotationIndex(Map<MethodKey, AnnotationSet> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static AnnotationIndex empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AnnotationIndex of(List<Entry> entries) {
        Map<MethodKey, AnnotationSet> map = new LinkedHashMap<>();
        for (Entry entry : entries) {
            map.put(entry.key(), entry.annotations());
        }
        return new AnnotationIndex(map);
    }

    public AnnotationSet resolve(MethodKey key, Method method, AnnotationReader reader) {
        AnnotationSet registered = entries.get(key);
        return registered != null ? registered : reader.read(method);
    }

    public List<Entry> entries() {
        List<Entry> list = new ArrayList<>();
        entries.forEach((key, annotations) -> list.add(new Entry(key, annotations)));
        return list;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public record Entry(MethodKey key, AnnotationSet annotations) {
    }

    public static class Builder {
        private final Map<MethodKey, Set<String>> suites = new LinkedHashMap<>();
        private final Map<MethodKey, List<ParameterBinding>> params = new LinkedHashMap<>();

        public Builder suites(MethodKey key, String... names) {
            suites.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(Arrays.asList(names));
            params.computeIfAbsent(key, k -> new ArrayList<>());
            return this;
        }

        public Builder params(MethodKey key, ParameterBinding... bindings) {
            params.computeIfAbsent(key, k -> new ArrayList<>()).addAll(Arrays.asList(bindings));
            suites.computeIfAbsent(key, k -> new LinkedHashSet<>());
            return this;
        }

        public AnnotationIndex build() {
            Map<MethodKey, AnnotationSet> map = new LinkedHashMap<>();
            for (MethodKey key : suites.keySet()) {
                map.put(key, new AnnotationSet(suites.get(key), params.get(key)));
            }
            return new AnnotationIndex(map);
        }
    }
}
