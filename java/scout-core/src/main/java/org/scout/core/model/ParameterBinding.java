package org.scout.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One set of arguments for a parameterized test method: either named (a map from
 * parameter name to value) or positional (a list of values).
 *
 * Serialized as the bare JSON object or array.
 */
public final class ParameterBinding {

    private final Map<String, Object> named;
    private final List<Object> positional;

    private ParameterBinding(Map<String, Object> named, List<Object> positional) {
        this.named = named;
        this.positional = positional;
    }

    public static ParameterBinding named(Map<String, ?> arguments) {
        return new ParameterBinding(Collections.unmodifiableMap(new LinkedHashMap<>(arguments)), null);
    }

    public static ParameterBinding positional(List<?> arguments) {
        // values may legitimately be null, so no List.copyOf
        return new ParameterBinding(null, Collections.unmodifiableList(new ArrayList<>(arguments)));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    @SuppressWarnings("unchecked")
    public static ParameterBinding of(Object arguments) {
        if (arguments instanceof Map<?, ?> map) {
            return named((Map<String, ?>) map);
        }
        if (arguments instanceof List<?> list) {
            return positional(list);
        }
        throw new IllegalArgumentException("A parameter binding must be a JSON object or array, got: " + arguments);
    }

    public boolean isNamed() {
        return named != null;
    }

    public Map<String, Object> namedArguments() {
        return named;
    }

    public List<Object> positionalArguments() {
        return positional;
    }

    @JsonValue
    public Object arguments() {
        return named != null ? named : positional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterBinding that)) return false;
        return Objects.equals(named, that.named) && Objects.equals(positional, that.positional);
    }

    @Override
    public int hashCode() {
        return Objects.hash(named, positional);
    }

    @Override
    public String toString() {
        return String.valueOf(arguments());
    }
}
