package org.scout.core.annotation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.scout.core.model.ParameterBinding;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Metadata attached to a test method: suite tags and parameter bindings.
 * An empty {@code params} list means a single invocation without arguments.
 */
public record AnnotationSet(Set<String> suites, List<ParameterBinding> params) {

    public static final AnnotationSet EMPTY = new AnnotationSet(Set.of(), List.of());

    @JsonCreator
    public AnnotationSet(@JsonProperty("suites") Set<String> suites,
                         @JsonProperty("params") List<ParameterBinding> params) {
        this.suites = suites == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(suites));
        this.params = params == null ? List.of() : List.copyOf(params);
    }

    public boolean inSuite(String suite) {
        return suites.contains(suite);
    }

    /**
     * The bindings to invoke with, one per invocation; a {@code null} element stands for
     * the no-argument call.
     */
    public List<ParameterBinding> invocations() {
        return params.isEmpty() ? Collections.singletonList(null) : params;
    }
}
