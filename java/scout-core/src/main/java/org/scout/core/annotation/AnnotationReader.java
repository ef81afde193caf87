package org.scout.core.annotation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.model.ParameterBinding;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@link Suites} and {@link Parameters} declared on a loaded test method.
 */
public class AnnotationReader {

    private final ObjectMapper objectMapper;

    public AnnotationReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public AnnotationSet read(Method method) {
        Set<String> suites = new LinkedHashSet<>();
        Suites declaredSuites = method.getAnnotation(Suites.class);
        if (declaredSuites != null) {
            suites.addAll(Arrays.asList(declaredSuites.value()));
        }

        List<ParameterBinding> params = new ArrayList<>();
        Parameters declaredParams = method.getAnnotation(Parameters.class);
        if (declaredParams != null) {
            for (String json : declaredParams.value()) {
                params.add(parse(method, json));
            }
        }
        return new AnnotationSet(suites, params);
    }

    private ParameterBinding parse(Method method, String json) {
        try {
            return ParameterBinding.of(objectMapper.readValue(json, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid @Parameters entry on " + method.getName()
                    + ": " + e.getOriginalMessage(), e);
        }
    }
}
