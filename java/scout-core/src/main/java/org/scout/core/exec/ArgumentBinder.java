package org.scout.core.exec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.model.ParameterBinding;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link ParameterBinding} into the argument array of a test method.
 *
 * Named bindings match method parameters by name, which needs classes compiled with
 * {@code -parameters}. Values are converted to the declared parameter types through Jackson.
 */
class ArgumentBinder {

    private static final Object[] NO_ARGS = new Object[0];

    private final ObjectMapper objectMapper;

    ArgumentBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Object[] bind(Method method, ParameterBinding binding) {
        Parameter[] parameters = method.getParameters();
        if (binding == null) {
            if (parameters.length != 0) {
                throw new IllegalArgumentException(method.getName() + "() takes " + parameters.length
                        + " arguments but no parameters were given");
            }
            return NO_ARGS;
        }
        return binding.isNamed()
                ? bindNamed(method, parameters, binding.namedArguments())
                : bindPositional(method, parameters, binding.positionalArguments());
    }

    private Object[] bindPositional(Method method, Parameter[] parameters, List<Object> values) {
        if (values.size() != parameters.length) {
            throw new IllegalArgumentException(method.getName() + "() takes " + parameters.length
                    + " arguments but " + values.size() + " were given");
        }
        Object[] args = new Object[parameters.length];
        for (int i = 0; i < parameters.length; i++) {
            args[i] = convert(values.get(i), parameters[i]);
        }
        return args;
    }

    private Object[] bindNamed(Method method, Parameter[] parameters, Map<String, Object> values) {
        Object[] args = new Object[parameters.length];
        Set<String> unused = new HashSet<>(values.keySet());
        for (int i = 0; i < parameters.length; i++) {
            Parameter parameter = parameters[i];
            if (!parameter.isNamePresent()) {
                throw new IllegalArgumentException(method.getName()
                        + "() has no parameter names; compile it with -parameters to bind by name");
            }
            if (!values.containsKey(parameter.getName())) {
                throw new IllegalArgumentException(method.getName() + "() missing argument '"
                        + parameter.getName() + "'");
            }
            args[i] = convert(values.get(parameter.getName()), parameter);
            unused.remove(parameter.getName());
        }
        if (!unused.isEmpty()) {
            throw new IllegalArgumentException(method.getName() + "() got unexpected arguments " + unused);
        }
        return args;
    }

    private Object convert(Object value, Parameter parameter) {
        if (value == null) {
            if (parameter.getType().isPrimitive()) {
                throw new IllegalArgumentException("null cannot be bound to primitive parameter '"
                        + parameter.getName() + "'");
            }
            return null;
        }
        JavaType type = objectMapper.constructType(parameter.getParameterizedType());
        return objectMapper.convertValue(value, type);
    }
}
