package org.scout.core.exec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scout.core.annotation.AnnotationIndex;
import org.scout.core.annotation.AnnotationReader;
import org.scout.core.annotation.AnnotationSet;
import org.scout.core.filter.TestFilter;
import org.scout.core.load.LoadedUnit;
import org.scout.core.load.UnitLoadException;
import org.scout.core.load.UnitLoader;
import org.scout.core.model.DiscoveredUnit;
import org.scout.core.model.InvocationOutcome;
import org.scout.core.model.MethodKey;
import org.scout.core.model.OutcomeError;
import org.scout.core.model.ParameterBinding;
import org.scout.core.prep.PrepContext;
import org.scout.core.prep.Preps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Executes the tests of a batch of units inside the current process.
 *
 * Each unit is loaded on its own; a unit that fails to load fails every test that
 * survived the filter, and any failure of a single class or method is recorded as an
 * outcome without affecting its siblings.
 */
public class BatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchRunner.class);

    private final UnitLoader unitLoader;
    private final PrepContext prepContext;
    private final AnnotationIndex annotationIndex;
    private final AnnotationReader annotationReader;
    private final ArgumentBinder argumentBinder;

    public BatchRunner(UnitLoader unitLoader, PrepContext prepContext, AnnotationIndex annotationIndex,
                       ObjectMapper objectMapper) {
        this.unitLoader = unitLoader;
        this.prepContext = prepContext;
        this.annotationIndex = annotationIndex;
        this.annotationReader = new AnnotationReader(objectMapper);
        this.argumentBinder = new ArgumentBinder(objectMapper);
    }

    public List<InvocationOutcome> run(List<DiscoveredUnit> batch, TestFilter filter, String suite) {
        List<InvocationOutcome> outcomes = new ArrayList<>();
        run(batch, filter, suite, outcomes::add);
        return outcomes;
    }

    /**
     * Runs the batch in order, handing each outcome to {@code sink} as soon as it is known.
     */
    public void run(List<DiscoveredUnit> batch, TestFilter filter, String suite, Consumer<InvocationOutcome> sink) {
        for (DiscoveredUnit unit : batch) {
            runUnit(unit, filter, suite, sink);
        }
    }

    private void runUnit(DiscoveredUnit unit, TestFilter filter, String suite, Consumer<InvocationOutcome> sink) {
        if (!filter.matchesFile(unit.unitId())) {
            return;
        }
        Map<String, List<String>> surviving = filter.narrow(unit);
        if (surviving.isEmpty()) {
            return;
        }

        LoadedUnit loaded;
        try {
            loaded = unitLoader.load(unit);
        } catch (UnitLoadException e) {
            logger.warn("Unit {} failed to load: {}", unit.unitId(), e.getMessage());
            failAll(unit.unitId(), surviving, OutcomeError.execError(e.getMessage()), sink);
            return;
        }

        surviving.forEach((className, methods) -> {
            Optional<Class<?>> type = loaded.findClass(className);
            if (type.isEmpty()) {
                failAll(unit.unitId(), Map.of(className, methods), OutcomeError.classNotFound(), sink);
                return;
            }
            runClass(unit.unitId(), className, type.get(), methods, suite, sink);
        });
    }

    private void runClass(String unitId, String className, Class<?> type, List<String> methods,
                          String suite, Consumer<InvocationOutcome> sink) {
        PrepContext.ClassPreps classPreps = prepContext.openClass(unitId + "." + className);
        try (Preps.Binding ignored = Preps.bind(prepContext, classPreps)) {
            Object instance;
            try {
                instance = instantiate(type);
            } catch (InvocationTargetException e) {
                OutcomeError error = OutcomeError.of(e.getCause() != null ? e.getCause() : e);
                logger.debug("Construction of {}.{} failed: {}", unitId, className, error.describe());
                failAll(unitId, Map.of(className, methods), error, sink);
                return;
            } catch (ReflectiveOperationException | RuntimeException e) {
                failAll(unitId, Map.of(className, methods), OutcomeError.of(e), sink);
                return;
            }

            for (String methodName : methods) {
                MethodKey key = new MethodKey(unitId, className, methodName);
                Method method = findMethod(type, methodName);
                if (method == null) {
                    sink.accept(InvocationOutcome.fail(key, OutcomeError.methodNotFound(), null));
                    continue;
                }

                AnnotationSet annotations;
                try {
                    annotations = annotationIndex.resolve(key, method, annotationReader);
                } catch (RuntimeException e) {
                    sink.accept(InvocationOutcome.fail(key, OutcomeError.of(e), null));
                    continue;
                }
                if (suite != null && !suite.isEmpty() && !annotations.inSuite(suite)) {
                    continue;
                }

                for (ParameterBinding binding : annotations.invocations()) {
                    PrepContext.MethodPreps methodPreps = prepContext.openMethod(key + "[" + binding + "]");
                    try (Preps.Binding invocation = Preps.bind(prepContext, classPreps, methodPreps)) {
                        sink.accept(invoke(key, instance, method, binding));
                    }
                }
            }
        }
    }

    private InvocationOutcome invoke(MethodKey key, Object instance, Method method, ParameterBinding binding) {
        try {
            Object[] args = argumentBinder.bind(method, binding);
            method.invoke(instance, args);
            logger.debug("PASS {}", key);
            return InvocationOutcome.pass(key, binding);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.debug("FAIL {}: {}", key, cause.toString());
            return InvocationOutcome.fail(key, OutcomeError.of(cause), binding);
        } catch (IllegalAccessException | RuntimeException e) {
            logger.debug("FAIL {} before invocation: {}", key, e.getMessage());
            return InvocationOutcome.fail(key, OutcomeError.of(e), binding);
        }
    }

    private static Object instantiate(Class<?> type) throws ReflectiveOperationException {
        Constructor<?> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }

    // first declaration wins, searching from the class up its hierarchy
    private static Method findMethod(Class<?> type, String name) {
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.getName().equals(name) && !method.isSynthetic() && !method.isBridge()) {
                    method.setAccessible(true);
                    return method;
                }
            }
        }
        return null;
    }

    private static void failAll(String unitId, Map<String, List<String>> methods, OutcomeError error,
                                Consumer<InvocationOutcome> sink) {
        methods.forEach((className, names) -> {
            for (String methodName : names) {
                sink.accept(InvocationOutcome.fail(new MethodKey(unitId, className, methodName), error, null));
            }
        });
    }
}
