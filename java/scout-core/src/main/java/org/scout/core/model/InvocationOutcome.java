package org.scout.core.model;

/**
 * Result of one (method, parameter binding) invocation attempt.
 *
 * @param params the binding used, or {@code null} for a no-argument call
 */
public record InvocationOutcome(String unitId,
                                String className,
                                String methodName,
                                boolean passed,
                                OutcomeError error,
                                ParameterBinding params) {

    public static InvocationOutcome pass(MethodKey key, ParameterBinding params) {
        return new InvocationOutcome(key.unitId(), key.className(), key.methodName(), true, null, params);
    }

    public static InvocationOutcome fail(MethodKey key, OutcomeError error, ParameterBinding params) {
        return new InvocationOutcome(key.unitId(), key.className(), key.methodName(), false, error, params);
    }

    public MethodKey key() {
        return new MethodKey(unitId, className, methodName);
    }
}
