package org.scout.core.prep;

/**
 * Entry point for test code to obtain prep values.
 *
 * The runner binds the active {@link PrepContext} to the executing thread while it
 * constructs a test class and invokes its methods; resolving outside of that window fails.
 */
public final class Preps {

    private static final ThreadLocal<Binding> CURRENT = new ThreadLocal<>();

    private Preps() {
    }

    public static Object session(String name) {
        return resolve(PrepScope.SESSION, name);
    }

    public static Object forClass(String name) {
        return resolve(PrepScope.CLASS, name);
    }

    public static Object method(String name) {
        return resolve(PrepScope.METHOD, name);
    }

    public static Object resolve(String scope, String name) {
        return resolve(PrepScope.of(scope), name);
    }

    public static Object resolve(PrepScope scope, String name) {
        Binding binding = CURRENT.get();
        if (binding == null) {
            throw new IllegalStateException("No active prep context; preps resolve only while a test runs");
        }
        return binding.context.resolve(scope, name, binding.classPreps, binding.methodPreps);
    }

    /**
     * Binds a context to the current thread until the returned binding is closed.
     */
    public static Binding bind(PrepContext context, PrepContext.ClassPreps classPreps) {
        return bind(context, classPreps, null);
    }

    /**
     * Binds a context for one invocation; method-scoped values are shared until the binding closes.
     */
    public static Binding bind(PrepContext context, PrepContext.ClassPreps classPreps,
                               PrepContext.MethodPreps methodPreps) {
        Binding binding = new Binding(context, classPreps, methodPreps, CURRENT.get());
        CURRENT.set(binding);
        return binding;
    }

    public static final class Binding implements AutoCloseable {
        private final PrepContext context;
        private final PrepContext.ClassPreps classPreps;
        private final PrepContext.MethodPreps methodPreps;
        private final Binding previous;

        private Binding(PrepContext context, PrepContext.ClassPreps classPreps,
                        PrepContext.MethodPreps methodPreps, Binding previous) {
            this.context = context;
            this.classPreps = classPreps;
            this.methodPreps = methodPreps;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        }
    }
}
