package org.scout.core.load;

import org.scout.core.model.DiscoveredUnit;
import org.scout.core.model.OutcomeError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Compiles a unit's source text in memory and defines the result in a fresh class loader.
 *
 * Every class the compilation produced is initialized eagerly, so a failing static
 * initializer is reported as a load failure of the whole unit rather than of whichever
 * test happens to touch the class first.
 */
public class CompilingUnitLoader implements UnitLoader {
    private static final Logger logger = LoggerFactory.getLogger(CompilingUnitLoader.class);

    private final JavaCompiler compiler;
    private final List<String> options;
    private final ClassLoader parent;

    public CompilingUnitLoader(CompilerSettings settings) {
        this.compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No system Java compiler available; Scout must run on a JDK");
        }

        List<String> classpath = buildClasspath(settings.getClasspath());
        this.options = new ArrayList<>(List.of("-parameters", "-proc:none", "-implicit:class", "-nowarn"));
        options.add("-classpath");
        options.add(String.join(File.pathSeparator, classpath));
        if (!settings.getSourcePath().isEmpty()) {
            options.add("-sourcepath");
            options.add(settings.getSourcePath().stream()
                    .map(Path::toString)
                    .collect(Collectors.joining(File.pathSeparator)));
        }

        this.parent = extraClassLoader(settings.getClasspath());
        logger.debug("Unit loader ready with {} classpath entries", classpath.size());
    }

    @Override
    public synchronized LoadedUnit load(DiscoveredUnit unit) throws UnitLoadException {
        Map<String, byte[]> compiled = compile(unit);
        UnitClassLoader loader = new UnitClassLoader(unit.unitId(), compiled, parent);

        Map<String, Class<?>> classes = new LinkedHashMap<>();
        for (String name : loader.compiledClassNames()) {
            try {
                classes.put(name, Class.forName(name, true, loader));
            } catch (ExceptionInInitializerError e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new UnitLoadException("Initialization of " + name + " failed: "
                        + OutcomeError.of(cause).describe(), cause);
            } catch (LinkageError | ClassNotFoundException e) {
                throw new UnitLoadException(OutcomeError.of(e).describe(), e);
            }
        }
        logger.debug("Loaded unit {} ({} classes)", unit.unitId(), classes.size());
        return new LoadedUnit(unit, classes);
    }

    private Map<String, byte[]> compile(DiscoveredUnit unit) throws UnitLoadException {
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8);

        try (InMemoryFileManager fileManager = new InMemoryFileManager(standard)) {
            JavaFileObject source = new SourceObject(unit);
            Boolean ok = compiler.getTask(null, fileManager, diagnostics, options, null, List.of(source)).call();
            if (!Boolean.TRUE.equals(ok)) {
                throw new UnitLoadException("Compilation failed: " + describe(diagnostics.getDiagnostics()));
            }
            return fileManager.compiled();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to close file manager for " + unit.unitId(), e);
        } catch (IllegalStateException | IllegalArgumentException e) {
            // javac reports unusable options or sources this way
            throw new UnitLoadException("Compilation failed: " + e.getMessage(), e);
        }
    }

    private static String describe(List<Diagnostic<? extends JavaFileObject>> diagnostics) {
        String errors = diagnostics.stream()
                .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                .map(d -> "line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT))
                .collect(Collectors.joining("; "));
        return errors.isEmpty() ? "unknown compiler error" : errors;
    }

    private static List<String> buildClasspath(List<String> extra) {
        Set<String> entries = new LinkedHashSet<>();
        // units compile against the annotation and prep contract of this very engine
        codeSourceOf(CompilingUnitLoader.class).ifPresent(entries::add);
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                entries.add(entry);
            }
        }
        entries.addAll(extra);
        return new ArrayList<>(entries);
    }

    public static Optional<String> codeSourceOf(Class<?> type) {
        CodeSource source = type.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(source.getLocation().toURI()).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            logger.debug("Cannot resolve code source of {}: {}", type.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    private static ClassLoader extraClassLoader(List<String> extra) {
        ClassLoader base = CompilingUnitLoader.class.getClassLoader();
        if (extra.isEmpty()) {
            return base;
        }
        List<URL> urls = new ArrayList<>();
        for (String entry : extra) {
            try {
                urls.add(Path.of(entry).toUri().toURL());
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("Invalid classpath entry " + entry, e);
            }
        }
        return new URLClassLoader("scout-classpath", urls.toArray(new URL[0]), base);
    }

    private static final class SourceObject extends SimpleJavaFileObject {
        private final String content;

        SourceObject(DiscoveredUnit unit) {
            super(sourceUri(unit.unitId()), Kind.SOURCE);
            this.content = unit.content();
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return content;
        }

        // unit ids are file paths, not class names, so public classes may be named freely
        @Override
        public boolean isNameCompatible(String simpleName, Kind kind) {
            return kind == Kind.SOURCE;
        }

        private static URI sourceUri(String unitId) {
            try {
                return new URI("string", null, "/" + unitId + Kind.SOURCE.extension, null);
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Unit id cannot form a source URI: " + unitId, e);
            }
        }
    }

    private static final class ClassObject extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassObject(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static final class InMemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ClassObject> outputs = new ConcurrentHashMap<>();
        private final List<String> order = new ArrayList<>();

        InMemoryFileManager(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(JavaFileManager.Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            ClassObject output = new ClassObject(className);
            if (outputs.put(className, output) == null) {
                order.add(className);
            }
            return output;
        }

        Map<String, byte[]> compiled() {
            Map<String, byte[]> result = new LinkedHashMap<>();
            for (String name : order) {
                result.put(name, outputs.get(name).bytes.toByteArray());
            }
            return result;
        }
    }
}
