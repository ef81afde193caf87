package org.scout.core.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds test classes and test methods in Java source text by walking its syntax tree.
 *
 * A test class is a top-level class whose name starts with {@link #DEFAULT_CLASS_PREFIX};
 * a test method is a method declared directly in it whose name starts with
 * {@link #DEFAULT_METHOD_PREFIX}. Nothing is compiled or executed.
 */
public class TestExtractor {

    public static final String DEFAULT_CLASS_PREFIX = "Test";
    public static final String DEFAULT_METHOD_PREFIX = "test";

    private final JavaParser parser;
    private final String classPrefix;
    private final String methodPrefix;

    public TestExtractor() {
        this(DEFAULT_CLASS_PREFIX, DEFAULT_METHOD_PREFIX);
    }

    public TestExtractor(String classPrefix, String methodPrefix) {
        ParserConfiguration config = new ParserConfiguration();
        config.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
        this.classPrefix = classPrefix;
        this.methodPrefix = methodPrefix;
    }

    public ExtractedUnit extract(String content) throws UnitParseException {
        ParseResult<CompilationUnit> result = parser.parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new UnitParseException(describe(result.getProblems()));
        }
        CompilationUnit cu = result.getResult().get();

        String packageName = cu.getPackageDeclaration()
                .map(PackageDeclaration::getNameAsString)
                .orElse("");

        List<String> imports = new ArrayList<>();
        for (ImportDeclaration imp : cu.getImports()) {
            imports.add(render(imp));
        }

        List<String> testClasses = new ArrayList<>();
        Map<String, List<String>> testMethods = new LinkedHashMap<>();

        for (TypeDeclaration<?> type : cu.getTypes()) {
            if (!(type instanceof ClassOrInterfaceDeclaration cls) || cls.isInterface() || cls.isAbstract()) {
                continue;
            }
            String className = cls.getNameAsString();
            if (!className.startsWith(classPrefix)) {
                continue;
            }
            // overloads share a name and are run once
            Set<String> methods = new LinkedHashSet<>();
            for (MethodDeclaration method : cls.getMethods()) {
                String methodName = method.getNameAsString();
                if (methodName.startsWith(methodPrefix)) {
                    methods.add(methodName);
                }
            }
            testClasses.add(className);
            testMethods.put(className, List.copyOf(methods));
        }

        return new ExtractedUnit(packageName,
                Collections.unmodifiableList(testClasses),
                Collections.unmodifiableMap(testMethods),
                Collections.unmodifiableList(imports));
    }

    private static String render(ImportDeclaration imp) {
        StringBuilder sb = new StringBuilder();
        if (imp.isStatic()) {
            sb.append("static ");
        }
        sb.append(imp.getNameAsString());
        if (imp.isAsterisk()) {
            sb.append(".*");
        }
        return sb.toString();
    }

    private static String describe(List<Problem> problems) {
        if (problems.isEmpty()) {
            return "Unparseable source";
        }
        return problems.stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
    }
}
