package com.vsharp.vgc.toolchain;

import com.vsharp.vgc.engine.BuildOptions;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles an emitted unit in memory with the JDK compiler and runs its entry
 * point.
 *
 * The unit is expected to declare a public class named by
 * {@link BuildOptions#getClassName()} (in the default package) with a public
 * static, parameterless entry method. Classes are loaded by a throwaway class
 * loader, so repeated requests never see each other's classes. An exception
 * thrown by the entry method is reported as an error diagnostic.
 */
public final class JavaSourceToolchain implements Toolchain {
    private static final Logger log = LogManager.getLogger(JavaSourceToolchain.class);

    private final String className;
    private final String methodName;

    public JavaSourceToolchain() {
        this(BuildOptions.defaults());
    }

    public JavaSourceToolchain(BuildOptions options) {
        this.className = options.getClassName();
        this.methodName = options.getMethodName();
    }

    /** True if the running JVM ships a system Java compiler. */
    public static boolean isAvailable() {
        return ToolProvider.getSystemJavaCompiler() != null;
    }

    @Override
    public ToolchainResult compileAndExecute(String source) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null)
            return ToolchainResult.failure(List.of(Diagnostic.error("No system Java compiler available")));

        DiagnosticCollector<JavaFileObject> collector = new DiagnosticCollector<>();
        Map<String, byte[]> classes;
        boolean compiled;
        try (var fileManager = new MemoryFileManager(
                compiler.getStandardFileManager(collector, Locale.ROOT, StandardCharsets.UTF_8))) {
            compiled = compiler.getTask(null, fileManager, collector, List.of("-proc:none"), null,
                    List.of(new SourceFile(className, source))).call();
            classes = fileManager.classes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close in-memory file manager", e);
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (var d : collector.getDiagnostics())
            diagnostics.add(toDiagnostic(d));

        if (!compiled) {
            log.debug("Compilation of {} failed with {} diagnostics", className, diagnostics.size());
            return ToolchainResult.failure(diagnostics);
        }
        for (Diagnostic d : diagnostics)
            log.warn("{}: {}", className, d);

        try {
            ClassLoader loader = new MemoryClassLoader(classes, getClass().getClassLoader());
            Method entry = loader.loadClass(className).getMethod(methodName);
            Object value = entry.invoke(null);
            log.info("Executed {}.{} -> {}", className, methodName, value);
            return new ToolchainResult(true, diagnostics, value);
        } catch (InvocationTargetException e) {
            diagnostics.add(Diagnostic.error("Execution failed: " + e.getCause()));
            return ToolchainResult.failure(diagnostics);
        } catch (ReflectiveOperationException e) {
            diagnostics.add(Diagnostic.error("Entry point " + className + "." + methodName + "() not usable: " + e));
            return ToolchainResult.failure(diagnostics);
        }
    }

    private static Diagnostic toDiagnostic(javax.tools.Diagnostic<? extends JavaFileObject> d) {
        Diagnostic.Severity severity = switch (d.getKind()) {
            case ERROR -> Diagnostic.Severity.ERROR;
            case WARNING, MANDATORY_WARNING -> Diagnostic.Severity.WARNING;
            default -> Diagnostic.Severity.INFO;
        };
        return new Diagnostic(severity, d.getMessage(Locale.ROOT), d.getLineNumber());
    }

    /** Source held in a string. */
    private static final class SourceFile extends SimpleJavaFileObject {
        private final String code;

        SourceFile(String className, String code) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return code;
        }
    }

    /** Class file written to a byte array. */
    private static final class ClassFile extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassFile(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {
        private final Map<String, ClassFile> outputs = new HashMap<>();

        MemoryFileManager(StandardJavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(JavaFileManager.Location location, String className,
                JavaFileObject.Kind kind, FileObject sibling) {
            ClassFile file = new ClassFile(className);
            outputs.put(className, file);
            return file;
        }

        Map<String, byte[]> classes() {
            Map<String, byte[]> result = new HashMap<>();
            outputs.forEach((name, file) -> result.put(name, file.bytes.toByteArray()));
            return result;
        }
    }

    private static final class MemoryClassLoader extends ClassLoader {
        private final Map<String, byte[]> classes;

        MemoryClassLoader(Map<String, byte[]> classes, ClassLoader parent) {
            super(parent);
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classes.get(name);
            if (bytes == null)
                throw new ClassNotFoundException(name);
            return defineClass(name, bytes, 0, bytes.length);
        }
    }
}
