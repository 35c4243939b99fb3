package com.ttennebkram.enhancer.operations;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Modifier;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Finds the concrete {@link OperationBase} subclasses in the operations
 * package, whether the package sits in a classes directory or inside a jar.
 *
 * Only top-level {@code *Operation} classes carrying {@link OperationInfo}
 * qualify. Results are sorted by class name so registration order does not
 * depend on the file system.
 */
public final class OperationScanner {

    private static final Logger LOG = Logger.getLogger(OperationScanner.class.getName());

    static final String OPERATIONS_PACKAGE = OperationScanner.class.getPackage().getName();

    private static final String CLASS_SUFFIX = "Operation.class";

    private OperationScanner() {
    }

    /**
     * @return every concrete, annotated operation class, sorted by name
     * @throws IllegalStateException if the package location cannot be read
     */
    public static List<Class<? extends OperationBase>> findOperationClasses() {
        String packagePath = OPERATIONS_PACKAGE.replace('.', '/');
        ClassLoader loader = OperationScanner.class.getClassLoader();

        Set<String> classNames = new TreeSet<>();
        try {
            Enumeration<URL> roots = loader.getResources(packagePath);
            while (roots.hasMoreElements()) {
                URL root = roots.nextElement();
                switch (root.getProtocol()) {
                    case "file":
                        listDirectory(Paths.get(root.toURI()), classNames);
                        break;
                    case "jar":
                        listJar(root, packagePath, classNames);
                        break;
                    default:
                        LOG.fine("Ignoring operation location " + root);
                }
            }
        } catch (IOException | UncheckedIOException | URISyntaxException e) {
            throw new IllegalStateException("Cannot scan " + OPERATIONS_PACKAGE + " for operations", e);
        }

        List<Class<? extends OperationBase>> result = new ArrayList<>();
        for (String className : classNames) {
            Class<? extends OperationBase> type = loadOperation(loader, className);
            if (type != null) {
                result.add(type);
            }
        }
        LOG.fine("Found " + result.size() + " operation classes");
        return result;
    }

    private static void listDirectory(Path directory, Set<String> classNames) throws IOException {
        if (!Files.isDirectory(directory)) return;
        try (Stream<Path> files = Files.list(directory)) {
            files.map(p -> p.getFileName().toString())
                    .filter(OperationScanner::isCandidate)
                    .forEach(name -> classNames.add(toClassName(name)));
        }
    }

    private static void listJar(URL root, String packagePath, Set<String> classNames) throws IOException {
        JarURLConnection connection = (JarURLConnection) root.openConnection();
        connection.setUseCaches(false);
        String prefix = packagePath + "/";
        try (JarFile jar = connection.getJarFile()) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                String name = entries.nextElement().getName();
                if (!name.startsWith(prefix)) continue;
                String simpleName = name.substring(prefix.length());
                // Sub-packages are not scanned
                if (simpleName.indexOf('/') < 0 && isCandidate(simpleName)) {
                    classNames.add(toClassName(simpleName));
                }
            }
        }
    }

    /** Top-level class files named {@code *Operation.class}; nested classes contain '$'. */
    private static boolean isCandidate(String fileName) {
        return fileName.endsWith(CLASS_SUFFIX) && fileName.indexOf('$') < 0;
    }

    private static String toClassName(String fileName) {
        return OPERATIONS_PACKAGE + "." + fileName.substring(0, fileName.length() - ".class".length());
    }

    private static Class<? extends OperationBase> loadOperation(ClassLoader loader, String className) {
        Class<?> type;
        try {
            type = Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.log(Level.WARNING, "Skipping unloadable class " + className, e);
            return null;
        }
        if (!OperationBase.class.isAssignableFrom(type)
                || Modifier.isAbstract(type.getModifiers())
                || !type.isAnnotationPresent(OperationInfo.class)) {
            LOG.fine("Skipping " + className + ": not a concrete annotated operation");
            return null;
        }
        return type.asSubclass(OperationBase.class);
    }
}
