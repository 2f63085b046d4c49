package schemamigrator.discovery;

import schemamigrator.Migration;
import schemamigrator.exceptions.MigrationException;

import org.reflections.Reflections;
import org.reflections.ReflectionsException;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers {@link Migration} implementations with the Reflections library and
 * instantiates them through their public no-arg constructor.
 *
 * <p>Two sources are supported:
 * <ul>
 *   <li>a package on an existing class loader, e.g. {@code com.acme.migrations}</li>
 *   <li>a directory of compiled classes, plus any jars directly inside it</li>
 * </ul>
 *
 * <p>Interfaces, abstract classes, non-public classes and classes without a
 * public no-arg constructor are skipped. A constructor that throws fails the
 * whole load.
 *
 * <h2>Usage:</h2>
 * <pre>
 * List&lt;Migration&gt; found = new MigrationLoader().fromPackage("com.acme.migrations", classLoader);
 * List&lt;Migration&gt; found = new MigrationLoader().fromDirectory(Path.of("build/migrations"));
 * </pre>
 */
public final class MigrationLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationLoader.class);

    private final List<URLClassLoader> opened = new ArrayList<>();

    /**
     * Loads migrations declared in a package (and its subpackages).
     *
     * @param packageName package to scan
     * @param classLoader loader that can see the package
     * @return one instance per migration class, ordered by class name
     * @throws MigrationException load-failed if scanning or instantiation fails
     */
    public List<Migration> fromPackage(String packageName, ClassLoader classLoader) throws MigrationException {
        if (packageName == null || packageName.isBlank()) {
            throw MigrationException.loadFailed(String.valueOf(packageName), "package name is blank");
        }
        ConfigurationBuilder config = new ConfigurationBuilder()
                .forPackage(packageName, classLoader)
                .filterInputsBy(new FilterBuilder().includePackage(packageName))
                .addClassLoaders(classLoader)
                .setScanners(Scanners.SubTypes);

        String prefix = packageName + ".";
        return instantiate(scan(config, packageName), classLoader, n -> n.startsWith(prefix), packageName);
    }

    /**
     * Loads migrations from a directory holding compiled classes in their package
     * layout. Jars placed directly in the directory are scanned too.
     *
     * <p>The class loader created here stays open while the returned migrations
     * are in use, so they can keep loading their own helper classes; {@link #close()}
     * releases it. When the load fails or finds nothing it is closed right away.
     *
     * @param directory directory to scan
     * @return one instance per migration class, ordered by class name
     * @throws MigrationException load-failed if the directory is missing or loading fails
     */
    public List<Migration> fromDirectory(Path directory) throws MigrationException {
        String source = String.valueOf(directory);
        if (directory == null || !Files.isDirectory(directory)) {
            throw MigrationException.loadFailed(source, "directory does not exist");
        }

        List<URL> urls = new ArrayList<>();
        try {
            urls.add(directory.toUri().toURL());
            List<Path> jars;
            try (Stream<Path> entries = Files.list(directory)) {
                jars = entries.filter(p -> p.getFileName().toString().endsWith(".jar"))
                        .sorted()
                        .collect(Collectors.toList());
            }
            for (Path jar : jars) {
                urls.add(jar.toUri().toURL());
            }
        } catch (MalformedURLException e) {
            throw MigrationException.loadFailed(source, "invalid path", e);
        } catch (IOException e) {
            throw MigrationException.loadFailed(source, "cannot list directory", e);
        }

        URLClassLoader classLoader = new URLClassLoader(urls.toArray(new URL[0]), MigrationLoader.class.getClassLoader());
        ConfigurationBuilder config = new ConfigurationBuilder()
                .setUrls(urls)
                .addClassLoaders(classLoader)
                .setScanners(Scanners.SubTypes);

        List<Migration> migrations;
        try {
            migrations = instantiate(scan(config, source), classLoader, n -> true, source);
        } catch (MigrationException | RuntimeException e) {
            closeQuietly(classLoader, e);
            throw e;
        }
        if (migrations.isEmpty()) {
            closeQuietly(classLoader);
            return migrations;
        }
        synchronized (opened) {
            opened.add(classLoader);
        }
        return migrations;
    }

    /** Number of directory class loaders currently held open. */
    int openClassLoaders() {
        synchronized (opened) {
            return opened.size();
        }
    }

    /**
     * Closes every class loader opened by {@link #fromDirectory(Path)}. Migrations
     * loaded from a directory must not be run afterwards.
     */
    @Override
    public void close() {
        List<URLClassLoader> toClose;
        synchronized (opened) {
            toClose = new ArrayList<>(opened);
            opened.clear();
        }
        for (URLClassLoader classLoader : toClose) {
            closeQuietly(classLoader);
        }
    }

    private static void closeQuietly(URLClassLoader classLoader) {
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close migration class loader {}", classLoader, e);
        }
    }

    private static void closeQuietly(URLClassLoader classLoader, Exception failure) {
        try {
            classLoader.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Every scanned class name. The sub-types index maps each supertype to the
     * classes that extend it, so the scanned classes are the union of its values.
     */
    private static Set<String> scan(ConfigurationBuilder config, String source) throws MigrationException {
        try {
            Reflections reflections = new Reflections(config);
            Map<String, Set<String>> subTypes = reflections.getStore().get(Scanners.SubTypes.index());
            Set<String> names = new TreeSet<>();
            if (subTypes != null) {
                for (Collection<String> values : subTypes.values()) {
                    names.addAll(values);
                }
            }
            return names;
        } catch (ReflectionsException e) {
            throw MigrationException.loadFailed(source, "classpath scan failed", e);
        }
    }

    private static List<Migration> instantiate(Set<String> classNames,
                                               ClassLoader classLoader,
                                               Predicate<String> include,
                                               String source) throws MigrationException {
        List<Migration> migrations = new ArrayList<>();
        for (String className : classNames) {
            if (!include.test(className)) continue;

            Class<?> type;
            try {
                type = Class.forName(className, false, classLoader);
            } catch (ClassNotFoundException | LinkageError e) {
                log.debug("Skipping {}: {}", className, e.toString());
                continue;
            }
            if (!isInstantiableMigration(type)) continue;

            Constructor<?> constructor;
            try {
                constructor = type.getConstructor();
            } catch (NoSuchMethodException e) {
                log.debug("Skipping {}: no public no-arg constructor", className);
                continue;
            }

            try {
                migrations.add((Migration) constructor.newInstance());
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw MigrationException.loadFailed(source,
                        "constructor of " + className + " failed: " + cause.getMessage(), cause);
            } catch (ReflectiveOperationException e) {
                throw MigrationException.loadFailed(source, "cannot instantiate " + className, e);
            }
        }
        log.debug("Discovered {} migration(s) in {}", migrations.size(), source);
        return migrations;
    }

    private static boolean isInstantiableMigration(Class<?> type) {
        int modifiers = type.getModifiers();
        return Migration.class.isAssignableFrom(type)
                && !type.isInterface()
                && !Modifier.isAbstract(modifiers)
                && Modifier.isPublic(modifiers)
                && !(type.isMemberClass() && !Modifier.isStatic(modifiers));
    }
}
