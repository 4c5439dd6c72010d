package com.cellblock.runtime;

import com.cellblock.node.Node;
import com.cellblock.wire.CodeUnit;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.JarURLConnection;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.TreeSet;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * The classes a runtime needs beyond its kernel, in binary form.
 *
 * <p>Units are read from the class path, nested and anonymous classes included. The marker
 * unit comes last, so a node only reports the code present once every unit has loaded.
 */
public final class RequiredCode {

    public static final String MARKER_UNIT = Node.MANAGER_CLASS;

    public static final List<String> PACKAGES = List.of(
            "com.cellblock.remote",
            "com.cellblock.remote.script",
            "com.cellblock.remote.intellisense");

    private final List<CodeUnit> units;

    private RequiredCode(List<CodeUnit> units) {
        this.units = List.copyOf(units);
    }

    public static RequiredCode scan() {
        return scan(RequiredCode.class.getClassLoader());
    }

    public static RequiredCode scan(ClassLoader loader) {
        var names = new TreeSet<String>();
        for (String pkg : PACKAGES) {
            names.addAll(classNames(loader, pkg));
        }
        if (!names.contains(MARKER_UNIT)) {
            throw new IllegalStateException("marker unit " + MARKER_UNIT + " not found on the class path");
        }
        names.remove(MARKER_UNIT);
        var units = new ArrayList<CodeUnit>();
        for (String name : names) {
            units.add(read(loader, name));
        }
        units.add(read(loader, MARKER_UNIT));
        return new RequiredCode(units);
    }

    public List<CodeUnit> units() {
        return units;
    }

    public List<String> unitNames() {
        return units.stream().map(CodeUnit::name).toList();
    }

    private static List<String> classNames(ClassLoader loader, String pkg) {
        String dir = pkg.replace('.', '/');
        var names = new ArrayList<String>();
        try {
            Enumeration<URL> roots = loader.getResources(dir);
            for (URL root : Collections.list(roots)) {
                switch (root.getProtocol()) {
                    case "file" -> names.addAll(fromDirectory(Path.of(root.toURI()), pkg));
                    case "jar" -> names.addAll(fromJar(root, dir, pkg));
                    default -> throw new IllegalStateException("cannot list classes under " + root);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list package " + pkg, e);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("cannot list package " + pkg, e);
        }
        return names;
    }

    private static List<String> fromDirectory(Path directory, String pkg) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(file -> file.getFileName().toString())
                    .filter(RequiredCode::isClassFile)
                    .map(file -> pkg + "." + file.substring(0, file.length() - ".class".length()))
                    .toList();
        }
    }

    private static List<String> fromJar(URL root, String dir, String pkg) throws IOException {
        var connection = (JarURLConnection) root.openConnection();
        connection.setUseCaches(false);
        var names = new ArrayList<String>();
        try (JarFile jar = connection.getJarFile()) {
            String prefix = connection.getEntryName() != null ? connection.getEntryName() : dir;
            if (!prefix.endsWith("/")) {
                prefix = prefix + "/";
            }
            for (JarEntry entry : Collections.list(jar.entries())) {
                String entryName = entry.getName();
                if (!entryName.startsWith(prefix)) continue;
                String file = entryName.substring(prefix.length());
                if (file.contains("/") || !isClassFile(file)) continue;
                names.add(pkg + "." + file.substring(0, file.length() - ".class".length()));
            }
        }
        return names;
    }

    private static boolean isClassFile(String file) {
        return file.endsWith(".class") && !file.equals("package-info.class");
    }

    private static CodeUnit read(ClassLoader loader, String className) {
        String resource = className.replace('.', '/') + ".class";
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("class file of " + className + " not found");
            }
            return new CodeUnit(className, in.readAllBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
    }
}
