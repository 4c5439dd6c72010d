package com.cellblock.node;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the class files pushed to a node and defines them on first use.
 *
 * <p>Registered names are resolved child-first, so the pushed binaries win over any copy
 * on the application class path. Everything else, including the node kernel, is delegated
 * to the parent loader. A loader is never emptied; purging a node replaces it.
 */
public class NodeCodeLoader extends ClassLoader {

    private static final int CLASS_MAGIC = 0xCAFEBABE;
    private static final int MAJOR_VERSION_OFFSET = 44;

    static {
        registerAsParallelCapable();
    }

    private final Map<String, byte[]> units = new ConcurrentHashMap<>();

    public NodeCodeLoader(ClassLoader parent) {
        super("cellblock-node-code", parent);
    }

    /**
     * Registers the binary form of one class.
     *
     * @throws CodeLoadException when the binary is not a class file this JVM can define,
     *                           or when the unit is already present
     */
    public void register(String name, byte[] binary) {
        if (name == null || name.isBlank()) {
            throw new CodeLoadException(String.valueOf(name), "unit name cannot be blank");
        }
        if (binary == null || binary.length < 8) {
            throw new CodeLoadException(name, "truncated class file");
        }
        int magic = ((binary[0] & 0xFF) << 24) | ((binary[1] & 0xFF) << 16) | ((binary[2] & 0xFF) << 8) | (binary[3] & 0xFF);
        if (magic != CLASS_MAGIC) {
            throw new CodeLoadException(name, "not a class file");
        }
        int major = ((binary[6] & 0xFF) << 8) | (binary[7] & 0xFF);
        int supported = Runtime.version().feature() + MAJOR_VERSION_OFFSET;
        if (major > supported) {
            throw new CodeLoadException(name,
                    "unsupported class file version " + major + " (this runtime supports up to " + supported + ")");
        }
        if (units.putIfAbsent(name, binary.clone()) != null) {
            throw new CodeLoadException(name, "unit already loaded");
        }
    }

    public boolean contains(String name) {
        return units.containsKey(name);
    }

    public Set<String> unitNames() {
        return Collections.unmodifiableSet(units.keySet());
    }

    public int size() {
        return units.size();
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        byte[] binary = units.get(name);
        if (binary == null) {
            return super.loadClass(name, resolve);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> type = findLoadedClass(name);
            if (type == null) {
                try {
                    type = defineClass(name, binary, 0, binary.length);
                } catch (ClassFormatError e) {
                    throw new ClassNotFoundException(name + ": " + e.getMessage(), e);
                }
            }
            if (resolve) {
                resolveClass(type);
            }
            return type;
        }
    }
}
