package com.cellblock.runtime;

import com.cellblock.node.BootScript;
import com.cellblock.node.RuntimeNode;
import com.cellblock.wire.NodeAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Spawns runtimes as child JVMs on the coordinator's class path:
 * <pre>
 * java -cp &lt;classpath&gt; com.cellblock.node.RuntimeNode --name &lt;identity&gt; --bind &lt;host&gt; --eval "&lt;boot script&gt;" -- &lt;coordinator&gt;
 * </pre>
 */
public class JvmProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(JvmProcessLauncher.class);

    private final RuntimeProperties properties;

    public JvmProcessLauncher(RuntimeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void checkLaunchable() {
        executable();
    }

    @Override
    public RuntimeProcess launch(RuntimeIdentity identity, NodeAddress coordinator) {
        Path executable = executable();
        List<String> command = buildCommand(executable.toString(), identity, coordinator);
        log.debug("Spawning runtime {}: {}", identity.name(), command);
        try {
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            return new OsRuntimeProcess(process);
        } catch (IOException e) {
            throw new SpawnException("cannot start runtime " + identity.name() + ": " + e.getMessage(), e);
        }
    }

    private Path executable() {
        return resolveExecutable(properties.getJavaExecutable())
                .orElseThrow(() -> new SpawnException("java executable not found: " + properties.getJavaExecutable()));
    }

    List<String> buildCommand(String executable, RuntimeIdentity identity, NodeAddress coordinator) {
        String script = BootScript.standard(properties.getChildAckTimeoutMillis());
        BootScript.requireSingleLine(script);
        var command = new ArrayList<String>();
        command.add(executable);
        command.add("-cp");
        command.add(properties.getClasspath());
        command.add(RuntimeNode.class.getName());
        command.add("--name");
        command.add(identity.name());
        command.add("--bind");
        command.add(properties.getBindAddress());
        command.add("--eval");
        command.add(script);
        command.add("--");
        command.add(coordinator.toString());
        return command;
    }

    /**
     * Resolves an absolute path, or searches {@code PATH} for a bare command name.
     */
    public static Optional<Path> resolveExecutable(String executable) {
        if (executable == null || executable.isBlank()) {
            return Optional.empty();
        }
        Path path = Path.of(executable);
        if (path.isAbsolute() || executable.contains(File.separator)) {
            return Files.isExecutable(path) ? Optional.of(path) : Optional.empty();
        }
        String searchPath = System.getenv("PATH");
        if (searchPath == null) {
            return Optional.empty();
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, executable);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
