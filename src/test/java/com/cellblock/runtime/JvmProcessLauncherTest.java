package com.cellblock.runtime;

import com.cellblock.node.BootScript;
import com.cellblock.node.RuntimeNode;
import com.cellblock.wire.NodeAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JvmProcessLauncherTest {

    @Test
    @DisplayName("the child command runs the runtime node with a single-line boot script")
    void buildsCommand() {
        var properties = new RuntimeProperties();
        properties.getRuntime().setClasspath("/app/classes");
        properties.getRuntime().setChildAckTimeoutMillis(7000);
        var launcher = new JvmProcessLauncher(properties);
        var identity = new RuntimeIdentity("abcd2345-cellblock", "cellblock", RuntimeIdentity.Origin.SYNTHESIZED);

        List<String> command = launcher.buildCommand("/usr/bin/java", identity, new NodeAddress("127.0.0.1", 4000));

        assertEquals(List.of("/usr/bin/java", "-cp", "/app/classes", RuntimeNode.class.getName(),
                "--name", "abcd2345-cellblock", "--bind", "127.0.0.1",
                "--eval", BootScript.standard(7000), "--", "127.0.0.1:4000"), command);
    }

    @Test
    void missingExecutableIsASpawnFailure() {
        var properties = new RuntimeProperties();
        properties.getRuntime().setJavaExecutable("/definitely/not/here/java");
        var launcher = new JvmProcessLauncher(properties);
        var identity = new RuntimeIdentity("x-cellblock", "cellblock", RuntimeIdentity.Origin.SYNTHESIZED);

        var e = assertThrows(SpawnException.class, () -> launcher.launch(identity, new NodeAddress("127.0.0.1", 4000)));
        assertEquals("java executable not found: /definitely/not/here/java", e.getMessage());
    }

    @Test
    void resolvesTheRunningJava() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();

        assertTrue(JvmProcessLauncher.resolveExecutable(java).isPresent());
        assertTrue(JvmProcessLauncher.resolveExecutable("").isEmpty());
        assertTrue(JvmProcessLauncher.resolveExecutable("no-such-binary-cellblock").isEmpty());
    }
}
