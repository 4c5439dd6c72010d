package com.cellblock.dispatch.cli;

import com.cellblock.core.events.CellblockEvent;
import com.cellblock.core.events.EventBus;
import com.cellblock.runtime.CellRuntime;
import com.cellblock.runtime.ContainerDownException;
import com.cellblock.runtime.RuntimeConnection;
import com.cellblock.runtime.RuntimeDownException;
import com.cellblock.runtime.RuntimeManager;
import com.cellblock.wire.EvaluationResponse;
import com.cellblock.wire.NodeAddress;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

/**
 * CLI command: cellblock run &lt;file&gt;
 * <p>
 * Evaluates the cells of a file one after another on a runtime of the chosen kind,
 * printing each cell's output. Exits with 1 when any cell failed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Evaluate the cells of a file")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "File with cells separated by '#%% <container>' lines")
    private Path file;

    @Option(names = {"--runtime", "-r"},
            description = "Runtime kind: standalone, embedded, attached",
            defaultValue = "standalone")
    private String runtimeType;

    @Option(names = "--address", description = "Control address (host:port) of an attached runtime")
    private String address;

    @Option(names = "--name", description = "Name of an attached runtime")
    private String name;

    private final RuntimeManager runtimeManager;

    public RunCommand(RuntimeManager runtimeManager) {
        this.runtimeManager = runtimeManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        CellFile cells;
        try {
            cells = CellFile.parse(Files.readString(file));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
        if (cells.cells().isEmpty()) {
            ConsoleOutput.info("No cells in " + file);
            return 0;
        }

        CellRuntime runtime;
        RuntimeConnection connection;
        try {
            runtime = runtimeManager.runtime(runtimeType, address == null ? null : NodeAddress.parse(address), name);
            connection = runtimeManager.connect(runtime);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Cannot start runtime: " + e.getMessage());
            return 1;
        }
        ConsoleOutput.runtime(runtime.describe());

        EventBus.Subscription subscription = connection.takeOwnership(event -> {
            if (!CellblockEvent.EVALUATION_COMPLETED.equals(event.eventType())) {
                ConsoleOutput.watchEvent(event);
            }
        });
        int failures = 0;
        try {
            for (int i = 0; i < cells.cells().size(); i++) {
                CellFile.Cell cell = cells.cells().get(i);
                ConsoleOutput.cellHeader(cell.container(), cell.evaluation());
                if (!evaluate(connection, cells, i)) {
                    failures++;
                }
                if (!connection.isConnected()) {
                    ConsoleOutput.error("Runtime is gone, stopping");
                    return 1;
                }
            }
        } finally {
            subscription.unsubscribe();
            connection.disconnect();
        }

        ConsoleOutput.rule();
        if (failures == 0) {
            ConsoleOutput.success("Evaluated " + cells.cells().size() + " cells");
            return 0;
        }
        ConsoleOutput.error(failures + " of " + cells.cells().size() + " cells failed");
        return 1;
    }

    private boolean evaluate(RuntimeConnection connection, CellFile cells, int index) {
        try {
            EvaluationResponse response = connection.evaluate(cells.request(index)).get();
            ConsoleOutput.cellOutput(response.output(), response.evaluationTimeMs());
            if (response.failed()) {
                ConsoleOutput.cellError(response.error());
                return false;
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.cellError("interrupted");
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ContainerDownException down) {
                ConsoleOutput.cellError("container " + down.container() + " is down: " + down.getMessage());
            } else if (cause instanceof RuntimeDownException) {
                ConsoleOutput.cellError(cause.getMessage());
            } else {
                ConsoleOutput.cellError(String.valueOf(cause.getMessage()));
            }
            return false;
        }
    }
}
