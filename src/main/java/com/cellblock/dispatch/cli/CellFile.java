package com.cellblock.dispatch.cli;

import com.cellblock.wire.EvaluationRequest;
import com.cellblock.wire.Locator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A file of code cells. A line {@code #%% <container>} starts a new cell evaluated in that
 * container; lines before the first marker belong to a cell in container {@code main}.
 * Every cell sees the bindings of all cells above it.
 */
public final class CellFile {

    public static final String MARKER = "#%%";
    public static final String DEFAULT_CONTAINER = "main";

    public record Cell(String container, String evaluation, String code) {

        public Locator locator() {
            return new Locator(container, evaluation);
        }
    }

    private final List<Cell> cells;

    private CellFile(List<Cell> cells) {
        this.cells = List.copyOf(cells);
    }

    public static CellFile parse(String text) {
        var cells = new ArrayList<Cell>();
        String container = DEFAULT_CONTAINER;
        var code = new StringBuilder();
        boolean explicit = false;
        for (String line : text.split("\\R", -1)) {
            if (line.startsWith(MARKER)) {
                addCell(cells, container, code, explicit);
                String name = line.substring(MARKER.length()).trim();
                container = name.isEmpty() ? DEFAULT_CONTAINER : name;
                code.setLength(0);
                explicit = true;
            } else {
                code.append(line).append('\n');
            }
        }
        addCell(cells, container, code, explicit);
        return new CellFile(cells);
    }

    // an implicit leading cell is kept only when it holds code
    private static void addCell(List<Cell> cells, String container, StringBuilder code, boolean explicit) {
        String body = code.toString().strip();
        if (!explicit && body.isEmpty()) {
            return;
        }
        cells.add(new Cell(container, "cell-" + (cells.size() + 1), body));
    }

    public List<Cell> cells() {
        return cells;
    }

    /**
     * The request for cell {@code index}: all earlier cells as parents, most recent first.
     */
    public EvaluationRequest request(int index) {
        Cell cell = cells.get(index);
        var parents = new ArrayList<Locator>();
        for (int i = index - 1; i >= 0; i--) {
            parents.add(cells.get(i).locator());
        }
        return new EvaluationRequest(cell.container(), cell.evaluation(), cell.code(), parents, Map.of());
    }
}
