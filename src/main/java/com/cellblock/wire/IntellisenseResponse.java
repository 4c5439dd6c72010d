package com.cellblock.wire;

import java.util.List;

/**
 * Answer to an {@link IntellisenseRequest}. {@code items} holds completions or signatures,
 * {@code content} holds details or formatted code.
 */
public record IntellisenseResponse(String kind, List<String> items, String content) {

    public IntellisenseResponse {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static IntellisenseResponse ofItems(String kind, List<String> items) {
        return new IntellisenseResponse(kind, items, null);
    }

    public static IntellisenseResponse ofContent(String kind, String content) {
        return new IntellisenseResponse(kind, List.of(), content);
    }
}
