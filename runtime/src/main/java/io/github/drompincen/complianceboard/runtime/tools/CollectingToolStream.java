package io.github.drompincen.complianceboard.runtime.tools;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Buffers what a tool reports while it runs, for callers that answer with a single response.
 * Progress updates are kept as {@code "[NN%] message"} lines next to the notes, in arrival order.
 */
public class CollectingToolStream implements ToolStream {

    private final List<String> lines = new CopyOnWriteArrayList<>();

    @Override
    public void progress(int percent, String message) {
        lines.add("[" + percent + "%] " + (message != null ? message : ""));
    }

    @Override
    public void note(String text) {
        if (text != null && !text.isBlank()) lines.add(text);
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }
}
