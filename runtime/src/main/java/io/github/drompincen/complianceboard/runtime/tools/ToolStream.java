package io.github.drompincen.complianceboard.runtime.tools;

public interface ToolStream {

    ToolStream NONE = new ToolStream() {
        @Override public void progress(int percent, String message) {}
        @Override public void note(String text) {}
    };

    void progress(int percent, String message);

    void note(String text);
}
