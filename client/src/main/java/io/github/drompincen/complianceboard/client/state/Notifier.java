package io.github.drompincen.complianceboard.client.state;

/** Transient success and failure messages shown to the user. */
public interface Notifier {

    void success(String message);

    void error(String message);
}
