package io.github.drompincen.complianceboard.client.state;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void success(String message) {
        log.info(message);
    }

    @Override
    public void error(String message) {
        log.warn(message);
    }
}
