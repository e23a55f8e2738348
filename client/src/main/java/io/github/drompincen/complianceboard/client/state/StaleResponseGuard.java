package io.github.drompincen.complianceboard.client.state;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out a token per request. Only the response carrying the latest token may touch state; older ones are
 * ignored on arrival.
 */
public class StaleResponseGuard {

    private final AtomicLong token = new AtomicLong();

    public long next() {
        return token.incrementAndGet();
    }

    public boolean isCurrent(long candidate) {
        return token.get() == candidate;
    }

    /** Drops whatever is in flight. */
    public void invalidate() {
        token.incrementAndGet();
    }
}
