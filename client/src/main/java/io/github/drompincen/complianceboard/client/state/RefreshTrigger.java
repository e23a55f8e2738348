package io.github.drompincen.complianceboard.client.state;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic refresh version. Every {@link #trigger()} emits a new version, so repeated triggers are never
 * merged into one.
 */
public class RefreshTrigger {

    private final AtomicLong version = new AtomicLong();
    private final Sinks.Many<Long> sink = Sinks.many().multicast().directBestEffort();

    public long trigger() {
        long next;
        synchronized (sink) {
            next = version.incrementAndGet();
            sink.tryEmitNext(next);
        }
        return next;
    }

    public long current() {
        return version.get();
    }

    public Flux<Long> versions() {
        return sink.asFlux();
    }
}
