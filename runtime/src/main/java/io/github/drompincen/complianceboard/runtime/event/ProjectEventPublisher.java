package io.github.drompincen.complianceboard.runtime.event;

import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of project change events. Sequence numbers increase monotonically per project, so a subscriber
 * seeing two events can always tell them apart even when they describe the same entity.
 */
@Service
public class ProjectEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProjectEventPublisher.class);

    private final ConcurrentHashMap<String, AtomicLong> seqCounters = new ConcurrentHashMap<>();
    private final Sinks.Many<ChangeEvent> sink = Sinks.many().multicast().directBestEffort();
    private final Clock clock;

    public ProjectEventPublisher() {
        this(Clock.systemUTC());
    }

    public ProjectEventPublisher(Clock clock) {
        this.clock = clock;
    }

    public ChangeEvent emit(String projectId, ChangeEvent.EntityType entityType, String entityId,
                            ChangeEvent.Action action, ChangeEvent.Origin origin) {
        long seq = seqCounters.computeIfAbsent(projectId, k -> new AtomicLong()).incrementAndGet();
        ChangeEvent event = new ChangeEvent(projectId, seq, entityType, entityId, action, origin, clock.instant());
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Dropped change event {} for project {}: {}", action, projectId, result);
        }
        return event;
    }

    public Flux<ChangeEvent> events() {
        return sink.asFlux();
    }

    public Flux<ChangeEvent> events(String projectId) {
        return sink.asFlux().filter(e -> projectId.equals(e.projectId()));
    }

    public long currentSeq(String projectId) {
        AtomicLong counter = seqCounters.get(projectId);
        return counter != null ? counter.get() : 0L;
    }
}
