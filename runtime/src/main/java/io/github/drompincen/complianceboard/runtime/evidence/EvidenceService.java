package io.github.drompincen.complianceboard.runtime.evidence;

import io.github.drompincen.complianceboard.protocol.api.ApiResult;
import io.github.drompincen.complianceboard.protocol.api.EvidenceDto;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Evidence items and evidence requests attached to documentation pages. Both belong to their page: they are
 * dropped when the page is deleted. Callers check that the page exists before attaching.
 */
@Service
public class EvidenceService {

    private static final Logger log = LoggerFactory.getLogger(EvidenceService.class);

    private final Map<String, List<EvidenceDto>> evidenceByProject = new ConcurrentHashMap<>();
    private final Map<String, List<EvidenceRequestDto>> requestsByProject = new ConcurrentHashMap<>();
    private final ProjectEventPublisher events;
    private final Clock clock;

    @Autowired
    public EvidenceService(ProjectEventPublisher events) {
        this(events, Clock.systemUTC());
    }

    public EvidenceService(ProjectEventPublisher events, Clock clock) {
        this.events = events;
        this.clock = clock;
    }

    public ApiResult<EvidenceDto> addEvidence(String projectId, String documentId, EvidenceDto request) {
        return addEvidence(projectId, documentId, request, ChangeEvent.Origin.USER);
    }

    public ApiResult<EvidenceDto> addEvidence(String projectId, String documentId, EvidenceDto request,
                                              ChangeEvent.Origin origin) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            return ApiResult.failure("Evidence name is required");
        }
        if (request.value() != null && request.collection() != null) {
            return ApiResult.failure("Evidence carries either a value or a collection, not both");
        }
        EvidenceDto evidence = new EvidenceDto(UUID.randomUUID().toString(), documentId, request.name().trim(),
                request.description(), request.valueType(), request.value(), request.collection(), clock.instant());
        evidenceByProject.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(evidence);
        events.emit(projectId, ChangeEvent.EntityType.EVIDENCE, evidence.id(),
                ChangeEvent.Action.CREATED, origin != null ? origin : ChangeEvent.Origin.USER);
        return ApiResult.success(evidence);
    }

    public ApiResult<EvidenceRequestDto> addRequest(String projectId, String documentId, EvidenceRequestDto request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            return ApiResult.failure("Evidence request title is required");
        }
        String status = request.status() == null || request.status().isBlank() ? "pending" : request.status().trim();
        EvidenceRequestDto created = new EvidenceRequestDto(UUID.randomUUID().toString(), documentId,
                request.title().trim(), request.description(), status, request.dueDate(), clock.instant());
        requestsByProject.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(created);
        events.emit(projectId, ChangeEvent.EntityType.EVIDENCE_REQUEST, created.id(),
                ChangeEvent.Action.CREATED, ChangeEvent.Origin.USER);
        return ApiResult.success(created);
    }

    public List<EvidenceDto> evidenceFor(String projectId, String documentId) {
        return evidenceByProject.getOrDefault(projectId, List.of()).stream()
                .filter(e -> documentId.equals(e.documentId()))
                .toList();
    }

    public List<EvidenceDto> evidenceForProject(String projectId) {
        return List.copyOf(evidenceByProject.getOrDefault(projectId, List.of()));
    }

    public List<EvidenceRequestDto> requestsFor(String projectId, String documentId) {
        return requestsByProject.getOrDefault(projectId, List.of()).stream()
                .filter(r -> documentId.equals(r.documentId()))
                .toList();
    }

    public Optional<EvidenceRequestDto> findRequest(String projectId, String requestId) {
        return requestsByProject.getOrDefault(projectId, List.of()).stream()
                .filter(r -> r.id().equals(requestId))
                .findFirst();
    }

    /**
     * Open (not completed) requests across the project. A non-blank query keeps requests whose title contains
     * it, ignoring case.
     */
    public List<EvidenceRequestDto> searchOpenRequests(String projectId, String q, int limit) {
        String needle = q == null ? "" : q.trim().toLowerCase(Locale.ROOT);
        return requestsByProject.getOrDefault(projectId, List.of()).stream()
                .filter(EvidenceRequestClassifier::isOpen)
                .filter(r -> needle.isEmpty() || (r.title() != null && r.title().toLowerCase(Locale.ROOT).contains(needle)))
                .limit(Math.max(0, limit))
                .toList();
    }

    /** Drops every evidence item and request attached to one of the given pages. */
    public int dropForPages(String projectId, Set<String> documentIds) {
        if (documentIds.isEmpty()) return 0;
        int dropped = 0;
        List<EvidenceDto> evidence = evidenceByProject.get(projectId);
        if (evidence != null) {
            int before = evidence.size();
            evidence.removeIf(e -> documentIds.contains(e.documentId()));
            dropped += before - evidence.size();
        }
        List<EvidenceRequestDto> requests = requestsByProject.get(projectId);
        if (requests != null) {
            int before = requests.size();
            requests.removeIf(r -> documentIds.contains(r.documentId()));
            dropped += before - requests.size();
        }
        if (dropped > 0) {
            log.debug("Dropped {} evidence entries for {} deleted pages in project {}", dropped, documentIds.size(), projectId);
        }
        return dropped;
    }
}
