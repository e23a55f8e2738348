package io.github.drompincen.complianceboard.runtime.document;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.event.ChangeEvent;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import io.github.drompincen.complianceboard.runtime.event.ProjectEventPublisher;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Per-project documentation trees plus the weak relations between their pages. Each project's tree is
 * guarded by its own store monitor.
 */
@Service
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final Map<String, DocumentTreeStore> stores = new ConcurrentHashMap<>();
    private final Map<String, Map<String, List<Relation>>> relations = new ConcurrentHashMap<>();
    private final EvidenceService evidenceService;
    private final ProjectEventPublisher events;
    private final ComplianceBoardProperties properties;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    @Autowired
    public DocumentService(EvidenceService evidenceService, ProjectEventPublisher events,
                           ComplianceBoardProperties properties) {
        this(evidenceService, events, properties, Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public DocumentService(EvidenceService evidenceService, ProjectEventPublisher events,
                           ComplianceBoardProperties properties, Clock clock, Supplier<String> idGenerator) {
        this.evidenceService = evidenceService;
        this.events = events;
        this.properties = properties;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public List<DocumentPageDto> getDocumentTree(String projectId) {
        return read(projectId, DocumentTreeStore::tree);
    }

    public Optional<DocumentPageDto> find(String projectId, String pageId) {
        return read(projectId, store -> store.find(pageId));
    }

    public boolean exists(String projectId, String pageId) {
        return read(projectId, store -> store.contains(pageId));
    }

    public DocumentPageDto createRoot(String projectId, String title, ChangeEvent.Origin origin) {
        DocumentTreeStore store = store(projectId);
        DocumentPageDto page;
        synchronized (store) {
            page = store.createRoot(title, null).page();
        }
        log.info("Created root page {} '{}' in project {}", page.id(), page.title(), projectId);
        emit(projectId, page.id(), ChangeEvent.Action.CREATED, origin);
        return page;
    }

    public Optional<DocumentPageDto> addChild(String projectId, String parentId, String title, ChangeEvent.Origin origin) {
        Optional<DocumentPageDto> page = mutate(projectId, store -> store.addChild(parentId, title, null))
                .map(TreeChange::page);
        page.ifPresent(p -> {
            log.info("Created page {} under {} in project {}", p.id(), parentId, projectId);
            emit(projectId, p.id(), ChangeEvent.Action.CREATED, origin);
        });
        return page;
    }

    public Optional<DocumentPageDto> update(String projectId, String pageId, DocumentMetadataUpdate update,
                                            ChangeEvent.Origin origin) {
        Optional<DocumentPageDto> page = mutate(projectId, store -> store.updateMetadata(pageId, update, null))
                .map(TreeChange::page);
        page.ifPresent(p -> emit(projectId, p.id(), ChangeEvent.Action.UPDATED, origin));
        return page;
    }

    /**
     * Deletes a page with its subtree and the evidence attached to it. Relations pointing at removed pages are
     * left in place and skipped when read. Returns the removed ids.
     */
    public Optional<Set<String>> delete(String projectId, String pageId, ChangeEvent.Origin origin) {
        Optional<Set<String>> removed = mutate(projectId, store -> store.delete(pageId, null))
                .map(TreeChange::removedIds);
        removed.ifPresent(ids -> {
            Map<String, List<Relation>> projectRelations = relations.get(projectId);
            if (projectRelations != null) ids.forEach(projectRelations::remove);
            evidenceService.dropForPages(projectId, ids);
            log.info("Deleted page {} and {} descendants in project {}", pageId, ids.size() - 1, projectId);
            emit(projectId, pageId, ChangeEvent.Action.DELETED, origin);
        });
        return removed;
    }

    public ApiResult<RelatedPageSummary> relate(String projectId, String sourceId, RelationRequest request) {
        if (request == null || request.relatedDocumentId() == null || request.relatedDocumentId().isBlank()) {
            return ApiResult.failure("Related document is required");
        }
        if (sourceId.equals(request.relatedDocumentId())) {
            return ApiResult.failure("A page cannot be related to itself");
        }
        Optional<DocumentPageDto> source = find(projectId, sourceId);
        Optional<DocumentPageDto> target = find(projectId, request.relatedDocumentId());
        if (source.isEmpty() || target.isEmpty()) {
            return ApiResult.failure("Document not found");
        }
        String relationType = request.relationType() != null && !request.relationType().isBlank()
                ? request.relationType().trim() : null;
        List<Relation> outgoing = relations.computeIfAbsent(projectId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(sourceId, k -> new CopyOnWriteArrayList<>());
        outgoing.removeIf(r -> r.targetId().equals(request.relatedDocumentId()));
        outgoing.add(new Relation(request.relatedDocumentId(), relationType));
        emit(projectId, sourceId, ChangeEvent.Action.UPDATED, ChangeEvent.Origin.USER);
        return ApiResult.success(summarize(target.get(), relationType));
    }

    /** Related pages of a page; relations whose target no longer exists are skipped. */
    public List<RelatedPageSummary> relatedPages(String projectId, String pageId) {
        List<Relation> outgoing = relations.getOrDefault(projectId, Map.of()).getOrDefault(pageId, List.of());
        List<RelatedPageSummary> out = new ArrayList<>(outgoing.size());
        for (Relation relation : outgoing) {
            find(projectId, relation.targetId())
                    .ifPresent(target -> out.add(summarize(target, relation.relationType())));
        }
        return out;
    }

    public Optional<FullDocumentDto> getFullDocument(String projectId, String pageId) {
        return find(projectId, pageId).map(page -> new FullDocumentDto(
                page,
                evidenceService.evidenceFor(projectId, pageId),
                evidenceService.requestsFor(projectId, pageId),
                page.children(),
                relatedPages(projectId, pageId)));
    }

    /**
     * Blank {@code q} returns the most relevant pages; otherwise pages whose title contains {@code q} come
     * first, followed by pages that only match in their content.
     */
    public List<DocumentSummaryDto> searchDocuments(String projectId, String q, Integer limit) {
        int max = limit != null && limit > 0 ? limit : properties.documents().searchDefaultLimit();
        List<DocumentPageDto> pages = read(projectId, DocumentTreeStore::flatten);
        String needle = q == null ? "" : q.trim().toLowerCase(Locale.ROOT);

        List<DocumentPageDto> ranked;
        if (needle.isEmpty()) {
            ranked = new ArrayList<>(pages);
            ranked.sort(Comparator.comparing(DocumentPageDto::relevanceScore,
                    Comparator.nullsLast(Comparator.reverseOrder())));
        } else {
            List<DocumentPageDto> titleMatches = new ArrayList<>();
            List<DocumentPageDto> contentMatches = new ArrayList<>();
            for (DocumentPageDto page : pages) {
                if (contains(page.title(), needle)) titleMatches.add(page);
                else if (contains(page.content(), needle)) contentMatches.add(page);
            }
            ranked = new ArrayList<>(titleMatches);
            ranked.addAll(contentMatches);
        }
        return ranked.stream()
                .limit(max)
                .map(p -> new DocumentSummaryDto(p.id(), p.title(), p.pageKind(), p.relevanceScore()))
                .toList();
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static RelatedPageSummary summarize(DocumentPageDto page, String relationType) {
        return new RelatedPageSummary(page.id(), page.title(), page.status(), page.pageKind(),
                page.isControl(), relationType);
    }

    private DocumentTreeStore store(String projectId) {
        return stores.computeIfAbsent(projectId, k -> new DocumentTreeStore(clock, idGenerator));
    }

    private <T> T read(String projectId, Function<DocumentTreeStore, T> reader) {
        DocumentTreeStore store = store(projectId);
        synchronized (store) {
            return reader.apply(store);
        }
    }

    private Optional<TreeChange> mutate(String projectId, Function<DocumentTreeStore, Optional<TreeChange>> mutation) {
        DocumentTreeStore store = store(projectId);
        synchronized (store) {
            return mutation.apply(store);
        }
    }

    private void emit(String projectId, String pageId, ChangeEvent.Action action, ChangeEvent.Origin origin) {
        events.emit(projectId, ChangeEvent.EntityType.DOCUMENT, pageId, action,
                origin != null ? origin : ChangeEvent.Origin.USER);
    }

    private record Relation(String targetId, String relationType) {}
}
