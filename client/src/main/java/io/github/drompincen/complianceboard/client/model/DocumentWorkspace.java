package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.client.api.ApiCalls;
import io.github.drompincen.complianceboard.client.api.ComplianceApi;
import io.github.drompincen.complianceboard.client.state.*;
import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.runtime.document.DocumentTreeStore;
import io.github.drompincen.complianceboard.runtime.document.TreeChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Documentation tree of one project with the selected page. The tree is cached in a {@link DocumentTreeStore};
 * the selected page's full document and its auditors load separately, so a failing auditor panel leaves the
 * document readable.
 * <p>
 * State is touched on the {@code ui} executor only.
 */
public class DocumentWorkspace {

    private static final Logger log = LoggerFactory.getLogger(DocumentWorkspace.class);

    private final ComplianceApi api;
    private final String projectId;
    private final Notifier notifier;
    private final Executor ui;
    private final Clock clock;
    private final DocumentTreeStore store = new DocumentTreeStore();
    private final StaleResponseGuard selectionGuard = new StaleResponseGuard();

    private LoadState<List<DocumentPageDto>> tree = LoadState.idle();
    private String selectedId;
    private LoadState<FullDocumentDto> selected = LoadState.idle();
    private LoadState<List<AuditorDto>> auditors = LoadState.idle();

    public DocumentWorkspace(ComplianceApi api, String projectId, Notifier notifier, Executor ui) {
        this(api, projectId, notifier, ui, Clock.systemUTC());
    }

    public DocumentWorkspace(ComplianceApi api, String projectId, Notifier notifier, Executor ui, Clock clock) {
        this.api = api;
        this.projectId = projectId;
        this.notifier = notifier;
        this.ui = ui;
        this.clock = clock;
    }

    // ---- Loading ----

    /**
     * Reloads the tree. When the selected page is gone the first root is selected instead; with nothing
     * selected the first root is picked.
     */
    public CompletableFuture<Void> load() {
        tree = LoadState.loading(tree.value());
        return api.getDocumentTree(projectId).handleAsync((roots, error) -> {
            if (error != null) {
                log.warn("Could not load document tree of project {}: {}", projectId, error.getMessage());
                tree = LoadState.error(ApiCalls.message(error, "load documents"), this::load);
                return null;
            }
            store.load(roots);
            tree = LoadState.loaded(store.tree());
            if (selectedId == null || !store.contains(selectedId)) {
                List<DocumentPageDto> current = store.tree();
                select(current.isEmpty() ? null : current.get(0).id());
            }
            return null;
        }, ui);
    }

    /** Tree reload plus a reload of the selected page. Responses that race a user reload simply win last. */
    public void refresh() {
        String before = selectedId;
        load();
        if (before != null && before.equals(selectedId)) select(before);
    }

    public Disposable bind(RefreshTrigger trigger) {
        return trigger.versions().subscribe(version -> ui.execute(this::refresh));
    }

    /** Selects a page, ignoring responses still in flight for the previous selection. */
    public void select(String pageId) {
        long token = selectionGuard.next();
        selectedId = pageId;
        if (pageId == null) {
            selected = LoadState.idle();
            auditors = LoadState.idle();
            return;
        }
        selected = LoadState.loading(null);
        auditors = LoadState.loading(null);
        api.getFullDocument(projectId, pageId).whenCompleteAsync((document, error) -> {
            if (!selectionGuard.isCurrent(token)) return;
            selected = error != null
                    ? LoadState.error(ApiCalls.message(error, "load document"), () -> select(pageId))
                    : LoadState.loaded(document);
        }, ui);
        api.getDocumentAuditors(projectId, pageId).whenCompleteAsync((list, error) -> {
            if (!selectionGuard.isCurrent(token)) return;
            if (error != null) {
                log.debug("Auditors of page {} unavailable: {}", pageId, error.getMessage());
                auditors = LoadState.error(ApiCalls.message(error, "load assessment objectives"),
                        () -> reloadAuditors(pageId, token));
            } else {
                auditors = LoadState.loaded(list != null ? list : List.of());
            }
        }, ui);
    }

    // ---- Mutations ----

    public CompletableFuture<ApiResult<DocumentPageDto>> createRoot(String title) {
        return ApiCalls.guard(() -> api.createPage(projectId, new CreatePageRequest(title, null)), "create page")
                .thenApplyAsync(result -> {
                    if (result.success()) {
                        store.insert(result.value(), selectedId, true).ifPresent(this::applyChange);
                        notifier.success("Page created");
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                }, ui);
    }

    public CompletableFuture<ApiResult<DocumentPageDto>> addChild(String parentId, String title) {
        if (!store.contains(parentId)) {
            return CompletableFuture.completedFuture(ApiResult.failure("Document not found"));
        }
        return ApiCalls.guard(() -> api.createPage(projectId, new CreatePageRequest(title, parentId)), "create page")
                .thenApplyAsync(result -> {
                    if (result.success()) {
                        store.insert(result.value(), selectedId, true).ifPresent(this::applyChange);
                        notifier.success("Page created");
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                }, ui);
    }

    public CompletableFuture<ApiResult<DocumentPageDto>> rename(String pageId, String title) {
        return update(pageId, new DocumentMetadataUpdate(title, null, null, null, null, null, null, null, null));
    }

    public CompletableFuture<ApiResult<DocumentPageDto>> updateContent(String pageId, String content) {
        return update(pageId, new DocumentMetadataUpdate(null, content != null ? content : "", null, null, null,
                null, null, null, null));
    }

    /** Local state changes only once the server accepted the edit. */
    public CompletableFuture<ApiResult<DocumentPageDto>> update(String pageId, DocumentMetadataUpdate update) {
        if (!store.contains(pageId)) {
            return CompletableFuture.completedFuture(ApiResult.failure("Document not found"));
        }
        return ApiCalls.guard(() -> api.updatePage(projectId, pageId, update), "update page")
                .thenApplyAsync(result -> {
                    if (result.success()) {
                        store.updateMetadata(pageId, update, selectedId).ifPresent(this::applyChange);
                    } else {
                        notifier.error(result.error());
                    }
                    return result;
                }, ui);
    }

    /**
     * Removes the page and its subtree right away, then asks the server. A refused delete puts the previous
     * tree and selection back.
     */
    public CompletableFuture<ApiResult<Void>> delete(String pageId) {
        if (!store.contains(pageId)) {
            return CompletableFuture.completedFuture(ApiResult.failure("Document not found"));
        }
        OptimisticMutation<Snapshot> mutation = new OptimisticMutation<>(this::snapshot, this::restore,
                () -> store.delete(pageId, selectedId).ifPresent(this::applyChange));
        return mutation.execute(() -> api.deletePage(projectId, pageId), ui, "delete page")
                .thenApply(result -> {
                    if (result.success()) notifier.success("Page deleted");
                    else notifier.error(result.error());
                    return result;
                });
    }

    // ---- Views ----

    public LoadState<List<DocumentPageDto>> tree() {
        return tree;
    }

    public String selectedId() {
        return selectedId;
    }

    public LoadState<FullDocumentDto> selected() {
        return selected;
    }

    public LoadState<List<AuditorDto>> auditors() {
        return auditors;
    }

    public Optional<EvidencePanelModel> evidencePanel() {
        if (!selected.isLoaded() || selected.value() == null) return Optional.empty();
        return Optional.of(EvidencePanelModel.of(selected.value(), LocalDate.now(clock)));
    }

    // ---- Internals ----

    private void reloadAuditors(String pageId, long token) {
        if (!selectionGuard.isCurrent(token)) return;
        auditors = LoadState.loading(null);
        api.getDocumentAuditors(projectId, pageId).whenCompleteAsync((list, error) -> {
            if (!selectionGuard.isCurrent(token)) return;
            auditors = error != null
                    ? LoadState.error(ApiCalls.message(error, "load assessment objectives"),
                            () -> reloadAuditors(pageId, token))
                    : LoadState.loaded(list != null ? list : List.of());
        }, ui);
    }

    private void applyChange(TreeChange change) {
        tree = LoadState.loaded(change.tree());
        TreeChange.Selection selection = change.selection();
        switch (selection.kind()) {
            case UNCHANGED -> { }
            case UPDATED -> {
                if (selected.isLoaded() && selected.value() != null) {
                    FullDocumentDto current = selected.value();
                    DocumentPageDto page = selection.page();
                    selected = LoadState.loaded(new FullDocumentDto(page, current.evidence(),
                            current.evidenceRequests(), page.children(), current.relatedPages()));
                }
            }
            case MOVED -> select(selection.selectedId());
            case CLEARED -> select(null);
        }
    }

    private Snapshot snapshot() {
        return new Snapshot(store.tree(), selectedId, selected, auditors);
    }

    private void restore(Snapshot snapshot) {
        selectionGuard.invalidate();
        store.load(snapshot.tree());
        tree = LoadState.loaded(store.tree());
        selectedId = snapshot.selectedId();
        selected = snapshot.selected();
        auditors = snapshot.auditors();
        // A load cut short by the invalidation above has to start over.
        if (selectedId != null && (selected.isLoading() || auditors.isLoading())) select(selectedId);
    }

    private record Snapshot(List<DocumentPageDto> tree, String selectedId, LoadState<FullDocumentDto> selected,
                            LoadState<List<AuditorDto>> auditors) {}
}
