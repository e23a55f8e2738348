package io.github.drompincen.complianceboard.runtime.document;

import io.github.drompincen.complianceboard.protocol.api.DocumentMetadataUpdate;
import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;

import java.time.Clock;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Arena-backed documentation tree. Nodes are kept in a map keyed by id with parent pointers and ordered
 * child id lists, so lookups are O(1) and mutations touch only the path from the changed node to its root.
 * <p>
 * Immutable {@link DocumentPageDto} snapshots are cached per node. A mutation drops the cached snapshots on
 * the path to the root only, which means every untouched branch of the returned tree is the very same
 * snapshot instance as before.
 * <p>
 * Not thread-safe; callers serialize access.
 */
public class DocumentTreeStore {

    private static final Comparator<DocumentPageDto> BY_ORDER = Comparator.comparingInt(DocumentPageDto::order);

    private final Map<String, PageNode> nodes = new HashMap<>();
    private final List<String> rootIds = new ArrayList<>();
    private final Clock clock;
    private final Supplier<String> idGenerator;

    public DocumentTreeStore() {
        this(Clock.systemUTC(), () -> UUID.randomUUID().toString());
    }

    public DocumentTreeStore(Clock clock, Supplier<String> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    // ---- Reads ----

    public List<DocumentPageDto> tree() {
        List<DocumentPageDto> roots = new ArrayList<>(rootIds.size());
        for (String id : rootIds) {
            roots.add(snapshot(nodes.get(id)));
        }
        roots.sort(BY_ORDER);
        return List.copyOf(roots);
    }

    public Optional<DocumentPageDto> find(String id) {
        if (id == null) return Optional.empty();
        PageNode node = nodes.get(id);
        return node == null ? Optional.empty() : Optional.of(snapshot(node));
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public boolean isEmpty() {
        return rootIds.isEmpty();
    }

    public int size() {
        return nodes.size();
    }

    /** Ids from the root down to {@code id}, inclusive. Empty when the page is unknown. */
    public List<String> pathTo(String id) {
        LinkedList<String> path = new LinkedList<>();
        PageNode node = id == null ? null : nodes.get(id);
        while (node != null) {
            path.addFirst(node.id);
            node = node.parentId == null ? null : nodes.get(node.parentId);
        }
        return List.copyOf(path);
    }

    /** Every page in depth-first order, roots first. */
    public List<DocumentPageDto> flatten() {
        List<DocumentPageDto> out = new ArrayList<>(nodes.size());
        Deque<DocumentPageDto> stack = new ArrayDeque<>();
        List<DocumentPageDto> roots = tree();
        for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
        while (!stack.isEmpty()) {
            DocumentPageDto page = stack.pop();
            out.add(page);
            List<DocumentPageDto> children = page.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return out;
    }

    // ---- Mutations ----

    public TreeChange createRoot(String title, String selectedId) {
        String safeTitle = DocumentTemplates.safeTitle(title);
        boolean first = rootIds.isEmpty();
        String content = first ? DocumentTemplates.firstPage(safeTitle) : DocumentTemplates.basicPage(safeTitle);
        PageNode node = new PageNode(idGenerator.get(), null, safeTitle, content, rootIds.size(), clock.instant());
        nodes.put(node.id, node);
        rootIds.add(node.id);
        DocumentPageDto page = snapshot(node);
        return new TreeChange(tree(), page, Set.of(), TreeChange.Selection.moved(page));
    }

    public Optional<TreeChange> addChild(String parentId, String title, String selectedId) {
        PageNode parent = parentId == null ? null : nodes.get(parentId);
        if (parent == null) return Optional.empty();

        String safeTitle = DocumentTemplates.safeTitle(title);
        PageNode node = new PageNode(idGenerator.get(), parent.id, safeTitle,
                DocumentTemplates.basicPage(safeTitle), 0, clock.instant());
        nodes.put(node.id, node);
        parent.childIds.add(node.id);
        invalidate(parent);
        DocumentPageDto page = snapshot(node);
        return Optional.of(new TreeChange(tree(), page, Set.of(), TreeChange.Selection.moved(page)));
    }

    /** A blank title keeps the current one. */
    public Optional<TreeChange> rename(String pageId, String title, String selectedId) {
        return edit(pageId, selectedId, node -> retitle(node, title));
    }

    public Optional<TreeChange> updateContent(String pageId, String content, String selectedId) {
        return edit(pageId, selectedId, node -> node.content = content != null ? content : "");
    }

    public Optional<TreeChange> updateMetadata(String pageId, DocumentMetadataUpdate update, String selectedId) {
        return edit(pageId, selectedId, node -> {
            if (update.title() != null) retitle(node, update.title());
            if (update.content() != null) node.content = update.content();
            if (update.pageKind() != null) node.pageKind = update.pageKind();
            if (update.isControl() != null) node.isControl = update.isControl();
            if (update.scfId() != null) node.scfId = update.scfId();
            if (update.frameworks() != null) node.frameworks = List.copyOf(update.frameworks());
            if (update.frameworkMappings() != null) node.frameworkMappings = List.copyOf(update.frameworkMappings());
            if (update.relevanceScore() != null) node.relevanceScore = update.relevanceScore();
            if (update.status() != null) node.status = update.status();
        });
    }

    /**
     * Deletes a page and its whole subtree. When the selection lived inside the removed subtree it falls
     * back to the first remaining root page, or is cleared when the tree is now empty.
     */
    public Optional<TreeChange> delete(String pageId, String selectedId) {
        PageNode target = pageId == null ? null : nodes.get(pageId);
        if (target == null) return Optional.empty();
        DocumentPageDto selectedBefore = selectedSnapshot(selectedId);

        Set<String> removed = new LinkedHashSet<>();
        Deque<PageNode> stack = new ArrayDeque<>();
        stack.push(target);
        while (!stack.isEmpty()) {
            PageNode node = stack.pop();
            removed.add(node.id);
            for (String childId : node.childIds) {
                stack.push(nodes.get(childId));
            }
        }
        removed.forEach(nodes::remove);

        if (target.parentId == null) {
            rootIds.remove(target.id);
        } else {
            PageNode parent = nodes.get(target.parentId);
            parent.childIds.remove(target.id);
            invalidate(parent);
        }

        List<DocumentPageDto> tree = tree();
        TreeChange.Selection selection;
        if (selectedId != null && removed.contains(selectedId)) {
            selection = tree.isEmpty() ? TreeChange.Selection.cleared() : TreeChange.Selection.moved(tree.get(0));
        } else {
            selection = selectionAfter(selectedId, selectedBefore);
        }
        return Optional.of(new TreeChange(tree, null, Collections.unmodifiableSet(removed), selection));
    }

    /** Replaces the whole arena with the given tree value, keeping its ids. */
    public void load(List<DocumentPageDto> roots) {
        nodes.clear();
        rootIds.clear();
        if (roots == null) return;
        for (DocumentPageDto root : roots) {
            rootIds.add(root.id());
            loadSubtree(root, null);
        }
    }

    /**
     * Inserts a page produced elsewhere (for example by the server) under {@code page.parentId()}, or as a
     * root when it has none. Returns empty when the parent is unknown or the id is already taken.
     */
    public Optional<TreeChange> insert(DocumentPageDto page, String selectedId, boolean select) {
        if (page == null || nodes.containsKey(page.id())) return Optional.empty();
        PageNode parent = page.parentId() == null ? null : nodes.get(page.parentId());
        if (page.parentId() != null && parent == null) return Optional.empty();
        DocumentPageDto selectedBefore = selectedSnapshot(selectedId);

        loadSubtree(page, page.parentId());
        if (parent == null) {
            rootIds.add(page.id());
        } else {
            parent.childIds.add(page.id());
            invalidate(parent);
        }
        DocumentPageDto inserted = snapshot(nodes.get(page.id()));
        TreeChange.Selection selection = select
                ? TreeChange.Selection.moved(inserted)
                : selectionAfter(selectedId, selectedBefore);
        return Optional.of(new TreeChange(tree(), inserted, Set.of(), selection));
    }

    // ---- Internals ----

    private Optional<TreeChange> edit(String pageId, String selectedId, Consumer<PageNode> mutation) {
        PageNode node = pageId == null ? null : nodes.get(pageId);
        if (node == null) return Optional.empty();
        DocumentPageDto selectedBefore = selectedSnapshot(selectedId);
        mutation.accept(node);
        node.updatedAt = clock.instant();
        invalidate(node);
        return Optional.of(new TreeChange(tree(), snapshot(node), Set.of(),
                selectionAfter(selectedId, selectedBefore)));
    }

    private static void retitle(PageNode node, String title) {
        if (title != null && !title.isBlank()) node.title = title.trim();
    }

    private DocumentPageDto selectedSnapshot(String selectedId) {
        PageNode selected = selectedId == null ? null : nodes.get(selectedId);
        return selected == null ? null : snapshot(selected);
    }

    // A selected page whose snapshot was rebuilt changed itself or somewhere below it.
    private TreeChange.Selection selectionAfter(String selectedId, DocumentPageDto before) {
        PageNode selected = selectedId == null ? null : nodes.get(selectedId);
        if (selected == null) return TreeChange.Selection.unchanged(null);
        DocumentPageDto after = snapshot(selected);
        return after == before ? TreeChange.Selection.unchanged(after) : TreeChange.Selection.updated(after);
    }

    private void loadSubtree(DocumentPageDto page, String parentId) {
        Deque<Map.Entry<DocumentPageDto, String>> stack = new ArrayDeque<>();
        stack.push(Map.entry(page, parentId == null ? "" : parentId));
        while (!stack.isEmpty()) {
            var entry = stack.pop();
            DocumentPageDto current = entry.getKey();
            String parent = entry.getValue().isEmpty() ? null : entry.getValue();
            PageNode node = PageNode.from(current, parent);
            nodes.put(node.id, node);
            if (current.children() != null) {
                for (DocumentPageDto child : current.children()) {
                    node.childIds.add(child.id());
                    stack.push(Map.entry(child, node.id));
                }
            }
        }
    }

    private void invalidate(PageNode node) {
        PageNode current = node;
        while (current != null) {
            current.snapshot = null;
            current = current.parentId == null ? null : nodes.get(current.parentId);
        }
    }

    private DocumentPageDto snapshot(PageNode node) {
        if (node.snapshot != null) return node.snapshot;
        List<DocumentPageDto> children = new ArrayList<>(node.childIds.size());
        for (String childId : node.childIds) {
            children.add(snapshot(nodes.get(childId)));
        }
        children.sort(BY_ORDER);
        node.snapshot = new DocumentPageDto(node.id, node.parentId, node.title, node.content, node.order,
                node.createdAt, node.updatedAt, node.pageKind, node.isControl, node.scfId,
                node.frameworks, node.frameworkMappings, node.relevanceScore, node.status,
                List.copyOf(children));
        return node.snapshot;
    }
}
