package io.github.drompincen.complianceboard.runtime.document;

import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;

import java.util.*;

/** Helpers over plain tree values, for callers that hold a tree without a store. */
public final class DocumentTrees {

    private DocumentTrees() {}

    /** Depth-first search across children. */
    public static Optional<DocumentPageDto> findById(List<DocumentPageDto> roots, String id) {
        if (roots == null || id == null) return Optional.empty();
        Deque<DocumentPageDto> stack = new ArrayDeque<>();
        for (int i = roots.size() - 1; i >= 0; i--) stack.push(roots.get(i));
        while (!stack.isEmpty()) {
            DocumentPageDto page = stack.pop();
            if (id.equals(page.id())) return Optional.of(page);
            List<DocumentPageDto> children = page.children();
            if (children != null) {
                for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    public static int count(List<DocumentPageDto> roots) {
        if (roots == null) return 0;
        int n = 0;
        for (DocumentPageDto root : roots) {
            n += 1 + count(root.children());
        }
        return n;
    }
}
