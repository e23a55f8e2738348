package io.github.drompincen.complianceboard.runtime.document;

import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;

import java.util.List;
import java.util.Set;

/**
 * Result of a tree mutation: the new tree value, the page that was created or changed (null on delete),
 * the ids removed by a delete, and what happened to the caller's selection.
 */
public record TreeChange(
        List<DocumentPageDto> tree,
        DocumentPageDto page,
        Set<String> removedIds,
        Selection selection
) {

    public record Selection(Kind kind, DocumentPageDto page) {

        public enum Kind {
            /** The selected page was not touched (or nothing is selected). */
            UNCHANGED,
            /** The selected page itself or its subtree changed; {@code page} is the fresh value. */
            UPDATED,
            /** Selection moved to another page (new root, or fallback after delete). */
            MOVED,
            /** Nothing is left to select. */
            CLEARED
        }

        public static Selection unchanged(DocumentPageDto page) {
            return new Selection(Kind.UNCHANGED, page);
        }

        public static Selection updated(DocumentPageDto page) {
            return new Selection(Kind.UPDATED, page);
        }

        public static Selection moved(DocumentPageDto page) {
            return new Selection(Kind.MOVED, page);
        }

        public static Selection cleared() {
            return new Selection(Kind.CLEARED, null);
        }

        public String selectedId() {
            return page != null ? page.id() : null;
        }
    }
}
