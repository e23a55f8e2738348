package io.github.drompincen.complianceboard.runtime.document;

import io.github.drompincen.complianceboard.protocol.api.DocumentPageDto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Mutable arena entry. Only {@link DocumentTreeStore} touches these. */
final class PageNode {

    final String id;
    String parentId;
    String title;
    String content;
    int order;
    final Instant createdAt;
    Instant updatedAt;
    String pageKind;
    Boolean isControl;
    String scfId;
    List<String> frameworks;
    List<DocumentPageDto.FrameworkMapping> frameworkMappings;
    Integer relevanceScore;
    String status;
    final List<String> childIds = new ArrayList<>();

    DocumentPageDto snapshot;

    PageNode(String id, String parentId, String title, String content, int order, Instant createdAt) {
        this.id = id;
        this.parentId = parentId;
        this.title = title;
        this.content = content;
        this.order = order;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    static PageNode from(DocumentPageDto page, String parentId) {
        PageNode node = new PageNode(page.id(), parentId, page.title(), page.content(), page.order(),
                page.createdAt());
        node.updatedAt = page.updatedAt() != null ? page.updatedAt() : page.createdAt();
        node.pageKind = page.pageKind();
        node.isControl = page.isControl();
        node.scfId = page.scfId();
        node.frameworks = page.frameworks();
        node.frameworkMappings = page.frameworkMappings();
        node.relevanceScore = page.relevanceScore();
        node.status = page.status();
        return node;
    }
}
