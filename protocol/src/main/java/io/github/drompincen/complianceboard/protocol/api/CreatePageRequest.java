package io.github.drompincen.complianceboard.protocol.api;

/**
 * New documentation page. A blank title becomes "Untitled Page"; a null {@code parentId} creates a root page.
 */
public record CreatePageRequest(String title, String parentId) {}
