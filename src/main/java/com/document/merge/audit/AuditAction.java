package com.document.merge.audit;

/**
 * Auditable mutations performed on destination documents.
 */
public enum AuditAction {
    NODES_ATTACHED,
    NODE_DETACHED,
    CONTAINER_SYNTHESIZED,
    PACKAGE_CREATED,
    REFERENCES_RELOCATED,
    NODES_RENAMED,
    IDENTITY_REPLACED,
    SOURCE_PACKAGE_MISSING
}
