package io.b2mash.payables.approval;

import java.util.UUID;

/**
 * Outcome of a single review or archive action.
 *
 * @param status the document's status after the action
 * @param changed false when the action was a repeat of one that had already happened
 */
public record ApprovalResult(DocumentKind kind, UUID id, String status, boolean changed) {}
