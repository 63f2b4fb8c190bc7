package io.b2mash.payables.approval;

import io.b2mash.payables.exception.ResourceConflictException;

/**
 * Review status shared by vendors, payments, credit notes and advance payments.
 *
 * <ul>
 *   <li>PENDING_APPROVAL → APPROVED
 *   <li>PENDING_APPROVAL → REJECTED
 *   <li>APPROVED and REJECTED are terminal
 * </ul>
 *
 * <p>Repeating the transition that already happened is a no-op; attempting the opposite one fails
 * with a conflict, which is how a concurrent approve/reject pair is told apart from a retry.
 */
public enum ApprovalStatus {
  PENDING_APPROVAL,
  APPROVED,
  REJECTED;

  public String value() {
    return name().toLowerCase();
  }

  public boolean canTransitionTo(ApprovalStatus target) {
    return switch (this) {
      case PENDING_APPROVAL -> target == APPROVED || target == REJECTED;
      case APPROVED, REJECTED -> false;
    };
  }

  /**
   * Checks an approval request against this status.
   *
   * @param documentLabel human-readable document kind, e.g. "credit note"
   * @return true if the document must move to APPROVED, false if it already is
   * @throws ResourceConflictException if the document was rejected
   */
  public boolean approvalChangesState(String documentLabel) {
    if (this == APPROVED) {
      return false;
    }
    if (!canTransitionTo(APPROVED)) {
      throw new ResourceConflictException(
          "No longer pending approval", "Cannot approve a rejected " + documentLabel);
    }
    return true;
  }

  /**
   * Checks a rejection request against this status.
   *
   * @return true if the document must move to REJECTED, false if it already is
   * @throws ResourceConflictException if the document was approved
   */
  public boolean rejectionChangesState(String documentLabel) {
    if (this == REJECTED) {
      return false;
    }
    if (!canTransitionTo(REJECTED)) {
      throw new ResourceConflictException(
          "No longer pending approval", "Cannot reject an approved " + documentLabel);
    }
    return true;
  }
}
