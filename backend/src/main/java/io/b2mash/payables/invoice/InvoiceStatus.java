package io.b2mash.payables.invoice;

/**
 * Invoice lifecycle status.
 *
 * <ul>
 *   <li>PENDING_APPROVAL → UNPAID (approved) or REJECTED
 *   <li>UNPAID, PARTIAL, PAID, OVERDUE move between each other as approved payments settle the net
 *       payable amount
 *   <li>ON_HOLD is set manually and blocks new payments
 *   <li>REJECTED is terminal
 * </ul>
 */
public enum InvoiceStatus {
  PENDING_APPROVAL,
  UNPAID,
  PARTIAL,
  PAID,
  OVERDUE,
  ON_HOLD,
  REJECTED;

  public String value() {
    return name().toLowerCase();
  }

  /** Whether approved payments drive this status. */
  public boolean isSettlementTracked() {
    return switch (this) {
      case UNPAID, PARTIAL, PAID, OVERDUE -> true;
      case PENDING_APPROVAL, ON_HOLD, REJECTED -> false;
    };
  }

  /** Whether the invoice has passed review and counts toward balances and reports. */
  public boolean isApproved() {
    return switch (this) {
      case UNPAID, PARTIAL, PAID, OVERDUE, ON_HOLD -> true;
      case PENDING_APPROVAL, REJECTED -> false;
    };
  }
}
