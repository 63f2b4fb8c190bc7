package io.b2mash.payables.report;

/**
 * Lifecycle of a monthly report period.
 *
 * <ul>
 *   <li>DRAFT → FINALIZED (snapshot captured)
 *   <li>FINALIZED → SUBMITTED (snapshot handed over)
 *   <li>FINALIZED → DRAFT (snapshot discarded, super admins only)
 *   <li>SUBMITTED is terminal
 * </ul>
 */
public enum ReportPeriodStatus {
  DRAFT,
  FINALIZED,
  SUBMITTED;

  public String value() {
    return name().toLowerCase();
  }

  public boolean canTransitionTo(ReportPeriodStatus target) {
    return switch (this) {
      case DRAFT -> target == FINALIZED;
      case FINALIZED -> target == SUBMITTED || target == DRAFT;
      case SUBMITTED -> false;
    };
  }
}
