package io.b2mash.payables.report;

import io.b2mash.payables.exception.InvalidInputException;
import java.util.Locale;

public enum ReportView {
  LIVE,
  INVOICE_DATE,
  SUBMITTED;

  public static ReportView fromValue(String value) {
    if (value == null || value.isBlank()) {
      return LIVE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidInputException(
          "Invalid report view",
          "Unknown view '" + value + "'; use live, invoice_date or submitted");
    }
  }

  /** Recomputation mode of this view; SUBMITTED renders the stored snapshot instead. */
  public ReportMode mode() {
    return switch (this) {
      case LIVE -> ReportMode.LIVE;
      case INVOICE_DATE -> ReportMode.INVOICE_DATE;
      case SUBMITTED -> throw new IllegalStateException("Submitted view is not recomputed");
    };
  }
}
