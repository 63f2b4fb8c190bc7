package io.b2mash.payables.approval;

import io.b2mash.payables.exception.InvalidInputException;
import java.util.Arrays;

/** Documents that go through review. Path segments use {@link #value()}. */
public enum DocumentKind {
  VENDOR("vendor", "vendor"),
  INVOICE("invoice", "invoice"),
  PAYMENT("payment", "payment"),
  CREDIT_NOTE("credit_note", "credit note"),
  ADVANCE_PAYMENT("advance_payment", "advance payment");

  private final String value;
  private final String label;

  DocumentKind(String value, String label) {
    this.value = value;
    this.label = label;
  }

  public String value() {
    return value;
  }

  /** Lower-case human-readable name, used in messages. */
  public String label() {
    return label;
  }

  public boolean isArchivable() {
    return switch (this) {
      case INVOICE, CREDIT_NOTE, ADVANCE_PAYMENT -> true;
      case VENDOR, PAYMENT -> false;
    };
  }

  public boolean hasReportingMonth() {
    return isArchivable();
  }

  public static DocumentKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(
            kind ->
                kind.value.equalsIgnoreCase(value)
                    || kind.name().equalsIgnoreCase(value)
                    || kind.value.replace('_', '-').equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid document type", "Unknown document type: " + value));
  }
}
