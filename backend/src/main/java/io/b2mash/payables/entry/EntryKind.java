package io.b2mash.payables.entry;

import io.b2mash.payables.exception.InvalidInputException;
import java.util.Arrays;

/** The four source document kinds that make up the normalized entry stream. */
public enum EntryKind {
  INVOICE("invoice"),
  PAYMENT("payment"),
  CREDIT_NOTE("credit_note"),
  ADVANCE_PAYMENT("advance_payment");

  private final String value;

  EntryKind(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Debit kinds raise what is owed, credit kinds settle it. On a shared date debits are posted
   * first.
   */
  public boolean isDebit() {
    return switch (this) {
      case INVOICE, CREDIT_NOTE -> true;
      case PAYMENT, ADVANCE_PAYMENT -> false;
    };
  }

  public static EntryKind fromValue(String value) {
    return Arrays.stream(values())
        .filter(kind -> kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () -> new InvalidInputException("Invalid entry type", "Unknown entry type: " + value));
  }
}
