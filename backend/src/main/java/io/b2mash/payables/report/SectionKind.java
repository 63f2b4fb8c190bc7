package io.b2mash.payables.report;

public enum SectionKind {
  PAYMENT_TYPE,
  CREDIT_NOTES,
  UNPAID
}
