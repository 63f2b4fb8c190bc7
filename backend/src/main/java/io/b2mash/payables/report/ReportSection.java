package io.b2mash.payables.report;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * @param paymentTypeId payment type of a {@link SectionKind#PAYMENT_TYPE} section; null otherwise
 */
public record ReportSection(
    SectionKind kind,
    UUID paymentTypeId,
    String name,
    List<ReportEntry> entries,
    BigDecimal subtotal,
    int entryCount) {}
