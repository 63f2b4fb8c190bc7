package io.b2mash.payables.entry;

import io.b2mash.payables.advance.AdvancePayment;
import io.b2mash.payables.creditnote.CreditNote;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.payment.Payment;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything the normalizer needs, fetched up front. {@code invoices} must contain every invoice
 * referenced by the payments, credit notes and linked advances; consumers filter invoices by their
 * own criteria, so extra invoices are harmless.
 *
 * @param vendorNames vendor id to display name
 * @param paymentTypeNames payment type id to display name
 */
public record SourceRecords(
    List<Invoice> invoices,
    List<Payment> payments,
    List<CreditNote> creditNotes,
    List<AdvancePayment> advancePayments,
    Map<UUID, String> vendorNames,
    Map<UUID, String> paymentTypeNames) {}
