package io.b2mash.payables.report;

import java.util.UUID;

/** Configured payment type, in section order. */
public record PaymentTypeRef(UUID id, String name) {}
