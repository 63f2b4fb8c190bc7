package io.b2mash.payables.approval;

import java.util.List;
import java.util.UUID;

/** Per-item outcome of a bulk action. A partially failed batch is still a successful call. */
public record BulkOperationResult(int succeeded, int failed, List<ItemError> errors) {

  public record ItemError(UUID id, String message) {}
}
