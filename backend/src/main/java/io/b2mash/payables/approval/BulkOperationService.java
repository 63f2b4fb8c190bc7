package io.b2mash.payables.approval;

import io.b2mash.payables.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.ErrorResponseException;

/**
 * Applies one action to many documents. Every item runs in its own transaction, so a failing item
 * rolls back only itself and the rest of the batch still commits.
 */
@Service
public class BulkOperationService {

  private static final Logger log = LoggerFactory.getLogger(BulkOperationService.class);

  static final int MAX_BATCH_SIZE = 200;

  private final ApprovalService approvalService;
  private final TransactionTemplate itemTransaction;

  public BulkOperationService(
      ApprovalService approvalService, PlatformTransactionManager transactionManager) {
    this.approvalService = approvalService;
    this.itemTransaction = new TransactionTemplate(transactionManager);
    this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  public BulkOperationResult execute(
      ApprovalAction action, DocumentKind kind, List<UUID> ids, String reason) {
    var uniqueIds = new LinkedHashSet<>(ids);
    if (uniqueIds.isEmpty() || uniqueIds.size() > MAX_BATCH_SIZE) {
      throw new InvalidInputException(
          "Invalid batch", "Select between 1 and " + MAX_BATCH_SIZE + " documents");
    }
    if (action == ApprovalAction.REJECT) {
      ApprovalService.validateReason(reason);
    }

    Consumer<UUID> operation =
        switch (action) {
          case APPROVE -> id -> approvalService.approve(kind, id);
          case REJECT -> id -> approvalService.reject(kind, id, reason);
          case ARCHIVE -> id -> approvalService.archive(kind, id, reason);
        };

    int succeeded = 0;
    var errors = new ArrayList<BulkOperationResult.ItemError>();
    for (UUID id : uniqueIds) {
      try {
        itemTransaction.executeWithoutResult(status -> operation.accept(id));
        succeeded++;
      } catch (RuntimeException e) {
        log.warn("Bulk {} of {} {} failed: {}", action.value(), kind.label(), id, e.getMessage());
        errors.add(new BulkOperationResult.ItemError(id, messageOf(e)));
      }
    }

    log.info(
        "Bulk {} of {} {}(s): {} succeeded, {} failed",
        action.value(),
        uniqueIds.size(),
        kind.label(),
        succeeded,
        errors.size());
    return new BulkOperationResult(succeeded, errors.size(), List.copyOf(errors));
  }

  private static String messageOf(RuntimeException e) {
    if (e instanceof ErrorResponseException errorResponse
        && errorResponse.getBody().getDetail() != null) {
      return errorResponse.getBody().getDetail();
    }
    if (e instanceof ObjectOptimisticLockingFailureException
        || e instanceof DataIntegrityViolationException) {
      return "Document was modified concurrently";
    }
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
