package io.b2mash.payables.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.payables.exception.InvalidInputException;
import io.b2mash.payables.exception.ResourceConflictException;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class BulkOperationServiceTest {

  private static final String REASON = "Duplicate of an earlier upload";

  @Mock private ApprovalService approvalService;
  @Mock private PlatformTransactionManager transactionManager;

  private BulkOperationService bulkOperationService;

  @BeforeEach
  void setUp() {
    bulkOperationService = new BulkOperationService(approvalService, transactionManager);
  }

  @Test
  void archive_oneAlreadyArchived_reportsPartialSuccess() {
    var first = UUID.randomUUID();
    var second = UUID.randomUUID();
    var third = UUID.randomUUID();
    when(approvalService.archive(eq(DocumentKind.INVOICE), any(UUID.class), eq(REASON)))
        .thenAnswer(
            invocation -> {
              UUID id = invocation.getArgument(1);
              if (id.equals(second)) {
                throw new ResourceConflictException(
                    "Already archived", "Invoice is already archived");
              }
              return new ApprovalResult(DocumentKind.INVOICE, id, "archived", true);
            });

    var result =
        bulkOperationService.execute(
            ApprovalAction.ARCHIVE, DocumentKind.INVOICE, List.of(first, second, third), REASON);

    assertThat(result.succeeded()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.errors())
        .containsExactly(
            new BulkOperationResult.ItemError(second, "Invoice is already archived"));
    verify(approvalService).archive(DocumentKind.INVOICE, third, REASON);
    verify(transactionManager, times(2)).commit(any());
    verify(transactionManager).rollback(any());
  }

  @Test
  void approve_duplicateIds_processesEachOnce() {
    var id = UUID.randomUUID();

    var result =
        bulkOperationService.execute(
            ApprovalAction.APPROVE, DocumentKind.PAYMENT, List.of(id, id, id), null);

    assertThat(result.succeeded()).isEqualTo(1);
    verify(approvalService, times(1)).approve(DocumentKind.PAYMENT, id);
  }

  @Test
  void approve_concurrentModification_reportsReadableMessage() {
    var id = UUID.randomUUID();
    when(approvalService.approve(DocumentKind.VENDOR, id))
        .thenThrow(new ObjectOptimisticLockingFailureException(Object.class, id));

    var result =
        bulkOperationService.execute(
            ApprovalAction.APPROVE, DocumentKind.VENDOR, List.of(id), null);

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.errors().get(0).message()).isEqualTo("Document was modified concurrently");
  }

  @Test
  void reject_shortReason_failsBeforeAnyItem() {
    var id = UUID.randomUUID();

    assertThatThrownBy(
            () ->
                bulkOperationService.execute(
                    ApprovalAction.REJECT, DocumentKind.INVOICE, List.of(id), "too short"))
        .isInstanceOf(InvalidInputException.class);
    verify(approvalService, never()).reject(any(), any(), any());
  }

  @Test
  void execute_emptyBatch_isRejected() {
    assertThatThrownBy(
            () ->
                bulkOperationService.execute(
                    ApprovalAction.APPROVE, DocumentKind.INVOICE, List.of(), null))
        .isInstanceOf(InvalidInputException.class);
  }

  @Test
  void execute_oversizedBatch_isRejected() {
    var ids =
        Collections.nCopies(BulkOperationService.MAX_BATCH_SIZE + 1, 0).stream()
            .map(i -> UUID.randomUUID())
            .toList();

    assertThatThrownBy(
            () ->
                bulkOperationService.execute(
                    ApprovalAction.APPROVE, DocumentKind.INVOICE, ids, null))
        .isInstanceOf(InvalidInputException.class);
    verify(approvalService, never()).approve(any(), any());
  }
}
