package io.b2mash.payables.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.payables.audit.AuditService;
import io.b2mash.payables.exception.GlobalExceptionHandler;
import io.b2mash.payables.exception.ResourceConflictException;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.invoice.InvoiceStatus;
import io.b2mash.payables.vendor.Vendor;
import io.b2mash.payables.vendor.VendorRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;

/** Approve and reject racing on one pending invoice. */
@SpringBootTest
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ApprovalConcurrencyIntegrationTest {

  @Autowired private VendorRepository vendorRepository;
  @Autowired private InvoiceRepository invoiceRepository;
  @Autowired private ApprovalService approvalService;
  @Autowired private AuditService auditService;

  private UUID vendorId;

  @BeforeAll
  void setUp() {
    var vendor = new Vendor("Race Condition Supplies");
    vendor.approve();
    vendorId = vendorRepository.save(vendor).getId();
  }

  // --- Stale copies ---

  @Test
  void rejectFromStaleCopy_afterApprove_failsWithOptimisticLock() {
    var invoiceId = pendingInvoice("RACE-001");

    var approving = invoiceRepository.findById(invoiceId).orElseThrow();
    var rejecting = invoiceRepository.findById(invoiceId).orElseThrow();

    assertThat(approving.approve()).isTrue();
    invoiceRepository.saveAndFlush(approving);

    assertThat(rejecting.reject("Duplicate of an earlier invoice")).isTrue();
    assertThatThrownBy(() -> invoiceRepository.saveAndFlush(rejecting))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);

    var stored = invoiceRepository.findById(invoiceId).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(InvoiceStatus.UNPAID);
    assertThat(stored.getRejectionReason()).isNull();
  }

  @Test
  void optimisticLockFailure_mapsToConflictWithoutRetryAdvice() {
    var handler = new GlobalExceptionHandler(auditService);

    var response =
        handler.handleOptimisticLock(
            new ObjectOptimisticLockingFailureException(Invoice.class, UUID.randomUUID()));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getDetail())
        .contains("no longer in the state")
        .doesNotContain("retry");
  }

  // --- Sequential loser ---

  @Test
  void rejectAfterApprove_throwsNoLongerPending() {
    var invoiceId = pendingInvoice("RACE-002");

    approvalService.approve(DocumentKind.INVOICE, invoiceId);

    assertThatThrownBy(
            () ->
                approvalService.reject(
                    DocumentKind.INVOICE, invoiceId, "Duplicate of an earlier invoice"))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            ex -> assertThat(ex.getBody().getTitle()).isEqualTo("No longer pending approval"));
    assertThat(invoiceRepository.findById(invoiceId).orElseThrow().getStatus())
        .isEqualTo(InvoiceStatus.UNPAID);
  }

  @Test
  void approveAfterReject_throwsNoLongerPending() {
    var invoiceId = pendingInvoice("RACE-003");

    approvalService.reject(DocumentKind.INVOICE, invoiceId, "Amount does not match the PO");

    assertThatThrownBy(() -> approvalService.approve(DocumentKind.INVOICE, invoiceId))
        .isInstanceOfSatisfying(
            ResourceConflictException.class,
            ex -> assertThat(ex.getBody().getTitle()).isEqualTo("No longer pending approval"));
    assertThat(invoiceRepository.findById(invoiceId).orElseThrow().getStatus())
        .isEqualTo(InvoiceStatus.REJECTED);
  }

  private UUID pendingInvoice(String number) {
    var date = LocalDate.of(2024, 7, 10);
    var invoice =
        new Invoice(
            number, vendorId, null, new BigDecimal("1800.00"), "INR", date, date.plusDays(30));
    return invoiceRepository.save(invoice).getId();
  }
}
