package io.b2mash.payables.advance;

import io.b2mash.payables.approval.ApprovalStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdvancePaymentRepository extends JpaRepository<AdvancePayment, UUID> {

  @Query(
      """
      SELECT a FROM AdvancePayment a WHERE a.invoiceId IN :invoiceIds
      ORDER BY a.paymentDate ASC, a.createdAt ASC
      """)
  List<AdvancePayment> findByInvoiceIds(@Param("invoiceIds") Collection<UUID> invoiceIds);

  @Query(
      """
      SELECT a FROM AdvancePayment a
      WHERE COALESCE(a.reportingMonth, a.paymentDate) BETWEEN :start AND :end
      ORDER BY a.paymentDate ASC, a.createdAt ASC
      """)
  List<AdvancePayment> findByEffectiveDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query(
      """
      SELECT a FROM AdvancePayment a WHERE a.paymentDate BETWEEN :start AND :end
      ORDER BY a.paymentDate ASC, a.createdAt ASC
      """)
  List<AdvancePayment> findByPaymentDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query("SELECT a FROM AdvancePayment a ORDER BY a.paymentDate ASC, a.createdAt ASC")
  List<AdvancePayment> findAllOrdered();

  boolean existsByInvoiceId(UUID invoiceId);

  @Query("SELECT COUNT(a) FROM AdvancePayment a WHERE a.status = :status AND a.archived = false")
  long countActiveByStatus(@Param("status") ApprovalStatus status);
}
