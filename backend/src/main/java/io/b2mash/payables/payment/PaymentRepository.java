package io.b2mash.payables.payment;

import io.b2mash.payables.approval.ApprovalStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

  @Query(
      """
      SELECT p FROM Payment p
      WHERE p.invoiceId IN :invoiceIds AND p.status = :status
      ORDER BY p.paymentDate ASC, p.createdAt ASC
      """)
  List<Payment> findByInvoiceIdsAndStatus(
      @Param("invoiceIds") Collection<UUID> invoiceIds, @Param("status") ApprovalStatus status);

  @Query(
      """
      SELECT p FROM Payment p
      WHERE p.status = :status AND p.paymentDate BETWEEN :start AND :end
      ORDER BY p.paymentDate ASC, p.createdAt ASC
      """)
  List<Payment> findByStatusAndPaymentDateBetween(
      @Param("status") ApprovalStatus status,
      @Param("start") LocalDate start,
      @Param("end") LocalDate end);

  @Query("SELECT p FROM Payment p ORDER BY p.paymentDate ASC, p.createdAt ASC")
  List<Payment> findAllOrdered();

  boolean existsByInvoiceIdAndStatus(UUID invoiceId, ApprovalStatus status);

  long countByStatus(ApprovalStatus status);
}
