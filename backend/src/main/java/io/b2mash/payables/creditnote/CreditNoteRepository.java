package io.b2mash.payables.creditnote;

import io.b2mash.payables.approval.ApprovalStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CreditNoteRepository extends JpaRepository<CreditNote, UUID> {

  @Query(
      """
      SELECT c FROM CreditNote c WHERE c.invoiceId IN :invoiceIds
      ORDER BY c.creditNoteDate ASC, c.createdAt ASC
      """)
  List<CreditNote> findByInvoiceIds(@Param("invoiceIds") Collection<UUID> invoiceIds);

  @Query(
      """
      SELECT c FROM CreditNote c
      WHERE COALESCE(c.reportingMonth, c.creditNoteDate) BETWEEN :start AND :end
      ORDER BY c.creditNoteDate ASC, c.createdAt ASC
      """)
  List<CreditNote> findByEffectiveDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query(
      """
      SELECT c FROM CreditNote c WHERE c.creditNoteDate BETWEEN :start AND :end
      ORDER BY c.creditNoteDate ASC, c.createdAt ASC
      """)
  List<CreditNote> findByCreditNoteDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query("SELECT c FROM CreditNote c ORDER BY c.creditNoteDate ASC, c.createdAt ASC")
  List<CreditNote> findAllOrdered();

  @Query("SELECT COUNT(c) FROM CreditNote c WHERE c.status = :status AND c.archived = false")
  long countActiveByStatus(@Param("status") ApprovalStatus status);
}
