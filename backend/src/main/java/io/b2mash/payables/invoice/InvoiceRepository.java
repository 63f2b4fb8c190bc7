package io.b2mash.payables.invoice;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  @Query("SELECT i FROM Invoice i WHERE i.profileId = :profileId ORDER BY i.createdAt ASC")
  List<Invoice> findByProfileId(@Param("profileId") UUID profileId);

  /** Invoices whose effective month (reporting, else received, else invoice date) is in range. */
  @Query(
      """
      SELECT i FROM Invoice i
      WHERE COALESCE(i.reportingMonth, i.receivedDate, i.invoiceDate) BETWEEN :start AND :end
      ORDER BY i.createdAt ASC
      """)
  List<Invoice> findByEffectiveDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.invoiceDate BETWEEN :start AND :end
      ORDER BY i.createdAt ASC
      """)
  List<Invoice> findByInvoiceDateBetween(
      @Param("start") LocalDate start, @Param("end") LocalDate end);

  @Query("SELECT i FROM Invoice i WHERE i.archived = false ORDER BY i.createdAt ASC")
  List<Invoice> findAllActive();

  @Query("SELECT i FROM Invoice i ORDER BY i.createdAt ASC")
  List<Invoice> findAllOrdered();

  @Query(
      "SELECT COUNT(i) FROM Invoice i WHERE i.status = :status AND i.archived = false")
  long countActiveByStatus(@Param("status") InvoiceStatus status);
}
