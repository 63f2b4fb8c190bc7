package io.b2mash.payables.invoice;

import io.b2mash.payables.approval.ApprovalStatus;
import io.b2mash.payables.payment.Payment;
import io.b2mash.payables.payment.PaymentRepository;
import io.b2mash.payables.tds.WithholdingCalculator;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Derives an invoice's payment status from its approved payments. */
@Service
public class InvoiceSettlementService {

  private static final Logger log = LoggerFactory.getLogger(InvoiceSettlementService.class);

  private final PaymentRepository paymentRepository;
  private final InvoiceRepository invoiceRepository;
  private final WithholdingCalculator calculator;

  public InvoiceSettlementService(
      PaymentRepository paymentRepository,
      InvoiceRepository invoiceRepository,
      WithholdingCalculator calculator) {
    this.paymentRepository = paymentRepository;
    this.invoiceRepository = invoiceRepository;
    this.calculator = calculator;
  }

  /** Net amount the vendor is owed for the invoice, after withholding. */
  public BigDecimal payableAmount(Invoice invoice) {
    if (!invoice.isTdsApplicable() || invoice.getTdsPercentage() == null) {
      return invoice.getInvoiceAmount();
    }
    return calculator
        .withhold(invoice.getInvoiceAmount(), invoice.getTdsPercentage(), invoice.isTdsRounded())
        .payableAmount();
  }

  @Transactional
  public Invoice refresh(Invoice invoice) {
    BigDecimal totalPaid =
        paymentRepository
            .findByInvoiceIdsAndStatus(List.of(invoice.getId()), ApprovalStatus.APPROVED)
            .stream()
            .map(Payment::getAmountPaid)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    var before = invoice.getStatus();
    invoice.applySettlement(totalPaid, payableAmount(invoice));
    if (before != invoice.getStatus()) {
      log.info(
          "Invoice {} moved from {} to {} (paid {})",
          invoice.getId(),
          before.value(),
          invoice.getStatus().value(),
          totalPaid);
    }
    return invoiceRepository.save(invoice);
  }
}
