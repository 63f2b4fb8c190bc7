package io.b2mash.payables.payment;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.payables.invoice.Invoice;
import io.b2mash.payables.invoice.InvoiceRepository;
import io.b2mash.payables.paymenttype.PaymentType;
import io.b2mash.payables.paymenttype.PaymentTypeRepository;
import io.b2mash.payables.profile.BillingProfile;
import io.b2mash.payables.profile.BillingProfileRepository;
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
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/** Records a payment, approves it and checks the invoice, ledger and feed that follow from it. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PaymentRecordingIntegrationTest {

  private static final LocalDate INVOICE_DATE = LocalDate.of(2023, 2, 1);

  @Autowired private MockMvc mockMvc;
  @Autowired private VendorRepository vendorRepository;
  @Autowired private BillingProfileRepository profileRepository;
  @Autowired private PaymentTypeRepository paymentTypeRepository;
  @Autowired private InvoiceRepository invoiceRepository;

  private UUID vendorId;
  private UUID profileId;
  private UUID neftId;

  @BeforeAll
  void setUp() {
    var vendor = new Vendor("Payment Test Services");
    vendor.approve();
    vendorId = vendorRepository.save(vendor).getId();
    profileId =
        profileRepository
            .save(new BillingProfile("Payment Test Retainer", vendorId, null, null))
            .getId();
    neftId = paymentTypeRepository.save(new PaymentType("NEFT", "Bank transfer", 1)).getId();
  }

  @Test
  void approvedPaymentOfNetPayable_settlesInvoiceAndLedger() throws Exception {
    var invoiceId = invoice("PAY-001", true);

    var result =
        mockMvc
            .perform(
                post("/api/invoices/" + invoiceId + "/payments")
                    .with(memberJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(paymentJson("9000.00", "2023-02-10")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("pending_approval"))
            .andExpect(jsonPath("$.paymentTypeId").value(neftId.toString()))
            .andReturn();
    String paymentId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    // one unreviewed payment at a time
    mockMvc
        .perform(
            post("/api/invoices/" + invoiceId + "/payments")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentJson("100.00", "2023-02-11")))
        .andExpect(status().isConflict());

    mockMvc
        .perform(post("/api/approvals/payment/" + paymentId + "/approve").with(adminJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("approved"));

    mockMvc
        .perform(get("/api/ledger/" + profileId).with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.profileName").value("Payment Test Retainer"))
        .andExpect(jsonPath("$.summary.totalWithheld").value(1000.0))
        .andExpect(jsonPath("$.summary.outstandingBalance").value(0.0))
        .andExpect(jsonPath("$.summary.paymentCount").value(1));

    mockMvc
        .perform(
            post("/api/invoices/" + invoiceId + "/payments")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentJson("1.00", "2023-02-12")))
        .andExpect(status().isConflict());

    mockMvc
        .perform(
            get("/api/entries")
                .param("profileId", profileId.toString())
                .param("kind", "payment")
                .with(memberJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalElements").value(1))
        .andExpect(jsonPath("$.content[0].status").value("approved"));
  }

  @Test
  void recordPayment_pendingInvoice_conflicts() throws Exception {
    var invoiceId = invoice("PAY-002", false);

    mockMvc
        .perform(
            post("/api/invoices/" + invoiceId + "/payments")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentJson("500.00", "2023-02-10")))
        .andExpect(status().isConflict());
  }

  @Test
  void recordPayment_zeroAmount_isBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/invoices/" + UUID.randomUUID() + "/payments")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentJson("0.00", "2023-02-10")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void recordPayment_unknownInvoice_isNotFound() throws Exception {
    mockMvc
        .perform(
            post("/api/invoices/" + UUID.randomUUID() + "/payments")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentJson("500.00", "2023-02-10")))
        .andExpect(status().isNotFound());
  }

  // --- Helpers ---

  /** A 10,000 invoice with 10% withholding, so 9,000 is payable. */
  private UUID invoice(String number, boolean approved) {
    var invoice =
        new Invoice(
            number,
            vendorId,
            approved ? profileId : null,
            new BigDecimal("10000.00"),
            "INR",
            INVOICE_DATE,
            INVOICE_DATE.plusDays(30));
    invoice.configureTds(true, new BigDecimal("10.00"), false);
    if (approved) {
      invoice.approve();
    }
    return invoiceRepository.save(invoice).getId();
  }

  private String paymentJson(String amount, String date) {
    return """
        {"amount": %s, "paymentDate": "%s", "paymentTypeId": "%s", "transactionRef": "UTR-%s"}
        """
        .formatted(amount, date, neftId, date);
  }

  private JwtRequestPostProcessor memberJwt() {
    return jwt()
        .jwt(j -> j.subject("user_pay_member").claim("name", "Payment Member"))
        .authorities(new SimpleGrantedAuthority("ROLE_MEMBER"));
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("user_pay_admin").claim("name", "Payment Admin"))
        .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"));
  }
}
