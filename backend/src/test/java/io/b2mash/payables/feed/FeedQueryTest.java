package io.b2mash.payables.feed;

import static io.b2mash.payables.testutil.TestEntries.archivedContext;
import static io.b2mash.payables.testutil.TestEntries.context;
import static io.b2mash.payables.testutil.TestEntries.invoice;
import static io.b2mash.payables.testutil.TestEntries.payment;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.InvoiceEntry;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.entry.PaymentEntry;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;

class FeedQueryTest {

  private static final UUID PROFILE_A = UUID.randomUUID();
  private static final UUID PROFILE_B = UUID.randomUUID();
  private static final UUID BANK = UUID.randomUUID();
  private static final UUID CHEQUE = UUID.randomUUID();

  private final FeedQuery feedQuery = new FeedQuery();

  private InvoiceEntry openInvoice;
  private InvoiceEntry paidInvoice;
  private InvoiceEntry archivedInvoice;
  private PaymentEntry approvedPayment;
  private PaymentEntry pendingPayment;
  private List<NormalizedEntry> entries;

  @BeforeEach
  void setUp() {
    openInvoice = invoice(PROFILE_A, "INV-100", LocalDate.of(2026, 3, 1), "1000", "0");
    paidInvoice =
        invoice(
            context(PROFILE_B),
            "INV-200",
            LocalDate.of(2026, 3, 5),
            LocalDate.of(2026, 3, 5),
            "500",
            "0",
            "500",
            "paid");
    archivedInvoice =
        invoice(
            archivedContext(PROFILE_A),
            "INV-300",
            LocalDate.of(2026, 3, 2),
            LocalDate.of(2026, 3, 2),
            "300",
            "0",
            "0",
            "unpaid");
    approvedPayment =
        payment(paidInvoice, LocalDate.of(2026, 3, 6), "500", BANK, "Bank Transfer");
    pendingPayment =
        payment(
            openInvoice, LocalDate.of(2026, 3, 7), "100", CHEQUE, "Cheque", "pending_approval");
    entries =
        List.of(openInvoice, paidInvoice, archivedInvoice, approvedPayment, pendingPayment);
  }

  // --- Filtering ---

  @Test
  void query_defaultFilter_hidesArchivedEntries() {
    var result = feedQuery.query(entries, FeedFilter.ALL, FeedSort.DEFAULT);

    assertThat(result).hasSize(4).doesNotContain(archivedInvoice);
  }

  @Test
  void query_includeArchived_showsArchivedEntries() {
    var filter = FeedFilter.builder().includeArchived(true).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT)).contains(archivedInvoice);
  }

  @Test
  void query_kindFilter_keepsOnlyThatKind() {
    var filter = FeedFilter.builder().kinds(Set.of(EntryKind.PAYMENT)).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT))
        .containsExactly(pendingPayment, approvedPayment);
  }

  @Test
  void query_pendingActions_selectsOpenInvoicesAndUnreviewedDocuments() {
    var filter = FeedFilter.builder().statuses(Set.of(FeedQuery.PENDING_ACTIONS)).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT))
        .containsExactly(pendingPayment, openInvoice);
  }

  @Test
  void query_rawStatus_matchesExactly() {
    var filter = FeedFilter.builder().statuses(Set.of("paid")).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT)).containsExactly(paidInvoice);
  }

  @Test
  void query_dateRange_isInclusive() {
    var filter =
        FeedFilter.builder()
            .dateRange(LocalDate.of(2026, 3, 5), LocalDate.of(2026, 3, 6))
            .build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT))
        .containsExactly(approvedPayment, paidInvoice);
  }

  @Test
  void query_profileFilter_includesPaymentsThroughInvoiceContext() {
    var filter = FeedFilter.builder().profileId(PROFILE_B).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT))
        .containsExactlyInAnyOrder(paidInvoice, approvedPayment);
  }

  @Test
  void query_paymentTypeFilter_matchesPaymentMethod() {
    var filter = FeedFilter.builder().paymentTypeId(BANK).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT))
        .containsExactly(approvedPayment);
  }

  @Test
  void query_search_isCaseInsensitiveOverReferenceAndDescription() {
    var byReference = FeedFilter.builder().search("inv-2").build();
    var byDescription = FeedFilter.builder().search("  BANK ").build();

    assertThat(feedQuery.query(entries, byReference, FeedSort.DEFAULT))
        .containsExactly(paidInvoice);
    assertThat(feedQuery.query(entries, byDescription, FeedSort.DEFAULT))
        .containsExactly(approvedPayment);
  }

  @Test
  void query_recurringFalse_excludesRecurringProfiles() {
    var filter = FeedFilter.builder().recurring(false).build();

    assertThat(feedQuery.query(entries, filter, FeedSort.DEFAULT)).isEmpty();
  }

  @Test
  void pendingActionStatuses_differPerKind() {
    assertThat(FeedQuery.pendingActionStatuses(EntryKind.INVOICE))
        .contains("unpaid", "partial", "overdue", "on_hold", "pending_approval");
    assertThat(FeedQuery.pendingActionStatuses(EntryKind.CREDIT_NOTE))
        .containsExactly("pending_approval");
  }

  // --- Sorting ---

  @Test
  void query_amountAscending_ordersByGrossAmount() {
    var sort = new FeedSort(FeedSortKey.AMOUNT, Sort.Direction.ASC);

    assertThat(feedQuery.query(entries, FeedFilter.ALL, sort))
        .extracting(NormalizedEntry::id)
        .containsExactly(
            pendingPayment.id(), paidInvoice.id(), approvedPayment.id(), openInvoice.id());
  }

  @Test
  void query_equalKeys_keepInputOrderInBothDirections() {
    var sameDay = invoice(PROFILE_A, "INV-101", LocalDate.of(2026, 3, 1), "50", "0");
    List<NormalizedEntry> tied = List.of(openInvoice, sameDay);

    var descending = feedQuery.query(tied, FeedFilter.ALL, FeedSort.DEFAULT);
    var ascending =
        feedQuery.query(tied, FeedFilter.ALL, new FeedSort(FeedSortKey.DATE, Sort.Direction.ASC));

    assertThat(descending).containsExactly(openInvoice, sameDay);
    assertThat(ascending).containsExactly(openInvoice, sameDay);
  }
}
