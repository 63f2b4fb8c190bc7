package io.b2mash.payables.feed;

import io.b2mash.payables.entry.AdvancePaymentEntry;
import io.b2mash.payables.entry.CreditNoteEntry;
import io.b2mash.payables.entry.EntryIssue;
import io.b2mash.payables.entry.EntryKind;
import io.b2mash.payables.entry.InvoiceEntry;
import io.b2mash.payables.entry.NormalizedEntry;
import io.b2mash.payables.entry.PaymentEntry;
import io.b2mash.payables.exception.InvalidInputException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/entries")
public class FeedController {

  private final FeedService feedService;

  public FeedController(FeedService feedService) {
    this.feedService = feedService;
  }

  @GetMapping
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<FeedResponse> listEntries(
      @RequestParam(required = false) List<String> kind,
      @RequestParam(required = false) List<String> status,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate startDate,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate endDate,
      @RequestParam(required = false) UUID profileId,
      @RequestParam(required = false) UUID vendorId,
      @RequestParam(required = false) UUID categoryId,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(required = false) UUID paymentTypeId,
      @RequestParam(required = false) Boolean recurring,
      @RequestParam(required = false) Boolean tdsApplicable,
      @RequestParam(defaultValue = "false") boolean includeArchived,
      @RequestParam(required = false) String search,
      @RequestParam(defaultValue = "date") String sortBy,
      @RequestParam(defaultValue = "desc") String sortDirection,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(required = false) Integer size) {
    if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidInputException("Invalid date range", "endDate must not precede startDate");
    }
    var filter =
        FeedFilter.builder()
            .kinds(toKinds(kind))
            .statuses(toStatuses(status))
            .dateRange(startDate, endDate)
            .profileId(profileId)
            .vendorId(vendorId)
            .categoryId(categoryId)
            .entityId(entityId)
            .paymentTypeId(paymentTypeId)
            .recurring(recurring)
            .tdsApplicable(tdsApplicable)
            .includeArchived(includeArchived)
            .search(search)
            .build();
    var sort = new FeedSort(FeedSortKey.fromValue(sortBy), toDirection(sortDirection));
    return ResponseEntity.ok(FeedResponse.from(feedService.getEntries(filter, sort, page, size)));
  }

  private static Set<EntryKind> toKinds(List<String> values) {
    Set<EntryKind> kinds = new LinkedHashSet<>();
    if (values != null) {
      values.stream()
          .filter(value -> !value.isBlank())
          .map(EntryKind::fromValue)
          .forEach(kinds::add);
    }
    return kinds;
  }

  private static Set<String> toStatuses(List<String> values) {
    Set<String> statuses = new LinkedHashSet<>();
    if (values != null) {
      values.stream()
          .filter(value -> !value.isBlank())
          .map(value -> value.trim().toLowerCase(Locale.ROOT))
          .forEach(statuses::add);
    }
    return statuses;
  }

  private static Sort.Direction toDirection(String value) {
    return Sort.Direction.fromOptionalString(value)
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid sort direction", "Sort direction must be asc or desc"));
  }

  // --- DTOs ---

  public record FeedResponse(
      List<FeedEntryResponse> content,
      int page,
      int size,
      long totalElements,
      int totalPages,
      Map<String, Long> countsByKind,
      List<EntryIssue> issues) {

    static FeedResponse from(FeedPage page) {
      Map<String, Long> counts = new LinkedHashMap<>();
      page.countsByKind().forEach((kind, count) -> counts.put(kind.value(), count));
      return new FeedResponse(
          page.content().stream().map(FeedEntryResponse::from).toList(),
          page.page(),
          page.size(),
          page.totalElements(),
          page.totalPages(),
          counts,
          page.issues());
    }
  }

  public record FeedEntryResponse(
      String kind,
      UUID id,
      LocalDate date,
      String referenceNumber,
      String description,
      UUID profileId,
      UUID vendorId,
      String vendorName,
      BigDecimal grossAmount,
      BigDecimal withheldAmount,
      BigDecimal remainingBalance,
      String status,
      String displayStatus,
      UUID paymentMethodId,
      UUID invoiceId,
      boolean archived) {

    static FeedEntryResponse from(NormalizedEntry entry) {
      BigDecimal withheld;
      UUID invoiceId;
      switch (entry.kind()) {
        case INVOICE -> {
          withheld = ((InvoiceEntry) entry).withheldAmount();
          invoiceId = entry.id();
        }
        case PAYMENT -> {
          var payment = (PaymentEntry) entry;
          withheld = payment.withheldAmount();
          invoiceId = payment.invoiceId();
        }
        case CREDIT_NOTE -> {
          var creditNote = (CreditNoteEntry) entry;
          withheld = creditNote.withheldAmount();
          invoiceId = creditNote.invoiceId();
        }
        case ADVANCE_PAYMENT -> {
          withheld = null;
          invoiceId = ((AdvancePaymentEntry) entry).linkedInvoiceId();
        }
        default -> throw new IllegalStateException("Unexpected entry kind: " + entry.kind());
      }
      return new FeedEntryResponse(
          entry.kind().value(),
          entry.id(),
          entry.date(),
          entry.referenceNumber(),
          entry.description(),
          entry.profileId(),
          entry.context().vendorId(),
          entry.vendorName(),
          entry.grossAmount(),
          withheld,
          entry.remainingBalance(),
          entry.status(),
          entry.displayStatus(),
          entry.paymentMethodId(),
          invoiceId,
          entry.archived());
    }
  }
}
