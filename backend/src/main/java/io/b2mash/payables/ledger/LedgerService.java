package io.b2mash.payables.ledger;

import io.b2mash.payables.entry.EntryNormalizer;
import io.b2mash.payables.entry.SourceRecordLoader;
import io.b2mash.payables.exception.ResourceNotFoundException;
import io.b2mash.payables.profile.BillingProfile;
import io.b2mash.payables.profile.BillingProfileRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LedgerService {

  private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

  private final BillingProfileRepository profileRepository;
  private final SourceRecordLoader recordLoader;
  private final EntryNormalizer normalizer;
  private final LedgerBuilder ledgerBuilder;

  public LedgerService(
      BillingProfileRepository profileRepository,
      SourceRecordLoader recordLoader,
      EntryNormalizer normalizer,
      LedgerBuilder ledgerBuilder) {
    this.profileRepository = profileRepository;
    this.recordLoader = recordLoader;
    this.normalizer = normalizer;
    this.ledgerBuilder = ledgerBuilder;
  }

  /**
   * Builds the full ledger of a profile and then hides the rows the filter rejects. The summary
   * always covers the whole profile.
   */
  @Transactional(readOnly = true)
  public LedgerView getLedger(UUID profileId, LedgerFilter filter) {
    BillingProfile profile =
        profileRepository
            .findById(profileId)
            .orElseThrow(() -> new ResourceNotFoundException("BillingProfile", profileId));

    var normalized = normalizer.normalize(recordLoader.forProfile(profileId));
    var ledger = ledgerBuilder.buildLedger(profileId, normalized.entries(), LocalDate.now());
    var rows = ledger.entries().stream().filter(filter::matches).toList();

    log.debug(
        "Built ledger for profile {}: {} rows, {} shown, outstanding {}",
        profileId,
        ledger.entries().size(),
        rows.size(),
        ledger.summary().outstandingBalance());
    return new LedgerView(
        profileId, profile.getName(), rows, ledger.summary(), normalized.issues());
  }

  /** Active profiles with their unpaid invoice count and outstanding balance. */
  @Transactional(readOnly = true)
  public List<ProfileOption> profileOptions() {
    var records = recordLoader.all();
    var entries = normalizer.normalize(records).entries();
    var today = LocalDate.now();
    return profileRepository.findByActiveTrueOrderByNameAsc().stream()
        .map(
            profile -> {
              var summary = ledgerBuilder.buildLedger(profile.getId(), entries, today).summary();
              return new ProfileOption(
                  profile.getId(),
                  profile.getName(),
                  records.vendorNames().get(profile.getVendorId()),
                  summary.unpaidInvoiceCount(),
                  summary.outstandingBalance());
            })
        .toList();
  }
}
