package io.b2mash.payables.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.ActiveProfiles;

/** Two requests finalizing the same period from copies loaded before either one saved. */
@SpringBootTest
@ActiveProfiles("test")
class ReportPeriodConcurrencyIntegrationTest {

  private static final int YEAR = 2031;

  @Autowired private ReportPeriodRepository periodRepository;

  @Test
  void finalizeFromStaleCopy_failsAndKeepsFirstSnapshot() {
    periodRepository.saveAndFlush(new ReportPeriod(1, YEAR));

    var first = periodRepository.findByMonthAndYear(1, YEAR).orElseThrow();
    var second = periodRepository.findByMonthAndYear(1, YEAR).orElseThrow();

    first.finalizeWith("{\"version\":1,\"by\":\"first\"}", "user_a", "First", Instant.now(), null);
    periodRepository.saveAndFlush(first);

    second.finalizeWith(
        "{\"version\":1,\"by\":\"second\"}", "user_b", "Second", Instant.now(), null);
    assertThatThrownBy(() -> periodRepository.saveAndFlush(second))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);

    var stored = periodRepository.findByMonthAndYear(1, YEAR).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(ReportPeriodStatus.FINALIZED);
    assertThat(stored.getFinalizedByName()).isEqualTo("First");
    assertThat(stored.getSnapshotData()).contains("\"first\"");
  }

  @Test
  void unfinalizeFromStaleCopy_failsAfterSubmit() {
    var period = new ReportPeriod(2, YEAR);
    period.finalizeWith("{\"version\":1}", "user_a", "First", Instant.now(), null);
    periodRepository.saveAndFlush(period);

    var submitting = periodRepository.findByMonthAndYear(2, YEAR).orElseThrow();
    var reopening = periodRepository.findByMonthAndYear(2, YEAR).orElseThrow();

    submitting.markSubmitted("Auditor", "user_a", Instant.now());
    periodRepository.saveAndFlush(submitting);

    reopening.clearSnapshot();
    assertThatThrownBy(() -> periodRepository.saveAndFlush(reopening))
        .isInstanceOf(ObjectOptimisticLockingFailureException.class);

    var stored = periodRepository.findByMonthAndYear(2, YEAR).orElseThrow();
    assertThat(stored.getStatus()).isEqualTo(ReportPeriodStatus.SUBMITTED);
    assertThat(stored.hasSnapshot()).isTrue();
  }
}
