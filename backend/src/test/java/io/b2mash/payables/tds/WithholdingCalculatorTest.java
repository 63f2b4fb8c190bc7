package io.b2mash.payables.tds;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class WithholdingCalculatorTest {

  private final WithholdingCalculator calculator = new WithholdingCalculator();

  @Test
  void withhold_tenPercent_splitsGrossIntoWithheldAndPayable() {
    var result = calculator.withhold(new BigDecimal("10000"), new BigDecimal("10"), false);

    assertThat(result.withheldAmount()).isEqualByComparingTo("1000.00");
    assertThat(result.payableAmount()).isEqualByComparingTo("9000.00");
    assertThat(result.rounded()).isFalse();
  }

  @Test
  void withhold_roundUp_ceilsWithheldToWholeUnit() {
    // 7% of 333 = 23.31, rounded up to 24
    var result = calculator.withhold(new BigDecimal("333"), new BigDecimal("7"), true);

    assertThat(result.exactWithheldAmount()).isEqualByComparingTo("23.31");
    assertThat(result.withheldAmount()).isEqualByComparingTo("24.00");
    assertThat(result.payableAmount()).isEqualByComparingTo("309.00");
  }

  @Test
  void withhold_roundUp_ceilsProductBelowHalfCent() {
    // 10% of 100.01 = 10.001; the standard value is 10.00 but the ceiling is 11
    var result = calculator.withhold(new BigDecimal("100.01"), new BigDecimal("10"), true);

    assertThat(result.exactWithheldAmount()).isEqualByComparingTo("10.00");
    assertThat(result.withheldAmount()).isEqualByComparingTo("11.00");
    assertThat(result.payableAmount()).isEqualByComparingTo("89.01");
  }

  @Test
  void withhold_roundUp_tinyGrossStillWithholdsOneUnit() {
    // 10% of 0.04 = 0.004, which standard rounding drops entirely
    var result = calculator.withhold(new BigDecimal("0.04"), new BigDecimal("10"), true);

    assertThat(result.exactWithheldAmount()).isEqualByComparingTo("0.00");
    assertThat(result.withheldAmount()).isEqualByComparingTo("1.00");
    assertThat(calculator.roundingMakesDifference(new BigDecimal("0.04"), new BigDecimal("10")))
        .isTrue();
  }

  @Test
  void withhold_standardRounding_usesHalfUpAtTwoDecimals() {
    // 2.5% of 100.10 = 2.5025 -> 2.50
    var result = calculator.withhold(new BigDecimal("100.10"), new BigDecimal("2.5"), false);

    assertThat(result.withheldAmount()).isEqualByComparingTo("2.50");
    assertThat(result.payableAmount()).isEqualByComparingTo("97.60");
  }

  @Test
  void withhold_withoutRounding_payablePlusWithheldEqualsGross() {
    var gross = new BigDecimal("1234.56");
    for (String pct : new String[] {"1", "2.5", "7", "10", "33.33", "100"}) {
      var result = calculator.withhold(gross, new BigDecimal(pct), false);
      assertThat(result.payableAmount().add(result.withheldAmount()))
          .as("percentage %s", pct)
          .isEqualByComparingTo(gross);
    }
  }

  @Test
  void withhold_roundUp_neverWithholdsLessThanStandard() {
    var gross = new BigDecimal("987.65");
    for (String pct : new String[] {"0.5", "2", "7", "12.5", "18"}) {
      var percentage = new BigDecimal(pct);
      var standard = calculator.withhold(gross, percentage, false).withheldAmount();
      var roundedUp = calculator.withhold(gross, percentage, true).withheldAmount();
      assertThat(roundedUp).as("percentage %s", pct).isGreaterThanOrEqualTo(standard);
      assertThat(roundedUp.subtract(standard)).isLessThan(BigDecimal.ONE);
    }
  }

  @Test
  void withhold_nullOrZeroPercentage_withholdsNothing() {
    var none = calculator.withhold(new BigDecimal("500"), null, true);
    var zero = calculator.withhold(new BigDecimal("500"), BigDecimal.ZERO, true);

    assertThat(none.withheldAmount()).isEqualByComparingTo("0");
    assertThat(none.payableAmount()).isEqualByComparingTo("500.00");
    assertThat(zero.withheldAmount()).isEqualByComparingTo("0");
  }

  @Test
  void withhold_negativeGross_mirrorsPositiveCase() {
    var positive = calculator.withhold(new BigDecimal("333"), new BigDecimal("7"), true);
    var negative = calculator.withhold(new BigDecimal("-333"), new BigDecimal("7"), true);

    assertThat(negative.withheldAmount()).isEqualByComparingTo(positive.withheldAmount().negate());
    assertThat(negative.payableAmount()).isEqualByComparingTo(positive.payableAmount().negate());
  }

  @Test
  void roundingDifference_isZeroForWholeWithholding() {
    assertThat(calculator.roundingMakesDifference(new BigDecimal("1000"), new BigDecimal("10")))
        .isFalse();
    assertThat(calculator.roundingDifference(new BigDecimal("333"), new BigDecimal("7")))
        .isEqualByComparingTo("0.69");
  }

  @Test
  void impliedPercentage_recoversRate() {
    assertThat(calculator.impliedPercentage(new BigDecimal("10000"), new BigDecimal("1000")))
        .isEqualByComparingTo("10.00");
    assertThat(calculator.impliedPercentage(BigDecimal.ZERO, new BigDecimal("5")))
        .isEqualByComparingTo("0");
  }

  @Test
  void validatePercentage_rejectsOutOfRange() {
    assertThat(calculator.validatePercentage(new BigDecimal("-1"))).isPresent();
    assertThat(calculator.validatePercentage(new BigDecimal("100.01"))).isPresent();
    assertThat(calculator.validatePercentage(new BigDecimal("100"))).isEmpty();
    assertThat(calculator.validatePercentage(null)).isEmpty();
  }
}
