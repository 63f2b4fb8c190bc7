package io.b2mash.payables.tds;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Stateless TDS (tax deducted at source) calculator. All arithmetic is {@link BigDecimal}; the
 * standard policy rounds to scale 2 with HALF_UP, the round-up policy rounds the withheld amount to
 * the next whole currency unit.
 */
@Service
public class WithholdingCalculator {

  /**
   * Computes the withheld and net payable amounts.
   *
   * <p>The calculation is linear in sign: a negative gross (credit note reversal) yields a negative
   * withholding of the same magnitude as the positive case. Round-up therefore rounds away from
   * zero, which is the ceiling for every positive amount.
   *
   * @param grossAmount the gross amount; may be negative for reversals
   * @param percentage withholding percentage (e.g. 10.00 for 10%); null means no withholding
   * @param roundUp whether to round the withheld amount up to a whole unit
   */
  public WithholdingResult withhold(
      BigDecimal grossAmount, BigDecimal percentage, boolean roundUp) {
    Objects.requireNonNull(grossAmount, "grossAmount");
    if (percentage == null || percentage.signum() == 0 || grossAmount.signum() == 0) {
      return WithholdingResult.none(grossAmount);
    }

    // The ceiling is taken on the unrounded product, not on its scale-2 form.
    BigDecimal raw =
        grossAmount.multiply(percentage).divide(Amounts.HUNDRED, MathContext.DECIMAL128);
    BigDecimal exact = raw.setScale(2, RoundingMode.HALF_UP);
    BigDecimal withheld = roundUp ? raw.setScale(0, RoundingMode.UP).setScale(2) : exact;
    BigDecimal payable = Amounts.money(grossAmount).subtract(withheld);
    return new WithholdingResult(withheld, payable, exact, roundUp);
  }

  /** Extra amount withheld by the round-up policy compared to standard rounding. */
  public BigDecimal roundingDifference(BigDecimal grossAmount, BigDecimal percentage) {
    return withhold(grossAmount, percentage, true)
        .withheldAmount()
        .subtract(withhold(grossAmount, percentage, false).withheldAmount());
  }

  public boolean roundingMakesDifference(BigDecimal grossAmount, BigDecimal percentage) {
    return roundingDifference(grossAmount, percentage).signum() != 0;
  }

  /**
   * Derives the percentage that produced a withheld amount, rounded to two decimals. Returns zero
   * for a zero gross amount.
   */
  public BigDecimal impliedPercentage(BigDecimal grossAmount, BigDecimal withheldAmount) {
    if (grossAmount.signum() == 0) {
      return Amounts.ZERO;
    }
    return withheldAmount.multiply(Amounts.HUNDRED).divide(grossAmount, 2, RoundingMode.HALF_UP);
  }

  /** Returns a message when the percentage is outside 0..100, empty when usable. */
  public Optional<String> validatePercentage(BigDecimal percentage) {
    if (percentage == null) {
      return Optional.empty();
    }
    if (percentage.signum() < 0 || percentage.compareTo(Amounts.HUNDRED) > 0) {
      return Optional.of("TDS percentage must be between 0 and 100, got " + percentage);
    }
    return Optional.empty();
  }
}
