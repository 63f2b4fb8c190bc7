package io.b2mash.payables.tds;

import java.math.BigDecimal;

/**
 * Outcome of a withholding calculation.
 *
 * @param withheldAmount the amount withheld at source, after the rounding policy
 * @param payableAmount gross minus withheld
 * @param exactWithheldAmount withholding before ceiling rounding (scale 2)
 * @param rounded whether ceiling rounding was requested
 */
public record WithholdingResult(
    BigDecimal withheldAmount,
    BigDecimal payableAmount,
    BigDecimal exactWithheldAmount,
    boolean rounded) {

  public static WithholdingResult none(BigDecimal grossAmount) {
    return new WithholdingResult(
        Amounts.ZERO, Amounts.money(grossAmount), Amounts.ZERO, false);
  }
}
