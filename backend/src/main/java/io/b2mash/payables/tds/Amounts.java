package io.b2mash.payables.tds;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Money helpers shared by the ledger and report builders. All amounts are scale 2, HALF_UP. */
public final class Amounts {

  public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

  /** Remaining balances at or below this are treated as settled. */
  public static final BigDecimal PAID_TOLERANCE = new BigDecimal("0.01");

  static final BigDecimal HUNDRED = new BigDecimal("100");

  public static BigDecimal money(BigDecimal value) {
    return value == null ? ZERO : value.setScale(2, RoundingMode.HALF_UP);
  }

  /** True when {@code paid} covers {@code payable} within {@link #PAID_TOLERANCE}. */
  public static boolean isSettled(BigDecimal paid, BigDecimal payable) {
    return payable.subtract(paid).compareTo(PAID_TOLERANCE) <= 0;
  }

  /** Whole-number share of {@code part} in {@code whole}, HALF_UP; zero when whole is zero. */
  public static int percentOf(BigDecimal part, BigDecimal whole) {
    if (whole.signum() == 0) {
      return 0;
    }
    return part.multiply(HUNDRED).divide(whole, 0, RoundingMode.HALF_UP).intValueExact();
  }

  private Amounts() {}
}
