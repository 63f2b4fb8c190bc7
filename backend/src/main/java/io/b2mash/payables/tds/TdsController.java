package io.b2mash.payables.tds;

import io.b2mash.payables.exception.InvalidInputException;
import java.math.BigDecimal;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tds")
public class TdsController {

  private final WithholdingCalculator calculator;

  public TdsController(WithholdingCalculator calculator) {
    this.calculator = calculator;
  }

  /** Previews withholding for a gross amount, used by payment entry forms. */
  @GetMapping("/calculate")
  @PreAuthorize("hasAnyRole('MEMBER', 'ADMIN', 'SUPER_ADMIN')")
  public ResponseEntity<TdsCalculationResponse> calculate(
      @RequestParam BigDecimal amount,
      @RequestParam(required = false) BigDecimal percentage,
      @RequestParam(defaultValue = "false") boolean roundUp) {
    if (amount.signum() < 0) {
      throw new InvalidInputException("Invalid amount", "Amount must not be negative");
    }
    if (amount.stripTrailingZeros().scale() > 2) {
      throw new InvalidInputException(
          "Invalid amount", "Amount must have at most two decimal places");
    }
    calculator
        .validatePercentage(percentage)
        .ifPresent(
            message -> {
              throw new InvalidInputException("Invalid TDS percentage", message);
            });

    var result = calculator.withhold(amount, percentage, roundUp);
    boolean hasRate = percentage != null;
    return ResponseEntity.ok(
        new TdsCalculationResponse(
            Amounts.money(amount),
            percentage,
            roundUp,
            result.exactWithheldAmount(),
            result.withheldAmount(),
            result.payableAmount(),
            hasRate ? calculator.roundingDifference(amount, percentage) : Amounts.ZERO,
            hasRate && calculator.roundingMakesDifference(amount, percentage),
            calculator.impliedPercentage(amount, result.withheldAmount())));
  }

  // --- DTOs ---

  public record TdsCalculationResponse(
      BigDecimal grossAmount,
      BigDecimal percentage,
      boolean roundUp,
      BigDecimal exactWithheldAmount,
      BigDecimal withheldAmount,
      BigDecimal payableAmount,
      BigDecimal roundingDifference,
      boolean roundingMakesDifference,
      BigDecimal effectivePercentage) {}
}
