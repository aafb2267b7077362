package io.b2mash.ismsp.compliance;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Coverage percentage rounded half-up to one decimal place; {@code 0.0} for an empty catalog. */
public final class ComplianceRates {

  private ComplianceRates() {}

  public static double rate(long covered, long total) {
    if (total <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(covered)
        .multiply(BigDecimal.valueOf(100))
        .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
