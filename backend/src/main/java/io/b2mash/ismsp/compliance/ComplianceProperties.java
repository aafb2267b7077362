package io.b2mash.ismsp.compliance;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Rate thresholds, in percent, separating the compliance tiers.
 *
 * @param okThreshold lowest rate rated {@code ok}
 * @param warnThreshold lowest rate rated {@code warn}; anything below is {@code fail}
 */
@ConfigurationProperties("isms.compliance")
public record ComplianceProperties(
    @DefaultValue("80") double okThreshold, @DefaultValue("50") double warnThreshold) {

  public ComplianceProperties {
    if (warnThreshold > okThreshold) {
      throw new IllegalArgumentException(
          "isms.compliance.warn-threshold ("
              + warnThreshold
              + ") must not exceed ok-threshold ("
              + okThreshold
              + ")");
    }
  }

  public ComplianceTier tierFor(double rate) {
    if (rate >= okThreshold) {
      return ComplianceTier.OK;
    }
    if (rate >= warnThreshold) {
      return ComplianceTier.WARN;
    }
    return ComplianceTier.FAIL;
  }
}
