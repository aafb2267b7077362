package io.b2mash.ismsp.compliance;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ComplianceTier {
  OK,
  WARN,
  FAIL;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
