package io.b2mash.ismsp.evidence;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.ismsp.exception.StorageException;
import java.util.Locale;

public enum EvidenceStatus {
  PENDING,
  COMPLETED,
  REJECTED;

  /** Stored and rendered in lower case, matching the table's CHECK constraint. */
  @JsonValue
  public String dbValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EvidenceStatus fromDb(String value) {
    if (value == null) {
      return COMPLETED;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new StorageException("Unknown evidence status '" + value + "'", e);
    }
  }
}
