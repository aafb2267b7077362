package io.b2mash.ismsp.compliance;

/** Evidence count of one requirement; covered when at least one row of any status exists. */
public record ItemCoverage(String itemCode, String title, String category, long evidenceCount) {

  public boolean covered() {
    return evidenceCount > 0;
  }
}
