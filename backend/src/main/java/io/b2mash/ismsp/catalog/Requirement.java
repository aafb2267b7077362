package io.b2mash.ismsp.catalog;

/** One certification checklist item, identified by its dotted {@code itemCode} (e.g. 2.7.1). */
public record Requirement(
    String itemCode,
    String category,
    String title,
    String description,
    String requirementText,
    String controlObjective) {

  /** Chapter segment of the item code: {@code 2} for {@code 2.7.1}. */
  public static String chapterOf(String itemCode) {
    int separator = itemCode.indexOf('.');
    return separator > 0 ? itemCode.substring(0, separator) : itemCode;
  }
}
