package io.b2mash.ismsp.schema;

import java.util.List;

/**
 * Identifiers of every store object the adapter knows about. Relation names used in SQL text are
 * always taken from here, which is what makes concatenating them into statements safe.
 */
public final class SchemaNames {

  public static final String REQUIREMENTS = "isms_requirements";
  public static final String REQUIREMENTS_COMPAT = "isms_requirements_compat";
  public static final String CONTROLS = "controls";
  public static final String CONTROL_SECTIONS = "control_sections";
  public static final String EVIDENCES = "evidences";
  public static final String SEARCH_INDEX = "requirement_search_index";

  public static final String EVIDENCE_ITEM_CODE_GUARD = "evidences_require_item_code";
  public static final String EVIDENCE_TOUCH_TRIGGER = "evidences_touch_updated_at";
  public static final String SEARCH_INDEX_INSERT_TRIGGER = "requirement_search_index_ai";
  public static final String SEARCH_INDEX_UPDATE_TRIGGER = "requirement_search_index_au";
  public static final String SEARCH_INDEX_DELETE_TRIGGER = "requirement_search_index_ad";

  public static final List<String> CANONICAL_REQUIREMENT_COLUMNS =
      List.of(
          "item_code", "category", "title", "description", "requirement_text", "control_objective");

  private SchemaNames() {}
}
