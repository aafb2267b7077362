package io.b2mash.ismsp.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/**
 * {@code isms_requirements} is a table in one of the older column layouts ({@code item_title},
 * {@code requirement}, {@code certification_criteria}, {@code check_items}, ...). A read-only view
 * {@code isms_requirements_compat} renames whatever is there onto the canonical columns.
 */
@Component
@Order(2)
public class LegacyColumnsProbe implements SchemaProbe {

  private static final Logger log = LoggerFactory.getLogger(LegacyColumnsProbe.class);

  static final String NAME = "legacy-columns/v1";

  private static final List<String> TITLE_COLUMNS = List.of("title", "item_title");
  private static final List<String> DESCRIPTION_COLUMNS =
      List.of("description", "detailed_explanation", "key_checks");
  private static final List<String> REQUIREMENT_COLUMNS =
      List.of("requirement_text", "requirement", "certification_criteria", "check_items");
  private static final List<String> OBJECTIVE_COLUMNS = List.of("control_objective");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<RequirementSource> probe(JdbcClient jdbc, SchemaInspector inspector) {
    if (!inspector.tableExists(jdbc, SchemaNames.REQUIREMENTS)) {
      return Optional.empty();
    }
    var columns = inspector.columns(jdbc, SchemaNames.REQUIREMENTS);
    if (!columns.contains("item_code") || presentColumns(columns, TITLE_COLUMNS).isEmpty()) {
      return Optional.empty();
    }

    if (inspector.relationKind(jdbc, SchemaNames.REQUIREMENTS_COMPAT).isEmpty()) {
      jdbc.sql(compatibilityViewSql(columns)).update();
      log.info(
          "Created view {} over legacy {} columns {}",
          SchemaNames.REQUIREMENTS_COMPAT,
          SchemaNames.REQUIREMENTS,
          columns);
    } else if (!inspector.hasColumns(
        jdbc, SchemaNames.REQUIREMENTS_COMPAT, SchemaNames.CANONICAL_REQUIREMENT_COLUMNS)) {
      log.warn(
          "{} exists but does not expose the canonical columns, leaving it untouched",
          SchemaNames.REQUIREMENTS_COMPAT);
      return Optional.empty();
    }
    return Optional.of(
        new RequirementSource(NAME, SchemaNames.REQUIREMENTS_COMPAT, RelationKind.VIEW, false));
  }

  /** Only identifiers from the candidate lists above ever reach the statement text. */
  static String compatibilityViewSql(Set<String> columns) {
    return """
        CREATE VIEW %s AS
        SELECT item_code AS item_code,
               %s AS category,
               %s AS title,
               %s AS description,
               %s AS requirement_text,
               %s AS control_objective
        FROM %s
        """
        .formatted(
            SchemaNames.REQUIREMENTS_COMPAT,
            categoryExpression(columns),
            presentColumns(columns, TITLE_COLUMNS).get(0),
            coalesce(presentColumns(columns, DESCRIPTION_COLUMNS)),
            coalesce(presentColumns(columns, REQUIREMENT_COLUMNS)),
            coalesce(presentColumns(columns, OBJECTIVE_COLUMNS)),
            SchemaNames.REQUIREMENTS);
  }

  private static String categoryExpression(Set<String> columns) {
    if (columns.contains("category")) {
      return "category";
    }
    if (columns.contains("chapter")) {
      return "chapter";
    }
    return "CASE WHEN instr(item_code, '.') > 0"
        + " THEN substr(item_code, 1, instr(item_code, '.') - 1) ELSE item_code END";
  }

  private static List<String> presentColumns(Set<String> columns, List<String> candidates) {
    var present = new ArrayList<String>();
    for (String candidate : candidates) {
      if (columns.contains(candidate)) {
        present.add(candidate);
      }
    }
    return present;
  }

  private static String coalesce(List<String> present) {
    if (present.isEmpty()) {
      return "NULL";
    }
    if (present.size() == 1) {
      return present.get(0);
    }
    return "COALESCE(" + String.join(", ", present) + ")";
  }
}
