package io.b2mash.ismsp.schema;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/**
 * Catalog kept in the normalized pair {@code controls(control_id, name)} and {@code
 * control_sections(control_id, section_label, content)}. The view is only created when no object
 * named {@code isms_requirements} exists, so caller data is never shadowed.
 */
@Component
@Order(3)
public class ControlSectionsProbe implements SchemaProbe {

  private static final Logger log = LoggerFactory.getLogger(ControlSectionsProbe.class);

  static final String NAME = "control-sections/v1";

  static final String VIEW_SQL =
      """
      CREATE VIEW isms_requirements AS
      SELECT c.control_id AS item_code,
             CASE WHEN instr(c.control_id, '.') > 0
                  THEN substr(c.control_id, 1, instr(c.control_id, '.') - 1)
                  ELSE c.control_id
             END AS category,
             c.name AS title,
             COALESCE(
                 (SELECT s.content FROM control_sections s
                   WHERE s.control_id = c.control_id
                     AND lower(trim(s.section_label)) = 'detailed explanation'
                   ORDER BY s.rowid LIMIT 1),
                 (SELECT s.content FROM control_sections s
                   WHERE s.control_id = c.control_id
                     AND lower(trim(s.section_label)) = 'key checks'
                   ORDER BY s.rowid LIMIT 1)) AS description,
             (SELECT s.content FROM control_sections s
               WHERE s.control_id = c.control_id
                 AND lower(trim(s.section_label)) = 'certification criteria'
               ORDER BY s.rowid LIMIT 1) AS requirement_text,
             NULL AS control_objective
      FROM controls c
      """;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<RequirementSource> probe(JdbcClient jdbc, SchemaInspector inspector) {
    if (inspector.relationKind(jdbc, SchemaNames.REQUIREMENTS).isPresent()) {
      return Optional.empty();
    }
    boolean controls =
        inspector.hasColumns(jdbc, SchemaNames.CONTROLS, List.of("control_id", "name"));
    boolean sections =
        inspector.hasColumns(
            jdbc, SchemaNames.CONTROL_SECTIONS, List.of("control_id", "section_label", "content"));
    if (!controls || !sections) {
      return Optional.empty();
    }

    jdbc.sql(VIEW_SQL).update();
    log.info(
        "Created view {} over {} and {}",
        SchemaNames.REQUIREMENTS,
        SchemaNames.CONTROLS,
        SchemaNames.CONTROL_SECTIONS);
    return Optional.of(
        new RequirementSource(NAME, SchemaNames.REQUIREMENTS, RelationKind.VIEW, false));
  }
}
