package io.b2mash.ismsp.schema;

import java.util.Optional;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/** {@code isms_requirements} already exposes every canonical column, as a table or a view. */
@Component
@Order(1)
public class CanonicalRequirementsProbe implements SchemaProbe {

  static final String NAME = "canonical/v1";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Optional<RequirementSource> probe(JdbcClient jdbc, SchemaInspector inspector) {
    return inspector
        .relationKind(jdbc, SchemaNames.REQUIREMENTS)
        .filter(
            kind ->
                inspector.hasColumns(
                    jdbc, SchemaNames.REQUIREMENTS, SchemaNames.CANONICAL_REQUIREMENT_COLUMNS))
        .map(kind -> new RequirementSource(NAME, SchemaNames.REQUIREMENTS, kind, false));
  }
}
