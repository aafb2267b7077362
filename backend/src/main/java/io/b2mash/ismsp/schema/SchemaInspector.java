package io.b2mash.ismsp.schema;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/** Read-only look at {@code sqlite_master}, run on the caller's connection. */
@Component
public class SchemaInspector {

  public Optional<RelationKind> relationKind(JdbcClient jdbc, String name) {
    return jdbc.sql(
            """
            SELECT type FROM sqlite_master
            WHERE name = ? AND type IN ('table', 'view')
            """)
        .param(name)
        .query(String.class)
        .optional()
        .map(RelationKind::fromSqliteType);
  }

  public boolean tableExists(JdbcClient jdbc, String name) {
    return relationKind(jdbc, name).filter(kind -> kind == RelationKind.TABLE).isPresent();
  }

  public boolean triggerExists(JdbcClient jdbc, String name) {
    return jdbc.sql("SELECT COUNT(*) FROM sqlite_master WHERE type = 'trigger' AND name = ?")
            .param(name)
            .query(Long.class)
            .single()
        > 0;
  }

  /** Lower-cased column names in declaration order; empty when the relation does not exist. */
  public Set<String> columns(JdbcClient jdbc, String relation) {
    return new LinkedHashSet<>(
        jdbc.sql("SELECT lower(name) FROM pragma_table_info(?) ORDER BY cid")
            .param(relation)
            .query(String.class)
            .list());
  }

  public boolean hasColumns(JdbcClient jdbc, String relation, Iterable<String> required) {
    var present = columns(jdbc, relation);
    for (String column : required) {
      if (!present.contains(column)) {
        return false;
      }
    }
    return !present.isEmpty();
  }
}
