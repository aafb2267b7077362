package io.b2mash.ismsp.schema;

import io.b2mash.ismsp.exception.StorageException;
import io.b2mash.ismsp.store.StoreTimestamps;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/** Creates or upgrades the {@code evidences} table and the triggers that guard it. */
@Component
public class EvidenceSchemaProvisioner {

  private static final Logger log = LoggerFactory.getLogger(EvidenceSchemaProvisioner.class);

  static final String TABLE_SQL =
      """
      CREATE TABLE evidences (
          id            INTEGER PRIMARY KEY AUTOINCREMENT,
          item_code     TEXT NOT NULL,
          evidence_type TEXT NOT NULL,
          content       TEXT NOT NULL,
          file_path     TEXT,
          status        TEXT NOT NULL DEFAULT 'pending'
                        CHECK (status IN ('pending', 'completed', 'rejected')),
          created_by    TEXT NOT NULL DEFAULT 'system',
          created_at    TEXT NOT NULL DEFAULT (%1$s),
          updated_at    TEXT NOT NULL DEFAULT (%1$s)
      )
      """
          .formatted(StoreTimestamps.SQL_NOW);

  private static final List<String> REQUIRED_COLUMNS =
      List.of("id", "item_code", "evidence_type", "content");

  /** Columns older evidence tables may lack; existing rows count as completed. */
  private static final Map<String, String> UPGRADE_COLUMNS = new LinkedHashMap<>();

  static {
    UPGRADE_COLUMNS.put(
        "status",
        "status TEXT NOT NULL DEFAULT 'completed'"
            + " CHECK (status IN ('pending', 'completed', 'rejected'))");
    UPGRADE_COLUMNS.put("created_by", "created_by TEXT DEFAULT 'system'");
    UPGRADE_COLUMNS.put("file_path", "file_path TEXT");
    UPGRADE_COLUMNS.put("created_at", "created_at TEXT");
    UPGRADE_COLUMNS.put("updated_at", "updated_at TEXT");
  }

  // Fires only when the statement left updated_at alone and it is not already current, so the
  // inner UPDATE can never satisfy the WHEN clause again.
  static final String TOUCH_TRIGGER_SQL =
      """
      CREATE TRIGGER evidences_touch_updated_at
      AFTER UPDATE ON evidences
      FOR EACH ROW
      WHEN NEW.updated_at IS OLD.updated_at AND OLD.updated_at IS NOT %1$s
      BEGIN
          UPDATE evidences SET updated_at = %1$s WHERE id = NEW.id;
      END
      """
          .formatted(StoreTimestamps.SQL_NOW);

  public void ensureTable(JdbcClient jdbc, SchemaInspector inspector, List<String> provisioned) {
    var kind = inspector.relationKind(jdbc, SchemaNames.EVIDENCES);
    if (kind.isEmpty()) {
      jdbc.sql(TABLE_SQL).update();
      createIndexes(jdbc);
      provisioned.add("table " + SchemaNames.EVIDENCES);
      log.info("Created table {}", SchemaNames.EVIDENCES);
      return;
    }
    if (kind.get() == RelationKind.VIEW) {
      throw new StorageException("'" + SchemaNames.EVIDENCES + "' is a view, expected a table");
    }

    var columns = inspector.columns(jdbc, SchemaNames.EVIDENCES);
    for (String required : REQUIRED_COLUMNS) {
      if (!columns.contains(required)) {
        throw new StorageException(
            "Table '" + SchemaNames.EVIDENCES + "' has no '" + required + "' column");
      }
    }
    for (var column : UPGRADE_COLUMNS.entrySet()) {
      if (!columns.contains(column.getKey())) {
        jdbc.sql("ALTER TABLE " + SchemaNames.EVIDENCES + " ADD COLUMN " + column.getValue())
            .update();
        provisioned.add("column " + SchemaNames.EVIDENCES + "." + column.getKey());
        log.info("Added column {} to existing {}", column.getKey(), SchemaNames.EVIDENCES);
      }
    }
    createIndexes(jdbc);
  }

  public void ensureTouchTrigger(
      JdbcClient jdbc, SchemaInspector inspector, List<String> provisioned) {
    if (!inspector.triggerExists(jdbc, SchemaNames.EVIDENCE_TOUCH_TRIGGER)) {
      jdbc.sql(TOUCH_TRIGGER_SQL).update();
      provisioned.add("trigger " + SchemaNames.EVIDENCE_TOUCH_TRIGGER);
    }
  }

  /**
   * Rejects evidence whose item code is absent from {@code relation}. The trigger is rebuilt when
   * it points at a different relation than the one currently resolved; it is derived state, never
   * caller data.
   */
  public void ensureItemCodeGuard(
      JdbcClient jdbc, SchemaInspector inspector, String relation, List<String> provisioned) {
    var expected = itemCodeGuardSql(relation);
    var existing =
        jdbc.sql("SELECT sql FROM sqlite_master WHERE type = 'trigger' AND name = ?")
            .param(SchemaNames.EVIDENCE_ITEM_CODE_GUARD)
            .query(String.class)
            .optional();
    if (existing.isPresent()) {
      if (normalize(existing.get()).equals(normalize(expected))) {
        return;
      }
      jdbc.sql("DROP TRIGGER " + SchemaNames.EVIDENCE_ITEM_CODE_GUARD).update();
      log.info("Re-pointing {} at {}", SchemaNames.EVIDENCE_ITEM_CODE_GUARD, relation);
    }
    jdbc.sql(expected).update();
    provisioned.add("trigger " + SchemaNames.EVIDENCE_ITEM_CODE_GUARD);
  }

  static String itemCodeGuardSql(String relation) {
    return """
        CREATE TRIGGER evidences_require_item_code
        BEFORE INSERT ON evidences
        FOR EACH ROW
        WHEN NOT EXISTS (SELECT 1 FROM %s WHERE item_code = NEW.item_code)
        BEGIN
            SELECT RAISE(ABORT, 'evidence references unknown item_code');
        END
        """
        .formatted(relation);
  }

  private void createIndexes(JdbcClient jdbc) {
    jdbc.sql("CREATE INDEX IF NOT EXISTS idx_evidences_item_code ON evidences (item_code)")
        .update();
    jdbc.sql("CREATE INDEX IF NOT EXISTS idx_evidences_created_at ON evidences (created_at)")
        .update();
  }

  private static String normalize(String sql) {
    return sql.trim().replaceAll("\\s+", " ");
  }
}
