package io.b2mash.ismsp.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

/**
 * Maintains {@code requirement_search_index}, a lower-cased shadow of the searchable requirement
 * fields. Triggers on the base table keep it in step inside the same transaction as the write they
 * mirror. Only a canonical base table can carry the triggers; views are searched directly.
 */
@Component
public class SearchIndexProvisioner {

  private static final Logger log = LoggerFactory.getLogger(SearchIndexProvisioner.class);

  static final String TABLE_SQL =
      """
      CREATE TABLE requirement_search_index (
          item_code TEXT PRIMARY KEY,
          haystack  TEXT NOT NULL
      )
      """;

  private static final Map<String, String> TRIGGERS = new LinkedHashMap<>();

  static {
    TRIGGERS.put(
        SchemaNames.SEARCH_INDEX_INSERT_TRIGGER,
        """
        CREATE TRIGGER requirement_search_index_ai
        AFTER INSERT ON isms_requirements
        BEGIN
            INSERT OR REPLACE INTO requirement_search_index (item_code, haystack)
            VALUES (NEW.item_code, %s);
        END
        """
            .formatted(haystack("NEW")));
    TRIGGERS.put(
        SchemaNames.SEARCH_INDEX_UPDATE_TRIGGER,
        """
        CREATE TRIGGER requirement_search_index_au
        AFTER UPDATE ON isms_requirements
        BEGIN
            DELETE FROM requirement_search_index WHERE item_code = OLD.item_code;
            INSERT OR REPLACE INTO requirement_search_index (item_code, haystack)
            VALUES (NEW.item_code, %s);
        END
        """
            .formatted(haystack("NEW")));
    TRIGGERS.put(
        SchemaNames.SEARCH_INDEX_DELETE_TRIGGER,
        """
        CREATE TRIGGER requirement_search_index_ad
        AFTER DELETE ON isms_requirements
        BEGIN
            DELETE FROM requirement_search_index WHERE item_code = OLD.item_code;
        END
        """);
  }

  /**
   * @return whether the source is now index-backed
   */
  public boolean ensure(
      JdbcClient jdbc,
      SchemaInspector inspector,
      RequirementSource source,
      List<String> provisioned) {
    if (!source.writable() || !SchemaNames.REQUIREMENTS.equals(source.relation())) {
      return false;
    }

    boolean rebuild = false;
    if (!inspector.tableExists(jdbc, SchemaNames.SEARCH_INDEX)) {
      jdbc.sql(TABLE_SQL).update();
      provisioned.add("table " + SchemaNames.SEARCH_INDEX);
      rebuild = true;
    }
    for (var trigger : TRIGGERS.entrySet()) {
      if (!inspector.triggerExists(jdbc, trigger.getKey())) {
        jdbc.sql(trigger.getValue()).update();
        provisioned.add("trigger " + trigger.getKey());
        rebuild = true;
      }
    }

    // Writes made while a trigger was missing are not mirrored, so repopulate from scratch.
    if (rebuild) {
      jdbc.sql("DELETE FROM " + SchemaNames.SEARCH_INDEX).update();
      int rows =
          jdbc.sql(
                  """
                  INSERT OR REPLACE INTO requirement_search_index (item_code, haystack)
                  SELECT r.item_code, %s FROM isms_requirements r
                  """
                      .formatted(haystack("r")))
              .update();
      log.info("Populated {} with {} requirements", SchemaNames.SEARCH_INDEX, rows);
    }
    return true;
  }

  private static String haystack(String alias) {
    return ("lower(coalesce(%1$s.title, '') || char(10) || coalesce(%1$s.description, '')"
            + " || char(10) || coalesce(%1$s.requirement_text, '')"
            + " || char(10) || coalesce(%1$s.category, ''))")
        .formatted(alias);
  }
}
