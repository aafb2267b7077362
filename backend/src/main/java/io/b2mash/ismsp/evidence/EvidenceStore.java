package io.b2mash.ismsp.evidence;

import io.b2mash.ismsp.catalog.RequirementCatalog;
import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.schema.SchemaNames;
import io.b2mash.ismsp.store.LikePatterns;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.store.StoreTimestamps;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Append-only evidence records. Every row references a requirement of the resolved catalog; the
 * check here reports a clean {@code NotFound} and the item-code guard trigger backs it up inside
 * the store.
 */
@Repository
public class EvidenceStore {

  private static final Logger log = LoggerFactory.getLogger(EvidenceStore.class);

  static final String CREATED_BY = "system";

  private static final String COLUMNS =
      "id, item_code, evidence_type, content, file_path, status, created_by, created_at,"
          + " updated_at";

  private static final RowMapper<Evidence> ROW_MAPPER =
      (rs, rowNum) ->
          new Evidence(
              rs.getLong("id"),
              rs.getString("item_code"),
              rs.getString("evidence_type"),
              rs.getString("content"),
              rs.getString("file_path"),
              EvidenceStatus.fromDb(rs.getString("status")),
              rs.getString("created_by"),
              StoreTimestamps.parse(rs.getString("created_at")),
              StoreTimestamps.parse(rs.getString("updated_at")));

  private final SchemaAdapter schemaAdapter;
  private final StoreTemplate store;
  private final Clock clock;

  public EvidenceStore(SchemaAdapter schemaAdapter, StoreTemplate store, Clock clock) {
    this.schemaAdapter = schemaAdapter;
    this.store = store;
    this.clock = clock;
  }

  /**
   * Records completed evidence for a requirement.
   *
   * @return the store-assigned id
   */
  public long insert(String itemCode, String evidenceType, String content) {
    var code = requireText("item_code", itemCode).trim();
    var type = requireText("evidence_type", evidenceType).trim();
    requireText("content", content);
    var source = schemaAdapter.requireSource();
    var now = StoreTimestamps.format(StoreTimestamps.now(clock));

    long id =
        store.execute(
            "evidence.insert",
            jdbc -> {
              boolean known =
                  jdbc.sql("SELECT COUNT(*) FROM " + source.relation() + " WHERE item_code = ?")
                          .param(code)
                          .query(Long.class)
                          .single()
                      > 0;
              if (!known) {
                throw new NotFoundException("Requirement", code);
              }
              jdbc.sql(
                      """
                      INSERT INTO evidences
                          (item_code, evidence_type, content, status, created_by, created_at,
                           updated_at)
                      VALUES (?, ?, ?, ?, ?, ?, ?)
                      """)
                  .params(
                      code,
                      type,
                      content,
                      EvidenceStatus.COMPLETED.dbValue(),
                      CREATED_BY,
                      now,
                      now)
                  .update();
              return jdbc.sql("SELECT last_insert_rowid()").query(Long.class).single();
            });
    log.info("Recorded evidence {} ({}) for requirement {}", id, type, code);
    return id;
  }

  public Optional<Evidence> findById(long id) {
    schemaAdapter.ensureSchema();
    return store.execute(
        "evidence.find",
        jdbc ->
            jdbc.sql("SELECT " + COLUMNS + " FROM " + SchemaNames.EVIDENCES + " WHERE id = ?")
                .param(id)
                .query(ROW_MAPPER)
                .optional());
  }

  /** Newest first; rows sharing a timestamp come back in insertion order. */
  public List<Evidence> recent(String itemCode, int limit) {
    var code = requireText("item_code", itemCode).trim();
    if (limit <= 0) {
      throw new ValidationException("limit must be positive, was " + limit);
    }
    schemaAdapter.ensureSchema();
    return store.execute(
        "evidence.recent",
        jdbc ->
            jdbc.sql(
                    "SELECT "
                        + COLUMNS
                        + " FROM "
                        + SchemaNames.EVIDENCES
                        + " WHERE item_code = ? ORDER BY created_at DESC, id ASC LIMIT ?")
                .params(code, limit)
                .query(ROW_MAPPER)
                .list());
  }

  /**
   * Distinct requirements of the catalog, optionally only those whose category contains the
   * filter, that have at least one evidence row of any status.
   */
  public long countDistinctCovered(String category) {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "evidence.count-covered",
        jdbc ->
            jdbc.sql(
                    "SELECT COUNT(DISTINCT e.item_code) FROM "
                        + SchemaNames.EVIDENCES
                        + " e JOIN "
                        + source.relation()
                        + " r ON r.item_code = e.item_code"
                        + " WHERE (:category IS NULL OR lower(r.category) LIKE :category"
                        + LikePatterns.ESCAPE_CLAUSE
                        + ")")
                .param("category", RequirementCatalog.categoryPattern(category))
                .query(Long.class)
                .single());
  }

  private static String requireText(String argument, String value) {
    if (value == null || value.isBlank()) {
      throw ValidationException.missing(argument);
    }
    return value;
  }
}
