package io.b2mash.ismsp.catalog;

import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.StorageException;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.schema.RequirementSource;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.schema.SchemaNames;
import io.b2mash.ismsp.store.LikePatterns;
import io.b2mash.ismsp.store.StoreTemplate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Requirement reads through whichever relation the {@link SchemaAdapter} resolved. Writes are only
 * possible against the canonical base table; compatibility views are read-only.
 */
@Repository
public class RequirementCatalog {

  private static final Pattern ITEM_CODE = Pattern.compile("\\d+\\.\\d+\\.\\d+");

  public static final RowMapper<Requirement> ROW_MAPPER =
      (rs, rowNum) ->
          new Requirement(
              rs.getString("item_code"),
              rs.getString("category"),
              rs.getString("title"),
              rs.getString("description"),
              rs.getString("requirement_text"),
              rs.getString("control_objective"));

  static final String COLUMNS =
      "item_code, category, title, description, requirement_text, control_objective";

  private final SchemaAdapter schemaAdapter;
  private final StoreTemplate store;

  public RequirementCatalog(SchemaAdapter schemaAdapter, StoreTemplate store) {
    this.schemaAdapter = schemaAdapter;
    this.store = store;
  }

  public Requirement get(String itemCode) {
    var code = requireItemCode(itemCode);
    return find(code).orElseThrow(() -> new NotFoundException("Requirement", code));
  }

  public Optional<Requirement> find(String itemCode) {
    var code = requireItemCode(itemCode);
    var source = schemaAdapter.requireSource();
    return store.execute(
        "catalog.find",
        jdbc ->
            jdbc.sql(
                    "SELECT " + COLUMNS + " FROM " + source.relation() + " WHERE item_code = ?")
                .param(code)
                .query(ROW_MAPPER)
                .optional());
  }

  /** Requirements ordered by item code as text, so {@code 2.10.1} precedes {@code 2.2.1}. */
  public List<Requirement> list(String category) {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "catalog.list",
        jdbc ->
            jdbc.sql(
                    "SELECT "
                        + COLUMNS
                        + " FROM "
                        + source.relation()
                        + " WHERE (:category IS NULL OR lower(category) LIKE :category"
                        + LikePatterns.ESCAPE_CLAUSE
                        + ")"
                        + " ORDER BY item_code")
                .param("category", categoryPattern(category))
                .query(ROW_MAPPER)
                .list());
  }

  public long count(String category) {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "catalog.count",
        jdbc ->
            jdbc.sql(
                    "SELECT COUNT(DISTINCT item_code) FROM "
                        + source.relation()
                        + " WHERE (:category IS NULL OR lower(category) LIKE :category"
                        + LikePatterns.ESCAPE_CLAUSE
                        + ")")
                .param("category", categoryPattern(category))
                .query(Long.class)
                .single());
  }

  public List<String> categories() {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "catalog.categories",
        jdbc ->
            jdbc.sql(
                    "SELECT DISTINCT category FROM "
                        + source.relation()
                        + " WHERE category IS NOT NULL ORDER BY category")
                .query(String.class)
                .list());
  }

  /** Inserts or updates by item code. A blank category falls back to the chapter segment. */
  public Requirement save(Requirement requirement) {
    var source = requireWritable();
    var code = requireItemCode(requirement.itemCode());
    if (!ITEM_CODE.matcher(code).matches()) {
      throw new ValidationException(
          "item_code '" + code + "' must have the form <chapter>.<section>.<item>");
    }
    var title = requirement.title() == null ? "" : requirement.title().trim();
    if (title.isEmpty()) {
      throw ValidationException.missing("title");
    }
    var category =
        blankToNull(requirement.category()) == null
            ? Requirement.chapterOf(code)
            : requirement.category().trim();
    var saved =
        new Requirement(
            code,
            category,
            title,
            requirement.description(),
            requirement.requirementText(),
            requirement.controlObjective());

    store.executeWithoutResult(
        "catalog.save",
        jdbc ->
            jdbc.sql(
                    "INSERT INTO "
                        + source.relation()
                        + " ("
                        + COLUMNS
                        + ") VALUES (?, ?, ?, ?, ?, ?)"
                        + " ON CONFLICT (item_code) DO UPDATE SET"
                        + " category = excluded.category,"
                        + " title = excluded.title,"
                        + " description = excluded.description,"
                        + " requirement_text = excluded.requirement_text,"
                        + " control_objective = excluded.control_objective")
                .params(
                    saved.itemCode(),
                    saved.category(),
                    saved.title(),
                    saved.description(),
                    saved.requirementText(),
                    saved.controlObjective())
                .update());
    return saved;
  }

  /** Deletes a requirement nothing references; referenced item codes are never released. */
  public void delete(String itemCode) {
    var source = requireWritable();
    var code = requireItemCode(itemCode);
    store.executeWithoutResult(
        "catalog.delete",
        jdbc -> {
          long references =
              jdbc.sql("SELECT COUNT(*) FROM " + SchemaNames.EVIDENCES + " WHERE item_code = ?")
                  .param(code)
                  .query(Long.class)
                  .single();
          if (references > 0) {
            throw new ValidationException(
                "Requirement " + code + " is referenced by " + references + " evidence records");
          }
          int deleted =
              jdbc.sql("DELETE FROM " + source.relation() + " WHERE item_code = ?")
                  .param(code)
                  .update();
          if (deleted == 0) {
            throw new NotFoundException("Requirement", code);
          }
        });
  }

  private RequirementSource requireWritable() {
    var source = schemaAdapter.requireSource();
    if (!source.writable()) {
      throw new StorageException(
          "Requirement catalog is the read-only view "
              + source.relation()
              + " (resolved by "
              + source.probe()
              + ")");
    }
    return source;
  }

  private static String requireItemCode(String itemCode) {
    if (itemCode == null || itemCode.isBlank()) {
      throw ValidationException.missing("item_code");
    }
    return itemCode.trim();
  }

  static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * {@code LIKE} pattern for a category filter: contained anywhere, ASCII case-insensitive, or
   * {@code null} for no filter.
   */
  public static String categoryPattern(String category) {
    return category == null ? null : LikePatterns.containing(category);
  }
}
