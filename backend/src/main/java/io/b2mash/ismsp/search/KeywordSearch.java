package io.b2mash.ismsp.search;

import io.b2mash.ismsp.catalog.Requirement;
import io.b2mash.ismsp.catalog.RequirementCatalog;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.schema.RequirementSource;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.schema.SchemaNames;
import io.b2mash.ismsp.store.LikePatterns;
import io.b2mash.ismsp.store.StoreTemplate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Case-insensitive substring search over title, description, requirement text and category.
 *
 * <p>SQLite's {@code lower()} and {@code LIKE} only fold ASCII, so SQL is used purely to narrow the
 * candidates: through the search index when there is one, or a {@code LIKE} scan otherwise, and
 * only for ASCII keywords. The match itself is always decided here with Unicode lower-casing, which
 * keeps indexed and unindexed results identical.
 *
 * <p>Two non-ASCII characters lower-case to ASCII in Java: U+0130 (to {@code i} plus a combining
 * dot) and the Kelvin sign U+212A (to {@code k}). SQLite cannot fold them, so rows holding either
 * always pass the SQL narrowing and are judged by the Java check.
 */
@Service
public class KeywordSearch {

  private static final String COLUMNS =
      "r.item_code, r.category, r.title, r.description, r.requirement_text, r.control_objective";

  private static final String DOTTED_CAPITAL_I = "\u0130";
  private static final String KELVIN_SIGN = "\u212A";

  private final SchemaAdapter schemaAdapter;
  private final StoreTemplate store;
  private final SearchProperties properties;

  public KeywordSearch(
      SchemaAdapter schemaAdapter, StoreTemplate store, SearchProperties properties) {
    this.schemaAdapter = schemaAdapter;
    this.store = store;
    this.properties = properties;
  }

  /** Matches ordered by item code; an empty list is a valid answer. */
  public List<Requirement> search(String keyword) {
    if (keyword == null || keyword.isBlank()) {
      throw ValidationException.missing("keyword");
    }
    var needle = keyword.toLowerCase(Locale.ROOT);
    var source = schemaAdapter.requireSource();

    var candidates =
        store.execute(
            "search",
            jdbc -> {
              var statement = jdbc.sql(candidateSql(source, needle));
              if (isAscii(needle)) {
                statement =
                    statement
                        .param("pattern", LikePatterns.containing(needle))
                        .param("dottedCapitalI", DOTTED_CAPITAL_I)
                        .param("kelvinSign", KELVIN_SIGN);
              }
              return statement.query(RequirementCatalog.ROW_MAPPER).list();
            });

    var matches = candidates.stream().filter(requirement -> matches(requirement, needle));
    if (properties.maxResults() > 0) {
      matches = matches.limit(properties.maxResults());
    }
    return matches.toList();
  }

  static boolean matches(Requirement requirement, String needle) {
    return Stream.of(
            requirement.title(),
            requirement.description(),
            requirement.requirementText(),
            requirement.category())
        .anyMatch(field -> field != null && field.toLowerCase(Locale.ROOT).contains(needle));
  }

  private static String candidateSql(RequirementSource source, String needle) {
    var select = "SELECT " + COLUMNS + " FROM " + source.relation() + " r";
    if (!isAscii(needle)) {
      return select + " ORDER BY r.item_code";
    }
    if (source.searchIndexed()) {
      return select
          + " JOIN "
          + SchemaNames.SEARCH_INDEX
          + " i ON i.item_code = r.item_code"
          + " WHERE "
          + narrowing("i.haystack")
          + " ORDER BY r.item_code";
    }
    return select
        + " WHERE "
        + narrowing("r.title")
        + " OR "
        + narrowing("r.description")
        + " OR "
        + narrowing("r.requirement_text")
        + " OR "
        + narrowing("r.category")
        + " ORDER BY r.item_code";
  }

  private static String narrowing(String column) {
    return "(lower("
        + column
        + ") LIKE :pattern"
        + LikePatterns.ESCAPE_CLAUSE
        + " OR instr("
        + column
        + ", :dottedCapitalI) > 0 OR instr("
        + column
        + ", :kelvinSign) > 0)";
  }

  private static boolean isAscii(String value) {
    return value.chars().allMatch(c -> c < 0x80);
  }
}
