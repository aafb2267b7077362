package io.b2mash.ismsp.compliance;

import io.b2mash.ismsp.catalog.RequirementCatalog;
import io.b2mash.ismsp.evidence.EvidenceStore;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.schema.SchemaNames;
import io.b2mash.ismsp.store.StoreTemplate;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * Coverage counts and rates, computed on demand and never cached. Each aggregation runs in one
 * store transaction so its counts come from a single snapshot.
 */
@Service
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceAggregator {

  /** Rollup label for requirements without a category. */
  public static final String UNCATEGORIZED = "uncategorized";

  private final SchemaAdapter schemaAdapter;
  private final RequirementCatalog catalog;
  private final EvidenceStore evidenceStore;
  private final StoreTemplate store;
  private final ComplianceProperties properties;

  public ComplianceAggregator(
      SchemaAdapter schemaAdapter,
      RequirementCatalog catalog,
      EvidenceStore evidenceStore,
      StoreTemplate store,
      ComplianceProperties properties) {
    this.schemaAdapter = schemaAdapter;
    this.catalog = catalog;
    this.evidenceStore = evidenceStore;
    this.store = store;
    this.properties = properties;
  }

  /** Totals over the whole catalog, or over the categories containing {@code category}. */
  public ComplianceSummary overall(String category) {
    schemaAdapter.requireSource();
    return store.execute(
        "compliance.overall",
        jdbc -> {
          long total = catalog.count(category);
          long covered = evidenceStore.countDistinctCovered(category);
          return new ComplianceSummary(total, covered, ComplianceRates.rate(covered, total));
        });
  }

  /** One rollup per category, ascending; requirements without a category are grouped together. */
  public List<CategoryRollup> byCategory() {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "compliance.by-category",
        jdbc ->
            jdbc.sql(
                    """
                    SELECT COALESCE(r.category, '%1$s') AS category,
                           COUNT(DISTINCT r.item_code) AS total,
                           COUNT(DISTINCT e.item_code) AS covered
                    FROM %2$s r
                    LEFT JOIN %3$s e ON e.item_code = r.item_code
                    GROUP BY COALESCE(r.category, '%1$s')
                    ORDER BY category
                    """
                        .formatted(UNCATEGORIZED, source.relation(), SchemaNames.EVIDENCES))
                .query(
                    (rs, rowNum) -> {
                      long total = rs.getLong("total");
                      long covered = rs.getLong("covered");
                      return new CategoryRollup(
                          rs.getString("category"),
                          total,
                          covered,
                          ComplianceRates.rate(covered, total));
                    })
                .list());
  }

  /** Evidence count for every requirement, optionally filtered by category, by item code. */
  public List<ItemCoverage> itemCoverage(String category) {
    var source = schemaAdapter.requireSource();
    return store.execute(
        "compliance.item-coverage",
        jdbc ->
            jdbc.sql(
                    """
                    SELECT r.item_code, r.title, r.category, COUNT(e.id) AS evidence_count
                    FROM %1$s r
                    LEFT JOIN %2$s e ON e.item_code = r.item_code
                    WHERE (:category IS NULL OR lower(r.category) LIKE :category ESCAPE '\\')
                    GROUP BY r.item_code, r.title, r.category
                    ORDER BY r.item_code
                    """
                        .formatted(source.relation(), SchemaNames.EVIDENCES))
                .param("category", RequirementCatalog.categoryPattern(category))
                .query(
                    (rs, rowNum) ->
                        new ItemCoverage(
                            rs.getString("item_code"),
                            rs.getString("title"),
                            rs.getString("category"),
                            rs.getLong("evidence_count")))
                .list());
  }

  public ComplianceTier tier(double rate) {
    return properties.tierFor(rate);
  }
}
