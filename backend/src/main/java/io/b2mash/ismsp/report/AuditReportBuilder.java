package io.b2mash.ismsp.report;

import io.b2mash.ismsp.compliance.ComplianceAggregator;
import io.b2mash.ismsp.compliance.ComplianceProperties;
import io.b2mash.ismsp.compliance.ComplianceRates;
import io.b2mash.ismsp.compliance.ComplianceTier;
import io.b2mash.ismsp.exception.ValidationException;
import io.b2mash.ismsp.schema.SchemaAdapter;
import io.b2mash.ismsp.schema.SchemaNames;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.store.StoreTimestamps;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the time-windowed audit report. Evidence is windowed on the date prefix of {@code
 * created_at}, both bounds inclusive, and only rows whose item code joins to the catalog count.
 */
@Service
public class AuditReportBuilder {

  private static final Logger log = LoggerFactory.getLogger(AuditReportBuilder.class);

  public static final LocalDate DEFAULT_START = LocalDate.of(2020, 1, 1);
  public static final int RECENT_LIMIT = 10;

  private final SchemaAdapter schemaAdapter;
  private final StoreTemplate store;
  private final ComplianceProperties complianceProperties;
  private final Clock clock;

  public AuditReportBuilder(
      SchemaAdapter schemaAdapter,
      StoreTemplate store,
      ComplianceProperties complianceProperties,
      Clock clock) {
    this.schemaAdapter = schemaAdapter;
    this.store = store;
    this.complianceProperties = complianceProperties;
    this.clock = clock;
  }

  /**
   * @param startDate {@code YYYY-MM-DD}, defaults to 2020-01-01 when null or blank
   * @param endDate {@code YYYY-MM-DD}, defaults to today (UTC) when null or blank
   */
  public AuditReport build(String startDate, String endDate) {
    var start = parseDate("start_date", startDate, DEFAULT_START);
    var end = parseDate("end_date", endDate, StoreTimestamps.today(clock));
    if (start.isAfter(end)) {
      throw new ValidationException("start_date " + start + " is after end_date " + end);
    }
    var source = schemaAdapter.requireSource();
    var from = start.toString();
    var to = end.toString();
    var window = "substr(e.created_at, 1, 10) BETWEEN :start AND :end";

    var report =
        store.execute(
            "report.build",
            jdbc -> {
              long totalRequirements =
                  jdbc.sql("SELECT COUNT(DISTINCT item_code) FROM " + source.relation())
                      .query(Long.class)
                      .single();

              var windowTotals =
                  jdbc.sql(
                          """
                          SELECT COUNT(DISTINCT e.item_code) AS covered, COUNT(e.id) AS evidence
                          FROM %s e
                          WHERE %s
                            AND e.item_code IN (SELECT item_code FROM %s)
                          """
                              .formatted(SchemaNames.EVIDENCES, window, source.relation()))
                      .param("start", from)
                      .param("end", to)
                      .query(
                          (rs, rowNum) ->
                              new WindowTotals(rs.getLong("covered"), rs.getLong("evidence")))
                      .single();

              var perCategory =
                  jdbc.sql(
                          """
                          SELECT COALESCE(r.category, '%1$s') AS category,
                                 COUNT(DISTINCT CASE WHEN %2$s THEN e.item_code END) AS covered
                          FROM %3$s r
                          LEFT JOIN %4$s e ON e.item_code = r.item_code
                          GROUP BY COALESCE(r.category, '%1$s')
                          ORDER BY category
                          """
                              .formatted(
                                  ComplianceAggregator.UNCATEGORIZED,
                                  window,
                                  source.relation(),
                                  SchemaNames.EVIDENCES))
                      .param("start", from)
                      .param("end", to)
                      .query(
                          (rs, rowNum) ->
                              new CategoryCoverage(rs.getString("category"), rs.getLong("covered")))
                      .list();

              var recent =
                  jdbc.sql(
                          """
                          SELECT e.id, e.item_code, r.title, e.evidence_type, e.created_at
                          FROM %s e
                          JOIN (SELECT item_code, MIN(title) AS title FROM %s GROUP BY item_code) r
                            ON r.item_code = e.item_code
                          WHERE %s
                          ORDER BY e.created_at DESC, e.id ASC
                          LIMIT :limit
                          """
                              .formatted(SchemaNames.EVIDENCES, source.relation(), window))
                      .param("start", from)
                      .param("end", to)
                      .param("limit", RECENT_LIMIT)
                      .query(
                          (rs, rowNum) ->
                              new ReportedEvidence(
                                  rs.getLong("id"),
                                  rs.getString("item_code"),
                                  rs.getString("title"),
                                  rs.getString("evidence_type"),
                                  StoreTimestamps.parse(rs.getString("created_at"))))
                      .list();

              long covered = windowTotals.covered();
              double rate = ComplianceRates.rate(covered, totalRequirements);
              ComplianceTier recommendation = complianceProperties.tierFor(rate);
              return new AuditReport(
                  start,
                  end,
                  totalRequirements,
                  covered,
                  windowTotals.evidence(),
                  rate,
                  perCategory,
                  recommendation,
                  recent);
            });
    log.debug(
        "Built audit report for {}..{}: {}/{} covered, {} evidence rows",
        from,
        to,
        report.coveredInWindow(),
        report.totalRequirements(),
        report.totalEvidenceInWindow());
    return report;
  }

  private record WindowTotals(long covered, long evidence) {}

  private static LocalDate parseDate(String argument, String value, LocalDate fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new ValidationException(
          argument + " '" + value + "' is not a date in YYYY-MM-DD form");
    }
  }
}
