package io.b2mash.ismsp.report;

import io.b2mash.ismsp.compliance.ComplianceTier;
import java.time.LocalDate;
import java.util.List;

/**
 * Evidence coverage over an inclusive date window.
 *
 * @param coveredInWindow distinct requirements with evidence created inside the window
 * @param totalEvidenceInWindow evidence rows created inside the window
 * @param perCategory every catalog category with its windowed covered count, zero included
 * @param recommendation tier of {@code rate}
 * @param recentEvidence newest windowed evidence rows, at most {@link
 *     AuditReportBuilder#RECENT_LIMIT}
 */
public record AuditReport(
    LocalDate periodStart,
    LocalDate periodEnd,
    long totalRequirements,
    long coveredInWindow,
    long totalEvidenceInWindow,
    double rate,
    List<CategoryCoverage> perCategory,
    ComplianceTier recommendation,
    List<ReportedEvidence> recentEvidence) {}
