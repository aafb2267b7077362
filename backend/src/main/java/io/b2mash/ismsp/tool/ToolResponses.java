package io.b2mash.ismsp.tool;

import com.fasterxml.jackson.annotation.JsonFormat;
import io.b2mash.ismsp.catalog.Requirement;
import io.b2mash.ismsp.compliance.CategoryRollup;
import io.b2mash.ismsp.compliance.ComplianceSummary;
import io.b2mash.ismsp.compliance.ComplianceTier;
import io.b2mash.ismsp.compliance.ItemCoverage;
import io.b2mash.ismsp.evidence.Evidence;
import io.b2mash.ismsp.evidence.EvidenceStatus;
import java.time.LocalDateTime;
import java.util.List;

/** Payloads returned by the tool handlers. */
public final class ToolResponses {

  private ToolResponses() {}

  public record SearchResult(String keyword, int count, List<Requirement> matches) {}

  public record RequirementDetail(Requirement requirement, List<Evidence> recentEvidence) {}

  public record GeneratedEvidence(
      long id,
      String itemCode,
      String title,
      String evidenceType,
      String content,
      EvidenceStatus status,
      @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime createdAt) {}

  /**
   * @param category category filter, matched as a substring; {@code null} for all
   */
  public record ComplianceStatus(
      String category,
      ComplianceSummary summary,
      ComplianceTier tier,
      List<CategoryRollup> byCategory,
      List<ItemCoverage> items) {}
}
