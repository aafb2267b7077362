package io.b2mash.ismsp.tool;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** The externally callable operations, their wire names and argument contracts. */
public enum ToolOperation {
  SEARCH_REQUIREMENTS(
      "search_requirements",
      "Search ISMS-P requirements by keyword in title, description, requirement text or category",
      ToolRequests.SearchRequirements.class,
      List.of("keyword"),
      List.of()),
  GET_REQUIREMENT_DETAIL(
      "get_requirement_detail",
      "Show one requirement with its five most recent evidence records",
      ToolRequests.GetRequirementDetail.class,
      List.of("item_code"),
      List.of()),
  GENERATE_EVIDENCE(
      "generate_evidence",
      "Record completed evidence for a requirement",
      ToolRequests.GenerateEvidence.class,
      List.of("item_code", "evidence_type", "content"),
      List.of()),
  CHECK_COMPLIANCE(
      "check_compliance",
      "Coverage rate and tier, overall or by category substring, with per-category and item detail",
      ToolRequests.CheckCompliance.class,
      List.of(),
      List.of("category")),
  CREATE_AUDIT_REPORT(
      "create_audit_report",
      "Evidence coverage report for a date window (YYYY-MM-DD, both bounds inclusive)",
      ToolRequests.CreateAuditReport.class,
      List.of(),
      List.of("start_date", "end_date"));

  private final String toolName;
  private final String description;
  private final Class<? extends ToolRequest> requestType;
  private final List<String> requiredArguments;
  private final List<String> optionalArguments;

  ToolOperation(
      String toolName,
      String description,
      Class<? extends ToolRequest> requestType,
      List<String> requiredArguments,
      List<String> optionalArguments) {
    this.toolName = toolName;
    this.description = description;
    this.requestType = requestType;
    this.requiredArguments = requiredArguments;
    this.optionalArguments = optionalArguments;
  }

  public String toolName() {
    return toolName;
  }

  public String description() {
    return description;
  }

  public Class<? extends ToolRequest> requestType() {
    return requestType;
  }

  public List<String> requiredArguments() {
    return requiredArguments;
  }

  public List<String> optionalArguments() {
    return optionalArguments;
  }

  public static Optional<ToolOperation> fromToolName(String toolName) {
    return Arrays.stream(values()).filter(op -> op.toolName.equals(toolName)).findFirst();
  }
}
