package io.b2mash.ismsp.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Typed argument records, bound from the snake_case argument bag by {@link ToolRequestDecoder}. */
public final class ToolRequests {

  private ToolRequests() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SearchRequirements(String keyword) implements ToolRequest {
    @Override
    public ToolOperation operation() {
      return ToolOperation.SEARCH_REQUIREMENTS;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record GetRequirementDetail(String itemCode) implements ToolRequest {
    @Override
    public ToolOperation operation() {
      return ToolOperation.GET_REQUIREMENT_DETAIL;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record GenerateEvidence(String itemCode, String evidenceType, String content)
      implements ToolRequest {
    @Override
    public ToolOperation operation() {
      return ToolOperation.GENERATE_EVIDENCE;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CheckCompliance(String category) implements ToolRequest {
    @Override
    public ToolOperation operation() {
      return ToolOperation.CHECK_COMPLIANCE;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record CreateAuditReport(String startDate, String endDate) implements ToolRequest {
    @Override
    public ToolOperation operation() {
      return ToolOperation.CREATE_AUDIT_REPORT;
    }
  }
}
