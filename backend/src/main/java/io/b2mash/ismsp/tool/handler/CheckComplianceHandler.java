package io.b2mash.ismsp.tool.handler;

import io.b2mash.ismsp.compliance.ComplianceAggregator;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.tool.ToolHandler;
import io.b2mash.ismsp.tool.ToolOperation;
import io.b2mash.ismsp.tool.ToolRequests.CheckCompliance;
import io.b2mash.ismsp.tool.ToolResponses.ComplianceStatus;
import org.springframework.stereotype.Component;

@Component
public class CheckComplianceHandler implements ToolHandler<CheckCompliance> {

  private final ComplianceAggregator aggregator;
  private final StoreTemplate store;

  public CheckComplianceHandler(ComplianceAggregator aggregator, StoreTemplate store) {
    this.aggregator = aggregator;
    this.store = store;
  }

  @Override
  public ToolOperation operation() {
    return ToolOperation.CHECK_COMPLIANCE;
  }

  @Override
  public Class<CheckCompliance> requestType() {
    return CheckCompliance.class;
  }

  @Override
  public ComplianceStatus handle(CheckCompliance request) {
    var category =
        request.category() == null || request.category().isBlank()
            ? null
            : request.category().trim();
    // One snapshot for the summary and both breakdowns.
    return store.execute(
        "tool.check-compliance",
        jdbc -> {
          var summary = aggregator.overall(category);
          return new ComplianceStatus(
              category,
              summary,
              aggregator.tier(summary.rate()),
              aggregator.byCategory(),
              aggregator.itemCoverage(category));
        });
  }
}
