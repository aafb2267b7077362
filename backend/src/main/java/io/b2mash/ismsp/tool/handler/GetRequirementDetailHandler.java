package io.b2mash.ismsp.tool.handler;

import io.b2mash.ismsp.catalog.RequirementCatalog;
import io.b2mash.ismsp.evidence.EvidenceStore;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.tool.ToolHandler;
import io.b2mash.ismsp.tool.ToolOperation;
import io.b2mash.ismsp.tool.ToolRequests.GetRequirementDetail;
import io.b2mash.ismsp.tool.ToolResponses.RequirementDetail;
import org.springframework.stereotype.Component;

@Component
public class GetRequirementDetailHandler implements ToolHandler<GetRequirementDetail> {

  static final int RECENT_EVIDENCE_LIMIT = 5;

  private final RequirementCatalog catalog;
  private final EvidenceStore evidenceStore;
  private final StoreTemplate store;

  public GetRequirementDetailHandler(
      RequirementCatalog catalog, EvidenceStore evidenceStore, StoreTemplate store) {
    this.catalog = catalog;
    this.evidenceStore = evidenceStore;
    this.store = store;
  }

  @Override
  public ToolOperation operation() {
    return ToolOperation.GET_REQUIREMENT_DETAIL;
  }

  @Override
  public Class<GetRequirementDetail> requestType() {
    return GetRequirementDetail.class;
  }

  @Override
  public RequirementDetail handle(GetRequirementDetail request) {
    return store.execute(
        "tool.requirement-detail",
        jdbc -> {
          var requirement = catalog.get(request.itemCode());
          var evidence = evidenceStore.recent(requirement.itemCode(), RECENT_EVIDENCE_LIMIT);
          return new RequirementDetail(requirement, evidence);
        });
  }
}
