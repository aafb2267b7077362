package io.b2mash.ismsp.tool.handler;

import io.b2mash.ismsp.catalog.RequirementCatalog;
import io.b2mash.ismsp.evidence.EvidenceStore;
import io.b2mash.ismsp.exception.StorageException;
import io.b2mash.ismsp.store.StoreTemplate;
import io.b2mash.ismsp.tool.ToolHandler;
import io.b2mash.ismsp.tool.ToolOperation;
import io.b2mash.ismsp.tool.ToolRequests.GenerateEvidence;
import io.b2mash.ismsp.tool.ToolResponses.GeneratedEvidence;
import org.springframework.stereotype.Component;

@Component
public class GenerateEvidenceHandler implements ToolHandler<GenerateEvidence> {

  private final RequirementCatalog catalog;
  private final EvidenceStore evidenceStore;
  private final StoreTemplate store;

  public GenerateEvidenceHandler(
      RequirementCatalog catalog, EvidenceStore evidenceStore, StoreTemplate store) {
    this.catalog = catalog;
    this.evidenceStore = evidenceStore;
    this.store = store;
  }

  @Override
  public ToolOperation operation() {
    return ToolOperation.GENERATE_EVIDENCE;
  }

  @Override
  public Class<GenerateEvidence> requestType() {
    return GenerateEvidence.class;
  }

  @Override
  public GeneratedEvidence handle(GenerateEvidence request) {
    return store.execute(
        "tool.generate-evidence",
        jdbc -> {
          long id =
              evidenceStore.insert(request.itemCode(), request.evidenceType(), request.content());
          var evidence =
              evidenceStore
                  .findById(id)
                  .orElseThrow(
                      () -> new StorageException("Evidence " + id + " vanished after insert"));
          var requirement = catalog.get(evidence.itemCode());
          return new GeneratedEvidence(
              evidence.id(),
              evidence.itemCode(),
              requirement.title(),
              evidence.evidenceType(),
              evidence.content(),
              evidence.status(),
              evidence.createdAt());
        });
  }
}
