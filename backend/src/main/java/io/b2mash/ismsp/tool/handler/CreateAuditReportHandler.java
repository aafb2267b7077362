package io.b2mash.ismsp.tool.handler;

import io.b2mash.ismsp.report.AuditReport;
import io.b2mash.ismsp.report.AuditReportBuilder;
import io.b2mash.ismsp.tool.ToolHandler;
import io.b2mash.ismsp.tool.ToolOperation;
import io.b2mash.ismsp.tool.ToolRequests.CreateAuditReport;
import org.springframework.stereotype.Component;

@Component
public class CreateAuditReportHandler implements ToolHandler<CreateAuditReport> {

  private final AuditReportBuilder reportBuilder;

  public CreateAuditReportHandler(AuditReportBuilder reportBuilder) {
    this.reportBuilder = reportBuilder;
  }

  @Override
  public ToolOperation operation() {
    return ToolOperation.CREATE_AUDIT_REPORT;
  }

  @Override
  public Class<CreateAuditReport> requestType() {
    return CreateAuditReport.class;
  }

  @Override
  public AuditReport handle(CreateAuditReport request) {
    return reportBuilder.build(request.startDate(), request.endDate());
  }
}
