package io.b2mash.ismsp.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.ismsp.exception.NotFoundException;
import io.b2mash.ismsp.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRequestDecoderTest {

  private final ToolRequestDecoder decoder =
      new ToolRequestDecoder(
          new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

  @Test
  void decode_generateEvidence_bindsSnakeCaseArguments() {
    var request =
        decoder.decode(
            "generate_evidence",
            Map.of("item_code", "1.1.1", "evidence_type", "문서", "content", "정책문서"));

    assertThat(request)
        .isEqualTo(new ToolRequests.GenerateEvidence("1.1.1", "문서", "정책문서"));
    assertThat(request.operation()).isEqualTo(ToolOperation.GENERATE_EVIDENCE);
  }

  @Test
  void decode_optionalArgumentsMayBeAbsent() {
    assertThat(decoder.decode("check_compliance", null))
        .isEqualTo(new ToolRequests.CheckCompliance(null));
    assertThat(decoder.decode("create_audit_report", Map.of("start_date", "2024-01-01")))
        .isEqualTo(new ToolRequests.CreateAuditReport("2024-01-01", null));
  }

  @Test
  void decode_unknownTool_throwsNotFound() {
    assertThatThrownBy(() -> decoder.decode("delete_everything", Map.of()))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void decode_missingOrBlankRequiredArgument_throwsValidation() {
    var arguments = new HashMap<String, Object>();
    arguments.put("item_code", "1.1.1");
    arguments.put("evidence_type", "  ");
    arguments.put("content", "x");

    assertThatThrownBy(() -> decoder.decode("generate_evidence", arguments))
        .isInstanceOfSatisfying(
            ValidationException.class,
            e -> assertThat(e.getDetail()).contains("evidence_type"));
    assertThatThrownBy(() -> decoder.decode("search_requirements", Map.of()))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void decode_structuredValueForTextArgument_throwsValidation() {
    assertThatThrownBy(
            () -> decoder.decode("search_requirements", Map.of("keyword", Map.of("a", 1))))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void decode_ignoresUnknownArguments() {
    assertThat(decoder.decode("search_requirements", Map.of("keyword", "암호", "page", 2)))
        .isEqualTo(new ToolRequests.SearchRequirements("암호"));
  }
}
