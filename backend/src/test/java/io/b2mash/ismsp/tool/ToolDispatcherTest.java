package io.b2mash.ismsp.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.ismsp.exception.ErrorKind;
import io.b2mash.ismsp.exception.NotFoundException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class ToolDispatcherTest {

  private static final Executor DIRECT = Runnable::run;

  private final ToolRequestDecoder decoder = new ToolRequestDecoder(new ObjectMapper());
  private final Map<ToolOperation, ToolHandler<ToolRequest>> handlers =
      new EnumMap<>(ToolOperation.class);

  private ToolDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    for (ToolOperation operation : ToolOperation.values()) {
      handlers.put(operation, handlerFor(operation));
    }
    dispatcher = new ToolDispatcher(decoder, allHandlers(), DIRECT);
  }

  @Test
  void dispatch_success_wrapsPayload() {
    var handler = handlers.get(ToolOperation.SEARCH_REQUIREMENTS);
    when(handler.requestType()).thenReturn(ToolRequest.class);
    when(handler.handle(any())).thenReturn(List.of("2.7.1"));

    var result = dispatcher.dispatch("search_requirements", Map.of("keyword", "암호")).join();

    assertThat(result.success()).isTrue();
    assertThat(result.operation()).isEqualTo("search_requirements");
    assertThat(result.payload()).isEqualTo(List.of("2.7.1"));
    verify(handler).handle(new ToolRequests.SearchRequirements("암호"));
  }

  @Test
  void dispatch_domainFailure_becomesFailureResult() {
    var handler = handlers.get(ToolOperation.GET_REQUIREMENT_DETAIL);
    when(handler.requestType()).thenReturn(ToolRequest.class);
    when(handler.handle(any())).thenThrow(new NotFoundException("Requirement", "9.9.9"));

    var result =
        dispatcher.dispatch("get_requirement_detail", Map.of("item_code", "9.9.9")).join();

    assertThat(result.success()).isFalse();
    assertThat(result.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
    assertThat(result.message()).contains("9.9.9");
    assertThat(result.payload()).isNull();
  }

  @Test
  void dispatch_unexpectedFault_becomesStorageError() {
    var handler = handlers.get(ToolOperation.CHECK_COMPLIANCE);
    when(handler.requestType()).thenReturn(ToolRequest.class);
    when(handler.handle(any())).thenThrow(new IllegalStateException("boom"));

    var result = dispatcher.dispatch("check_compliance", Map.of()).join();

    assertThat(result.errorKind()).isEqualTo(ErrorKind.STORAGE_ERROR);
    assertThat(result.message()).contains("boom");
  }

  @Test
  void dispatch_setsAndClearsLoggingContext() {
    var handler = handlers.get(ToolOperation.CREATE_AUDIT_REPORT);
    var seenOperation = new AtomicReference<String>();
    when(handler.requestType()).thenReturn(ToolRequest.class);
    when(handler.handle(any()))
        .thenAnswer(
            invocation -> {
              seenOperation.set(MDC.get("operation"));
              assertThat(MDC.get("requestId")).isNotBlank();
              return "report";
            });

    dispatcher.dispatch("create_audit_report", Map.of()).join();

    assertThat(seenOperation).hasValue("create_audit_report");
    assertThat(MDC.get("operation")).isNull();
    assertThat(MDC.get("requestId")).isNull();
  }

  @Test
  void dispatch_badArguments_failWithoutReachingHandlers() {
    var unknown = dispatcher.dispatch("drop_tables", Map.of()).join();
    var missing = dispatcher.dispatch("generate_evidence", Map.of("item_code", "1.1.1")).join();

    assertThat(unknown.errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
    assertThat(missing.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    handlers.values().forEach(handler -> verify(handler, never()).handle(any()));
  }

  @Test
  void dispatch_saturatedPool_failsWithStorageError() {
    Executor saturated =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    var busyDispatcher = new ToolDispatcher(decoder, allHandlers(), saturated);

    var result = busyDispatcher.dispatch("check_compliance", Map.of()).join();

    assertThat(result.errorKind()).isEqualTo(ErrorKind.STORAGE_ERROR);
    verify(handlers.get(ToolOperation.CHECK_COMPLIANCE), never()).handle(any());
  }

  @Test
  void constructor_rejectsDuplicateAndMissingHandlers() {
    var duplicated = allHandlers();
    duplicated.add(handlerFor(ToolOperation.SEARCH_REQUIREMENTS));
    var incomplete = allHandlers();
    incomplete.remove(handlers.get(ToolOperation.GENERATE_EVIDENCE));

    assertThatThrownBy(() -> new ToolDispatcher(decoder, duplicated, DIRECT))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate");
    assertThatThrownBy(() -> new ToolDispatcher(decoder, incomplete, DIRECT))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("GENERATE_EVIDENCE");
  }

  @Test
  void describe_listsEveryOperation() {
    assertThat(dispatcher.describe())
        .extracting(ToolDescriptor::name)
        .containsExactly(
            "search_requirements",
            "get_requirement_detail",
            "generate_evidence",
            "check_compliance",
            "create_audit_report");
  }

  private List<ToolHandler<?>> allHandlers() {
    return new ArrayList<>(handlers.values());
  }

  @SuppressWarnings("unchecked")
  private static ToolHandler<ToolRequest> handlerFor(ToolOperation operation) {
    ToolHandler<ToolRequest> handler = mock(ToolHandler.class);
    lenient().when(handler.operation()).thenReturn(operation);
    return handler;
  }
}
