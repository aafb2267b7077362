package io.b2mash.ismsp.tool;

import io.b2mash.ismsp.exception.ErrorKind;
import io.b2mash.ismsp.exception.IsmsException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for tool invocations. Arguments are decoded on the caller's thread; the handler then
 * runs on the bounded worker pool. Every failure, expected or not, comes back as a {@link
 * ToolResult}; nothing is thrown at the caller.
 */
@Service
public class ToolDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

  static final String MDC_REQUEST_ID = "requestId";
  static final String MDC_OPERATION = "operation";

  private final ToolRequestDecoder decoder;
  private final Map<ToolOperation, ToolHandler<?>> handlers;
  private final Executor executor;

  public ToolDispatcher(
      ToolRequestDecoder decoder,
      List<ToolHandler<?>> handlers,
      @Qualifier("toolExecutor") Executor executor) {
    this.decoder = decoder;
    this.executor = executor;
    this.handlers = new EnumMap<>(ToolOperation.class);
    for (ToolHandler<?> handler : handlers) {
      var existing = this.handlers.putIfAbsent(handler.operation(), handler);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate ToolHandler for '"
                + handler.operation().toolName()
                + "': "
                + existing.getClass().getSimpleName()
                + " and "
                + handler.getClass().getSimpleName());
      }
    }
    var unhandled =
        Arrays.stream(ToolOperation.values()).filter(op -> !this.handlers.containsKey(op)).toList();
    if (!unhandled.isEmpty()) {
      throw new IllegalStateException("No ToolHandler registered for " + unhandled);
    }
  }

  public List<ToolDescriptor> describe() {
    return Arrays.stream(ToolOperation.values()).map(ToolDescriptor::of).toList();
  }

  public CompletableFuture<ToolResult> dispatch(String toolName, Map<String, ?> arguments) {
    var requestId = UUID.randomUUID().toString();
    ToolRequest request;
    try {
      request = decoder.decode(toolName, arguments);
    } catch (IsmsException e) {
      log.info("Rejected {} request {}: {}", toolName, requestId, e.getDetail());
      return CompletableFuture.completedFuture(
          ToolResult.failure(toolName, e.getKind(), e.getDetail()));
    }

    try {
      return CompletableFuture.supplyAsync(() -> execute(requestId, request), executor);
    } catch (RejectedExecutionException e) {
      log.warn("Worker pool saturated, rejecting {} request {}", toolName, requestId);
      return CompletableFuture.completedFuture(
          ToolResult.failure(
              toolName, ErrorKind.STORAGE_ERROR, "Service is busy, retry the request later"));
    }
  }

  ToolResult execute(String requestId, ToolRequest request) {
    var toolName = request.operation().toolName();
    MDC.put(MDC_REQUEST_ID, requestId);
    MDC.put(MDC_OPERATION, toolName);
    try {
      var payload = invoke(handlers.get(request.operation()), request);
      log.debug("Completed {}", toolName);
      return ToolResult.success(toolName, payload);
    } catch (IsmsException e) {
      if (e.getKind() == ErrorKind.STORAGE_ERROR) {
        log.warn("{} failed: {}", toolName, e.getDetail());
      } else {
        log.info("{} failed with {}: {}", toolName, e.getKind(), e.getDetail());
      }
      return ToolResult.failure(toolName, e.getKind(), e.getDetail());
    } catch (RuntimeException e) {
      log.error("Unexpected failure in {}", toolName, e);
      return ToolResult.failure(
          toolName, ErrorKind.STORAGE_ERROR, "Unexpected failure: " + e.getMessage());
    } finally {
      MDC.remove(MDC_REQUEST_ID);
      MDC.remove(MDC_OPERATION);
    }
  }

  private static <R extends ToolRequest> Object invoke(
      ToolHandler<R> handler, ToolRequest request) {
    return handler.handle(handler.requestType().cast(request));
  }
}
