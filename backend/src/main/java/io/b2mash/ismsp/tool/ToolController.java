package io.b2mash.ismsp.tool;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

  private final ToolDispatcher dispatcher;

  public ToolController(ToolDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @GetMapping
  public ResponseEntity<List<ToolDescriptor>> listTools() {
    return ResponseEntity.ok(dispatcher.describe());
  }

  @PostMapping("/{operation}")
  public CompletableFuture<ResponseEntity<Object>> invoke(
      @PathVariable String operation,
      @RequestBody(required = false) Map<String, Object> arguments) {
    return dispatcher.dispatch(operation, arguments).thenApply(ToolController::toResponse);
  }

  static ResponseEntity<Object> toResponse(ToolResult result) {
    if (result.success()) {
      return ResponseEntity.ok(result.payload());
    }
    var status = result.errorKind().status();
    var problem = ProblemDetail.forStatusAndDetail(status, result.message());
    problem.setTitle(status.getReasonPhrase());
    problem.setProperty("kind", result.errorKind().name());
    problem.setProperty("operation", result.operation());
    return ResponseEntity.status(status).body(problem);
  }
}
