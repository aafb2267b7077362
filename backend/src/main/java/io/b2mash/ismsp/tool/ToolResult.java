package io.b2mash.ismsp.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.b2mash.ismsp.exception.ErrorKind;

/** Outcome of one dispatched invocation: a payload, or an error kind with a message. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    String operation, boolean success, Object payload, ErrorKind errorKind, String message) {

  public static ToolResult success(String operation, Object payload) {
    return new ToolResult(operation, true, payload, null, null);
  }

  public static ToolResult failure(String operation, ErrorKind errorKind, String message) {
    return new ToolResult(operation, false, null, errorKind, message);
  }
}
